package com.example.txflow.core.reactive;

import reactor.core.publisher.Mono;

/** Non-blocking source of {@link ReactiveHandle}s. */
@FunctionalInterface
public interface ReactiveConnectionPool {

  /**
   * Leases a handle when subscribed.
   *
   * @return the handle, or an error if the pool is exhausted or the connection cannot be opened
   */
  Mono<ReactiveHandle> acquire();
}
