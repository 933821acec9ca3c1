package com.example.txflow.core.reactive;

import reactor.core.publisher.Mono;

/**
 * Caller logic run inside BEGIN/COMMIT by {@link ReactiveTransactionExecutor}. An error signal,
 * or an exception thrown while building the {@link Mono}, rolls the transaction back.
 *
 * @param <T> result type
 */
@FunctionalInterface
public interface ReactiveUnitOfWork<T> {
  /**
   * Builds the work for the transaction's session.
   *
   * @param session query executor bound to the transaction's handle
   * @return the deferred work; completing empty is a success without result
   */
  Mono<T> execute(final ReactiveSession session);
}
