package com.example.txflow.core;

import reactor.core.publisher.Mono;

/**
 * The I/O steps a transaction run is made of, expressed once for every concurrency idiom.
 *
 * <p>Blocking adapters return {@link Mono}s that execute synchronously on the subscribing thread;
 * non-blocking adapters return {@link Mono}s that complete on whatever thread finishes the I/O.
 * {@link TransactionFlow} sequences them and owns every protocol decision, so the adapters carry
 * no state.
 *
 * @param <H> the handle type leased from the pool
 */
public interface TransactionSteps<H> {

  /** Leases a handle from the pool. */
  Mono<H> acquire();

  /** Issues BEGIN on the handle. */
  Mono<Void> begin(H handle);

  /** Issues COMMIT on the handle. */
  Mono<Void> commit(H handle);

  /** Issues ROLLBACK on the handle. */
  Mono<Void> rollback(H handle);

  /** Returns a clean, idle handle to the pool. */
  Mono<Void> release(H handle);

  /** Tears down the physical connection behind the handle; it is never reused. */
  Mono<Void> destroy(H handle);
}
