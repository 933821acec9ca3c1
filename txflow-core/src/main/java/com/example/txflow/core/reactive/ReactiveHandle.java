package com.example.txflow.core.reactive;

import com.example.txflow.core.PooledHandle;
import com.example.txflow.core.Row;
import java.util.List;
import reactor.core.publisher.Mono;

/**
 * Non-blocking view of a leased session. Every method is lazy: nothing is sent until the
 * returned {@link Mono} is subscribed.
 */
public interface ReactiveHandle {

  Mono<Void> beginTransaction();

  Mono<Void> commit();

  Mono<Void> rollback();

  Mono<List<Row>> query(String sql, Object... params);

  Mono<Integer> update(String sql, Object... params);

  /** Returns the handle to the pool; only valid for an idle session outside a transaction. */
  Mono<Void> release();

  /** Tears down the physical connection; it is never reused. */
  Mono<Void> destroy();

  /** Returns the underlying blocking handle. */
  PooledHandle unwrap();
}
