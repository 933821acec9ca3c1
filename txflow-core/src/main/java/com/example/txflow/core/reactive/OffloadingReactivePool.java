package com.example.txflow.core.reactive;

import com.example.txflow.core.ConnectionPool;
import com.example.txflow.core.PooledHandle;
import com.example.txflow.core.Row;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

/**
 * {@link ReactiveConnectionPool} over a blocking {@link ConnectionPool}. Every driver call runs on
 * the given {@link Scheduler}, typically {@link
 * reactor.core.scheduler.Schedulers#boundedElastic()}, so that subscribers never block.
 *
 * <pre>{@code
 * var reactivePool = new OffloadingReactivePool(pool, Schedulers.boundedElastic());
 * var executor = new ReactiveTransactionExecutor(reactivePool);
 * }</pre>
 */
public final class OffloadingReactivePool implements ReactiveConnectionPool {

  private final ConnectionPool pool;
  private final Scheduler scheduler;

  public OffloadingReactivePool(final ConnectionPool pool, final Scheduler scheduler) {
    this.pool = Objects.requireNonNull(pool, "pool");
    this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
  }

  @Override
  public Mono<ReactiveHandle> acquire() {
    return offload(() -> new OffloadedHandle(pool.acquire()));
  }

  private <T> Mono<T> offload(final Callable<T> call) {
    return Mono.fromCallable(call).subscribeOn(scheduler);
  }

  private Mono<Void> offloadVoid(final HandleAction action) {
    return offload(
            () -> {
              action.run();
              return Boolean.TRUE;
            })
        .then();
  }

  @FunctionalInterface
  private interface HandleAction {
    void run() throws Exception;
  }

  private final class OffloadedHandle implements ReactiveHandle {

    private final PooledHandle handle;

    private OffloadedHandle(final PooledHandle handle) {
      this.handle = handle;
    }

    @Override
    public Mono<Void> beginTransaction() {
      return offloadVoid(handle::beginTransaction);
    }

    @Override
    public Mono<Void> commit() {
      return offloadVoid(handle::commit);
    }

    @Override
    public Mono<Void> rollback() {
      return offloadVoid(handle::rollback);
    }

    @Override
    public Mono<List<Row>> query(final String sql, final Object... params) {
      return offload(() -> handle.query(sql, params));
    }

    @Override
    public Mono<Integer> update(final String sql, final Object... params) {
      return offload(() -> handle.update(sql, params));
    }

    @Override
    public Mono<Void> release() {
      return offloadVoid(handle::release);
    }

    @Override
    public Mono<Void> destroy() {
      return offloadVoid(handle::destroy);
    }

    @Override
    public PooledHandle unwrap() {
      return handle;
    }
  }
}
