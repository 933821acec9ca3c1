package com.example.txflow.core.jdbc;

import com.example.txflow.core.ConnectionPool;
import com.example.txflow.core.PooledHandle;
import com.example.txflow.core.TransactionException;
import com.example.txflow.core.TransactionFlow;
import com.example.txflow.core.TransactionSteps;
import java.util.Objects;
import reactor.core.publisher.Mono;

/**
 * Blocking transaction executor: the unit of work is plain sequential code and every step runs
 * on the calling thread, which waits at each I/O boundary.
 *
 * <p>Shares its protocol with {@link com.example.txflow.core.reactive.ReactiveTransactionExecutor}
 * through {@link TransactionFlow}; the steps here are synchronous {@link Mono}s that never leave
 * the caller's thread.
 *
 * <h2>Usage</h2>
 *
 * <pre>{@code
 * var executor = new TransactionExecutor(pool);
 * String id = executor.runTransaction(session -> {
 *   session.update("INSERT INTO orders (customer, total) VALUES (?, ?)", customer, total);
 *   return session.query("SELECT LAST_INSERT_ID() AS id").get(0).get("id", String.class);
 * });
 * }</pre>
 */
public final class TransactionExecutor {

  private final TransactionFlow<PooledHandle> flow;

  /**
   * Creates an executor leasing handles from {@code pool}.
   *
   * @param pool the connection pool
   */
  public TransactionExecutor(final ConnectionPool pool) {
    this.flow = new TransactionFlow<>(new BlockingSteps(Objects.requireNonNull(pool, "pool")));
  }

  /**
   * Runs {@code work} in a transaction on a freshly acquired handle and waits for the outcome.
   *
   * @param work the unit of work
   * @param <T> result type
   * @return whatever {@code work} returned, possibly {@code null}
   * @throws TransactionException if acquisition, BEGIN, the work, COMMIT or the release failed
   */
  public <T> T runTransaction(final UnitOfWork<T> work) {
    Objects.requireNonNull(work, "work");
    return flow.<T>run(
            handle -> Mono.fromCallable(() -> work.execute(new TransactionSession(handle))))
        .block();
  }

  private record BlockingSteps(ConnectionPool pool) implements TransactionSteps<PooledHandle> {

    @Override
    public Mono<PooledHandle> acquire() {
      return Mono.fromCallable(pool::acquire);
    }

    @Override
    public Mono<Void> begin(final PooledHandle handle) {
      return run(handle::beginTransaction);
    }

    @Override
    public Mono<Void> commit(final PooledHandle handle) {
      return run(handle::commit);
    }

    @Override
    public Mono<Void> rollback(final PooledHandle handle) {
      return run(handle::rollback);
    }

    @Override
    public Mono<Void> release(final PooledHandle handle) {
      return run(handle::release);
    }

    @Override
    public Mono<Void> destroy(final PooledHandle handle) {
      return run(handle::destroy);
    }

    private static Mono<Void> run(final HandleAction action) {
      return Mono.fromCallable(
              () -> {
                action.run();
                return Boolean.TRUE;
              })
          .then();
    }
  }

  @FunctionalInterface
  private interface HandleAction {
    void run() throws Exception;
  }
}
