package com.example.txflow.core.reactive;

import static java.lang.System.Logger.Level.ERROR;

import com.example.txflow.core.TransactionException;
import com.example.txflow.core.TransactionFlow;
import com.example.txflow.core.TransactionSteps;
import java.lang.System.Logger;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;

/**
 * Non-blocking transaction executor: the protocol is a chain of asynchronous steps ending in a
 * single terminal signal.
 *
 * <p>Shares its protocol with {@link com.example.txflow.core.jdbc.TransactionExecutor} through
 * {@link TransactionFlow}, so both produce identical {@link TransactionException}s for the same
 * step outcomes.
 *
 * <h2>Mono Usage</h2>
 *
 * <pre>{@code
 * Mono<Integer> moved = executor.runTransaction(session ->
 *     session.update("UPDATE accounts SET balance = balance - ? WHERE id = ?", amount, from)
 *         .then(session.update(
 *             "UPDATE accounts SET balance = balance + ? WHERE id = ?", amount, to)));
 * }</pre>
 *
 * <h2>Callback Usage</h2>
 *
 * <pre>{@code
 * executor.runTransaction(work, (result, error) -> {
 *   if (error != null) {
 *     LOGGER.log(ERROR, "Transfer failed at " + error.state(), error);
 *   }
 * });
 * }</pre>
 */
public final class ReactiveTransactionExecutor {

  private static final Logger LOGGER =
      System.getLogger(ReactiveTransactionExecutor.class.getName());

  private final TransactionFlow<ReactiveHandle> flow;

  /**
   * Creates an executor leasing handles from {@code pool}.
   *
   * @param pool the reactive connection pool
   */
  public ReactiveTransactionExecutor(final ReactiveConnectionPool pool) {
    this.flow = new TransactionFlow<>(new ReactiveSteps(Objects.requireNonNull(pool, "pool")));
  }

  /**
   * Returns a deferred transaction run of {@code work}.
   *
   * @param work the unit of work
   * @param <T> result type
   * @return emits the work's result, completes empty if the work did, or errors with a {@link
   *     TransactionException}
   */
  public <T> Mono<T> runTransaction(final ReactiveUnitOfWork<T> work) {
    Objects.requireNonNull(work, "work");
    return flow.run(handle -> work.execute(new ReactiveSession(handle)));
  }

  /**
   * Starts a transaction run of {@code work} and reports its outcome to {@code callback}.
   *
   * @param work the unit of work
   * @param callback invoked once with the result or the {@link TransactionException}
   * @param <T> result type
   * @return handle to cancel the run; cancelling destroys the leased connection
   */
  public <T> Disposable runTransaction(
      final ReactiveUnitOfWork<T> work, final TransactionCallback<? super T> callback) {
    Objects.requireNonNull(callback, "callback");
    final var completed = new AtomicBoolean();
    return runTransaction(work)
        .map(Optional::of)
        .defaultIfEmpty(Optional.empty())
        .subscribe(
            result -> {
              completed.set(true);
              callback.onComplete(result.orElse(null), null);
            },
            error -> {
              if (completed.compareAndSet(false, true)
                  && error instanceof TransactionException tx) {
                callback.onComplete(null, tx);
              } else {
                LOGGER.log(ERROR, "Transaction callback failed", error);
              }
            });
  }

  private record ReactiveSteps(ReactiveConnectionPool pool)
      implements TransactionSteps<ReactiveHandle> {

    @Override
    public Mono<ReactiveHandle> acquire() {
      return pool.acquire();
    }

    @Override
    public Mono<Void> begin(final ReactiveHandle handle) {
      return handle.beginTransaction();
    }

    @Override
    public Mono<Void> commit(final ReactiveHandle handle) {
      return handle.commit();
    }

    @Override
    public Mono<Void> rollback(final ReactiveHandle handle) {
      return handle.rollback();
    }

    @Override
    public Mono<Void> release(final ReactiveHandle handle) {
      return handle.release();
    }

    @Override
    public Mono<Void> destroy(final ReactiveHandle handle) {
      return handle.destroy();
    }
  }
}
