package com.example.txflow.core;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.ERROR;
import static java.lang.System.Logger.Level.WARNING;

import java.lang.System.Logger;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import reactor.core.publisher.Mono;

/**
 * The transaction protocol, implemented once over an abstract {@link TransactionSteps} sequence.
 *
 * <ol>
 *   <li>Acquire a handle. Failure is terminal, the state stays all-false.
 *   <li>BEGIN, then mark the run as started.
 *   <li>Run the unit of work.
 *   <li>COMMIT, then mark the run as committed.
 *   <li>Release the handle.
 * </ol>
 *
 * <p>On any failure after acquisition:
 *
 * <ul>
 *   <li>started and not committed: ROLLBACK. Success marks the run as reverted and releases the
 *       handle; failure (of the rollback or of that release) destroys the handle.
 *   <li>otherwise (BEGIN failed, or the release after COMMIT failed): destroy the handle, its
 *       session is not known to be clean.
 * </ul>
 *
 * <p>Every failure surfaces as a {@link TransactionException} wrapping the original cause and the
 * final state. Rollback and destroy errors are logged and suppressed. Nested transactions are not
 * supported.
 *
 * <h2>Usage</h2>
 *
 * <pre>{@code
 * var flow = new TransactionFlow<>(steps);
 * Mono<Long> id = flow.run(handle -> insertOrder(handle, order));
 * }</pre>
 *
 * @param <H> the handle type leased from the pool
 */
public final class TransactionFlow<H> {

  private static final Logger LOGGER = System.getLogger(TransactionFlow.class.getName());

  private final TransactionSteps<H> steps;

  /**
   * Creates a flow over the given steps.
   *
   * @param steps the I/O steps of the concurrency idiom in use
   */
  public TransactionFlow(final TransactionSteps<H> steps) {
    this.steps = Objects.requireNonNull(steps, "steps");
  }

  /**
   * Runs {@code work} inside BEGIN/COMMIT on a freshly acquired handle.
   *
   * <p>The returned {@link Mono} emits the work's result (or completes empty when the work does),
   * or errors with a {@link TransactionException}. Nothing happens until it is subscribed.
   *
   * @param work the unit of work, given the raw handle
   * @param <T> result type
   * @return the deferred transaction run
   */
  public <T> Mono<T> run(final Function<? super H, ? extends Mono<? extends T>> work) {
    Objects.requireNonNull(work, "work");
    return Mono.defer(
        () -> {
          final var protocol = new TransactionProtocol();
          return acquire(protocol)
              .switchIfEmpty(Mono.error(new IllegalStateException("Pool returned no connection")))
              .onErrorMap(protocol::failure)
              .flatMap(handle -> execute(handle, protocol, work));
        });
  }

  /**
   * Leases a handle without forwarding cancellation to the pool step, so a handle that arrives
   * after the subscriber cancelled is still seen here and destroyed.
   */
  private Mono<H> acquire(final TransactionProtocol protocol) {
    return Mono.create(
        sink -> {
          sink.onCancel(protocol::settleAcquire);
          steps
              .acquire()
              .subscribe(
                  handle -> {
                    if (protocol.settleAcquire()) {
                      sink.success(handle);
                    } else if (protocol.markDestroyed()) {
                      LOGGER.log(WARNING, "Connection acquired after cancellation, destroying it");
                      destroyQuietly(handle).subscribe();
                    }
                  },
                  error -> {
                    if (protocol.settleAcquire()) {
                      sink.error(error);
                    } else {
                      LOGGER.log(DEBUG, "Acquire failed after cancellation", error);
                    }
                  },
                  () -> {
                    if (protocol.settleAcquire()) sink.success();
                  });
        });
  }

  private <T> Mono<T> execute(
      final H handle,
      final TransactionProtocol protocol,
      final Function<? super H, ? extends Mono<? extends T>> work) {
    return steps
        .begin(handle)
        .then(Mono.fromRunnable(protocol::begun))
        .then(
            Mono.<T>defer(() -> work.apply(handle))
                .map(Optional::of)
                .defaultIfEmpty(Optional.empty()))
        .flatMap(
            result ->
                steps
                    .commit(handle)
                    .then(Mono.fromRunnable(protocol::committed))
                    .thenReturn(result))
        .flatMap(result -> release(handle, protocol).thenReturn(result))
        .onErrorResume(
            failure ->
                cleanUp(handle, protocol, failure)
                    .then(Mono.defer(() -> Mono.<Optional<T>>error(protocol.failure(failure)))))
        .doOnCancel(
            () -> {
              if (protocol.markDestroyed()) {
                LOGGER.log(WARNING, "Transaction cancelled mid-flight, destroying connection");
                destroyQuietly(handle).subscribe();
              }
            })
        .flatMap(result -> Mono.<T>justOrEmpty(result));
  }

  private Mono<Void> cleanUp(
      final H handle, final TransactionProtocol protocol, final Throwable failure) {
    LOGGER.log(DEBUG, "Transaction failed at {0}", protocol.snapshot());

    if (!protocol.rollbackRequired()) {
      return destroy(handle, protocol);
    }

    return steps
        .rollback(handle)
        .then(Mono.fromRunnable(protocol::reverted))
        .then(release(handle, protocol))
        .onErrorResume(
            cleanupError -> {
              LOGGER.log(ERROR, "Rollback failed, destroying connection", cleanupError);
              return destroy(handle, protocol);
            });
  }

  private Mono<Void> release(final H handle, final TransactionProtocol protocol) {
    return Mono.defer(
        () ->
            protocol.isDisposed()
                ? Mono.<Void>empty()
                : steps.release(handle).then(Mono.fromRunnable(protocol::markReleased)));
  }

  private Mono<Void> destroy(final H handle, final TransactionProtocol protocol) {
    return Mono.defer(
        () -> {
          if (!protocol.markDestroyed()) return Mono.<Void>empty();
          LOGGER.log(WARNING, "Destroying connection, session state is unknown");
          return destroyQuietly(handle);
        });
  }

  private Mono<Void> destroyQuietly(final H handle) {
    return steps
        .destroy(handle)
        .onErrorResume(
            destroyError -> {
              LOGGER.log(ERROR, "Failed to destroy connection", destroyError);
              return Mono.empty();
            });
  }
}
