package com.example.txflow.core;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import com.example.txflow.core.jdbc.TransactionExecutor;
import com.example.txflow.core.reactive.OffloadingReactivePool;
import com.example.txflow.core.reactive.ReactiveTransactionExecutor;
import java.sql.SQLException;
import java.util.Collection;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.mockito.invocation.Invocation;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/** Both idioms must leave identical traces for the same step outcomes. */
public class TransactionIdiomEquivalenceTest {

  private static final SQLException ACQUIRE_ERROR = new SQLException("pool exhausted");
  private static final SQLException BEGIN_ERROR = new SQLException("BEGIN refused");
  private static final SQLException COMMIT_ERROR = new SQLException("Deadlock found");
  private static final SQLException ROLLBACK_ERROR = new SQLException("rollback lost");
  private static final SQLException RELEASE_ERROR = new SQLException("reset failed");
  private static final RuntimeException WORK_ERROR = new IllegalStateException("work failed");

  enum Scenario {
    SUCCESS,
    ACQUIRE_FAILS,
    BEGIN_FAILS,
    WORK_FAILS,
    WORK_AND_ROLLBACK_FAIL,
    COMMIT_FAILS,
    RELEASE_AFTER_COMMIT_FAILS
  }

  /** What one run left behind: its error and the cleanup calls made on the handle. */
  record Trace(TransactionState state, Throwable cause, int rollbacks, int releases, int destroys) {}

  @ParameterizedTest(name = "{0}")
  @EnumSource(Scenario.class)
  @DisplayName("Blocking and reactive idioms should produce identical outcomes")
  void idiomsShouldAgree(final Scenario scenario) throws SQLException {
    final var blocking =
        run(
            scenario,
            pool -> new TransactionExecutor(pool).runTransaction(session -> work(scenario)));
    final var reactive =
        run(
            scenario,
            pool ->
                new ReactiveTransactionExecutor(
                        new OffloadingReactivePool(pool, Schedulers.immediate()))
                    .runTransaction(session -> Mono.fromCallable(() -> work(scenario)))
                    .block());

    assertEquals(blocking, reactive);
    assertTrue(blocking.destroys() <= 1);
  }

  private static Integer work(final Scenario scenario) {
    if (scenario == Scenario.WORK_FAILS || scenario == Scenario.WORK_AND_ROLLBACK_FAIL) {
      throw WORK_ERROR;
    }
    return 42;
  }

  private static Trace run(final Scenario scenario, final Run run) throws SQLException {
    final var pool = mock(ConnectionPool.class);
    final var handle = mock(PooledHandle.class);
    if (scenario == Scenario.ACQUIRE_FAILS) {
      when(pool.acquire()).thenThrow(ACQUIRE_ERROR);
    } else {
      when(pool.acquire()).thenReturn(handle);
    }
    switch (scenario) {
      case BEGIN_FAILS -> doThrow(BEGIN_ERROR).when(handle).beginTransaction();
      case WORK_AND_ROLLBACK_FAIL -> doThrow(ROLLBACK_ERROR).when(handle).rollback();
      case COMMIT_FAILS -> doThrow(COMMIT_ERROR).when(handle).commit();
      case RELEASE_AFTER_COMMIT_FAILS -> doThrow(RELEASE_ERROR).when(handle).release();
      default -> {}
    }

    final var error = new AtomicReference<TransactionException>();
    try {
      assertEquals(Integer.valueOf(42), run.apply(pool));
    } catch (final TransactionException e) {
      error.set(e);
    }

    final var invocations = mockingDetails(handle).getInvocations();
    final var failure = error.get();
    return new Trace(
        failure == null ? null : failure.state(),
        failure == null ? null : failure.getCause(),
        count(invocations, "rollback"),
        count(invocations, "release"),
        count(invocations, "destroy"));
  }

  private static int count(final Collection<Invocation> invocations, final String method) {
    return (int)
        invocations.stream().filter(i -> i.getMethod().getName().equals(method)).count();
  }

  @FunctionalInterface
  interface Run {
    Integer apply(ConnectionPool pool);
  }
}
