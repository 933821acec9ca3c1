package com.example.txflow.core.reactive;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import com.example.txflow.core.ConnectionPool;
import com.example.txflow.core.PooledHandle;
import com.example.txflow.core.Row;
import com.example.txflow.core.TransactionException;
import com.example.txflow.core.TransactionState;
import java.sql.SQLException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.*;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

public class ReactiveTransactionExecutorTest {

  private ConnectionPool pool;
  private PooledHandle handle;
  private ReactiveTransactionExecutor executor;

  @BeforeEach
  void setUp() throws SQLException {
    pool = mock(ConnectionPool.class);
    handle = mock(PooledHandle.class);
    when(pool.acquire()).thenReturn(handle);
    executor =
        new ReactiveTransactionExecutor(new OffloadingReactivePool(pool, Schedulers.immediate()));
  }

  @Nested
  @DisplayName("Mono Entry Point")
  class MonoEntryPoint {

    @Test
    @DisplayName("Should be lazy until subscribed")
    void shouldBeLazy() {
      executor.runTransaction(session -> Mono.just(1));

      verifyNoInteractions(pool);
    }

    @Test
    @DisplayName("Should commit and release on success")
    void shouldCommitAndRelease() throws SQLException {
      final var rows = List.of(new Row(Map.of("id", 7L)));
      when(handle.query("SELECT id FROM orders WHERE customer = ?", "acme")).thenReturn(rows);

      final var result =
          executor
              .runTransaction(
                  session -> session.query("SELECT id FROM orders WHERE customer = ?", "acme"))
              .block();

      assertEquals(rows, result);
      final var order = inOrder(handle);
      order.verify(handle).beginTransaction();
      order.verify(handle).query("SELECT id FROM orders WHERE customer = ?", "acme");
      order.verify(handle).commit();
      order.verify(handle).release();
      verify(handle, never()).destroy();
    }

    @Test
    @DisplayName("Should expose the leased blocking handle through the session")
    void shouldExposeHandle() {
      final var seen =
          executor.runTransaction(session -> Mono.just(session.handle().unwrap())).block();

      assertSame(handle, seen);
    }

    @Test
    @DisplayName("Should complete empty when the unit of work completes empty")
    void shouldCompleteEmpty() throws SQLException {
      final var result = executor.runTransaction(session -> Mono.<String>empty()).block();

      assertNull(result);
      verify(handle).commit();
      verify(handle).release();
    }

    @Test
    @DisplayName("Should roll back on an error signal")
    void shouldRollbackOnErrorSignal() throws SQLException {
      final var boom = new IllegalArgumentException("boom");

      final var ex =
          assertThrows(
              TransactionException.class,
              () -> executor.runTransaction(session -> Mono.error(boom)).block());

      assertSame(boom, ex.getCause());
      assertEquals(new TransactionState(true, false, true), ex.state());
      verify(handle).rollback();
      verify(handle).release();
      verify(handle, never()).commit();
    }

    @Test
    @DisplayName("Should roll back when building the work throws")
    void shouldRollbackWhenWorkThrows() throws SQLException {
      final var boom = new IllegalStateException("assembly failed");

      final var ex =
          assertThrows(
              TransactionException.class,
              () ->
                  executor
                      .runTransaction(
                          session -> {
                            throw boom;
                          })
                      .block());

      assertSame(boom, ex.getCause());
      assertEquals(new TransactionState(true, false, true), ex.state());
    }

    @Test
    @DisplayName("Should destroy without rollback when BEGIN fails")
    void shouldDestroyWhenBeginFails() throws SQLException {
      doThrow(new SQLException("BEGIN refused")).when(handle).beginTransaction();

      final var ex =
          assertThrows(
              TransactionException.class,
              () -> executor.runTransaction(session -> Mono.just(1)).block());

      assertEquals(TransactionState.INITIAL, ex.state());
      verify(handle, never()).rollback();
      verify(handle, never()).release();
      verify(handle).destroy();
    }

    @Test
    @DisplayName("Should run every step on the given scheduler")
    void shouldOffloadSteps() throws SQLException {
      final Scheduler scheduler = Schedulers.newSingle("txflow-test");
      try {
        final var threads = new AtomicReference<String>();
        doAnswer(
                invocation -> {
                  threads.set(Thread.currentThread().getName());
                  return null;
                })
            .when(handle)
            .commit();
        final var offloaded =
            new ReactiveTransactionExecutor(new OffloadingReactivePool(pool, scheduler));

        offloaded.runTransaction(session -> Mono.just(1)).block(Duration.ofSeconds(5));

        assertTrue(threads.get().startsWith("txflow-test"));
      } finally {
        scheduler.dispose();
      }
    }
  }

  @Nested
  @DisplayName("Callback Entry Point")
  class CallbackEntryPoint {

    @Test
    @DisplayName("Should deliver the result once with no error")
    void shouldDeliverResult() {
      final var calls = new AtomicInteger();
      final var received = new AtomicReference<Object>();

      executor.runTransaction(
          session -> Mono.just("ok"),
          (result, error) -> {
            calls.incrementAndGet();
            received.set(result);
            assertNull(error);
          });

      assertEquals(1, calls.get());
      assertEquals("ok", received.get());
    }

    @Test
    @DisplayName("Should deliver null result when the work completes empty")
    void shouldDeliverNullResult() {
      final var calls = new AtomicInteger();

      executor.runTransaction(
          session -> Mono.<String>empty(),
          (result, error) -> {
            calls.incrementAndGet();
            assertNull(result);
            assertNull(error);
          });

      assertEquals(1, calls.get());
    }

    @Test
    @DisplayName("Should deliver the transaction error once")
    void shouldDeliverError() throws SQLException {
      final var commitError = new SQLException("Deadlock found");
      doThrow(commitError).when(handle).commit();
      final var calls = new AtomicInteger();
      final var received = new AtomicReference<TransactionException>();

      executor.runTransaction(
          session -> Mono.just(1),
          (result, error) -> {
            calls.incrementAndGet();
            received.set(error);
            assertNull(result);
          });

      assertEquals(1, calls.get());
      assertSame(commitError, received.get().getCause());
      assertEquals(new TransactionState(true, false, true), received.get().state());
    }

    @Test
    @DisplayName("Should not invoke the callback twice when it throws")
    void shouldNotInvokeCallbackTwice() {
      final var calls = new AtomicInteger();

      executor.runTransaction(
          session -> Mono.just(1),
          (result, error) -> {
            calls.incrementAndGet();
            throw new IllegalStateException("callback bug");
          });

      assertEquals(1, calls.get());
    }
  }

  @Nested
  @DisplayName("Cancellation")
  class Cancellation {

    @Test
    @DisplayName("Should destroy the handle when the subscriber cancels mid-transaction")
    void shouldDestroyOnCancel() throws Exception {
      final var reactiveHandle = mock(ReactiveHandle.class);
      final var destroyed = new CountDownLatch(1);
      final var released = new AtomicBoolean();
      when(reactiveHandle.beginTransaction()).thenReturn(Mono.empty());
      when(reactiveHandle.commit()).thenReturn(Mono.empty());
      when(reactiveHandle.rollback()).thenReturn(Mono.empty());
      when(reactiveHandle.release()).thenReturn(Mono.fromRunnable(() -> released.set(true)));
      when(reactiveHandle.destroy()).thenReturn(Mono.fromRunnable(destroyed::countDown));
      final var cancellable = new ReactiveTransactionExecutor(() -> Mono.just(reactiveHandle));

      final var running = cancellable.runTransaction(session -> Mono.never()).subscribe();
      running.dispose();

      assertTrue(destroyed.await(5, TimeUnit.SECONDS));
      assertFalse(released.get());
      verify(reactiveHandle, never()).commit();
    }

    @Test
    @DisplayName("Should destroy a handle that arrives after the subscriber cancelled")
    void shouldDestroyHandleAcquiredAfterCancel() throws Exception {
      final var acquireStarted = new CountDownLatch(1);
      final var poolReady = new CountDownLatch(1);
      when(pool.acquire())
          .thenAnswer(
              invocation -> {
                acquireStarted.countDown();
                assertTrue(poolReady.await(5, TimeUnit.SECONDS));
                return handle;
              });
      final Scheduler scheduler = Schedulers.newSingle("txflow-acquire");
      try {
        final var offloaded =
            new ReactiveTransactionExecutor(new OffloadingReactivePool(pool, scheduler));

        final var running = offloaded.runTransaction(session -> Mono.just(1)).subscribe();
        assertTrue(acquireStarted.await(5, TimeUnit.SECONDS));
        running.dispose();
        poolReady.countDown();

        verify(handle, timeout(5_000)).destroy();
        verify(handle, never()).beginTransaction();
        verify(handle, never()).release();
      } finally {
        scheduler.dispose();
      }
    }
  }
}
