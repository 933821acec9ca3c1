package com.example.txflow.core;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Mutable protocol state of a single transaction run. Created all-false when the run starts and
 * discarded when it returns.
 *
 * <p>Also tracks the final disposition of the acquired handle so that exactly one of release or
 * destroy reaches the pool.
 */
final class TransactionProtocol {

  enum Disposition {
    NONE,
    RELEASED,
    DESTROYED
  }

  private volatile boolean started;
  private volatile boolean committed;
  private volatile boolean reverted;

  private final AtomicReference<Disposition> disposition = new AtomicReference<>(Disposition.NONE);
  private final AtomicBoolean acquireSettled = new AtomicBoolean();

  void begun() {
    started = true;
  }

  void committed() {
    committed = true;
  }

  void reverted() {
    reverted = true;
  }

  /** ROLLBACK is owed when BEGIN went through and COMMIT did not. */
  boolean rollbackRequired() {
    return started && !committed;
  }

  /**
   * Settles the race between the acquire outcome and a cancelling subscriber.
   *
   * @return true for the first caller only
   */
  boolean settleAcquire() {
    return acquireSettled.compareAndSet(false, true);
  }

  boolean isDisposed() {
    return disposition.get() != Disposition.NONE;
  }

  void markReleased() {
    disposition.compareAndSet(Disposition.NONE, Disposition.RELEASED);
  }

  /**
   * Claims the handle for destruction.
   *
   * @return false if the handle was already released or destroyed
   */
  boolean markDestroyed() {
    return disposition.compareAndSet(Disposition.NONE, Disposition.DESTROYED);
  }

  Disposition disposition() {
    return disposition.get();
  }

  TransactionState snapshot() {
    return new TransactionState(started, committed, reverted);
  }

  TransactionException failure(final Throwable cause) {
    return new TransactionException(cause, snapshot());
  }
}
