package com.example.txflow.core;

import java.util.Objects;

/**
 * Failure of a transaction run, carrying the original cause and a snapshot of the protocol state
 * at the moment the run gave up.
 *
 * <p>This is the only error type the transaction executors surface. The cause is the exact
 * throwable raised by the failing step (acquire, BEGIN, unit of work, COMMIT or release); cleanup
 * failures are logged and never replace it.
 */
public final class TransactionException extends RuntimeException {

  /** Message shared by every transaction failure. */
  public static final String MESSAGE = "ERR_TX_FLOW_FAILURE";

  private final TransactionState state;

  /**
   * Creates a transaction failure.
   *
   * @param cause the original failure
   * @param state protocol state when the failure surfaced
   */
  public TransactionException(final Throwable cause, final TransactionState state) {
    super(MESSAGE, Objects.requireNonNull(cause, "cause"));
    this.state = Objects.requireNonNull(state, "state");
  }

  /**
   * Returns the protocol state snapshot.
   *
   * @return the state at failure time
   */
  public TransactionState state() {
    return state;
  }

  @Override
  public String toString() {
    return super.toString() + ", " + state + ", Original Error: " + getCause();
  }
}
