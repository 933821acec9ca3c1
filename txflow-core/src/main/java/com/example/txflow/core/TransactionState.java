package com.example.txflow.core;

/**
 * Immutable snapshot of how far a transaction protocol advanced.
 *
 * <p>The flags only ever move from {@code false} to {@code true}. On every terminal path where
 * {@code started} is true, exactly one of {@code committed} and {@code reverted} is true when the
 * outcome is known; both false means the outcome is unknown.
 *
 * <ul>
 *   <li>{@code started=true, committed=false, reverted=true}: no durable effect
 *   <li>{@code started=true, committed=false, reverted=false}: outcome unknown, treat as possibly
 *       applied
 * </ul>
 *
 * @param started BEGIN succeeded
 * @param committed COMMIT succeeded
 * @param reverted ROLLBACK succeeded
 */
public record TransactionState(boolean started, boolean committed, boolean reverted) {

  /** State of a transaction that has not issued BEGIN yet. */
  public static final TransactionState INITIAL = new TransactionState(false, false, false);

  /**
   * Returns true when the work may or may not have been applied and the caller has to assume it
   * was.
   *
   * @return true if the outcome is unknown
   */
  public boolean outcomeUnknown() {
    return started && !committed && !reverted;
  }
}
