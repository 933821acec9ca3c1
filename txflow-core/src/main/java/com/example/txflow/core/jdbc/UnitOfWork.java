package com.example.txflow.core.jdbc;

/**
 * Caller logic run inside BEGIN/COMMIT by {@link TransactionExecutor}.
 *
 * <p>Throwing anything rolls the transaction back.
 *
 * @param <T> result type
 */
@FunctionalInterface
public interface UnitOfWork<T> {
  /**
   * Executes the work on the transaction's session.
   *
   * @param session query executor bound to the transaction's handle
   * @return the result handed back to the caller, may be {@code null}
   * @throws Exception any failure; it becomes the cause of the resulting transaction error
   */
  T execute(final TransactionSession session) throws Exception;
}
