package com.example.txflow.core;

import java.sql.SQLException;
import java.util.function.Consumer;

/**
 * Pool of exclusively leased database sessions.
 *
 * <p>Every handle obtained from {@link #acquire()} must end with exactly one of {@link
 * PooledHandle#release()} or {@link PooledHandle#destroy()}.
 */
public interface ConnectionPool extends AutoCloseable {

  /**
   * Leases a handle.
   *
   * @return a handle owned exclusively by the caller
   * @throws SQLException if the pool is exhausted or a connection cannot be established
   */
  PooledHandle acquire() throws SQLException;

  /**
   * Subscribes to connection-level faults the pool observes outside of any caller's operation.
   *
   * @param listener receives each fault; must not throw
   */
  void onError(Consumer<? super Throwable> listener);

  /** Ends the pool, closing every physical connection. */
  @Override
  void close();
}
