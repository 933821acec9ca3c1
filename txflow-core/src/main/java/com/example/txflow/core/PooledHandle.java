package com.example.txflow.core;

import com.example.txflow.core.stream.RowEventSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;

/**
 * A leased, exclusive-use database session.
 *
 * <p>Commands on one handle are strictly sequential. A handle may only be {@linkplain #release()
 * released} when it is known to be idle and outside a transaction; otherwise it has to be
 * {@linkplain #destroy() destroyed}.
 */
public interface PooledHandle {

  void beginTransaction() throws SQLException;

  void commit() throws SQLException;

  void rollback() throws SQLException;

  /**
   * Runs a query and collects every row.
   *
   * @param sql statement with {@code ?} placeholders
   * @param params positional parameters
   * @return the rows, in result order
   * @throws SQLException on driver errors
   */
  List<Row> query(String sql, Object... params) throws SQLException;

  /**
   * Runs a data or schema modification statement.
   *
   * @param sql statement with {@code ?} placeholders
   * @param params positional parameters
   * @return affected row count
   * @throws SQLException on driver errors
   */
  int update(String sql, Object... params) throws SQLException;

  /**
   * Prepares a streaming query. Nothing is sent until the returned source is started.
   *
   * @param sql statement with {@code ?} placeholders
   * @param params positional parameters
   * @return a pausable row-event source bound to this handle
   */
  RowEventSource stream(String sql, Object... params);

  /** Returns the raw JDBC connection behind this handle. */
  Connection connection();

  /**
   * Returns the handle to the pool for reuse.
   *
   * @throws SQLException if the session could not be reset; the handle then has to be destroyed
   */
  void release() throws SQLException;

  /**
   * Tears down the physical connection; the handle is never reused.
   *
   * @throws SQLException if the driver reports an error while closing
   */
  void destroy() throws SQLException;
}
