package com.example.txflow.core.jdbc;

import com.example.txflow.core.PooledHandle;
import com.example.txflow.core.Row;
import com.example.txflow.core.stream.RowEventSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;

/** {@link PooledHandle} over one Hikari-managed JDBC connection. */
final class JdbcPooledHandle implements PooledHandle {

  private final Connection connection;
  private final HikariConnectionPool pool;

  JdbcPooledHandle(final Connection connection, final HikariConnectionPool pool) {
    this.connection = connection;
    this.pool = pool;
  }

  @Override
  public void beginTransaction() throws SQLException {
    connection.setAutoCommit(false);
  }

  @Override
  public void commit() throws SQLException {
    connection.commit();
  }

  @Override
  public void rollback() throws SQLException {
    connection.rollback();
  }

  @Override
  public List<Row> query(final String sql, final Object... params) throws SQLException {
    return Statements.query(connection, sql, pool.rowReader()::read, params);
  }

  @Override
  public int update(final String sql, final Object... params) throws SQLException {
    return Statements.update(connection, sql, params);
  }

  @Override
  public RowEventSource stream(final String sql, final Object... params) {
    return new JdbcRowEventSource(
        connection,
        sql,
        params == null ? new Object[0] : params.clone(),
        pool.rowReader(),
        pool.streamFetchSize(),
        pool::reportError);
  }

  @Override
  public Connection connection() {
    return connection;
  }

  @Override
  public void release() throws SQLException {
    // a session that cannot be put back into auto-commit is not handed back
    if (!connection.getAutoCommit()) connection.setAutoCommit(true);
    connection.close();
  }

  @Override
  public void destroy() {
    pool.evict(connection);
  }
}
