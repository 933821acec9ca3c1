package com.example.txflow.core.jdbc;

import com.example.txflow.core.PooledHandle;
import com.example.txflow.core.Row;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;

/**
 * What a blocking {@link UnitOfWork} sees: a query executor bound to the transaction's handle,
 * plus the raw handle and connection for anything else.
 *
 * <p>Do not commit, roll back or close through the raw objects; the executor owns the protocol.
 */
public final class TransactionSession {

  private final PooledHandle handle;

  TransactionSession(final PooledHandle handle) {
    this.handle = handle;
  }

  public List<Row> query(final String sql, final Object... params) throws SQLException {
    return handle.query(sql, params);
  }

  public int update(final String sql, final Object... params) throws SQLException {
    return handle.update(sql, params);
  }

  public PooledHandle handle() {
    return handle;
  }

  public Connection connection() {
    return handle.connection();
  }
}
