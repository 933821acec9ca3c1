package com.example.txflow.core.jdbc;

import com.example.txflow.core.Row;
import com.example.txflow.core.stream.RowEventSource;
import com.example.txflow.core.stream.RowListener;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.function.Consumer;

/**
 * {@link RowEventSource} over a forward-only JDBC result read with a streaming fetch size.
 *
 * <p>Rows are pumped on the thread that calls {@link #start} or {@link #resume()}, and only while
 * the source is not paused, so a listener that pauses in {@link RowListener#onRow} receives
 * exactly one row per resume. The statement is closed when the result ends or fails; when the
 * consumer walks away early the statement is left to the connection's destruction.
 */
final class JdbcRowEventSource implements RowEventSource {

  private final Connection connection;
  private final String sql;
  private final Object[] params;
  private final JdbcRowReader rowReader;
  private final int fetchSize;
  private final Consumer<Throwable> faultReporter;

  private RowListener listener;
  private PreparedStatement statement;
  private ResultSet resultSet;
  private volatile boolean paused;
  private boolean finished;
  private boolean pumping;

  JdbcRowEventSource(
      final Connection connection,
      final String sql,
      final Object[] params,
      final JdbcRowReader rowReader,
      final int fetchSize,
      final Consumer<Throwable> faultReporter) {
    this.connection = connection;
    this.sql = sql;
    this.params = params;
    this.rowReader = rowReader;
    this.fetchSize = fetchSize;
    this.faultReporter = faultReporter;
  }

  @Override
  public void start(final RowListener listener) {
    if (this.listener != null) throw new IllegalStateException("Stream already started");
    this.listener = listener;
    try {
      statement =
          connection.prepareStatement(sql, ResultSet.TYPE_FORWARD_ONLY, ResultSet.CONCUR_READ_ONLY);
      statement.setFetchSize(fetchSize);
      Statements.bind(statement, params);
      resultSet = statement.executeQuery();
    } catch (final SQLException e) {
      fail(e);
      return;
    }
    pump();
  }

  @Override
  public void pause() {
    paused = true;
  }

  @Override
  public void resume() {
    paused = false;
    pump();
  }

  private void pump() {
    if (pumping || listener == null) return;
    pumping = true;
    try {
      while (!paused && !finished) {
        final Row row;
        try {
          row = resultSet.next() ? rowReader.read(resultSet) : null;
        } catch (final SQLException e) {
          fail(e);
          return;
        }
        if (row == null) {
          finished = true;
          closeStatement();
          listener.onEnd();
          return;
        }
        listener.onRow(row);
      }
    } finally {
      pumping = false;
    }
  }

  private void fail(final SQLException error) {
    finished = true;
    listener.onError(error);
  }

  private void closeStatement() {
    try {
      statement.close();
    } catch (final SQLException e) {
      faultReporter.accept(e);
    }
  }
}
