package com.example.txflow.core.stream;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.ERROR;

import com.example.txflow.core.ConnectionPool;
import com.example.txflow.core.PooledHandle;
import com.example.txflow.core.Row;
import java.lang.System.Logger;
import java.sql.SQLException;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Forward-only, non-restartable iterator over a streaming query, holding at most one row in
 * flight.
 *
 * <p>The first {@link #hasNext()} acquires a handle and starts the query. Each delivered row
 * pauses the source and completes the current readiness future; the next {@link #hasNext()}
 * installs a fresh future and resumes the source. The end of the result completes the future with
 * no row.
 *
 * <p>Closing disposes the handle: it is released when the result was read to its end, and
 * destroyed in every other case (early stop, driver error), since a session with a query still in
 * flight cannot be reused. Exhaustion and errors close the iterator automatically; callers that
 * stop early must {@link #close()} it.
 *
 * <pre>{@code
 * try (var rows = new RowStreamIterator(pool, "SELECT * FROM trades WHERE day = ?", day)) {
 *   while (rows.hasNext()) {
 *     process(rows.next());
 *   }
 * }
 * }</pre>
 */
public final class RowStreamIterator implements Iterator<Row>, AutoCloseable {

  private static final Logger LOGGER = System.getLogger(RowStreamIterator.class.getName());

  private final ConnectionPool pool;
  private final String sql;
  private final Object[] params;
  private final RowListener listener = new SignalListener();

  private volatile CompletableFuture<Row> signal = new CompletableFuture<>();
  private volatile boolean aborted = true;

  private PooledHandle handle;
  private RowEventSource source;
  private Row next;
  private boolean started;
  private boolean done;
  private boolean closed;

  /**
   * Creates the iterator. No connection is taken until iteration starts.
   *
   * @param pool pool to lease the streaming handle from
   * @param sql query with {@code ?} placeholders
   * @param params positional parameters
   */
  public RowStreamIterator(final ConnectionPool pool, final String sql, final Object... params) {
    this.pool = Objects.requireNonNull(pool, "pool");
    this.sql = Objects.requireNonNull(sql, "sql");
    this.params = params == null ? new Object[0] : params.clone();
  }

  @Override
  public boolean hasNext() {
    if (next != null) return true;
    if (done || closed) return false;

    try {
      if (!started) {
        started = true;
        open();
      } else {
        signal = new CompletableFuture<>();
        source.resume();
      }
    } catch (final SQLException | RuntimeException e) {
      done = true;
      close();
      throw propagate(e);
    }

    final var row = await();
    if (row == null) {
      done = true;
      close();
      return false;
    }
    next = row;
    return true;
  }

  @Override
  public Row next() {
    if (!hasNext()) throw new NoSuchElementException();
    final var row = next;
    next = null;
    return row;
  }

  /** Returns true once the source signalled the natural end of the result. */
  public boolean completed() {
    return !aborted;
  }

  @Override
  public void close() {
    if (closed) return;
    closed = true;
    done = true;
    next = null;
    if (handle == null) return;

    if (aborted) {
      LOGGER.log(DEBUG, "Stream stopped before its end, destroying connection");
      destroyQuietly();
      return;
    }
    try {
      handle.release();
    } catch (final SQLException | RuntimeException e) {
      LOGGER.log(ERROR, "Failed to release streaming connection, destroying it", e);
      destroyQuietly();
    }
  }

  private void open() throws SQLException {
    handle = pool.acquire();
    source = handle.stream(sql, params);
    source.start(listener);
  }

  private Row await() {
    try {
      return signal.join();
    } catch (final CompletionException | CancellationException e) {
      done = true;
      close();
      throw propagate(e.getCause() != null ? e.getCause() : e);
    }
  }

  private void destroyQuietly() {
    try {
      handle.destroy();
    } catch (final SQLException | RuntimeException e) {
      LOGGER.log(ERROR, "Failed to destroy streaming connection", e);
    }
  }

  private static RuntimeException propagate(final Throwable error) {
    if (error instanceof RuntimeException re) return re;
    if (error instanceof Error err) throw err;
    return new RowStreamException(error);
  }

  private final class SignalListener implements RowListener {

    @Override
    public void onRow(final Row row) {
      source.pause();
      signal.complete(row);
    }

    @Override
    public void onError(final Throwable error) {
      signal.completeExceptionally(error);
    }

    @Override
    public void onEnd() {
      aborted = false;
      signal.complete(null);
    }
  }
}
