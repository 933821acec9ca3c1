package com.example.txflow.core.jdbc;

import static java.lang.System.Logger.Level.ERROR;
import static java.lang.System.Logger.Level.INFO;

import com.example.txflow.core.ConnectionPool;
import com.example.txflow.core.PooledHandle;
import com.example.txflow.core.Row;
import com.example.txflow.core.config.DbConfig;
import com.example.txflow.core.reactive.OffloadingReactivePool;
import com.example.txflow.core.reactive.ReactiveTransactionExecutor;
import com.example.txflow.core.stream.RowStreamIterator;
import java.lang.System.Logger;
import java.sql.SQLException;
import java.util.List;
import java.util.Objects;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * Database facility owning one connection pool between its {@link #start()} and {@link #stop()}
 * hooks.
 *
 * <p>While started it exposes a non-transactional query executor, streaming queries and both
 * transaction idioms, all sharing the same pool. Faults the pool reports outside of any call are
 * logged under the client's label.
 *
 * <h2>Usage</h2>
 *
 * <pre>{@code
 * var client = DbClient.builder()
 *     .config(DbConfigLoader.fromResource("db.json", "m0"))
 *     .label("m0")
 *     .build();
 * client.start();
 * try (var trades = client.streamQuery("SELECT * FROM trades WHERE day = ?", day)) {
 *   trades.forEach(this::settle);
 * }
 * client.stop();
 * }</pre>
 */
public final class DbClient implements AutoCloseable {

  private static final Logger LOGGER = System.getLogger(DbClient.class.getName());

  /** Label used when none is configured. */
  public static final String DEFAULT_LABEL = "generic";

  private final DbConfig config;
  private final String label;
  private final ConnectionPoolFactory poolFactory;
  private final Scheduler scheduler;

  private volatile ConnectionPool pool;
  private volatile TransactionExecutor transactions;
  private volatile ReactiveTransactionExecutor reactiveTransactions;
  private boolean stopped;

  private DbClient(final Builder builder) {
    this.config = Objects.requireNonNull(builder.config, "config");
    this.label = builder.label == null ? DEFAULT_LABEL : builder.label;
    this.poolFactory =
        builder.poolFactory == null ? HikariConnectionPool::new : builder.poolFactory;
    this.scheduler = builder.scheduler == null ? Schedulers.boundedElastic() : builder.scheduler;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Creates the pool and subscribes the fault logger to its error channel.
   *
   * @throws IllegalStateException if the client was already started or has been stopped
   */
  public synchronized void start() {
    if (pool != null) throw new IllegalStateException("DbClient [" + label + "] already started");
    if (stopped) throw new IllegalStateException("DbClient [" + label + "] has been stopped");

    final var created = poolFactory.create(config);
    created.onError(
        fault -> LOGGER.log(ERROR, "Connection pool fault [" + label + "]", fault));
    this.transactions = new TransactionExecutor(created);
    this.reactiveTransactions =
        new ReactiveTransactionExecutor(new OffloadingReactivePool(created, scheduler));
    this.pool = created;
    LOGGER.log(INFO, "DbClient [{0}] started with {1}", label, config);
  }

  /** Ends the pool, closing every physical connection. Calling it again does nothing. */
  public synchronized void stop() {
    final var current = pool;
    if (current == null) {
      stopped = true;
      return;
    }
    pool = null;
    transactions = null;
    reactiveTransactions = null;
    stopped = true;
    current.close();
    LOGGER.log(INFO, "DbClient [{0}] stopped", label);
  }

  @Override
  public void close() {
    stop();
  }

  public boolean isStarted() {
    return pool != null;
  }

  public String label() {
    return label;
  }

  /**
   * Runs one statement outside of any transaction.
   *
   * @param sql query with {@code ?} placeholders
   * @param params positional parameters
   * @return all result rows
   * @throws SQLException if acquisition or the statement fails
   */
  public List<Row> query(final String sql, final Object... params) throws SQLException {
    return withHandle(handle -> handle.query(sql, params));
  }

  /**
   * Runs one DML or DDL statement outside of any transaction.
   *
   * @param sql statement with {@code ?} placeholders
   * @param params positional parameters
   * @return affected row count
   * @throws SQLException if acquisition or the statement fails
   */
  public int update(final String sql, final Object... params) throws SQLException {
    return withHandle(handle -> handle.update(sql, params));
  }

  /**
   * Streams a query's rows one at a time over a dedicated connection.
   *
   * <p>The returned stream must be closed when not consumed to its end; closing it early destroys
   * the connection.
   *
   * @param sql query with {@code ?} placeholders
   * @param params positional parameters
   * @return a lazy, sequential, non-restartable stream
   */
  public Stream<Row> streamQuery(final String sql, final Object... params) {
    final var rows = new RowStreamIterator(requirePool(), sql, params);
    return StreamSupport.stream(
            Spliterators.spliteratorUnknownSize(rows, Spliterator.ORDERED | Spliterator.NONNULL),
            false)
        .onClose(rows::close);
  }

  /** Runs {@code work} in a transaction, blocking the calling thread. */
  public <T> T runTransaction(final UnitOfWork<T> work) {
    return transactions().runTransaction(work);
  }

  public TransactionExecutor transactions() {
    final var current = transactions;
    if (current == null) throw notStarted();
    return current;
  }

  public ReactiveTransactionExecutor reactiveTransactions() {
    final var current = reactiveTransactions;
    if (current == null) throw notStarted();
    return current;
  }

  private <T> T withHandle(final HandleCall<T> call) throws SQLException {
    final var handle = requirePool().acquire();
    final T result;
    try {
      result = call.apply(handle);
    } catch (final SQLException | RuntimeException e) {
      destroyQuietly(handle, e);
      throw e;
    }
    try {
      handle.release();
    } catch (final SQLException | RuntimeException e) {
      destroyQuietly(handle, e);
      throw e;
    }
    return result;
  }

  private static void destroyQuietly(final PooledHandle handle, final Exception primary) {
    try {
      handle.destroy();
    } catch (final SQLException | RuntimeException e) {
      primary.addSuppressed(e);
    }
  }

  private ConnectionPool requirePool() {
    final var current = pool;
    if (current == null) throw notStarted();
    return current;
  }

  private IllegalStateException notStarted() {
    return new IllegalStateException("DbClient [" + label + "] is not started");
  }

  @FunctionalInterface
  private interface HandleCall<T> {
    T apply(PooledHandle handle) throws SQLException;
  }

  /** Builder for {@link DbClient}. Only {@link #config(DbConfig)} is required. */
  public static final class Builder {
    private DbConfig config;
    private String label;
    private ConnectionPoolFactory poolFactory;
    private Scheduler scheduler;

    private Builder() {}

    public Builder config(final DbConfig config) {
      this.config = config;
      return this;
    }

    /** Name used in log lines, typically the config label. Defaults to {@code generic}. */
    public Builder label(final String label) {
      this.label = label;
      return this;
    }

    public Builder poolFactory(final ConnectionPoolFactory poolFactory) {
      this.poolFactory = poolFactory;
      return this;
    }

    /** Scheduler the reactive idiom offloads blocking driver calls onto. */
    public Builder scheduler(final Scheduler scheduler) {
      this.scheduler = scheduler;
      return this;
    }

    public DbClient build() {
      return new DbClient(this);
    }
  }
}
