package com.example.txflow.core.jdbc;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.WARNING;

import com.example.txflow.core.ConnectionPool;
import com.example.txflow.core.PooledHandle;
import com.example.txflow.core.config.DbConfig;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import java.lang.System.Logger;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * {@link ConnectionPool} backed by a {@link HikariDataSource}.
 *
 * <p>Releasing a handle restores auto-commit and returns the connection to Hikari; destroying it
 * evicts the connection so Hikari closes the physical session and never hands it out again.
 *
 * <pre>{@code
 * var pool = new HikariConnectionPool(DbConfig.builder()
 *     .host("db.internal")
 *     .user("app")
 *     .password(password)
 *     .database("ledger")
 *     .build());
 * }</pre>
 */
public final class HikariConnectionPool implements ConnectionPool {

  private static final Logger LOGGER = System.getLogger(HikariConnectionPool.class.getName());

  private final HikariDataSource dataSource;
  private final JdbcRowReader rowReader;
  private final int streamFetchSize;
  private final List<Consumer<? super Throwable>> errorListeners = new CopyOnWriteArrayList<>();

  /**
   * Builds and starts a Hikari pool for {@code config}.
   *
   * @param config connection settings
   */
  public HikariConnectionPool(final DbConfig config) {
    this(new HikariDataSource(toHikariConfig(config)), config);
  }

  HikariConnectionPool(final HikariDataSource dataSource, final DbConfig config) {
    this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
    this.rowReader = JdbcRowReader.from(config);
    this.streamFetchSize = config.streamFetchSize();
  }

  static HikariConfig toHikariConfig(final DbConfig config) {
    final var hikari = new HikariConfig();
    hikari.setJdbcUrl(config.resolvedJdbcUrl());
    hikari.setUsername(config.user());
    hikari.setPassword(config.password());
    hikari.setMaximumPoolSize(config.connectionLimit());
    hikari.setMinimumIdle(Math.min(config.connectionLimit(), 10));
    hikari.setConnectionTimeout(config.connectionTimeoutMillis());
    hikari.setAutoCommit(true);
    hikari.setPoolName("txflow-" + Integer.toHexString(System.identityHashCode(config)));
    if (config.resolvedJdbcUrl().startsWith("jdbc:mysql:")) {
      hikari.addDataSourceProperty("connectionTimeZone", config.timezone());
      hikari.addDataSourceProperty("forceConnectionTimeZoneToSession", "true");
    }
    return hikari;
  }

  @Override
  public PooledHandle acquire() throws SQLException {
    return new JdbcPooledHandle(dataSource.getConnection(), this);
  }

  @Override
  public void onError(final Consumer<? super Throwable> listener) {
    errorListeners.add(Objects.requireNonNull(listener, "listener"));
  }

  @Override
  public void close() {
    try {
      dataSource.close();
    } catch (final RuntimeException e) {
      reportError(e);
    }
  }

  JdbcRowReader rowReader() {
    return rowReader;
  }

  int streamFetchSize() {
    return streamFetchSize;
  }

  void evict(final Connection connection) {
    LOGGER.log(DEBUG, "Evicting connection from {0}", dataSource.getPoolName());
    dataSource.evictConnection(connection);
  }

  /** Publishes a fault that no in-flight caller can receive. */
  void reportError(final Throwable error) {
    if (errorListeners.isEmpty()) {
      LOGGER.log(WARNING, "Unhandled connection pool fault", error);
      return;
    }
    for (final var listener : errorListeners) {
      try {
        listener.accept(error);
      } catch (final RuntimeException e) {
        LOGGER.log(WARNING, "Connection pool error listener failed", e);
      }
    }
  }
}
