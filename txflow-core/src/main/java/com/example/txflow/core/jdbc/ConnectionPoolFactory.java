package com.example.txflow.core.jdbc;

import com.example.txflow.core.ConnectionPool;
import com.example.txflow.core.config.DbConfig;

/**
 * Factory that creates a {@link ConnectionPool} from a {@link DbConfig}. The default, {@link
 * HikariConnectionPool#HikariConnectionPool(DbConfig)}, builds a HikariCP pool.
 */
@FunctionalInterface
public interface ConnectionPoolFactory {
  /**
   * Creates a new pool configured from {@code config}.
   *
   * @param config connection settings
   * @return a started pool
   */
  ConnectionPool create(final DbConfig config);
}
