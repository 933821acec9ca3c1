package com.example.txflow.core.jdbc;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import com.example.txflow.core.config.DbConfig;
import com.zaxxer.hikari.HikariDataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import org.junit.jupiter.api.*;

public class HikariConnectionPoolTest {

  private final DbConfig config =
      DbConfig.builder()
          .host("db.internal")
          .user("app")
          .password("s3cret")
          .database("ledger")
          .build();

  private HikariDataSource dataSource;
  private Connection connection;
  private HikariConnectionPool pool;

  @BeforeEach
  void setUp() throws SQLException {
    dataSource = mock(HikariDataSource.class);
    connection = mock(Connection.class);
    when(dataSource.getConnection()).thenReturn(connection);
    pool = new HikariConnectionPool(dataSource, config);
  }

  @Test
  @DisplayName("Should map the config onto Hikari settings")
  void shouldMapConfig() {
    final var hikari = HikariConnectionPool.toHikariConfig(config);

    assertEquals("jdbc:mysql://db.internal:3306/ledger", hikari.getJdbcUrl());
    assertEquals("app", hikari.getUsername());
    assertEquals(100, hikari.getMaximumPoolSize());
    assertEquals(10, hikari.getMinimumIdle());
    assertEquals(30_000L, hikari.getConnectionTimeout());
    assertTrue(hikari.isAutoCommit());
    assertEquals("+00:00", hikari.getDataSourceProperties().getProperty("connectionTimeZone"));
  }

  @Test
  @DisplayName("Should not add MySQL session properties to other drivers")
  void shouldSkipMySqlPropertiesElsewhere() {
    final var h2 = DbConfig.builder().jdbcUrl("jdbc:h2:mem:test").connectionLimit(3).build();

    final var hikari = HikariConnectionPool.toHikariConfig(h2);

    assertEquals(3, hikari.getMinimumIdle());
    assertTrue(hikari.getDataSourceProperties().isEmpty());
  }

  @Test
  @DisplayName("Should restore auto-commit before returning a connection")
  void shouldRestoreAutoCommitOnRelease() throws SQLException {
    when(connection.getAutoCommit()).thenReturn(false);

    final var handle = pool.acquire();
    handle.beginTransaction();
    handle.release();

    final var order = inOrder(connection);
    order.verify(connection).setAutoCommit(false);
    order.verify(connection).setAutoCommit(true);
    order.verify(connection).close();
    verify(dataSource, never()).evictConnection(any());
  }

  @Test
  @DisplayName("Should evict the connection on destroy")
  void shouldEvictOnDestroy() throws SQLException {
    pool.acquire().destroy();

    verify(dataSource).evictConnection(connection);
    verify(connection, never()).close();
  }

  @Test
  @DisplayName("Should publish close failures to the error channel")
  void shouldPublishCloseFailures() {
    final var faults = new ArrayList<Throwable>();
    final var failure = new IllegalStateException("shutdown interrupted");
    doThrow(failure).when(dataSource).close();
    pool.onError(faults::add);

    pool.close();

    assertEquals(1, faults.size());
    assertSame(failure, faults.get(0));
  }

  @Test
  @DisplayName("Should keep notifying when a listener throws")
  void shouldIsolateListeners() {
    final var faults = new ArrayList<Throwable>();
    pool.onError(
        fault -> {
          throw new IllegalStateException("listener bug");
        });
    pool.onError(faults::add);

    pool.reportError(new SQLException("connection reset"));

    assertEquals(1, faults.size());
  }
}
