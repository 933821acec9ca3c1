package com.example.txflow.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.time.DateTimeException;
import java.time.ZoneOffset;

/**
 * Settings used to build the underlying connection pool.
 *
 * <p>Unset fields take their defaults. The fidelity defaults are correctness decisions, not
 * cosmetics: large numerics come back as exact text and temporal columns as text, so neither
 * floating-point rounding nor the JVM time zone leaks into results.
 *
 * @param host database host (required unless {@code jdbcUrl} is set)
 * @param port database port, default 3306
 * @param user user name
 * @param password password
 * @param database schema name
 * @param jdbcUrl explicit JDBC URL, overrides host/port/database
 * @param connectionLimit maximum physical connections, default 100
 * @param timezone fixed UTC offset temporal values are normalized to, default {@code +00:00}
 * @param supportBigNumbers return DECIMAL/BIGINT exactly rather than as floating point, default
 *     true
 * @param bigNumberStrings return exact numerics as text, default true
 * @param dateStrings return temporal columns as text, default true
 * @param connectionTimeoutMillis maximum wait for a pooled connection, default 30000
 * @param streamFetchSize fetch size hint for streaming queries; {@link Integer#MIN_VALUE} (row by
 *     row) for MySQL URLs, 1000 otherwise
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DbConfig(
    String host,
    Integer port,
    String user,
    String password,
    String database,
    String jdbcUrl,
    Integer connectionLimit,
    String timezone,
    Boolean supportBigNumbers,
    Boolean bigNumberStrings,
    Boolean dateStrings,
    Long connectionTimeoutMillis,
    Integer streamFetchSize) {

  public static final int DEFAULT_PORT = 3306;
  public static final int DEFAULT_CONNECTION_LIMIT = 100;
  public static final String DEFAULT_TIMEZONE = "+00:00";
  public static final long DEFAULT_CONNECTION_TIMEOUT_MILLIS = 30_000L;

  public DbConfig {
    if (port == null) port = DEFAULT_PORT;
    if (connectionLimit == null) connectionLimit = DEFAULT_CONNECTION_LIMIT;
    if (timezone == null) timezone = DEFAULT_TIMEZONE;
    if (supportBigNumbers == null) supportBigNumbers = true;
    if (bigNumberStrings == null) bigNumberStrings = true;
    if (dateStrings == null) dateStrings = true;
    if (connectionTimeoutMillis == null)
      connectionTimeoutMillis = DEFAULT_CONNECTION_TIMEOUT_MILLIS;

    if ((jdbcUrl == null || jdbcUrl.isBlank()) && (host == null || host.isBlank()))
      throw new IllegalArgumentException("host or jdbcUrl is required");
    if (connectionLimit < 1) throw new IllegalArgumentException("connectionLimit must be >= 1");
    if (connectionTimeoutMillis <= 0)
      throw new IllegalArgumentException("connectionTimeoutMillis must be > 0");
    try {
      ZoneOffset.of(timezone);
    } catch (final DateTimeException e) {
      throw new IllegalArgumentException("timezone must be a fixed UTC offset: " + timezone, e);
    }

    if (streamFetchSize == null)
      streamFetchSize = isMySql(jdbcUrl, host) ? Integer.MIN_VALUE : 1000;
  }

  /**
   * Returns a builder with every field unset.
   *
   * @return new builder
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns the JDBC URL to connect to.
   *
   * @return {@code jdbcUrl} if set, otherwise a MySQL URL built from host, port and database
   */
  public String resolvedJdbcUrl() {
    if (jdbcUrl != null && !jdbcUrl.isBlank()) return jdbcUrl;
    return "jdbc:mysql://%s:%d/%s".formatted(host, port, database == null ? "" : database);
  }

  public ZoneOffset zoneOffset() {
    return ZoneOffset.of(timezone);
  }

  /** Exact numerics are rendered as text. */
  public boolean numberStrings() {
    return supportBigNumbers && bigNumberStrings;
  }

  @Override
  public String toString() {
    return ("DbConfig[url=%s, user=%s, connectionLimit=%d, timezone=%s,"
            + " supportBigNumbers=%s, bigNumberStrings=%s, dateStrings=%s]")
        .formatted(
            resolvedJdbcUrl(),
            user,
            connectionLimit,
            timezone,
            supportBigNumbers,
            bigNumberStrings,
            dateStrings);
  }

  private static boolean isMySql(final String jdbcUrl, final String host) {
    if (jdbcUrl == null || jdbcUrl.isBlank()) return host != null;
    return jdbcUrl.startsWith("jdbc:mysql:") || jdbcUrl.startsWith("jdbc:mariadb:");
  }

  /** Fluent builder for {@link DbConfig}; unset fields fall back to the record defaults. */
  public static final class Builder {
    private String host;
    private Integer port;
    private String user;
    private String password;
    private String database;
    private String jdbcUrl;
    private Integer connectionLimit;
    private String timezone;
    private Boolean supportBigNumbers;
    private Boolean bigNumberStrings;
    private Boolean dateStrings;
    private Long connectionTimeoutMillis;
    private Integer streamFetchSize;

    private Builder() {}

    public Builder host(final String host) {
      this.host = host;
      return this;
    }

    public Builder port(final int port) {
      this.port = port;
      return this;
    }

    public Builder user(final String user) {
      this.user = user;
      return this;
    }

    public Builder password(final String password) {
      this.password = password;
      return this;
    }

    public Builder database(final String database) {
      this.database = database;
      return this;
    }

    public Builder jdbcUrl(final String jdbcUrl) {
      this.jdbcUrl = jdbcUrl;
      return this;
    }

    public Builder connectionLimit(final int connectionLimit) {
      this.connectionLimit = connectionLimit;
      return this;
    }

    public Builder timezone(final String timezone) {
      this.timezone = timezone;
      return this;
    }

    public Builder supportBigNumbers(final boolean supportBigNumbers) {
      this.supportBigNumbers = supportBigNumbers;
      return this;
    }

    public Builder bigNumberStrings(final boolean bigNumberStrings) {
      this.bigNumberStrings = bigNumberStrings;
      return this;
    }

    public Builder dateStrings(final boolean dateStrings) {
      this.dateStrings = dateStrings;
      return this;
    }

    public Builder connectionTimeoutMillis(final long connectionTimeoutMillis) {
      this.connectionTimeoutMillis = connectionTimeoutMillis;
      return this;
    }

    public Builder streamFetchSize(final int streamFetchSize) {
      this.streamFetchSize = streamFetchSize;
      return this;
    }

    /**
     * Builds the config.
     *
     * @return validated config
     * @throws IllegalArgumentException if a value is invalid
     */
    public DbConfig build() {
      return new DbConfig(
          host,
          port,
          user,
          password,
          database,
          jdbcUrl,
          connectionLimit,
          timezone,
          supportBigNumbers,
          bigNumberStrings,
          dateStrings,
          connectionTimeoutMillis,
          streamFetchSize);
    }
  }
}
