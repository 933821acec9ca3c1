package com.example.txflow.core.jdbc;

import com.example.txflow.core.Row;
import com.example.txflow.core.config.DbConfig;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Calendar;
import java.util.LinkedHashMap;
import java.util.TimeZone;

/**
 * Converts the current {@link ResultSet} row into a {@link Row}, applying the numeric and date
 * fidelity modes.
 */
final class JdbcRowReader {

  private final boolean supportBigNumbers;
  private final boolean numberStrings;
  private final boolean dateStrings;
  private final ZoneOffset timezone;

  JdbcRowReader(
      final boolean supportBigNumbers,
      final boolean numberStrings,
      final boolean dateStrings,
      final ZoneOffset timezone) {
    this.supportBigNumbers = supportBigNumbers;
    this.numberStrings = numberStrings;
    this.dateStrings = dateStrings;
    this.timezone = timezone;
  }

  static JdbcRowReader from(final DbConfig config) {
    return new JdbcRowReader(
        config.supportBigNumbers(),
        config.numberStrings(),
        config.dateStrings(),
        config.zoneOffset());
  }

  Row read(final ResultSet rs) throws SQLException {
    final var meta = rs.getMetaData();
    final var columns = meta.getColumnCount();
    final var values = new LinkedHashMap<String, Object>(columns * 2);
    for (int i = 1; i <= columns; i++) {
      values.put(meta.getColumnLabel(i), readValue(rs, i, meta.getColumnType(i)));
    }
    return new Row(values);
  }

  Object readValue(final ResultSet rs, final int index, final int sqlType) throws SQLException {
    return switch (sqlType) {
      case Types.DECIMAL, Types.NUMERIC -> readDecimal(rs.getBigDecimal(index));
      case Types.BIGINT -> readBigInt(rs.getObject(index));
      case Types.DATE -> dateStrings ? rs.getString(index) : rs.getObject(index, LocalDate.class);
      case Types.TIME, Types.TIME_WITH_TIMEZONE ->
          dateStrings ? rs.getString(index) : rs.getObject(index, LocalTime.class);
      case Types.TIMESTAMP -> dateStrings ? rs.getString(index) : readTimestamp(rs, index);
      case Types.TIMESTAMP_WITH_TIMEZONE ->
          dateStrings ? rs.getString(index) : readOffsetTimestamp(rs, index);
      default -> rs.getObject(index);
    };
  }

  private Object readDecimal(final BigDecimal value) {
    if (value == null) return null;
    if (numberStrings) return value.toPlainString();
    return supportBigNumbers ? value : value.doubleValue();
  }

  private Object readBigInt(final Object value) {
    if (value == null) return null;
    if (numberStrings) return value.toString();
    if (supportBigNumbers) return value;
    return value instanceof BigInteger big ? big.longValue() : ((Number) value).longValue();
  }

  private OffsetDateTime readTimestamp(final ResultSet rs, final int index) throws SQLException {
    final var calendar = Calendar.getInstance(TimeZone.getTimeZone(timezone));
    final var ts = rs.getTimestamp(index, calendar);
    return ts == null ? null : ts.toInstant().atOffset(timezone);
  }

  private OffsetDateTime readOffsetTimestamp(final ResultSet rs, final int index)
      throws SQLException {
    final var value = rs.getObject(index, OffsetDateTime.class);
    return value == null ? null : value.withOffsetSameInstant(timezone);
  }
}
