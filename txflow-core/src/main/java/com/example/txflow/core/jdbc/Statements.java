package com.example.txflow.core.jdbc;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.List;

/** Prepared statement helpers shared by the JDBC handle and the streaming source. */
final class Statements {

  private Statements() {}

  static <T> List<T> query(
      final Connection conn, final String sql, final RowMapper<T> mapper, final Object... params)
      throws SQLException {
    try (final var ps = conn.prepareStatement(sql)) {
      bind(ps, params);
      try (final var rs = ps.executeQuery()) {
        final var results = new ArrayList<T>();
        while (rs.next()) {
          results.add(mapper.map(rs));
        }
        return results;
      }
    }
  }

  static int update(final Connection conn, final String sql, final Object... params)
      throws SQLException {
    try (final var ps = conn.prepareStatement(sql)) {
      bind(ps, params);
      return ps.executeUpdate();
    }
  }

  static void bind(final PreparedStatement ps, final Object... params) throws SQLException {
    if (params == null) return;
    for (int i = 0; i < params.length; i++) {
      final var param = params[i];
      if (param == null) {
        ps.setObject(i + 1, null);
      } else if (param instanceof String s) {
        ps.setString(i + 1, s);
      } else if (param instanceof Integer n) {
        ps.setInt(i + 1, n);
      } else if (param instanceof Long n) {
        ps.setLong(i + 1, n);
      } else if (param instanceof Timestamp ts) {
        ps.setTimestamp(i + 1, ts);
      } else {
        ps.setObject(i + 1, param);
      }
    }
  }

  @FunctionalInterface
  interface RowMapper<T> {
    T map(ResultSet rs) throws SQLException;
  }
}
