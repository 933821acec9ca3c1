package com.example.txflow.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/** One result row: column labels in select order mapped to their (possibly null) values. */
public final class Row {

  private final Map<String, Object> values;

  /**
   * Creates a row from column values. Iteration order of {@code values} is kept.
   *
   * @param values column label to value
   */
  public Row(final Map<String, ?> values) {
    this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
  }

  /**
   * Returns the value of a column.
   *
   * @param column the column label
   * @return the value, {@code null} for SQL NULL
   * @throws IllegalArgumentException if the row has no such column
   */
  public Object get(final String column) {
    if (!values.containsKey(column)) {
      throw new IllegalArgumentException("Unknown column: " + column);
    }
    return values.get(column);
  }

  /**
   * Returns the value of a column cast to {@code type}.
   *
   * @param column the column label
   * @param type expected value type
   * @param <T> value type
   * @return the value, {@code null} for SQL NULL
   * @throws ClassCastException if the value is not a {@code type}
   */
  public <T> T get(final String column, final Class<T> type) {
    return type.cast(get(column));
  }

  public Set<String> columns() {
    return values.keySet();
  }

  public Map<String, Object> asMap() {
    return values;
  }

  @Override
  public boolean equals(final Object o) {
    return o instanceof Row other && values.equals(other.values);
  }

  @Override
  public int hashCode() {
    return Objects.hash(values);
  }

  @Override
  public String toString() {
    return "Row" + values;
  }
}
