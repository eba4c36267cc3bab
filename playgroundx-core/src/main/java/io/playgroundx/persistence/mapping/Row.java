package io.playgroundx.persistence.mapping;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One result row: column labels in select order, mapped to their raw values.
 * <p>
 * Immutable. Values may be null (SQL NULL); column labels may not.
 */
public final class Row {
  private final Map<String, Object> values;

  private Row(LinkedHashMap<String, Object> values) {
    this.values = Collections.unmodifiableMap(values);
  }

  /** Zips {@code columns} with {@code values} position by position. */
  public static Row of(List<String> columns, List<?> values) {
    Objects.requireNonNull(columns, "columns");
    Objects.requireNonNull(values, "values");
    if (columns.size() != values.size()) {
      throw new IllegalArgumentException("columns/values size mismatch: " + columns.size() + " != " + values.size());
    }
    LinkedHashMap<String, Object> m = new LinkedHashMap<>();
    for (int i = 0; i < columns.size(); i++) {
      String c = Objects.requireNonNull(columns.get(i), "column label");
      m.put(c, values.get(i));
    }
    return new Row(m);
  }

  public boolean has(String column) { return values.containsKey(column); }

  /** Raw value for {@code column}; null both for SQL NULL and for an unknown column (see {@link #has}). */
  public Object get(String column) { return values.get(column); }

  public List<String> columns() { return List.copyOf(values.keySet()); }

  /** Values in column order (may contain nulls). */
  public List<Object> values() { return Collections.unmodifiableList(new ArrayList<>(values.values())); }

  public int size() { return values.size(); }

  @JsonValue
  public Map<String, Object> asMap() { return values; }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Row r)) return false;
    return values.equals(r.values) && columns().equals(r.columns());
  }

  @Override
  public int hashCode() { return values.hashCode(); }

  @Override
  public String toString() { return "Row" + values; }
}
