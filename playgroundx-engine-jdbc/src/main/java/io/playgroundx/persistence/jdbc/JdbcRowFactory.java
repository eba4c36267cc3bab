package io.playgroundx.persistence.jdbc;

import io.playgroundx.persistence.mapping.Row;

import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns result-set rows into {@link Row}s keyed by column label.\n
 * Built once per result set from its metadata. Optionally treats the last column as a
 * window total that is split off from the data columns.
 */
public final class JdbcRowFactory {
  private final List<String> columns;
  private final boolean trailingTotal;

  private JdbcRowFactory(List<String> columns, boolean trailingTotal) {
    this.columns = columns;
    this.trailingTotal = trailingTotal;
  }

  public static JdbcRowFactory of(ResultSetMetaData md) throws SQLException {
    return new JdbcRowFactory(labels(md, md.getColumnCount()), false);
  }

  /** The last column holds the total row count and is left out of every {@link Row}. */
  public static JdbcRowFactory withTrailingTotal(ResultSetMetaData md) throws SQLException {
    int n = md.getColumnCount();
    if (n < 1) throw new SQLException("Result has no total column");
    return new JdbcRowFactory(labels(md, n - 1), true);
  }

  public List<String> columns() { return columns; }

  public Row read(ResultSet rs) throws SQLException {
    List<Object> values = new ArrayList<>(columns.size());
    for (int i = 1; i <= columns.size(); i++) values.add(rs.getObject(i));
    return Row.of(columns, values);
  }

  /** Total count from the current row; 0 when this factory has no total column or the value is NULL. */
  public long total(ResultSet rs) throws SQLException {
    if (!trailingTotal) return 0;
    Object v = rs.getObject(columns.size() + 1);
    if (v == null) return 0;
    if (v instanceof Number n) return n.longValue();
    return Long.parseLong(v.toString());
  }

  private static List<String> labels(ResultSetMetaData md, int count) throws SQLException {
    List<String> out = new ArrayList<>(count);
    for (int i = 1; i <= count; i++) out.add(md.getColumnLabel(i));
    return List.copyOf(out);
  }
}
