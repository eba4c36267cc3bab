package io.playgroundx.persistence.jdbc.dialect;

import io.playgroundx.persistence.jdbc.SqlStatement;
import io.playgroundx.persistence.page.PageRequest;

import java.sql.SQLException;
import java.sql.SQLNonTransientConnectionException;
import java.sql.SQLTransientConnectionException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * JDBC-generic dialect base.\n
 *
 * Renders the total-count wrapping with standard SQL (derived table + {@code COUNT(*) OVER ()}),
 * and classifies SQLState class {@code 08} (connection exception) as fatal.\n
 *
 * DB-specific dialects override the render hooks when they have a better form.
 */
public abstract class AbstractJdbcSqlDialect implements JdbcDialect {

  @Override
  public final SqlStatement paginate(SqlStatement base, PageRequest page) {
    Objects.requireNonNull(base, "base");
    String inner = stripTerminator(base.sql());
    if (page == null) return new SqlStatement(renderCounted(inner), base.params());

    List<Object> params = new ArrayList<>(base.params());
    params.add(page.size());
    params.add(page.offset());
    return new SqlStatement(renderCountedPage(inner), params);
  }

  /** Whole result of {@code query} plus the count column. */
  protected String renderCounted(String query) {
    return "SELECT subquery.*, COUNT(*) OVER () AS " + totalCountColumn()
        + " FROM (" + query + ") subquery";
  }

  /** One page of {@code query} plus the count column; ends with {@code LIMIT ? OFFSET ?}. */
  protected String renderCountedPage(String query) {
    return "SELECT * FROM (" + renderCounted(query) + ") paginated LIMIT ? OFFSET ?";
  }

  @Override
  public boolean isFatal(SQLException e) {
    for (SQLException cur = e; cur != null; cur = cur.getNextException()) {
      if (cur instanceof SQLNonTransientConnectionException || cur instanceof SQLTransientConnectionException) return true;
      String state = cur.getSQLState();
      if (state != null && state.startsWith("08")) return true;
      if (cur.getNextException() == cur) break;
    }
    return false;
  }

  static String stripTerminator(String sql) {
    String s = sql.strip();
    while (s.endsWith(";")) s = s.substring(0, s.length() - 1).strip();
    if (s.isEmpty()) throw new IllegalArgumentException("Empty SQL statement");
    return s;
  }
}
