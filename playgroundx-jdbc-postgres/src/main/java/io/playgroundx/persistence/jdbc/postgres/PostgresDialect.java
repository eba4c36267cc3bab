package io.playgroundx.persistence.jdbc.postgres;

import io.playgroundx.persistence.jdbc.dialect.AbstractJdbcSqlDialect;
import org.postgresql.util.PSQLState;

import java.sql.SQLException;

/**
 * Postgres dialect implementation for JDBC.
 *
 * Renders the count wrapping as a CTE with {@code SELECT *, COUNT(*) OVER ()}.\n
 * Connection-error states come from the driver's {@link PSQLState}.
 */
public final class PostgresDialect extends AbstractJdbcSqlDialect {
  @Override public String id() { return "postgres"; }

  @Override
  protected String renderCounted(String query) {
    return "WITH paginated AS (SELECT *, COUNT(*) OVER () AS " + totalCountColumn()
        + " FROM (" + query + ") AS subquery) SELECT * FROM paginated";
  }

  @Override
  protected String renderCountedPage(String query) {
    return "WITH paginated AS (SELECT *, COUNT(*) OVER () AS " + totalCountColumn()
        + " FROM (" + query + ") AS subquery LIMIT ? OFFSET ?) SELECT * FROM paginated";
  }

  @Override
  public boolean isFatal(SQLException e) {
    for (SQLException cur = e; cur != null; cur = cur.getNextException()) {
      if (PSQLState.isConnectionError(cur.getSQLState())) return true;
      if (cur.getNextException() == cur) break;
    }
    return super.isFatal(e);
  }
}
