package io.playgroundx.persistence.jdbc.dialect;

import io.playgroundx.persistence.jdbc.SqlStatement;
import io.playgroundx.persistence.page.PageRequest;

import java.sql.SQLException;

/** Database-specific statement rewriting and error classification for JDBC connectors. */
public interface JdbcDialect {
  String id();

  /** Label of the window-count column appended by {@link #paginate}. */
  default String totalCountColumn() { return "total_count"; }

  /**
   * Wraps {@code base} so that every row also carries the total row count of the unpaged query
   * as its last column. With a non-null {@code page}, limits the result to that page and appends
   * {@code size, offset} after the caller's parameters.
   */
  SqlStatement paginate(SqlStatement base, PageRequest page);

  /** True when {@code e} means the connection itself is unusable and must not go back to the pool. */
  boolean isFatal(SQLException e);
}
