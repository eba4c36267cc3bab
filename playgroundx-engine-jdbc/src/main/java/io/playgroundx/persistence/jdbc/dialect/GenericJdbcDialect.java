package io.playgroundx.persistence.jdbc.dialect;

/** Standard-SQL dialect; works for any database with window functions and LIMIT/OFFSET. */
public final class GenericJdbcDialect extends AbstractJdbcSqlDialect {
  @Override public String id() { return "generic"; }
}
