package io.playgroundx.persistence;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Raised when a statement fails on the database side.\n
 * Carries the statement text and bind parameters so the failure can be reproduced.
 */
public final class QueryExecutionException extends PersistenceException {
  private final String sql;
  private final List<Object> params;

  public QueryExecutionException(String message, String sql, List<?> params, Throwable cause) {
    super(message, cause);
    this.sql = sql;
    // params may hold SQL NULLs, so List.copyOf is not an option
    this.params = params == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(params));
  }

  public String sql() { return sql; }
  public List<Object> params() { return params; }
}
