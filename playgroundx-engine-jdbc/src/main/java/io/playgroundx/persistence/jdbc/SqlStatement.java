package io.playgroundx.persistence.jdbc;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/** SQL text with positional ({@code ?}) parameters, bound in list order. */
public record SqlStatement(String sql, List<Object> params) {
  public SqlStatement {
    Objects.requireNonNull(sql, "sql");
    // nulls are legal bind values
    params = params == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(params));
  }

  public static SqlStatement of(String sql, List<?> params) {
    List<Object> copy = params == null ? null : new ArrayList<Object>(params);
    return new SqlStatement(sql, copy);
  }
}
