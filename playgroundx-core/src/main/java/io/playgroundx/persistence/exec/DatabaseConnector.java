package io.playgroundx.persistence.exec;

import io.playgroundx.persistence.mapping.Row;
import io.playgroundx.persistence.page.PageRequest;
import io.playgroundx.persistence.page.PagedResult;

import java.util.List;
import java.util.Optional;

/**
 * Raw-SQL executor bound to one database target.
 * <p>
 * Holds at most one pooled connection, acquired lazily. Not thread-safe: one connector belongs to
 * one request. Every operation runs in its own transaction, committed on success and rolled back
 * on failure.
 */
public interface DatabaseConnector extends AutoCloseable {
  String name();

  void connect();

  boolean isConnected();

  /** Releases any held connection and acquires a fresh one. */
  void reconnect();

  /** Returns the held connection to its pool; no-op when not connected. */
  @Override
  void close();

  /** Runs a statement that returns no rows; returns the update count. */
  int execute(String query, List<?> params);

  default int execute(String query) { return execute(query, List.of()); }

  Optional<Row> fetchOne(String query, List<?> params);

  default Optional<Row> fetchOne(String query) { return fetchOne(query, List.of()); }

  /** At most {@code size} rows; {@code size} must be &gt;= 1. */
  List<Row> fetchMany(String query, int size, List<?> params);

  default List<Row> fetchMany(String query, int size) { return fetchMany(query, size, List.of()); }

  /**
   * All rows of {@code query}, or one page of them when {@code page} is non-null.\n
   * Pagination metadata is attached only when a page was requested and at least one row came back.
   */
  PagedResult<Row> fetchAll(String query, List<?> params, PageRequest page);

  default PagedResult<Row> fetchAll(String query, List<?> params) { return fetchAll(query, params, null); }

  default PagedResult<Row> fetchAll(String query, PageRequest page) { return fetchAll(query, List.of(), page); }
}
