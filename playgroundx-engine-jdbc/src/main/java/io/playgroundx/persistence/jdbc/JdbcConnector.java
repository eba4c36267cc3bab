package io.playgroundx.persistence.jdbc;

import io.playgroundx.persistence.ConnectionException;
import io.playgroundx.persistence.QueryExecutionException;
import io.playgroundx.persistence.ValidationException;
import io.playgroundx.persistence.exec.ConnectionPool;
import io.playgroundx.persistence.exec.DatabaseConnector;
import io.playgroundx.persistence.jdbc.dialect.JdbcDialect;
import io.playgroundx.persistence.mapping.Row;
import io.playgroundx.persistence.page.Metadata;
import io.playgroundx.persistence.page.PageRequest;
import io.playgroundx.persistence.page.PagedResult;
import io.playgroundx.persistence.page.Pagination;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link DatabaseConnector} over a pooled JDBC connection.
 * <p>
 * Each operation runs on the held connection in its own transaction: commit on success,
 * rollback and {@link QueryExecutionException} on failure. The statement is closed on every path.
 * After a fatal transport error the connection is discarded from the pool and the next operation
 * reconnects.
 */
public final class JdbcConnector implements DatabaseConnector {
  private static final Logger log = LoggerFactory.getLogger(JdbcConnector.class);

  private final String name;
  private final ConnectionPool<Connection> pool;
  private final JdbcDialect dialect;
  private Connection conn;

  public JdbcConnector(String name, ConnectionPool<Connection> pool, JdbcDialect dialect) {
    this.name = Objects.requireNonNull(name, "name");
    this.pool = Objects.requireNonNull(pool, "pool");
    this.dialect = Objects.requireNonNull(dialect, "dialect");
  }

  @FunctionalInterface
  private interface StatementWork<T> {
    T run(PreparedStatement ps) throws SQLException;
  }

  @Override public String name() { return name; }

  @Override
  public void connect() {
    if (conn != null) return;
    Connection c = pool.acquire();
    try {
      if (c.getAutoCommit()) c.setAutoCommit(false);
    } catch (SQLException e) {
      pool.discard(c);
      throw new ConnectionException("Connection from pool '" + pool.name() + "' is unusable: " + e.getMessage(), e);
    }
    conn = c;
    if (log.isDebugEnabled()) log.debug("playgroundx.jdbc connected connector={} pool={}", name, pool.stats());
  }

  @Override public boolean isConnected() { return conn != null; }

  @Override
  public void reconnect() {
    close();
    connect();
  }

  @Override
  public void close() {
    Connection c = conn;
    if (c == null) return;
    conn = null;
    pool.release(c);
    if (log.isDebugEnabled()) log.debug("playgroundx.jdbc released connector={} pool={}", name, pool.stats());
  }

  @Override
  public int execute(String query, List<?> params) {
    return run("EXECUTE", SqlStatement.of(query, params), PreparedStatement::executeUpdate);
  }

  @Override
  public Optional<Row> fetchOne(String query, List<?> params) {
    return run("FETCH_ONE", SqlStatement.of(query, params), ps -> {
      ps.setMaxRows(1);
      try (ResultSet rs = ps.executeQuery()) {
        if (!rs.next()) return Optional.empty();
        return Optional.of(JdbcRowFactory.of(rs.getMetaData()).read(rs));
      }
    });
  }

  @Override
  public List<Row> fetchMany(String query, int size, List<?> params) {
    if (size < 1) throw new ValidationException("size", "size must be >= 1 (got " + size + ")");
    return run("FETCH_MANY", SqlStatement.of(query, params), ps -> {
      ps.setMaxRows(size);
      try (ResultSet rs = ps.executeQuery()) {
        JdbcRowFactory rows = JdbcRowFactory.of(rs.getMetaData());
        List<Row> out = new ArrayList<>();
        while (out.size() < size && rs.next()) out.add(rows.read(rs));
        return out;
      }
    });
  }

  @Override
  public PagedResult<Row> fetchAll(String query, List<?> params, PageRequest page) {
    SqlStatement st = dialect.paginate(SqlStatement.of(query, params), page);
    return run("FETCH_ALL", st, ps -> {
      try (ResultSet rs = ps.executeQuery()) {
        JdbcRowFactory rows = JdbcRowFactory.withTrailingTotal(rs.getMetaData());
        List<Row> out = new ArrayList<>();
        long total = 0;
        while (rs.next()) {
          if (out.isEmpty()) total = rows.total(rs);
          out.add(rows.read(rs));
        }
        if (out.isEmpty()) return PagedResult.<Row>empty();
        if (page == null) return PagedResult.unpaged(out);
        return PagedResult.of(out, Metadata.of(Pagination.computeMeta(page.page(), page.size(), total)));
      }
    });
  }

  private <T> T run(String op, SqlStatement st, StatementWork<T> work) {
    connect();
    Connection c = conn;
    long start = System.nanoTime();
    debugSql(op, st);
    try {
      T out;
      try (PreparedStatement ps = c.prepareStatement(st.sql())) {
        bindAll(ps, st.params());
        out = work.run(ps);
      }
      c.commit();
      debugDone(op, out, System.nanoTime() - start);
      return out;
    } catch (SQLException e) {
      log.error("playgroundx.jdbc_failed connector={} op={} sqlState={} sql={} params={}",
          name, op, e.getSQLState(), st.sql(), st.params(), e);
      rollback(c, e);
      if (dialect.isFatal(e)) dropConnection(c);
      throw new QueryExecutionException(op + " failed on '" + name + "': " + e.getMessage(), st.sql(), st.params(), e);
    } catch (RuntimeException e) {
      rollback(c, e);
      throw e;
    }
  }

  private static void bindAll(PreparedStatement ps, List<Object> params) throws SQLException {
    for (int i = 0; i < params.size(); i++) ps.setObject(i + 1, params.get(i));
  }

  private void rollback(Connection c, Exception cause) {
    try {
      c.rollback();
    } catch (SQLException re) {
      cause.addSuppressed(re);
      log.warn("playgroundx.jdbc rollback_failed connector={} sqlState={} msg={}", name, re.getSQLState(), re.getMessage());
    }
  }

  private void dropConnection(Connection c) {
    if (conn == c) conn = null;
    pool.discard(c);
  }

  private void debugSql(String op, SqlStatement st) {
    if (!log.isDebugEnabled()) return;
    log.debug("playgroundx.jdbc op={} connector={} dialect={} paramCount={} sql={}",
        op, name, dialect.id(), st.params().size(), st.sql());

    // TRACE: bind types only, raw values may carry personal data
    if (log.isTraceEnabled() && !st.params().isEmpty()) {
      int idx = 1;
      for (Object v : st.params()) {
        log.trace("playgroundx.jdbc bind index={} valueType={}", idx++, v == null ? "null" : v.getClass().getName());
      }
    }
  }

  private void debugDone(String op, Object result, long durationNanos) {
    if (!log.isDebugEnabled()) return;
    log.debug("playgroundx.jdbc_done op={} connector={} durationMs={} result={}",
        op, name, durationNanos / 1_000_000.0, safeResult(result));
  }

  private static String safeResult(Object r) {
    if (r == null) return "null";
    if (r instanceof Number n) return String.valueOf(n);
    if (r instanceof List<?> l) return "rows=" + l.size();
    if (r instanceof Optional<?> o) return o.isPresent() ? "rows=1" : "rows=0";
    if (r instanceof PagedResult<?> p) return "rows=" + p.data().size() + " pagination=" + p.pagination();
    return r.getClass().getSimpleName();
  }
}
