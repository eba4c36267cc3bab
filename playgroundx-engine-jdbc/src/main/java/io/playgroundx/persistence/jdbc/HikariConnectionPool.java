package io.playgroundx.persistence.jdbc;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import com.zaxxer.hikari.HikariPoolMXBean;
import io.playgroundx.persistence.ConnectionException;
import io.playgroundx.persistence.exec.ConnectionPool;
import io.playgroundx.persistence.exec.PoolSettings;
import io.playgroundx.persistence.exec.PoolStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;

/**
 * {@link ConnectionPool} over a {@link HikariDataSource}.
 * <p>
 * Connections are handed out with auto-commit off; the connector owns commit/rollback.
 * Hikari resets connection state when a connection comes back.
 */
public final class HikariConnectionPool implements ConnectionPool<Connection> {
  private static final Logger log = LoggerFactory.getLogger(HikariConnectionPool.class);

  private final String name;
  private final PoolSettings settings;
  private final HikariDataSource ds;

  private HikariConnectionPool(String name, PoolSettings settings, HikariDataSource ds) {
    this.name = name;
    this.settings = settings;
    this.ds = ds;
  }

  /**
   * Starts a pool and opens its first connection.
   *
   * @throws ConnectionException when the first connection cannot be established
   */
  public static HikariConnectionPool start(String name,
                                           String jdbcUrl,
                                           String user,
                                           String password,
                                           PoolSettings settings) {
    return start(name, jdbcUrl, null, user, password, settings);
  }

  public static HikariConnectionPool start(String name,
                                           String jdbcUrl,
                                           String driverClassName,
                                           String user,
                                           String password,
                                           PoolSettings settings) {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(jdbcUrl, "jdbcUrl");
    Objects.requireNonNull(settings, "settings");

    HikariConfig hc = new HikariConfig();
    hc.setPoolName(name);
    hc.setJdbcUrl(jdbcUrl);
    if (driverClassName != null && !driverClassName.isBlank()) hc.setDriverClassName(driverClassName);
    hc.setUsername(user);
    hc.setPassword(password);
    hc.setMinimumIdle(settings.minSize());
    hc.setMaximumPoolSize(settings.maxSize());
    hc.setConnectionTimeout(settings.acquireTimeout().toMillis());
    hc.setAutoCommit(false);
    // fail construction if the very first connection cannot be made
    hc.setInitializationFailTimeout(1);

    HikariDataSource ds;
    try {
      ds = new HikariDataSource(hc);
    } catch (RuntimeException e) {
      throw new ConnectionException("Could not start pool '" + name + "' for " + jdbcUrl + ": " + rootMessage(e), e);
    }
    log.info("playgroundx.pool started name={} url={} min={} max={} acquireTimeoutMs={}",
        name, jdbcUrl, settings.minSize(), settings.maxSize(), settings.acquireTimeout().toMillis());
    return new HikariConnectionPool(name, settings, ds);
  }

  @Override public String name() { return name; }

  @Override
  public Connection acquire() {
    try {
      Connection c = ds.getConnection();
      if (log.isTraceEnabled()) log.trace("playgroundx.pool acquire name={} stats={}", name, stats());
      return c;
    } catch (SQLException e) {
      throw new ConnectionException("Could not acquire connection from pool '" + name + "': " + e.getMessage(), e);
    }
  }

  @Override
  public void release(Connection conn) {
    if (conn == null) return;
    try {
      // Hikari's proxy close is idempotent: a second release does nothing
      conn.close();
    } catch (SQLException e) {
      log.warn("playgroundx.pool release_failed name={} sqlState={} msg={}; evicting connection",
          name, e.getSQLState(), e.getMessage());
      evict(conn);
    }
  }

  @Override
  public void discard(Connection conn) {
    if (conn == null) return;
    log.warn("playgroundx.pool discard name={}", name);
    evict(conn);
  }

  private void evict(Connection conn) {
    try {
      ds.evictConnection(conn);
    } catch (RuntimeException e) {
      log.error("playgroundx.pool evict_failed name={}", name, e);
    }
  }

  @Override
  public PoolStats stats() {
    HikariPoolMXBean mx = ds.getHikariPoolMXBean();
    if (mx == null) return new PoolStats(0, 0, 0, settings.maxSize());
    return new PoolStats(mx.getActiveConnections(), mx.getIdleConnections(), mx.getTotalConnections(), settings.maxSize());
  }

  @Override
  public void close() {
    if (ds.isClosed()) return;
    log.info("playgroundx.pool closing name={}", name);
    ds.close();
  }

  public boolean isClosed() { return ds.isClosed(); }

  private static String rootMessage(Throwable t) {
    Throwable cur = t;
    while (cur.getCause() != null && cur.getCause() != cur) cur = cur.getCause();
    return cur.getMessage();
  }
}
