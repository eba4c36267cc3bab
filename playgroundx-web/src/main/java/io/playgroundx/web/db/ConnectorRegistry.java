package io.playgroundx.web.db;

import io.playgroundx.persistence.exec.ConnectionPool;
import io.playgroundx.persistence.exec.DatabaseConnector;
import io.playgroundx.persistence.jdbc.HikariConnectionPool;
import io.playgroundx.persistence.jdbc.postgres.PostgresConnectors;
import io.playgroundx.persistence.log.LoggingProxy;
import io.playgroundx.web.config.DatabaseProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Application-wide owner of one connection pool per configured target.\n
 * Pools start on first use and live until {@link #close()}.
 */
public final class ConnectorRegistry implements ConnectorFactory, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(ConnectorRegistry.class);

  private final Map<DatabaseTarget, DatabaseProperties.Target> targets;
  private final Map<DatabaseTarget, HikariConnectionPool> pools = new ConcurrentHashMap<>();
  private volatile boolean closed;

  public ConnectorRegistry(DatabaseProperties props) {
    Objects.requireNonNull(props, "props");
    Map<DatabaseTarget, DatabaseProperties.Target> m = new EnumMap<>(DatabaseTarget.class);
    m.put(DatabaseTarget.PRIMARY, props.getPrimary());
    m.put(DatabaseTarget.SECONDARY, props.getSecondary());
    this.targets = m;
  }

  @Override
  public boolean isConfigured(DatabaseTarget target) {
    DatabaseProperties.Target t = targets.get(target);
    return t != null && t.isConfigured();
  }

  @Override
  public DatabaseConnector open(DatabaseTarget target) {
    if (closed) throw new IllegalStateException("ConnectorRegistry is closed");
    if (!isConfigured(target)) throw new IllegalStateException("Database target not configured: " + target.key());

    // a failed start is not cached; the next request retries
    HikariConnectionPool pool = pools.computeIfAbsent(target, k -> {
      DatabaseProperties.Target t = targets.get(k);
      return PostgresConnectors.startPool(k.key(), t.credentials(), t.poolSettings());
    });
    ConnectionPool<Connection> p = pool;
    return LoggingProxy.wrap(DatabaseConnector.class, PostgresConnectors.connector(target.key(), p));
  }

  /** Pool of {@code target} if it has been started. */
  public HikariConnectionPool pool(DatabaseTarget target) { return pools.get(target); }

  @Override
  public void close() {
    closed = true;
    for (Map.Entry<DatabaseTarget, HikariConnectionPool> e : pools.entrySet()) {
      try {
        e.getValue().close();
      } catch (RuntimeException ex) {
        log.error("playgroundx.registry pool_close_failed target={}", e.getKey().key(), ex);
      }
    }
    pools.clear();
  }
}
