package io.playgroundx.web.db;

import io.playgroundx.persistence.ConnectionException;
import io.playgroundx.persistence.exec.DatabaseConnector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Per-request access to database targets.
 * <p>
 * Opens at most one connector per target, on first use, and closes all of them in {@link #close()}.
 * Confined to the request thread.
 */
public final class DatabaseManager implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(DatabaseManager.class);

  private final ConnectorFactory factory;
  private final Map<DatabaseTarget, DatabaseConnector> open = new EnumMap<>(DatabaseTarget.class);
  private boolean closed;

  public DatabaseManager(ConnectorFactory factory) {
    this.factory = Objects.requireNonNull(factory, "factory");
  }

  /**
   * Connected connector for {@code target}, cached for the rest of the request.
   *
   * @throws ConnectionException when the target cannot be reached
   */
  public DatabaseConnector connector(DatabaseTarget target) {
    Objects.requireNonNull(target, "target");
    if (closed) throw new IllegalStateException("DatabaseManager is closed");
    DatabaseConnector c = open.get(target);
    if (c != null) return c;

    c = factory.open(target);
    c.connect();
    open.put(target, c);
    return c;
  }

  public DatabaseConnector primary() { return connector(DatabaseTarget.PRIMARY); }

  /** Like {@link #connector} but empty when the target is unconfigured or unreachable. */
  public Optional<DatabaseConnector> find(DatabaseTarget target) {
    if (!factory.isConfigured(target)) return Optional.empty();
    try {
      return Optional.of(connector(target));
    } catch (ConnectionException e) {
      log.warn("playgroundx.db target_unavailable target={} msg={}", target.key(), e.getMessage());
      return Optional.empty();
    }
  }

  public boolean isOpen(DatabaseTarget target) { return open.containsKey(target); }

  /** Closes every opened connector; failures are logged so the remaining ones still get closed. */
  @Override
  public void close() {
    if (closed) return;
    closed = true;
    for (Map.Entry<DatabaseTarget, DatabaseConnector> e : open.entrySet()) {
      try {
        e.getValue().close();
      } catch (RuntimeException ex) {
        log.error("playgroundx.db close_failed target={}", e.getKey().key(), ex);
      }
    }
    open.clear();
  }
}
