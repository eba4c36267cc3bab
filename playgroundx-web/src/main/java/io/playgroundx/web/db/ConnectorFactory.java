package io.playgroundx.web.db;

import io.playgroundx.persistence.exec.DatabaseConnector;

/** Opens (unconnected) connectors for a target. */
public interface ConnectorFactory {
  boolean isConfigured(DatabaseTarget target);

  /**
   * @throws IllegalStateException when {@code target} is not configured
   * @throws io.playgroundx.persistence.ConnectionException when the target's pool cannot be started
   */
  DatabaseConnector open(DatabaseTarget target);
}
