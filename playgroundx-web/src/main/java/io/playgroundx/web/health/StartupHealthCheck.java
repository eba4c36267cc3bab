package io.playgroundx.web.health;

import io.playgroundx.persistence.exec.DatabaseConnector;
import io.playgroundx.persistence.mapping.Row;
import io.playgroundx.web.db.ConnectorFactory;
import io.playgroundx.web.db.DatabaseTarget;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;

import java.util.Optional;

/** Verifies the primary database answers before the application starts serving. */
public final class StartupHealthCheck implements ApplicationRunner {
  private static final Logger log = LoggerFactory.getLogger(StartupHealthCheck.class);
  static final String QUERY = "SELECT 1 AS _health";

  private final ConnectorFactory connectors;

  public StartupHealthCheck(ConnectorFactory connectors) {
    this.connectors = connectors;
  }

  @Override
  public void run(ApplicationArguments args) {
    check();
  }

  /** @throws IllegalStateException when the primary database is unreachable or answers unexpectedly */
  public void check() {
    try (DatabaseConnector db = connectors.open(DatabaseTarget.PRIMARY)) {
      Optional<Row> row = db.fetchOne(QUERY);
      Object v = row.map(r -> r.get("_health")).orElse(null);
      if (!(v instanceof Number n) || n.intValue() != 1) {
        throw new IllegalStateException("Unexpected health check answer from " + DatabaseTarget.PRIMARY.key() + ": " + v);
      }
      log.info("playgroundx.health database={} status=UP", DatabaseTarget.PRIMARY.key());
    } catch (RuntimeException e) {
      log.error("playgroundx.health database={} status=DOWN", DatabaseTarget.PRIMARY.key(), e);
      throw new IllegalStateException("Database health check failed", e);
    }
  }
}
