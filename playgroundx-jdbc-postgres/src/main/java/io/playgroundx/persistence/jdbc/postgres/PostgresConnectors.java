package io.playgroundx.persistence.jdbc.postgres;

import io.playgroundx.persistence.exec.ConnectionPool;
import io.playgroundx.persistence.exec.DatabaseCredentials;
import io.playgroundx.persistence.exec.PoolSettings;
import io.playgroundx.persistence.jdbc.HikariConnectionPool;
import io.playgroundx.persistence.jdbc.JdbcConnector;

import java.sql.Connection;
import java.util.Objects;

/** Pools and connectors for PostgreSQL targets. */
public final class PostgresConnectors {
  public static final String DRIVER = "org.postgresql.Driver";

  private static final PostgresDialect DIALECT = new PostgresDialect();

  private PostgresConnectors() {}

  public static String jdbcUrl(DatabaseCredentials creds) {
    Objects.requireNonNull(creds, "creds");
    return "jdbc:postgresql://" + creds.host() + ":" + creds.port() + "/" + creds.database();
  }

  /**
   * Starts a pool for {@code creds}.
   *
   * @throws IllegalArgumentException when required credential fields are missing
   * @throws io.playgroundx.persistence.ConnectionException when the database cannot be reached
   */
  public static HikariConnectionPool startPool(String name, DatabaseCredentials creds, PoolSettings settings) {
    Objects.requireNonNull(creds, "creds");
    if (!creds.isComplete()) {
      throw new IllegalArgumentException("Incomplete credentials for '" + name + "', missing: " + creds.missingFields());
    }
    return HikariConnectionPool.start(name, jdbcUrl(creds), DRIVER, creds.user(), creds.password(), settings);
  }

  public static JdbcConnector connector(String name, ConnectionPool<Connection> pool) {
    return new JdbcConnector(name, pool, DIALECT);
  }
}
