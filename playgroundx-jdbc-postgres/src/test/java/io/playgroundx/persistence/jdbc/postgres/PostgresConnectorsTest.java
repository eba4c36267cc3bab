package io.playgroundx.persistence.jdbc.postgres;

import io.playgroundx.persistence.exec.PoolSettings;
import io.playgroundx.persistence.jdbc.HikariConnectionPool;
import io.playgroundx.persistence.jdbc.JdbcConnector;
import io.playgroundx.persistence.mapping.Row;
import io.playgroundx.persistence.page.PageRequest;
import io.playgroundx.persistence.page.PagedResult;
import io.playgroundx.persistence.page.PaginationMeta;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/** Runs the CTE pagination against H2 in PostgreSQL mode through a real pool and connector. */
final class PostgresConnectorsTest {
  private static final String USERS = "SELECT id, username FROM users ORDER BY id";

  private HikariConnectionPool pool;
  private JdbcConnector db;

  @BeforeEach
  void setUp() {
    String url = "jdbc:h2:mem:pgx_" + UUID.randomUUID().toString().replace("-", "")
        + ";DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_LOWER=TRUE";
    pool = HikariConnectionPool.start("pg-h2", url, "sa", "", new PoolSettings(1, 2, Duration.ofSeconds(2)));
    db = PostgresConnectors.connector("primary", pool);
    db.execute("CREATE TABLE users (id BIGINT PRIMARY KEY, username VARCHAR(64) NOT NULL)");
  }

  @AfterEach
  void tearDown() {
    db.close();
    pool.close();
  }

  private void seed(int n) {
    for (int i = 1; i <= n; i++) {
      db.execute("INSERT INTO users (id, username) VALUES (?, ?)", List.of((long) i, "user" + i));
    }
  }

  @Test
  void emptyTable_givesNoDataAndNoMetadata() {
    PagedResult<Row> r = db.fetchAll(USERS, PageRequest.of(1, 5));
    assertTrue(r.data().isEmpty());
    assertNull(r.metadata());
  }

  @Test
  void firstPage_countsEveryRow() {
    seed(12);
    PagedResult<Row> r = db.fetchAll(USERS, PageRequest.of(1, 5));

    assertEquals(5, r.data().size());
    assertEquals(new PaginationMeta(1, 5, 12, 3), r.pagination());
    assertEquals(List.of("id", "username"), r.data().get(0).columns());
    assertEquals("user1", r.data().get(0).get("username"));
  }

  @Test
  void lastPage_isPartial() {
    seed(12);
    PagedResult<Row> r = db.fetchAll(USERS, PageRequest.of(3, 5));

    assertEquals(2, r.data().size());
    assertEquals(new PaginationMeta(3, 5, 12, 3), r.pagination());
    assertEquals("user11", r.data().get(0).get("username"));
  }

  @Test
  void callerParamsBindBeforeLimitAndOffset() {
    seed(12);
    PagedResult<Row> r = db.fetchAll("SELECT id, username FROM users WHERE id > ? ORDER BY id",
        List.of(4L), PageRequest.of(2, 3));

    assertEquals(new PaginationMeta(2, 3, 8, 3), r.pagination());
    assertEquals(List.of("user8", "user9", "user10"),
        r.data().stream().map(row -> row.get("username")).toList());
  }
}
