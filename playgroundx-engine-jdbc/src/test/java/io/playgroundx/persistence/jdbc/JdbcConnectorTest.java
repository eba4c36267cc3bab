package io.playgroundx.persistence.jdbc;

import io.playgroundx.persistence.QueryExecutionException;
import io.playgroundx.persistence.ValidationException;
import io.playgroundx.persistence.jdbc.dialect.AbstractJdbcSqlDialect;
import io.playgroundx.persistence.jdbc.dialect.GenericJdbcDialect;
import io.playgroundx.persistence.mapping.Row;
import io.playgroundx.persistence.page.LinksMeta;
import io.playgroundx.persistence.page.PageRequest;
import io.playgroundx.persistence.page.PagedResult;
import io.playgroundx.persistence.page.PaginationMeta;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

final class JdbcConnectorTest {
  private static final String USERS = "SELECT id, username, email, created_at FROM users ORDER BY id";

  private HikariConnectionPool pool;
  private JdbcConnector db;

  @BeforeEach
  void setUp() {
    pool = H2Pools.start(1, 4, Duration.ofSeconds(2));
    db = new JdbcConnector("primary", pool, new GenericJdbcDialect());
    db.execute("CREATE TABLE users (id BIGINT PRIMARY KEY, username VARCHAR(64) NOT NULL, "
        + "email VARCHAR(255), created_at TIMESTAMP NOT NULL)");
  }

  @AfterEach
  void tearDown() {
    db.close();
    pool.close();
  }

  private void seedUsers(int n) {
    for (int i = 1; i <= n; i++) {
      db.execute("INSERT INTO users (id, username, email, created_at) VALUES (?, ?, ?, ?)",
          List.of((long) i, "user" + i, "user" + i + "@example.com",
              Timestamp.valueOf(LocalDateTime.of(2024, 1, 1, 0, 0).plusDays(i))));
    }
  }

  @Test
  void firstPage_carriesTotalsAndOnlyDataColumns() {
    seedUsers(12);
    PagedResult<Row> r = db.fetchAll(USERS, PageRequest.of(1, 5));

    assertEquals(5, r.data().size());
    assertEquals(new PaginationMeta(1, 5, 12, 3), r.pagination());
    assertEquals(List.of("id", "username", "email", "created_at"), r.data().get(0).columns());

    LinksMeta links = r.withLinks((p, s) -> "/user?page=" + p + "&size=" + s).metadata().links();
    assertNull(links.prev());
    assertEquals("/user?page=2&size=5", links.next());
  }

  @Test
  void lastPage_isPartial() {
    seedUsers(12);
    PagedResult<Row> r = db.fetchAll(USERS, PageRequest.of(3, 5));

    assertEquals(2, r.data().size());
    assertEquals(new PaginationMeta(3, 5, 12, 3), r.pagination());
    LinksMeta links = r.withLinks((p, s) -> "/user?page=" + p + "&size=" + s).metadata().links();
    assertNull(links.next());
    assertEquals("/user?page=2&size=5", links.prev());
  }

  @Test
  void emptyResult_hasNoMetadata() {
    PagedResult<Row> r = db.fetchAll(USERS, PageRequest.of(1, 5));
    assertTrue(r.data().isEmpty());
    assertNull(r.metadata());
  }

  @Test
  void pageAfterTheLast_isEmptyWithoutMetadata() {
    seedUsers(3);
    PagedResult<Row> r = db.fetchAll(USERS, PageRequest.of(2, 5));
    assertTrue(r.isEmpty());
    assertNull(r.metadata());
  }

  @Test
  void callerParams_precedePageParams() {
    seedUsers(12);
    PagedResult<Row> r = db.fetchAll("SELECT id FROM users WHERE id > ? ORDER BY id", List.of(2L), PageRequest.of(2, 4));
    assertEquals(4, r.data().size());
    assertEquals(10, r.pagination().totalRecords());
    assertEquals(3, r.pagination().totalPages());
  }

  @Test
  void unpagedFetchAll_returnsEverythingWithoutMetadata() {
    seedUsers(12);
    PagedResult<Row> r = db.fetchAll(USERS, List.of());
    assertEquals(12, r.data().size());
    assertNull(r.metadata());
    assertFalse(r.data().get(0).has("total_count"));
  }

  @Test
  void fetchOne_withoutMatch_isEmpty() {
    seedUsers(2);
    assertEquals(Optional.empty(), db.fetchOne("SELECT id FROM users WHERE id = ?", List.of(999L)));

    Row r = db.fetchOne("SELECT id, username FROM users WHERE id = ?", List.of(2L)).orElseThrow();
    assertEquals("user2", r.get("username"));
  }

  @Test
  void fetchMany_isBoundedBySize() {
    seedUsers(12);
    assertEquals(4, db.fetchMany(USERS, 4).size());
    assertEquals(12, db.fetchMany(USERS, 50).size());
    assertThrows(ValidationException.class, () -> db.fetchMany(USERS, 0));
  }

  @Test
  void failedExecute_rollsBackAndCarriesStatement() {
    seedUsers(2);
    String dup = "INSERT INTO users (id, username, email, created_at) VALUES (?, ?, ?, ?)";
    List<Object> params = List.of(1L, "again", "x@example.com", Timestamp.valueOf(LocalDateTime.now()));

    QueryExecutionException ex = assertThrows(QueryExecutionException.class, () -> db.execute(dup, params));
    assertEquals(dup, ex.sql());
    assertEquals(params, ex.params());
    assertInstanceOf(SQLException.class, ex.getCause());

    // connection stays usable and nothing from the failed call leaked in
    Row count = db.fetchOne("SELECT COUNT(*) AS n FROM users").orElseThrow();
    assertEquals(2L, ((Number) count.get("n")).longValue());
    assertTrue(db.isConnected());
  }

  @Test
  void committedWrites_areVisibleToOtherConnections() {
    seedUsers(1);
    try (JdbcConnector other = new JdbcConnector("other", pool, new GenericJdbcDialect())) {
      assertTrue(other.fetchOne("SELECT id FROM users WHERE id = 1").isPresent());
    }
  }

  @Test
  void nullParams_areBound() {
    db.execute("INSERT INTO users (id, username, email, created_at) VALUES (?, ?, ?, ?)",
        java.util.Arrays.asList(5L, "noemail", null, Timestamp.valueOf(LocalDateTime.now())));
    Row r = db.fetchOne("SELECT email FROM users WHERE id = 5").orElseThrow();
    assertTrue(r.has("email"));
    assertNull(r.get("email"));
  }

  @Test
  void close_returnsConnection_andNextCallReconnects() {
    db.fetchOne("SELECT 1 AS one");
    assertTrue(db.isConnected());
    assertEquals(1, pool.stats().active());

    db.close();
    assertFalse(db.isConnected());
    assertEquals(0, pool.stats().active());
    assertDoesNotThrow(db::close);

    assertTrue(db.fetchOne("SELECT 1 AS one").isPresent());
    assertTrue(db.isConnected());
  }

  @Test
  void reconnect_swapsConnectionWithoutLeaking() {
    db.connect();
    db.reconnect();
    assertTrue(db.isConnected());
    assertEquals(1, pool.stats().active());
  }

  @Test
  void fatalError_discardsConnection() {
    AbstractJdbcSqlDialect alwaysFatal = new AbstractJdbcSqlDialect() {
      @Override public String id() { return "always-fatal"; }
      @Override public boolean isFatal(SQLException e) { return true; }
    };
    JdbcConnector fragile = new JdbcConnector("fragile", pool, alwaysFatal);
    fragile.connect();
    assertEquals(2, pool.stats().active());

    assertThrows(QueryExecutionException.class, () -> fragile.fetchOne("SELECT * FROM no_such_table"));
    assertFalse(fragile.isConnected());
    assertEquals(1, pool.stats().active());

    assertTrue(fragile.fetchOne("SELECT 1 AS one").isPresent());
    fragile.close();
  }
}
