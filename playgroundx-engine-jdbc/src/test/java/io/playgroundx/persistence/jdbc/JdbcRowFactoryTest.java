package io.playgroundx.persistence.jdbc;

import io.playgroundx.persistence.mapping.Row;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class JdbcRowFactoryTest {
  @Test
  void rowsFollowSelectOrder() throws Exception {
    try (HikariConnectionPool pool = H2Pools.start(1, 1, Duration.ofSeconds(1))) {
      Connection c = pool.acquire();
      try (PreparedStatement ps = c.prepareStatement("SELECT 3 AS c, 'x' AS a, CAST(NULL AS VARCHAR) AS b");
           ResultSet rs = ps.executeQuery()) {
        JdbcRowFactory f = JdbcRowFactory.of(rs.getMetaData());
        assertTrue(rs.next());
        Row r = f.read(rs);
        assertEquals(List.of("c", "a", "b"), r.columns());
        assertEquals(Arrays.asList(3, "x", null), r.values());
      } finally {
        pool.release(c);
      }
    }
  }

  @Test
  void trailingTotal_isSplitOff() throws Exception {
    try (HikariConnectionPool pool = H2Pools.start(1, 1, Duration.ofSeconds(1))) {
      Connection c = pool.acquire();
      try (PreparedStatement ps = c.prepareStatement("SELECT 'a' AS name, CAST(42 AS BIGINT) AS total_count");
           ResultSet rs = ps.executeQuery()) {
        JdbcRowFactory f = JdbcRowFactory.withTrailingTotal(rs.getMetaData());
        assertTrue(rs.next());
        assertEquals(List.of("name"), f.read(rs).columns());
        assertEquals(42, f.total(rs));
      } finally {
        pool.release(c);
      }
    }
  }
}
