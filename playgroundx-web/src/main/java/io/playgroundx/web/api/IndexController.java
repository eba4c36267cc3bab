package io.playgroundx.web.api;

import io.playgroundx.persistence.mapping.Row;
import io.playgroundx.web.db.DatabaseManager;
import io.playgroundx.web.db.DatabaseTarget;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
public final class IndexController {
  static final String SESSION_QUERY = "SELECT session_user, current_database()";

  /** Session user and database of every reachable target; null for the others. */
  @GetMapping("/")
  public ApiResponse<Map<String, Row>> index(DatabaseManager db) {
    Map<String, Row> data = new LinkedHashMap<>();
    for (DatabaseTarget t : DatabaseTarget.values()) {
      data.put(t.key(), db.find(t).flatMap(c -> c.fetchOne(SESSION_QUERY)).orElse(null));
    }
    return ApiResponse.up(data);
  }
}
