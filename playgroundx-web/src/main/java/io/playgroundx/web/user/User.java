package io.playgroundx.web.user;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.playgroundx.persistence.mapping.Row;
import io.playgroundx.persistence.mapping.RowDecoder;
import io.playgroundx.persistence.mapping.Rows;

import java.time.LocalDateTime;

public record User(
    @JsonProperty("id") long id,
    @JsonProperty("username") String username,
    @JsonProperty("email") String email,
    @JsonProperty("created_at") LocalDateTime createdAt
) {
  public static final RowDecoder<User> DECODER = User::fromRow;

  public static User fromRow(Row row) {
    return new User(
        Rows.requireLong(row, "id"),
        Rows.requireString(row, "username"),
        Rows.optionalString(row, "email"),
        Rows.requireDateTime(row, "created_at"));
  }
}
