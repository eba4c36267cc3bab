package io.playgroundx.persistence.page;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/** Navigation links; {@code next}/{@code prev} are null when there is no such page. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record LinksMeta(
    @JsonProperty("self") String self,
    @JsonProperty("next") String next,
    @JsonProperty("prev") String prev
) {
  public LinksMeta {
    Objects.requireNonNull(self, "self");
  }
}
