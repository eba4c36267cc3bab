package io.playgroundx.persistence.page;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record Metadata(
    @JsonProperty("pagination") PaginationMeta pagination,
    @JsonProperty("links") LinksMeta links
) {
  public static Metadata of(PaginationMeta pagination) { return new Metadata(pagination, null); }

  public Metadata withLinks(LinksMeta links) { return new Metadata(pagination, links); }
}
