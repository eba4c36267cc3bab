package io.playgroundx.persistence.page;

import com.fasterxml.jackson.annotation.JsonProperty;

public record PaginationMeta(
    @JsonProperty("page") int page,
    @JsonProperty("size") int size,
    @JsonProperty("total_records") long totalRecords,
    @JsonProperty("total_pages") long totalPages
) {}
