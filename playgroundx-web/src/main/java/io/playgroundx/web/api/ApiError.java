package io.playgroundx.web.api;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ApiError(
    @JsonProperty("error") String error,
    @JsonProperty("status_code") int statusCode
) {}
