package io.playgroundx.web.api;

import org.springframework.http.HttpStatus;

import java.util.Objects;

/** Error with a caller-facing message and HTTP status. */
public final class ApiException extends RuntimeException {
  private final HttpStatus status;

  public ApiException(HttpStatus status, String message) {
    super(message);
    this.status = Objects.requireNonNull(status, "status");
  }

  public HttpStatus status() { return status; }
}
