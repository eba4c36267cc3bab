package io.playgroundx.web.api;

import io.playgroundx.persistence.ConnectionException;
import io.playgroundx.persistence.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.NoHandlerFoundException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

/** Maps failures to {@code {"error": ..., "status_code": ...}}. */
@RestControllerAdvice
public final class ApiExceptionHandler {
  private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

  static final String INTERNAL_ERROR = "Internal server error";

  @ExceptionHandler(ApiException.class)
  public ResponseEntity<ApiError> api(ApiException e) {
    log.error("APIException: {}", e.getMessage());
    return error(e.status(), e.getMessage());
  }

  @ExceptionHandler(ValidationException.class)
  public ResponseEntity<ApiError> validation(ValidationException e) {
    log.warn("Invalid request: {}", e.getMessage());
    return error(HttpStatus.BAD_REQUEST, e.getMessage());
  }

  @ExceptionHandler({MethodArgumentTypeMismatchException.class, MissingServletRequestParameterException.class})
  public ResponseEntity<ApiError> badParameter(Exception e) {
    log.warn("Invalid request: {}", e.getMessage());
    return error(HttpStatus.BAD_REQUEST, "Invalid request");
  }

  @ExceptionHandler(ConnectionException.class)
  public ResponseEntity<ApiError> unavailable(ConnectionException e) {
    log.error("Database connection error: {}", e.getMessage(), e);
    return error(HttpStatus.SERVICE_UNAVAILABLE, "Database unavailable");
  }

  @ExceptionHandler({NoHandlerFoundException.class, NoResourceFoundException.class})
  public ResponseEntity<ApiError> notFound(Exception e) {
    log.error("HTTPException: {}", e.getMessage());
    return error(HttpStatus.NOT_FOUND, "Not found");
  }

  @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
  public ResponseEntity<ApiError> methodNotAllowed(HttpRequestMethodNotSupportedException e) {
    log.error("HTTPException: {}", e.getMessage());
    return error(HttpStatus.METHOD_NOT_ALLOWED, "Method not allowed");
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ApiError> unhandled(Exception e) {
    log.error("Unhandled exception: {}", e.getMessage(), e);
    return error(HttpStatus.INTERNAL_SERVER_ERROR, INTERNAL_ERROR);
  }

  private static ResponseEntity<ApiError> error(HttpStatus status, String message) {
    return ResponseEntity.status(status).body(new ApiError(message, status.value()));
  }
}
