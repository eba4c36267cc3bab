package io.playgroundx.persistence;

/**
 * Raised on malformed caller input: pagination parameters out of range, or a row
 * that cannot be decoded into the requested entity.
 */
public final class ValidationException extends PersistenceException {
  private final String field;

  public ValidationException(String message) {
    this(null, message);
  }

  public ValidationException(String field, String message) {
    super(message);
    this.field = field;
  }

  /** Offending field name, or null when the failure is not tied to a single field. */
  public String field() { return field; }
}
