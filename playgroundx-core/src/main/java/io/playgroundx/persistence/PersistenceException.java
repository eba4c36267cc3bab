package io.playgroundx.persistence;

/** Base type for every failure raised by the persistence layer. */
public class PersistenceException extends RuntimeException {
  public PersistenceException(String message) {
    super(message);
  }

  public PersistenceException(String message, Throwable cause) {
    super(message, cause);
  }
}
