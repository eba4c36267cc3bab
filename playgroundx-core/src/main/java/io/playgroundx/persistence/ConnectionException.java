package io.playgroundx.persistence;

/**
 * Raised when a connection cannot be established or obtained from a pool
 * (network, authentication, or pool exhaustion after the acquire timeout).
 * <p>
 * Fatal to the current request only; the pool stays usable.
 */
public final class ConnectionException extends PersistenceException {
  public ConnectionException(String message) {
    super(message);
  }

  public ConnectionException(String message, Throwable cause) {
    super(message, cause);
  }
}
