package io.playgroundx.persistence.exec;

/**
 * Bounded, thread-safe pool of connections of type {@code C}.
 * <p>
 * A connection handed out by {@link #acquire()} is owned by the caller until it is given back
 * through {@link #release} or {@link #discard}.
 */
public interface ConnectionPool<C> extends AutoCloseable {
  /**
   * Returns a free connection, opening a new one while below the maximum size.\n
   * At the maximum, waits up to the acquire timeout for a release.
   *
   * @throws io.playgroundx.persistence.ConnectionException on handshake failure or timeout
   */
  C acquire();

  /** Returns {@code conn} to the free set. Never throws; releasing twice is a no-op. */
  void release(C conn);

  /** Evicts {@code conn} after a fatal transport error; the pool replaces it on demand. */
  void discard(C conn);

  PoolStats stats();

  String name();

  @Override
  void close();
}
