package io.playgroundx.persistence.exec;

import java.time.Duration;
import java.util.Objects;

/**
 * Pool bounds.\n
 * {@code minSize} connections are opened when the pool starts, more on demand up to {@code maxSize};
 * {@code acquireTimeout} bounds how long {@code acquire} waits for a free connection.
 */
public record PoolSettings(int minSize, int maxSize, Duration acquireTimeout) {
  public static final int DEFAULT_MIN_SIZE = 5;
  public static final int DEFAULT_MAX_SIZE = 20;
  public static final Duration DEFAULT_ACQUIRE_TIMEOUT = Duration.ofSeconds(30);
  /** Lower bound imposed by the JDBC pool implementation. */
  public static final Duration MIN_ACQUIRE_TIMEOUT = Duration.ofMillis(250);

  public PoolSettings {
    Objects.requireNonNull(acquireTimeout, "acquireTimeout");
    if (minSize < 1) throw new IllegalArgumentException("minSize must be >= 1");
    if (maxSize < minSize) throw new IllegalArgumentException("maxSize must be >= minSize");
    if (acquireTimeout.compareTo(MIN_ACQUIRE_TIMEOUT) < 0) {
      throw new IllegalArgumentException("acquireTimeout must be >= " + MIN_ACQUIRE_TIMEOUT.toMillis() + "ms");
    }
  }

  public static PoolSettings defaults() {
    return new PoolSettings(DEFAULT_MIN_SIZE, DEFAULT_MAX_SIZE, DEFAULT_ACQUIRE_TIMEOUT);
  }
}
