package io.playgroundx.persistence.exec;

/** Point-in-time view of a pool; the numbers may be stale as soon as they are read. */
public record PoolStats(int active, int idle, int total, int maxSize) {}
