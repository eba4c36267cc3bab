package io.playgroundx.web.db;

/** Database targets a request can talk to; {@link #key()} is the name used in responses and config. */
public enum DatabaseTarget {
  PRIMARY("postgres"),
  SECONDARY("oracle");

  private final String key;

  DatabaseTarget(String key) { this.key = key; }

  public String key() { return key; }
}
