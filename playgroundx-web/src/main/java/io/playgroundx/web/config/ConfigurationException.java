package io.playgroundx.web.config;

/** Invalid or incomplete application configuration; fatal at startup. */
public final class ConfigurationException extends RuntimeException {
  public ConfigurationException(String message) {
    super(message);
  }
}
