package io.github.themoah.sigmon.config;

/**
 * The detector configuration is missing or malformed.
 */
public class ConfigException extends RuntimeException {

  public ConfigException(String message) {
    super(message);
  }

  public ConfigException(String message, Throwable cause) {
    super(message, cause);
  }
}
