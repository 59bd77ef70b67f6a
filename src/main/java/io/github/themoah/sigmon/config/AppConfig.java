package io.github.themoah.sigmon.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Process configuration loaded from environment variables.
 *
 * @param httpPort HTTP server port for health and metrics endpoints
 */
public record AppConfig(
  int httpPort
) {
  private static final Logger log = LoggerFactory.getLogger(AppConfig.class);

  private static final int DEFAULT_HTTP_PORT = 8888;

  /**
   * Loads configuration from environment variables with defaults.
   *
   * @return AppConfig instance
   */
  public static AppConfig fromEnvironment() {
    int port = EnvParser.parseInt("HTTP_PORT", DEFAULT_HTTP_PORT);

    log.info("AppConfig loaded: httpPort={}", port);
    return new AppConfig(port);
  }
}
