package io.github.themoah.sigmon.config;

import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads typed environment variables, falling back to the default on blank or invalid values.
 */
final class EnvParser {

  private static final Logger log = LoggerFactory.getLogger(EnvParser.class);

  private EnvParser() {}

  static int parseInt(String envVar, int defaultValue) {
    return parse(envVar, System.getenv(envVar), Integer::parseInt, defaultValue);
  }

  static boolean parseBoolean(String envVar, boolean defaultValue) {
    String value = System.getenv(envVar);
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    return Boolean.parseBoolean(value.trim());
  }

  static String parseString(String envVar, String defaultValue) {
    String value = System.getenv(envVar);
    return (value == null || value.isBlank()) ? defaultValue : value.trim();
  }

  static <T> T parse(String name, String value, Function<String, T> parser, T defaultValue) {
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    try {
      return parser.apply(value.trim());
    } catch (NumberFormatException e) {
      log.warn("Invalid value for {}: '{}', using default: {}", name, value, defaultValue);
      return defaultValue;
    }
  }
}
