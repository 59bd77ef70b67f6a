package io.github.themoah.sigmon.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Configuration for the metrics reporter that publishes detector metrics.
 *
 * @param reporterType registry type: prometheus, datadog, otlp or none
 * @param jvmMetricsEnabled whether JVM metrics are bound to the registry
 */
public record ReporterConfig(
  String reporterType,
  boolean jvmMetricsEnabled
) {

  private static final Logger log = LoggerFactory.getLogger(ReporterConfig.class);

  private static final String DEFAULT_REPORTER = "prometheus";
  private static final String DISABLED = "none";

  public boolean isEnabled() {
    return reporterType != null && !DISABLED.equalsIgnoreCase(reporterType);
  }

  /**
   * Loads configuration from environment variables.
   *
   * <p>Supported environment variables:
   * <ul>
   *   <li>METRICS_REPORTER - prometheus, datadog, otlp or none (default: prometheus)</li>
   *   <li>METRICS_JVM_ENABLED - bind JVM memory/GC/thread metrics (default: false)</li>
   * </ul>
   */
  public static ReporterConfig fromEnvironment() {
    String type = EnvParser.parseString("METRICS_REPORTER", DEFAULT_REPORTER);
    boolean jvm = EnvParser.parseBoolean("METRICS_JVM_ENABLED", false);

    ReporterConfig config = new ReporterConfig(type, jvm);
    log.info("Reporter config: type={}, jvmMetrics={}", type, jvm);
    return config;
  }
}
