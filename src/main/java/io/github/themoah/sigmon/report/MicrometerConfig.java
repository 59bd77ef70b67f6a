package io.github.themoah.sigmon.report;

import io.micrometer.core.instrument.Clock;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.jvm.JvmGcMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;
import io.micrometer.datadog.DatadogConfig;
import io.micrometer.datadog.DatadogMeterRegistry;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import io.micrometer.registry.otlp.OtlpConfig;
import io.micrometer.registry.otlp.OtlpMeterRegistry;
import java.time.Duration;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Factory for the Micrometer registry the detector publishes to.
 */
public final class MicrometerConfig {

  private static final Logger log = LoggerFactory.getLogger(MicrometerConfig.class);

  private static final String DEFAULT_SERVICE_NAME = "sigmon";

  private MicrometerConfig() {}

  /**
   * Creates a meter registry based on the reporter type.
   *
   * @param reporterType "prometheus", "datadog" or "otlp"
   * @return the configured MeterRegistry, or null if the type is unknown
   */
  public static MeterRegistry createRegistry(String reporterType) {
    if (reporterType == null) {
      return null;
    }

    return switch (reporterType.toLowerCase()) {
      case "prometheus" -> createPrometheusRegistry();
      case "datadog" -> createDatadogRegistry();
      case "otlp" -> createOtlpRegistry();
      default -> {
        log.warn("Unknown reporter type: {}", reporterType);
        yield null;
      }
    };
  }

  public static PrometheusMeterRegistry createPrometheusRegistry() {
    log.info("Creating Prometheus meter registry");
    return new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
  }

  /**
   * Creates a Datadog registry from DD_API_KEY, DD_APP_KEY and DD_SITE.
   */
  public static MeterRegistry createDatadogRegistry() {
    log.info("Creating Datadog meter registry");

    DatadogConfig config = new DatadogConfig() {
      @Override
      public String apiKey() {
        return System.getenv("DD_API_KEY");
      }

      @Override
      public String applicationKey() {
        return System.getenv("DD_APP_KEY");
      }

      @Override
      public String uri() {
        return "https://api." + System.getenv().getOrDefault("DD_SITE", "datadoghq.com");
      }

      @Override
      public String get(String key) {
        return null;
      }
    };

    return new DatadogMeterRegistry(config, Clock.SYSTEM);
  }

  /**
   * Creates an OTLP (HTTP) registry.
   *
   * <p>Endpoint from OTLP_ENDPOINT, else OTEL_EXPORTER_OTLP_ENDPOINT + /v1/metrics, else
   * localhost:4318. Step from OTLP_STEP_MS (default 60s). Service name from
   * OTEL_SERVICE_NAME (default sigmon).
   */
  public static MeterRegistry createOtlpRegistry() {
    log.info("Creating OTLP meter registry");

    OtlpConfig config = new OtlpConfig() {
      @Override
      public String url() {
        String url = System.getenv("OTLP_ENDPOINT");
        if (isSet(url)) {
          return url;
        }
        String base = System.getenv("OTEL_EXPORTER_OTLP_ENDPOINT");
        if (isSet(base)) {
          return base.endsWith("/v1/metrics") ? base : base + "/v1/metrics";
        }
        return "http://localhost:4318/v1/metrics";
      }

      @Override
      public Duration step() {
        String stepMs = System.getenv("OTLP_STEP_MS");
        if (isSet(stepMs)) {
          try {
            return Duration.ofMillis(Long.parseLong(stepMs));
          } catch (NumberFormatException e) {
            log.warn("Invalid OTLP_STEP_MS: {}, using default 60s", stepMs);
          }
        }
        return Duration.ofSeconds(60);
      }

      @Override
      public Map<String, String> resourceAttributes() {
        String serviceName = System.getenv("OTEL_SERVICE_NAME");
        return Map.of("service.name", isSet(serviceName) ? serviceName : DEFAULT_SERVICE_NAME);
      }

      @Override
      public String get(String key) {
        return null;
      }
    };

    OtlpMeterRegistry registry = new OtlpMeterRegistry(config, Clock.SYSTEM);
    log.info("OTLP registry created - endpoint: {}", config.url());
    return registry;
  }

  /**
   * Binds JVM metrics (memory, GC, threads, CPU) to the given registry.
   */
  public static void bindJvmMetrics(MeterRegistry registry) {
    log.info("Binding JVM metrics to registry");
    new JvmMemoryMetrics().bindTo(registry);
    new JvmGcMetrics().bindTo(registry);
    new JvmThreadMetrics().bindTo(registry);
    new ProcessorMetrics().bindTo(registry);
  }

  private static boolean isSet(String value) {
    return value != null && !value.isBlank();
  }
}
