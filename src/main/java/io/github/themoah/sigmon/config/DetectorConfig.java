package io.github.themoah.sigmon.config;

import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The detector configuration document.
 *
 * @param metrics monitored metric types, in reporting order
 * @param projectId Cloud Monitoring project to query
 * @param pollingInterval time between detection cycles
 * @param baselineDuration length of the historical baseline window
 * @param recentDuration length of the recent detection window
 * @param filters optional extra filter expression per metric
 * @param zScoreThreshold absolute z-score above which a sample is anomalous
 * @param baselineRefreshInterval how often to recompute the baseline, {@link Duration#ZERO} for never
 */
public record DetectorConfig(
  List<String> metrics,
  String projectId,
  Duration pollingInterval,
  Duration baselineDuration,
  Duration recentDuration,
  Map<String, String> filters,
  double zScoreThreshold,
  Duration baselineRefreshInterval
) {

  private static final Logger log = LoggerFactory.getLogger(DetectorConfig.class);

  static final String KEY_METRICS = "metrics";
  static final String KEY_PROJECT_ID = "project_id";
  static final String KEY_POLLING_TIME = "polling_time";
  static final String KEY_BASELINE_DURATION = "baseline_duration";
  static final String KEY_RECENT_DURATION = "recent_duration";
  static final String KEY_FILTERS = "filters";
  static final String KEY_Z_SCORE_THRESHOLD = "z_score_threshold";
  static final String KEY_BASELINE_REFRESH_HOURS = "baseline_refresh_hours";

  private static final int DEFAULT_BASELINE_DAYS = 7;
  private static final double DEFAULT_Z_SCORE_THRESHOLD = 3.0;

  public DetectorConfig {
    metrics = List.copyOf(metrics);
    filters = Map.copyOf(filters);
  }

  /**
   * Returns the filter configured for a metric, or null if there is none.
   */
  public String filterFor(String metricId) {
    return filters.get(metricId);
  }

  public boolean isBaselineRefreshEnabled() {
    return !baselineRefreshInterval.isZero();
  }

  /**
   * Parses and validates the configuration document.
   *
   * <p>Keys:
   * <ul>
   *   <li>metrics - list of metric types (required, non-empty)</li>
   *   <li>project_id - Cloud Monitoring project (required)</li>
   *   <li>polling_time - seconds between cycles (required, &gt; 0)</li>
   *   <li>recent_duration - recent window in minutes (required, &gt; 0)</li>
   *   <li>baseline_duration - baseline window in days (default: 7, also when 0)</li>
   *   <li>filters - map of metric type to extra filter expression (default: none)</li>
   *   <li>z_score_threshold - anomaly threshold (default: 3.0)</li>
   *   <li>baseline_refresh_hours - baseline refresh period (default: 0, never)</li>
   * </ul>
   *
   * @param json the parsed document
   * @return the validated configuration
   * @throws ConfigException if a key is missing, mistyped or out of range
   */
  public static DetectorConfig fromJson(JsonObject json) {
    if (json == null || json.isEmpty()) {
      throw new ConfigException("Configuration document is empty");
    }

    List<String> metrics = readMetrics(json);
    String projectId = readString(json, KEY_PROJECT_ID);

    int pollingSeconds = requireInt(json, KEY_POLLING_TIME);
    if (pollingSeconds <= 0) {
      throw new ConfigException(KEY_POLLING_TIME + " must be > 0, got " + pollingSeconds);
    }

    int recentMinutes = requireInt(json, KEY_RECENT_DURATION);
    if (recentMinutes <= 0) {
      throw new ConfigException(KEY_RECENT_DURATION + " must be > 0, got " + recentMinutes);
    }

    int baselineDays = optionalInt(json, KEY_BASELINE_DURATION, 0);
    if (baselineDays < 0) {
      throw new ConfigException(KEY_BASELINE_DURATION + " must be >= 0, got " + baselineDays);
    }
    if (baselineDays == 0) {
      baselineDays = DEFAULT_BASELINE_DAYS;
    }

    double threshold = optionalDouble(json, KEY_Z_SCORE_THRESHOLD, DEFAULT_Z_SCORE_THRESHOLD);
    if (!Double.isFinite(threshold) || threshold < 0) {
      throw new ConfigException(KEY_Z_SCORE_THRESHOLD + " must be a finite number >= 0, got " + threshold);
    }

    int refreshHours = optionalInt(json, KEY_BASELINE_REFRESH_HOURS, 0);
    if (refreshHours < 0) {
      throw new ConfigException(KEY_BASELINE_REFRESH_HOURS + " must be >= 0, got " + refreshHours);
    }

    Map<String, String> filters = readFilters(json);
    for (String filtered : filters.keySet()) {
      if (!metrics.contains(filtered)) {
        log.warn("Filter configured for unmonitored metric: {}", filtered);
      }
    }

    DetectorConfig config = new DetectorConfig(
      metrics,
      projectId,
      Duration.ofSeconds(pollingSeconds),
      Duration.ofDays(baselineDays),
      Duration.ofMinutes(recentMinutes),
      filters,
      threshold,
      Duration.ofHours(refreshHours)
    );

    log.info("Detector config loaded: project={}, metrics={}, pollingTime={}s, baselineDays={}, "
        + "recentMinutes={}, zScoreThreshold={}, baselineRefreshHours={}",
      projectId, metrics.size(), pollingSeconds, baselineDays, recentMinutes, threshold, refreshHours);

    return config;
  }

  private static List<String> readMetrics(JsonObject json) {
    Object raw = json.getValue(KEY_METRICS);
    if (!(raw instanceof JsonArray array) || array.isEmpty()) {
      throw new ConfigException(KEY_METRICS + " must be a non-empty list of metric types");
    }
    List<String> metrics = new ArrayList<>();
    for (Object item : array) {
      if (!(item instanceof String metric) || metric.isBlank()) {
        throw new ConfigException(KEY_METRICS + " entries must be non-blank strings, got: " + item);
      }
      if (metrics.contains(metric)) {
        log.warn("Metric listed more than once: {}", metric);
        continue;
      }
      metrics.add(metric);
    }
    return metrics;
  }

  private static Map<String, String> readFilters(JsonObject json) {
    Object raw = json.getValue(KEY_FILTERS);
    if (raw == null) {
      return Map.of();
    }
    if (!(raw instanceof JsonObject object)) {
      throw new ConfigException(KEY_FILTERS + " must be a map of metric type to filter expression");
    }
    Map<String, String> filters = new LinkedHashMap<>();
    for (Map.Entry<String, Object> entry : object) {
      if (!(entry.getValue() instanceof String filter)) {
        throw new ConfigException("Filter for " + entry.getKey() + " must be a string");
      }
      if (!filter.isBlank()) {
        filters.put(entry.getKey(), filter);
      }
    }
    return filters;
  }

  private static String readString(JsonObject json, String key) {
    Object raw = json.getValue(key);
    if (!(raw instanceof String value) || value.isBlank()) {
      throw new ConfigException(key + " is required");
    }
    return value;
  }

  private static int requireInt(JsonObject json, String key) {
    if (json.getValue(key) == null) {
      throw new ConfigException(key + " is required");
    }
    return optionalInt(json, key, 0);
  }

  private static int optionalInt(JsonObject json, String key, int defaultValue) {
    Object raw = json.getValue(key);
    if (raw == null) {
      return defaultValue;
    }
    if (raw instanceof Integer || raw instanceof Long || raw instanceof Short) {
      return ((Number) raw).intValue();
    }
    throw new ConfigException(key + " must be an integer, got: " + raw);
  }

  private static double optionalDouble(JsonObject json, String key, double defaultValue) {
    Object raw = json.getValue(key);
    if (raw == null) {
      return defaultValue;
    }
    if (raw instanceof Number number) {
      return number.doubleValue();
    }
    throw new ConfigException(key + " must be a number, got: " + raw);
  }
}
