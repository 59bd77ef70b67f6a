package io.github.themoah.sigmon.report;

import io.github.themoah.sigmon.model.Anomaly;
import io.github.themoah.sigmon.model.BaselineStats;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.vertx.core.Future;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Publishes anomaly counts and per-metric statistics through a Micrometer MeterRegistry.
 * Works with any Micrometer-supported backend (Prometheus, Datadog, OTLP).
 */
public class MicrometerAnomalyReporter implements AnomalyReporter {

  private static final Logger log = LoggerFactory.getLogger(MicrometerAnomalyReporter.class);

  static final String ANOMALIES = "sigmon.anomalies";
  static final String CYCLES = "sigmon.cycles";
  static final String BASELINE_MEAN = "sigmon.baseline.mean";
  static final String BASELINE_STDDEV = "sigmon.baseline.stddev";
  static final String CURRENT_MEAN = "sigmon.current.mean";
  static final String CURRENT_STDDEV = "sigmon.current.stddev";

  private final MeterRegistry registry;
  // Gauge values held as raw double bits
  private final Map<String, AtomicLong> gaugeValues = new ConcurrentHashMap<>();
  private final Map<String, Gauge> gauges = new ConcurrentHashMap<>();

  public MicrometerAnomalyReporter(MeterRegistry registry) {
    this.registry = registry;
  }

  @Override
  public void reportAnomalies(List<Anomaly> anomalies) {
    for (Anomaly anomaly : anomalies) {
      Counter.builder(ANOMALIES)
        .description("Samples flagged as anomalous")
        .tags(metricTags(anomaly.metricId()))
        .register(registry)
        .increment();
    }
  }

  /**
   * Updates the per-metric gauges. The snapshot is complete, so gauges of metrics missing
   * from it (dropped by a baseline refresh) are removed.
   */
  @Override
  public void reportStatistics(Map<String, BaselineStats> stats) {
    log.debug("Reporting statistics for {} metrics", stats.size());

    Set<String> activeKeys = new HashSet<>();
    stats.forEach((metricId, s) -> {
      Tags tags = metricTags(metricId);
      activeKeys.add(recordGauge(BASELINE_MEAN, tags, s.baselineMean()));
      activeKeys.add(recordGauge(BASELINE_STDDEV, tags, s.baselineStdDev()));
      activeKeys.add(recordGauge(CURRENT_MEAN, tags, s.currentMean()));
      activeKeys.add(recordGauge(CURRENT_STDDEV, tags, s.currentStdDev()));
    });

    removeStaleGauges(activeKeys);
  }

  @Override
  public void reportCycle(boolean succeeded) {
    Counter.builder(CYCLES)
      .description("Detection cycles by outcome")
      .tag("outcome", succeeded ? "success" : "failure")
      .register(registry)
      .increment();
  }

  @Override
  public Future<Void> start() {
    log.info("MicrometerAnomalyReporter started");
    return Future.succeededFuture();
  }

  @Override
  public Future<Void> close() {
    log.info("Closing MicrometerAnomalyReporter");
    if (registry != null) {
      registry.close();
    }
    return Future.succeededFuture();
  }

  private String recordGauge(String name, Tags tags, double value) {
    String key = name + tags;
    AtomicLong bits = gaugeValues.computeIfAbsent(key, k -> {
      AtomicLong holder = new AtomicLong(Double.doubleToLongBits(value));
      gauges.put(k, Gauge.builder(name, holder, h -> Double.longBitsToDouble(h.get()))
        .tags(tags)
        .register(registry));
      return holder;
    });
    bits.set(Double.doubleToLongBits(value));
    return key;
  }

  private void removeStaleGauges(Set<String> activeKeys) {
    Set<String> stale = new HashSet<>(gaugeValues.keySet());
    stale.removeAll(activeKeys);

    for (String key : stale) {
      gaugeValues.remove(key);
      Gauge gauge = gauges.remove(key);
      if (gauge != null) {
        registry.remove(gauge);
      }
      log.debug("Removed stale gauge: {}", key);
    }
    if (!stale.isEmpty()) {
      log.info("Cleaned up {} stale gauges", stale.size());
    }
  }

  private static Tags metricTags(String metricId) {
    return Tags.of("metric", metricId);
  }
}
