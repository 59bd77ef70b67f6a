package io.github.themoah.sigmon.engine;

import io.github.themoah.sigmon.engine.StatisticalUtils.Stats;
import io.github.themoah.sigmon.model.Anomaly;
import io.github.themoah.sigmon.model.BaselineStats;
import io.github.themoah.sigmon.model.MetricSample;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps a per-metric baseline and scores recent samples against it.
 *
 * <p>Lifecycle: {@link #initializeBaseline} once at startup (or on an explicit refresh),
 * then {@link #updateCurrentWindow} and {@link #detectAnomalies} once per polling cycle.
 *
 * <p>Not thread-safe. All calls must come from a single owner, which in the running
 * service is the event loop of the verticle that created it.
 */
public class StatisticsEngine {

  private static final Logger log = LoggerFactory.getLogger(StatisticsEngine.class);

  private static final String ANOMALY_MESSAGE =
    "Value deviates significantly from the mean (Z-score: %.2f)";
  private static final String ZERO_VARIANCE_MESSAGE =
    "Value deviates from a constant baseline of %.2f (Z-score: %.2f)";

  private Map<String, BaselineStats> stats = new LinkedHashMap<>();
  private Map<String, Double> zScores = Map.of();
  private boolean initialized = false;

  /**
   * Computes a fresh baseline for every metric and replaces all previous state.
   *
   * <p>NaN and infinite values are left out of the statistics. Metrics with no finite
   * samples get no entry and are excluded from detection until a
   * later initialization finds data for them. The engine counts as initialized afterwards
   * even if every metric was skipped.
   *
   * @param samplesByMetric historical samples grouped by metric id
   */
  public void initializeBaseline(Map<String, List<MetricSample>> samplesByMetric) {
    log.info("Initialising baseline for {} metrics", samplesByMetric.size());

    Map<String, BaselineStats> fresh = new LinkedHashMap<>();

    for (Map.Entry<String, List<MetricSample>> entry : samplesByMetric.entrySet()) {
      String metricId = entry.getKey();
      List<MetricSample> samples = finiteOnly(metricId, entry.getValue());

      if (samples.isEmpty()) {
        log.warn("No data points for metric: {}. Skipping baseline", metricId);
        continue;
      }

      Stats baseline = StatisticalUtils.calculateStats(samples);
      fresh.put(metricId, BaselineStats.baseline(baseline.mean(), baseline.stdDev()));

      log.info("Baseline for metric {}: mean={}, stdDev={} ({} samples)",
        metricId, format(baseline.mean()), format(baseline.stdDev()), samples.size());
    }

    this.stats = fresh;
    this.initialized = true;
    log.info("Baseline initialised: {} of {} metrics have data", fresh.size(), samplesByMetric.size());
  }

  /**
   * Recomputes the current-window mean and standard deviation for each metric.
   *
   * <p>NaN and infinite values are left out of the statistics; they are still scored by
   * {@link #detectAnomalies}. A metric with no finite samples keeps its previous
   * current-window values. A metric
   * without a baseline entry is rejected: it is skipped and no entry is created for it.
   *
   * @param samplesByMetric recent samples grouped by metric id
   */
  public void updateCurrentWindow(Map<String, List<MetricSample>> samplesByMetric) {
    for (Map.Entry<String, List<MetricSample>> entry : samplesByMetric.entrySet()) {
      String metricId = entry.getKey();
      List<MetricSample> samples = finiteOnly(metricId, entry.getValue());

      if (samples.isEmpty()) {
        log.info("No data points for metric: {} in the current run. Keeping previous values", metricId);
        continue;
      }

      BaselineStats existing = stats.get(metricId);
      if (existing == null) {
        log.warn("No baseline for metric: {}. Ignoring current window of {} samples",
          metricId, samples.size());
        continue;
      }

      Stats current = StatisticalUtils.calculateStats(samples);
      stats.put(metricId, existing.withCurrent(current.mean(), current.stdDev()));

      log.debug("Current window for metric {} updated: mean={}, stdDev={}",
        metricId, format(current.mean()), format(current.stdDev()));
    }
  }

  /**
   * Scores every sample against its metric's baseline and returns those whose absolute
   * z-score is strictly greater than {@code threshold}.
   *
   * <p>A zero-variance baseline is handled explicitly: a sample equal to the baseline mean
   * is never anomalous, any other sample always is, whatever the threshold.
   *
   * <p>Every computed z-score is kept in a report keyed by {@code "<metricId> at <timestamp>"},
   * available from {@link #lastZScores()} until the next call.
   *
   * @param samplesByMetric recent samples grouped by metric id
   * @param threshold z-score threshold, finite and {@code >= 0}
   * @return anomalies in input order (metric order, then sample order)
   * @throws BaselineNotInitializedException if no baseline was ever initialized
   */
  public List<Anomaly> detectAnomalies(Map<String, List<MetricSample>> samplesByMetric, double threshold) {
    if (!initialized) {
      throw new BaselineNotInitializedException();
    }
    if (!Double.isFinite(threshold) || threshold < 0) {
      throw new IllegalArgumentException("threshold must be finite and >= 0, got " + threshold);
    }

    List<Anomaly> anomalies = new ArrayList<>();
    Map<String, Double> report = new LinkedHashMap<>();

    for (Map.Entry<String, List<MetricSample>> entry : samplesByMetric.entrySet()) {
      String metricId = entry.getKey();
      BaselineStats baseline = stats.get(metricId);
      if (baseline == null) {
        log.info("No baseline stats for metric: {}. Skipping", metricId);
        continue;
      }

      log.debug("Detecting anomalies for metric: {}", metricId);
      for (MetricSample sample : orEmpty(entry.getValue())) {
        double zScore = StatisticalUtils.zScore(
          sample.value(), baseline.baselineMean(), baseline.baselineStdDev());
        report.put(metricId + " at " + sample.timestamp(), zScore);

        boolean anomalous;
        String message;
        if (baseline.hasZeroVariance()) {
          anomalous = zScore != 0.0;
          message = String.format(Locale.ROOT, ZERO_VARIANCE_MESSAGE, baseline.baselineMean(), zScore);
        } else {
          anomalous = StatisticalUtils.exceedsThreshold(zScore, threshold);
          message = String.format(Locale.ROOT, ANOMALY_MESSAGE, zScore);
        }

        if (anomalous) {
          anomalies.add(new Anomaly(metricId, sample.value(), sample.timestamp(), message, zScore));
        }
      }
    }

    this.zScores = Collections.unmodifiableMap(report);

    if (log.isDebugEnabled()) {
      report.forEach((key, z) -> log.debug("Z-score for {}: {}", key, format(z)));
    }
    log.info("{} anomalies detected", anomalies.size());

    return anomalies;
  }

  public boolean isInitialized() {
    return initialized;
  }

  /**
   * Looks up the statistics for a metric.
   *
   * @param metricId the metric id
   * @return the stats, or empty if the metric has no baseline
   */
  public Optional<BaselineStats> getStats(String metricId) {
    return Optional.ofNullable(stats.get(metricId));
  }

  /**
   * Returns a copy of all per-metric statistics.
   */
  public Map<String, BaselineStats> snapshot() {
    return Collections.unmodifiableMap(new LinkedHashMap<>(stats));
  }

  /**
   * Returns the z-scores computed by the most recent {@link #detectAnomalies} call.
   */
  public Map<String, Double> lastZScores() {
    return zScores;
  }

  private static List<MetricSample> orEmpty(List<MetricSample> samples) {
    return samples == null ? List.of() : samples;
  }

  private static List<MetricSample> finiteOnly(String metricId, List<MetricSample> samples) {
    List<MetricSample> finite = new ArrayList<>();
    for (MetricSample sample : orEmpty(samples)) {
      if (Double.isFinite(sample.value())) {
        finite.add(sample);
      }
    }
    int dropped = orEmpty(samples).size() - finite.size();
    if (dropped > 0) {
      log.debug("Ignoring {} non-finite values of metric {} in statistics", dropped, metricId);
    }
    return finite;
  }

  private static String format(double value) {
    return String.format(Locale.ROOT, "%.2f", value);
  }
}
