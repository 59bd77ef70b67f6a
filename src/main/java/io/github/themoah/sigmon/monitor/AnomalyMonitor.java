package io.github.themoah.sigmon.monitor;

import io.github.themoah.sigmon.config.DetectorConfig;
import io.github.themoah.sigmon.engine.BaselineNotInitializedException;
import io.github.themoah.sigmon.engine.StatisticsEngine;
import io.github.themoah.sigmon.model.Anomaly;
import io.github.themoah.sigmon.model.BaselineStats;
import io.github.themoah.sigmon.model.MetricSample;
import io.github.themoah.sigmon.model.QueryWindow;
import io.github.themoah.sigmon.report.AnomalyReporter;
import io.github.themoah.sigmon.source.MetricsSource;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Consumer;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives the detector: loads the baseline once at startup, then periodically fetches the
 * recent window, updates the engine, detects anomalies and hands them to the reporters.
 *
 * <p>Must be started from a Vert.x context. Timer callbacks and backend results are all
 * delivered on that context, so the engine is only ever touched from one thread. Work never
 * overlaps: a tick arriving while a cycle or refresh is running is coalesced into one
 * follow-up run.
 */
public class AnomalyMonitor {

  private static final Logger log = LoggerFactory.getLogger(AnomalyMonitor.class);

  private final Vertx vertx;
  private final MetricsSource source;
  private final StatisticsEngine engine;
  private final List<AnomalyReporter> reporters;
  private final DetectorConfig config;
  private final Clock clock;

  private Long pollTimerId;
  private Long refreshTimerId;
  private boolean inFlight = false;
  private boolean cyclePending = false;
  private boolean refreshPending = false;

  private volatile boolean baselineReady = false;
  private volatile boolean lastCycleSucceeded = false;

  public AnomalyMonitor(
    Vertx vertx,
    MetricsSource source,
    StatisticsEngine engine,
    List<AnomalyReporter> reporters,
    DetectorConfig config
  ) {
    this(vertx, source, engine, reporters, config, Clock.systemUTC());
  }

  /**
   * Constructor for testing with an injectable clock.
   */
  AnomalyMonitor(
    Vertx vertx,
    MetricsSource source,
    StatisticsEngine engine,
    List<AnomalyReporter> reporters,
    DetectorConfig config,
    Clock clock
  ) {
    this.vertx = vertx;
    this.source = source;
    this.engine = engine;
    this.reporters = List.copyOf(reporters);
    this.config = config;
    this.clock = clock;
  }

  /**
   * Starts the monitor: initializes the baseline, runs a first detection cycle, then
   * schedules one cycle per polling interval.
   *
   * @return Future that fails if the baseline cannot be fetched
   */
  public Future<Void> start() {
    log.info("Starting anomaly monitor for {} metrics, polling every {}s",
      config.metrics().size(), config.pollingInterval().toSeconds());

    inFlight = true;
    return Future.all(reporters.stream().map(AnomalyReporter::start).collect(Collectors.toList()))
      .compose(v -> loadBaseline())
      .compose(v -> runCycle().otherwiseEmpty())
      .onComplete(ar -> inFlight = false)
      .onSuccess(v -> schedule())
      .onFailure(err -> log.error("Failed to start anomaly monitor", err))
      .mapEmpty();
  }

  /**
   * Stops the periodic timers and closes the reporters.
   */
  public Future<Void> stop() {
    log.info("Stopping anomaly monitor");
    if (pollTimerId != null) {
      vertx.cancelTimer(pollTimerId);
      pollTimerId = null;
    }
    if (refreshTimerId != null) {
      vertx.cancelTimer(refreshTimerId);
      refreshTimerId = null;
    }
    return Future.all(reporters.stream().map(AnomalyReporter::close).collect(Collectors.toList()))
      .mapEmpty();
  }

  /**
   * Returns true once a baseline has been initialized.
   */
  public boolean isBaselineReady() {
    return baselineReady;
  }

  /**
   * Returns true if the most recent detection cycle completed.
   */
  public boolean lastCycleSucceeded() {
    return lastCycleSucceeded;
  }

  private void schedule() {
    pollTimerId = vertx.setPeriodic(config.pollingInterval().toMillis(), id -> requestCycle());
    log.info("Detection cycle scheduled, timer ID: {}", pollTimerId);

    if (config.isBaselineRefreshEnabled()) {
      refreshTimerId = vertx.setPeriodic(config.baselineRefreshInterval().toMillis(), id -> requestRefresh());
      log.info("Baseline refresh scheduled every {}h, timer ID: {}",
        config.baselineRefreshInterval().toHours(), refreshTimerId);
    }
  }

  void requestCycle() {
    if (inFlight) {
      log.debug("Previous run still in progress, deferring detection cycle");
      cyclePending = true;
      return;
    }
    runExclusive(this::runCycle);
  }

  void requestRefresh() {
    if (inFlight) {
      log.debug("Previous run still in progress, deferring baseline refresh");
      refreshPending = true;
      return;
    }
    runExclusive(this::refreshBaseline);
  }

  private void runExclusive(Supplier<Future<?>> task) {
    inFlight = true;
    task.get().onComplete(ar -> {
      inFlight = false;
      if (refreshPending) {
        refreshPending = false;
        runExclusive(this::refreshBaseline);
      } else if (cyclePending) {
        cyclePending = false;
        runExclusive(this::runCycle);
      }
    });
  }

  /**
   * Fetches the baseline window for every metric and re-initializes the engine.
   */
  Future<Void> loadBaseline() {
    log.info("Fetching baseline window of {} days", config.baselineDuration().toDays());

    return fetchWindow(config.baselineDuration())
      .map(historical -> {
        engine.initializeBaseline(historical);
        baselineReady = engine.isInitialized();
        return null;
      })
      .mapEmpty();
  }

  private Future<Void> refreshBaseline() {
    return loadBaseline()
      .onFailure(err -> log.warn("Baseline refresh failed, keeping previous baseline: {}", err.getMessage()))
      .otherwiseEmpty();
  }

  /**
   * Runs one detection cycle. A failed fetch abandons the whole cycle: nothing is updated.
   *
   * @return Future with the anomalies found, failed if the cycle was abandoned
   */
  Future<List<Anomaly>> runCycle() {
    log.debug("Fetching recent metrics");

    return fetchWindow(config.recentDuration())
      .map(recent -> {
        engine.updateCurrentWindow(recent);
        logStatistics(recent);

        List<Anomaly> anomalies = engine.detectAnomalies(recent, config.zScoreThreshold());
        Map<String, BaselineStats> snapshot = engine.snapshot();
        notifyReporters(reporter -> reporter.reportStatistics(snapshot));
        notifyReporters(reporter -> reporter.reportAnomalies(anomalies));
        return anomalies;
      })
      .onSuccess(anomalies -> {
        lastCycleSucceeded = true;
        notifyReporters(reporter -> reporter.reportCycle(true));
      })
      .onFailure(err -> {
        lastCycleSucceeded = false;
        notifyReporters(reporter -> reporter.reportCycle(false));
        if (err instanceof BaselineNotInitializedException) {
          log.error("Detection attempted before baseline initialisation, skipping cycle");
        } else {
          log.error("Detection cycle abandoned, waiting for next poll: {}", err.getMessage());
        }
      });
  }

  private Future<Map<String, List<MetricSample>>> fetchWindow(Duration length) {
    QueryWindow window = QueryWindow.endingAt(clock.instant(), length);
    List<String> metrics = config.metrics();

    List<Future<List<MetricSample>>> fetches = metrics.stream()
      .map(metricId -> source.listSeries(metricId, config.filterFor(metricId), window))
      .collect(Collectors.toList());

    return Future.all(fetches)
      .map(composite -> {
        Map<String, List<MetricSample>> samplesByMetric = new LinkedHashMap<>();
        for (int i = 0; i < metrics.size(); i++) {
          List<MetricSample> samples = composite.resultAt(i);
          samplesByMetric.put(metrics.get(i), samples);
        }
        log.debug("Fetched window {} - {} for {} metrics", window.start(), window.end(), metrics.size());
        return samplesByMetric;
      });
  }

  private void logStatistics(Map<String, List<MetricSample>> recent) {
    for (String metricId : recent.keySet()) {
      engine.getStats(metricId).ifPresent(stats -> log.info(formatStatistics(metricId, stats)));
    }
  }

  static String formatStatistics(String metricId, BaselineStats stats) {
    return String.format(Locale.ROOT,
      "Metric: %s, Baseline Mean: %.2f, Baseline StdDev: %.2f, Current Mean: %.2f, Current StdDev: %.2f",
      metricId, stats.baselineMean(), stats.baselineStdDev(), stats.currentMean(), stats.currentStdDev());
  }

  private void notifyReporters(Consumer<AnomalyReporter> action) {
    for (AnomalyReporter reporter : reporters) {
      try {
        action.accept(reporter);
      } catch (RuntimeException e) {
        log.warn("Reporter {} failed", reporter.getClass().getSimpleName(), e);
      }
    }
  }
}
