package io.github.themoah.sigmon.report;

import io.github.themoah.sigmon.model.Anomaly;
import io.github.themoah.sigmon.model.BaselineStats;
import io.vertx.core.Future;
import java.util.List;
import java.util.Map;

/**
 * Interface for publishing detection results to an external surface.
 */
public interface AnomalyReporter {

  /**
   * Reports the anomalies found in one detection cycle.
   *
   * @param anomalies anomalies in detection order, possibly empty
   */
  void reportAnomalies(List<Anomaly> anomalies);

  /**
   * Reports the per-metric statistics after a cycle updated them.
   *
   * @param stats statistics keyed by metric id
   */
  default void reportStatistics(Map<String, BaselineStats> stats) {
    // Default no-op implementation for reporters that only publish anomalies
  }

  /**
   * Records the outcome of a detection cycle.
   *
   * @param succeeded false if the cycle was abandoned
   */
  default void reportCycle(boolean succeeded) {
    // Default no-op implementation
  }

  /**
   * Starts the reporter.
   *
   * @return Future that completes when started
   */
  Future<Void> start();

  /**
   * Closes the reporter and releases resources.
   *
   * @return Future that completes when closed
   */
  Future<Void> close();
}
