package io.github.themoah.sigmon.model;

import java.time.Instant;

/**
 * A sample flagged as anomalous against its metric's baseline.
 *
 * @param metricId the metric the sample belongs to
 * @param value the observed value
 * @param timestamp when the value was observed
 * @param message human-readable explanation including the z-score
 * @param zScore the computed z-score (infinite for a deviation from a zero-variance baseline)
 */
public record Anomaly(
  String metricId,
  double value,
  Instant timestamp,
  String message,
  double zScore
) {}
