package io.github.themoah.sigmon.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A single observation of a metric.
 *
 * @param metricId the metric type the value belongs to (e.g. "compute.googleapis.com/instance/cpu/utilization")
 * @param value the observed measurement
 * @param timestamp end of the sampling interval the value applies to
 */
public record MetricSample(
  String metricId,
  double value,
  Instant timestamp
) {

  public MetricSample {
    if (metricId == null || metricId.isBlank()) {
      throw new IllegalArgumentException("metricId cannot be null or blank");
    }
    Objects.requireNonNull(timestamp, "timestamp cannot be null");
  }
}
