package io.github.themoah.sigmon.source;

/**
 * A metrics backend request failed (transport, authentication or query error).
 */
public class MetricsSourceException extends RuntimeException {

  private final String metricId;

  public MetricsSourceException(String metricId, String message, Throwable cause) {
    super(message, cause);
    this.metricId = metricId;
  }

  /**
   * Returns the metric whose query failed.
   */
  public String metricId() {
    return metricId;
  }
}
