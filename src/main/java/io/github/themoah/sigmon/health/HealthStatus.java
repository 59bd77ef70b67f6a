package io.github.themoah.sigmon.health;

/**
 * Health status reported by the probe endpoints.
 */
public enum HealthStatus {
  UP,
  DOWN;

  public static HealthStatus of(boolean healthy) {
    return healthy ? UP : DOWN;
  }

  public int httpStatusCode() {
    return this == UP ? 200 : 503;
  }
}
