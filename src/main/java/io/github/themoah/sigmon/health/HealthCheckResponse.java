package io.github.themoah.sigmon.health;

import io.vertx.core.json.JsonObject;

/**
 * Immutable health check response.
 *
 * @param status overall health status
 * @param baseline "ready" or "pending" (null for liveness check)
 * @param backend "reachable" or "unreachable" (null for liveness check)
 */
public record HealthCheckResponse(
  HealthStatus status,
  String baseline,
  String backend
) {
  /**
   * Creates a liveness response (HTTP server only).
   */
  public static HealthCheckResponse liveness() {
    return new HealthCheckResponse(HealthStatus.UP, null, null);
  }

  /**
   * Creates a readiness response. Ready means a baseline exists and the last detection
   * cycle reached the metrics backend.
   *
   * @param baselineReady true if the baseline has been initialized
   * @param backendReachable true if the last cycle succeeded
   */
  public static HealthCheckResponse readiness(boolean baselineReady, boolean backendReachable) {
    return new HealthCheckResponse(
      HealthStatus.of(baselineReady && backendReachable),
      baselineReady ? "ready" : "pending",
      backendReachable ? "reachable" : "unreachable"
    );
  }

  /**
   * Converts to JSON for HTTP response.
   */
  public JsonObject toJson() {
    JsonObject json = new JsonObject().put("status", status.name());
    if (baseline != null) {
      json.put("baseline", baseline);
    }
    if (backend != null) {
      json.put("backend", backend);
    }
    return json;
  }
}
