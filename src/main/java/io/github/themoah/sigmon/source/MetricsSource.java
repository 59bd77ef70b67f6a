package io.github.themoah.sigmon.source;

import io.github.themoah.sigmon.model.MetricSample;
import io.github.themoah.sigmon.model.QueryWindow;
import io.vertx.core.Future;
import java.util.List;

/**
 * Supplies samples of a named metric from a metrics backend.
 * All methods return Vert.x Futures for async, non-blocking execution.
 */
public interface MetricsSource {

  /**
   * Lists the samples of a metric inside a time window.
   *
   * <p>Samples may come back in any order, may contain duplicates or gaps, and the
   * list may be empty.
   *
   * @param metricId the metric identifier
   * @param filter an additional backend filter expression, or null for none
   * @param window the time window to query
   * @return Future containing the samples, failed with {@link MetricsSourceException}
   *     on backend errors
   */
  Future<List<MetricSample>> listSeries(String metricId, String filter, QueryWindow window);

  /**
   * Releases the backend client.
   *
   * @return Future that completes when the client is closed
   */
  Future<Void> close();
}
