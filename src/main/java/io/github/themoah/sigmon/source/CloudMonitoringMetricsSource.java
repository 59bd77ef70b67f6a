package io.github.themoah.sigmon.source;

import com.google.api.gax.rpc.ApiException;
import com.google.cloud.monitoring.v3.MetricServiceClient;
import com.google.monitoring.v3.ListTimeSeriesRequest;
import com.google.monitoring.v3.Point;
import com.google.monitoring.v3.ProjectName;
import com.google.monitoring.v3.TimeInterval;
import com.google.monitoring.v3.TimeSeries;
import com.google.monitoring.v3.TypedValue;
import com.google.protobuf.Timestamp;
import io.github.themoah.sigmon.model.MetricSample;
import io.github.themoah.sigmon.model.QueryWindow;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Implementation of MetricsSource using the Google Cloud Monitoring v3 API.
 *
 * <p>The gRPC client is blocking, so every request runs on the Vert.x worker pool.
 * Credentials come from Application Default Credentials.
 */
public class CloudMonitoringMetricsSource implements MetricsSource {

  private static final Logger log = LoggerFactory.getLogger(CloudMonitoringMetricsSource.class);

  private final Vertx vertx;
  private final String projectName;
  private final Function<ListTimeSeriesRequest, Iterable<TimeSeries>> lister;
  private final AutoCloseable client;

  /**
   * Creates a source backed by a new MetricServiceClient.
   *
   * @param vertx the Vert.x instance
   * @param projectId the Cloud Monitoring project to query
   * @return the metrics source
   * @throws IOException if the client cannot be created (e.g. no credentials)
   */
  public static CloudMonitoringMetricsSource create(Vertx vertx, String projectId) throws IOException {
    log.info("Creating Cloud Monitoring client for project: {}", projectId);
    MetricServiceClient client = MetricServiceClient.create();
    return new CloudMonitoringMetricsSource(
      vertx,
      projectId,
      request -> client.listTimeSeries(request).iterateAll(),
      client
    );
  }

  /**
   * Creates a source with an injectable request function (for testing).
   */
  CloudMonitoringMetricsSource(
    Vertx vertx,
    String projectId,
    Function<ListTimeSeriesRequest, Iterable<TimeSeries>> lister,
    AutoCloseable client
  ) {
    this.vertx = Objects.requireNonNull(vertx, "vertx cannot be null");
    this.projectName = ProjectName.of(Objects.requireNonNull(projectId, "projectId cannot be null")).toString();
    this.lister = Objects.requireNonNull(lister, "lister cannot be null");
    this.client = client;
  }

  @Override
  public Future<List<MetricSample>> listSeries(String metricId, String filter, QueryWindow window) {
    Objects.requireNonNull(metricId, "metricId cannot be null");
    Objects.requireNonNull(window, "window cannot be null");

    ListTimeSeriesRequest request = buildRequest(projectName, metricId, filter, window);
    log.debug("Fetching metric {} from {} to {} with filter: {}",
      metricId, window.start(), window.end(), request.getFilter());

    return vertx.<List<MetricSample>>executeBlocking(() -> {
      List<MetricSample> samples = new ArrayList<>();
      int seriesCount = 0;
      try {
        for (TimeSeries series : lister.apply(request)) {
          samples.addAll(toSamples(metricId, series));
          seriesCount++;
        }
      } catch (ApiException e) {
        throw new MetricsSourceException(metricId,
          "Could not list time series for " + metricId + ": " + e.getStatusCode().getCode(), e);
      } catch (RuntimeException e) {
        throw new MetricsSourceException(metricId,
          "Could not list time series for " + metricId + ": " + e.getMessage(), e);
      }
      log.debug("Fetched {} samples in {} series for metric {}", samples.size(), seriesCount, metricId);
      return samples;
    }, false)
      .onFailure(err -> log.error("Failed to fetch time series for metric: {}", metricId, err));
  }

  @Override
  public Future<Void> close() {
    if (client == null) {
      return Future.succeededFuture();
    }
    log.info("Closing Cloud Monitoring client");
    return vertx.<Void>executeBlocking(() -> {
      client.close();
      return null;
    }, false)
      .onSuccess(v -> log.info("Cloud Monitoring client closed"))
      .onFailure(err -> log.error("Failed to close Cloud Monitoring client", err));
  }

  /**
   * Builds the filter expression selecting a metric type, optionally narrowed by an
   * extra expression.
   *
   * @param metricId the metric type
   * @param filter additional filter, may be null or blank
   * @return e.g. {@code metric.type="x" AND resource.type="gce_instance"}
   */
  static String buildFilter(String metricId, String filter) {
    String base = "metric.type=\"" + metricId + "\"";
    if (filter == null || filter.isBlank()) {
      return base;
    }
    return base + " AND " + filter.trim();
  }

  static ListTimeSeriesRequest buildRequest(
    String projectName,
    String metricId,
    String filter,
    QueryWindow window
  ) {
    return ListTimeSeriesRequest.newBuilder()
      .setName(projectName)
      .setFilter(buildFilter(metricId, filter))
      .setInterval(TimeInterval.newBuilder()
        .setStartTime(toTimestamp(window.start()))
        .setEndTime(toTimestamp(window.end()))
        .build())
      .setView(ListTimeSeriesRequest.TimeSeriesView.FULL)
      .build();
  }

  /**
   * Flattens the points of a time series into samples of the requested metric.
   * Points whose value is not numeric are skipped.
   */
  static List<MetricSample> toSamples(String metricId, TimeSeries series) {
    List<MetricSample> samples = new ArrayList<>(series.getPointsCount());
    for (Point point : series.getPointsList()) {
      OptionalDouble value = numericValue(point.getValue());
      if (value.isEmpty()) {
        log.debug("Skipping non-numeric point of metric {}: {}", metricId, point.getValue().getValueCase());
        continue;
      }
      Instant timestamp = toInstant(point.getInterval().getEndTime());
      samples.add(new MetricSample(metricId, value.getAsDouble(), timestamp));
    }
    return samples;
  }

  static OptionalDouble numericValue(TypedValue value) {
    return switch (value.getValueCase()) {
      case DOUBLE_VALUE -> OptionalDouble.of(value.getDoubleValue());
      case INT64_VALUE -> OptionalDouble.of(value.getInt64Value());
      case DISTRIBUTION_VALUE -> OptionalDouble.of(value.getDistributionValue().getMean());
      default -> OptionalDouble.empty();
    };
  }

  private static Timestamp toTimestamp(Instant instant) {
    return Timestamp.newBuilder().setSeconds(instant.getEpochSecond()).build();
  }

  private static Instant toInstant(Timestamp timestamp) {
    return Instant.ofEpochSecond(timestamp.getSeconds(), timestamp.getNanos());
  }
}
