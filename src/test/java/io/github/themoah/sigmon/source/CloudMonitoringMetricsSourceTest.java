package io.github.themoah.sigmon.source;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.google.api.Distribution;
import com.google.monitoring.v3.ListTimeSeriesRequest;
import com.google.monitoring.v3.Point;
import com.google.monitoring.v3.TimeInterval;
import com.google.monitoring.v3.TimeSeries;
import com.google.monitoring.v3.TypedValue;
import com.google.protobuf.Timestamp;
import io.github.themoah.sigmon.model.MetricSample;
import io.github.themoah.sigmon.model.QueryWindow;
import io.vertx.core.Vertx;
import io.vertx.junit5.VertxExtension;
import io.vertx.junit5.VertxTestContext;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

/**
 * Tests for the Cloud Monitoring source, with the gRPC call replaced by a stub.
 */
@ExtendWith(VertxExtension.class)
public class CloudMonitoringMetricsSourceTest {

  private static final String METRIC = "custom.googleapis.com/queue/depth";
  private static final Instant END = Instant.parse("2024-03-01T12:00:00.750Z");

  @Test
  void buildFilter_metricTypeOnly() {
    assertEquals("metric.type=\"" + METRIC + "\"", CloudMonitoringMetricsSource.buildFilter(METRIC, null));
    assertEquals("metric.type=\"" + METRIC + "\"", CloudMonitoringMetricsSource.buildFilter(METRIC, "   "));
  }

  @Test
  void buildFilter_appendsExtraExpression() {
    assertEquals(
      "metric.type=\"" + METRIC + "\" AND resource.type=\"gce_instance\"",
      CloudMonitoringMetricsSource.buildFilter(METRIC, " resource.type=\"gce_instance\" "));
  }

  @Test
  void buildRequest_usesWholeSecondInterval() {
    QueryWindow window = QueryWindow.endingAt(END, Duration.ofMinutes(5));

    ListTimeSeriesRequest request =
      CloudMonitoringMetricsSource.buildRequest("projects/p1", METRIC, null, window);

    assertEquals("projects/p1", request.getName());
    assertEquals(END.getEpochSecond(), request.getInterval().getEndTime().getSeconds());
    assertEquals(END.getEpochSecond() - 300, request.getInterval().getStartTime().getSeconds());
    assertEquals(0, request.getInterval().getEndTime().getNanos());
    assertEquals(ListTimeSeriesRequest.TimeSeriesView.FULL, request.getView());
  }

  @Test
  void toSamples_convertsNumericPoints() {
    TimeSeries series = TimeSeries.newBuilder()
      .addPoints(point(100, TypedValue.newBuilder().setDoubleValue(1.5).build()))
      .addPoints(point(160, TypedValue.newBuilder().setInt64Value(42).build()))
      .addPoints(point(220, TypedValue.newBuilder()
        .setDistributionValue(Distribution.newBuilder().setCount(4).setMean(7.25).build())
        .build()))
      .build();

    List<MetricSample> samples = CloudMonitoringMetricsSource.toSamples(METRIC, series);

    assertEquals(List.of(
      new MetricSample(METRIC, 1.5, Instant.ofEpochSecond(100)),
      new MetricSample(METRIC, 42.0, Instant.ofEpochSecond(160)),
      new MetricSample(METRIC, 7.25, Instant.ofEpochSecond(220))
    ), samples);
  }

  @Test
  void toSamples_skipsNonNumericPoints() {
    TimeSeries series = TimeSeries.newBuilder()
      .addPoints(point(100, TypedValue.newBuilder().setBoolValue(true).build()))
      .addPoints(point(160, TypedValue.newBuilder().setStringValue("up").build()))
      .addPoints(point(220, TypedValue.newBuilder().setDoubleValue(3.0).build()))
      .build();

    List<MetricSample> samples = CloudMonitoringMetricsSource.toSamples(METRIC, series);

    assertEquals(1, samples.size());
    assertEquals(3.0, samples.get(0).value());
  }

  @Test
  void listSeries_flattensAllSeries(Vertx vertx, VertxTestContext testContext) {
    AtomicReference<ListTimeSeriesRequest> captured = new AtomicReference<>();
    TimeSeries first = TimeSeries.newBuilder()
      .addPoints(point(100, TypedValue.newBuilder().setDoubleValue(1.0).build()))
      .build();
    TimeSeries second = TimeSeries.newBuilder()
      .addPoints(point(100, TypedValue.newBuilder().setDoubleValue(2.0).build()))
      .addPoints(point(160, TypedValue.newBuilder().setDoubleValue(3.0).build()))
      .build();

    CloudMonitoringMetricsSource source = new CloudMonitoringMetricsSource(vertx, "p1", request -> {
      captured.set(request);
      return List.of(first, second);
    }, null);

    source.listSeries(METRIC, "resource.type=\"k8s_container\"", QueryWindow.endingAt(END, Duration.ofDays(7)))
      .onComplete(testContext.succeeding(samples -> testContext.verify(() -> {
        assertEquals(List.of(1.0, 2.0, 3.0), samples.stream().map(MetricSample::value).toList());
        ListTimeSeriesRequest request = captured.get();
        assertEquals("projects/p1", request.getName());
        assertEquals("metric.type=\"" + METRIC + "\" AND resource.type=\"k8s_container\"", request.getFilter());
        assertEquals(Duration.ofDays(7).toSeconds(),
          request.getInterval().getEndTime().getSeconds() - request.getInterval().getStartTime().getSeconds());
        testContext.completeNow();
      })));
  }

  @Test
  void listSeries_noSeries_returnsEmptyList(Vertx vertx, VertxTestContext testContext) {
    CloudMonitoringMetricsSource source = new CloudMonitoringMetricsSource(vertx, "p1", request -> List.of(), null);

    source.listSeries(METRIC, null, QueryWindow.endingAt(END, Duration.ofMinutes(5)))
      .onComplete(testContext.succeeding(samples -> testContext.verify(() -> {
        assertTrue(samples.isEmpty());
        testContext.completeNow();
      })));
  }

  @Test
  void listSeries_backendError_failsWithMetricId(Vertx vertx, VertxTestContext testContext) {
    CloudMonitoringMetricsSource source = new CloudMonitoringMetricsSource(vertx, "p1", request -> {
      throw new IllegalStateException("connection refused");
    }, null);

    source.listSeries(METRIC, null, QueryWindow.endingAt(END, Duration.ofMinutes(5)))
      .onComplete(testContext.failing(err -> testContext.verify(() -> {
        MetricsSourceException e = assertInstanceOf(MetricsSourceException.class, err);
        assertEquals(METRIC, e.metricId());
        assertTrue(e.getMessage().contains("connection refused"), e.getMessage());
        testContext.completeNow();
      })));
  }

  @Test
  void close_closesClient(Vertx vertx, VertxTestContext testContext) {
    AtomicBoolean closed = new AtomicBoolean(false);
    CloudMonitoringMetricsSource source =
      new CloudMonitoringMetricsSource(vertx, "p1", request -> List.of(), () -> closed.set(true));

    source.close().onComplete(testContext.succeeding(v -> testContext.verify(() -> {
      assertTrue(closed.get());
      testContext.completeNow();
    })));
  }

  @Test
  void close_withoutClient_succeeds(Vertx vertx, VertxTestContext testContext) {
    CloudMonitoringMetricsSource source =
      new CloudMonitoringMetricsSource(vertx, "p1", request -> List.of(), null);

    source.close().onComplete(testContext.succeedingThenComplete());
  }

  private static Point point(long endSeconds, TypedValue value) {
    return Point.newBuilder()
      .setInterval(TimeInterval.newBuilder()
        .setEndTime(Timestamp.newBuilder().setSeconds(endSeconds).build())
        .build())
      .setValue(value)
      .build();
  }
}
