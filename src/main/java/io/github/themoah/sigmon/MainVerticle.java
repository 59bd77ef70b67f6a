package io.github.themoah.sigmon;

import io.github.themoah.sigmon.config.AppConfig;
import io.github.themoah.sigmon.config.ConfigLoader;
import io.github.themoah.sigmon.config.DetectorConfig;
import io.github.themoah.sigmon.config.ReporterConfig;
import io.github.themoah.sigmon.engine.StatisticsEngine;
import io.github.themoah.sigmon.health.HealthCheckHandler;
import io.github.themoah.sigmon.monitor.AnomalyMonitor;
import io.github.themoah.sigmon.report.AnomalyReporter;
import io.github.themoah.sigmon.report.LogAnomalyReporter;
import io.github.themoah.sigmon.report.MicrometerAnomalyReporter;
import io.github.themoah.sigmon.report.MicrometerConfig;
import io.github.themoah.sigmon.report.PrometheusHandler;
import io.github.themoah.sigmon.source.CloudMonitoringMetricsSource;
import io.github.themoah.sigmon.source.MetricsSource;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import io.vertx.core.AbstractVerticle;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.http.HttpServer;
import io.vertx.ext.web.Router;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Main verticle for Sigmon.
 * Loads configuration, connects to Cloud Monitoring, starts the HTTP server and the monitor.
 */
public class MainVerticle extends AbstractVerticle {

  private static final Logger log = LoggerFactory.getLogger(MainVerticle.class);

  private MetricsSource metricsSource;
  private AnomalyMonitor monitor;
  private HttpServer httpServer;

  @Override
  public void start(Promise<Void> startPromise) {
    log.info("Starting Sigmon MainVerticle");

    AppConfig appConfig = AppConfig.fromEnvironment();
    ReporterConfig reporterConfig = ReporterConfig.fromEnvironment();

    ConfigLoader.load(vertx)
      .compose(config -> {
        Router router = Router.router(vertx);
        monitor = createMonitor(config, reporterConfig, router);
        new HealthCheckHandler(monitor).registerRoutes(router);

        router.route().handler(ctx -> ctx.response()
          .setStatusCode(404)
          .putHeader("content-type", "application/json")
          .end("{\"error\": \"Not Found\"}"));

        return startHttpServer(router, appConfig.httpPort());
      })
      .compose(server -> {
        httpServer = server;
        return monitor.start();
      })
      .onSuccess(v -> {
        log.info("Sigmon started successfully on port {}", appConfig.httpPort());
        startPromise.complete();
      })
      .onFailure(err -> {
        log.error("Failed to start Sigmon", err);
        startPromise.fail(err);
      });
  }

  @Override
  public void stop(Promise<Void> stopPromise) {
    log.info("Stopping Sigmon MainVerticle");

    Future<Void> stopMonitor = (monitor != null)
      ? monitor.stop()
      : Future.succeededFuture();

    stopMonitor
      .compose(v -> httpServer != null ? httpServer.close() : Future.<Void>succeededFuture())
      .compose(v -> metricsSource != null ? metricsSource.close() : Future.<Void>succeededFuture())
      .onSuccess(v -> {
        log.info("Sigmon stopped successfully");
        stopPromise.complete();
      })
      .onFailure(err -> {
        log.error("Error during Sigmon shutdown", err);
        stopPromise.fail(err);
      });
  }

  private AnomalyMonitor createMonitor(DetectorConfig config, ReporterConfig reporterConfig, Router router) {
    try {
      metricsSource = CloudMonitoringMetricsSource.create(vertx, config.projectId());
    } catch (IOException e) {
      throw new IllegalStateException("Failed to create Cloud Monitoring client: " + e.getMessage(), e);
    }

    List<AnomalyReporter> reporters = new ArrayList<>();
    reporters.add(new LogAnomalyReporter());
    createMicrometerReporter(reporterConfig, router).ifPresent(reporters::add);

    return new AnomalyMonitor(vertx, metricsSource, new StatisticsEngine(), reporters, config);
  }

  private Optional<AnomalyReporter> createMicrometerReporter(ReporterConfig config, Router router) {
    if (!config.isEnabled()) {
      log.info("Metrics reporting is disabled");
      return Optional.empty();
    }

    MeterRegistry registry = MicrometerConfig.createRegistry(config.reporterType());
    if (registry == null) {
      log.warn("Failed to create meter registry for type: {}", config.reporterType());
      return Optional.empty();
    }

    if (config.jvmMetricsEnabled()) {
      MicrometerConfig.bindJvmMetrics(registry);
    }

    if (registry instanceof PrometheusMeterRegistry prometheusRegistry) {
      new PrometheusHandler(prometheusRegistry).registerRoutes(router);
    }

    return Optional.of(new MicrometerAnomalyReporter(registry));
  }

  private Future<HttpServer> startHttpServer(Router router, int port) {
    return vertx.createHttpServer()
      .requestHandler(router)
      .listen(port)
      .onSuccess(server -> log.info("HTTP server started on port {}", port))
      .onFailure(err -> log.error("Failed to start HTTP server", err));
  }
}
