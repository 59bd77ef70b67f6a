package io.github.themoah.sigmon.report;

import io.github.themoah.sigmon.model.Anomaly;
import io.vertx.core.Future;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes one log line per anomaly.
 */
public class LogAnomalyReporter implements AnomalyReporter {

  private static final Logger log = LoggerFactory.getLogger(LogAnomalyReporter.class);

  @Override
  public void reportAnomalies(List<Anomaly> anomalies) {
    for (Anomaly anomaly : anomalies) {
      log.warn(formatLine(anomaly));
    }
    if (!anomalies.isEmpty()) {
      log.info("Reported {} anomalies", anomalies.size());
    }
  }

  /**
   * Renders an anomaly as a single line of text.
   *
   * @param anomaly the anomaly
   * @return e.g. {@code Anomaly detected: cpu at 2024-01-01T00:00:00Z with value 131.00 - <message>}
   */
  static String formatLine(Anomaly anomaly) {
    return String.format(Locale.ROOT, "Anomaly detected: %s at %s with value %.2f - %s",
      anomaly.metricId(), anomaly.timestamp(), anomaly.value(), anomaly.message());
  }

  @Override
  public Future<Void> start() {
    log.info("LogAnomalyReporter started");
    return Future.succeededFuture();
  }

  @Override
  public Future<Void> close() {
    return Future.succeededFuture();
  }
}
