package io.github.themoah.sigmon.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;
import org.junit.jupiter.api.Test;

public class BaselineStatsTest {

  @Test
  void baseline_startsWithZeroCurrentWindow() {
    BaselineStats stats = BaselineStats.baseline(100.0, 10.0);

    assertEquals(0.0, stats.currentMean());
    assertEquals(0.0, stats.currentStdDev());
    assertFalse(stats.hasZeroVariance());
  }

  @Test
  void withCurrent_keepsBaseline() {
    BaselineStats stats = BaselineStats.baseline(5.0, 0.0).withCurrent(7.0, 1.5);

    assertEquals(new BaselineStats(5.0, 0.0, 7.0, 1.5), stats);
    assertTrue(stats.hasZeroVariance());
  }

  @Test
  void constructor_rejectsNegativeOrNaNStdDev() {
    assertThrows(IllegalArgumentException.class, () -> new BaselineStats(1.0, -0.1, 0.0, 0.0));
    assertThrows(IllegalArgumentException.class, () -> new BaselineStats(1.0, 0.0, 0.0, Double.NaN));
  }

  @Test
  void metricSample_rejectsBlankMetricId() {
    Instant now = Instant.parse("2024-03-01T12:00:00Z");

    assertThrows(IllegalArgumentException.class, () -> new MetricSample(" ", 1.0, now));
    assertThrows(NullPointerException.class, () -> new MetricSample("cpu", 1.0, null));
  }
}
