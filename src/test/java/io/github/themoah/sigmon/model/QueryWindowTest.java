package io.github.themoah.sigmon.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.Test;

public class QueryWindowTest {

  private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");

  @Test
  void endingAt_spansRequestedLength() {
    QueryWindow window = QueryWindow.endingAt(NOW, Duration.ofDays(7));

    assertEquals(NOW, window.end());
    assertEquals(Instant.parse("2024-02-23T12:00:00Z"), window.start());
    assertEquals(Duration.ofDays(7), window.length());
  }

  @Test
  void constructor_rejectsInvertedRange() {
    assertThrows(IllegalArgumentException.class, () -> new QueryWindow(NOW, NOW.minusSeconds(1)));
    assertThrows(NullPointerException.class, () -> new QueryWindow(null, NOW));
  }
}
