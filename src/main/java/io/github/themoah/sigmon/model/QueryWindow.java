package io.github.themoah.sigmon.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * A time range {@code [start, end)} requested from the metrics source.
 *
 * @param start inclusive start
 * @param end exclusive end
 */
public record QueryWindow(
  Instant start,
  Instant end
) {

  public QueryWindow {
    Objects.requireNonNull(start, "start cannot be null");
    Objects.requireNonNull(end, "end cannot be null");
    if (end.isBefore(start)) {
      throw new IllegalArgumentException("window end " + end + " is before start " + start);
    }
  }

  /**
   * Creates a window of the given length ending at {@code now}.
   */
  public static QueryWindow endingAt(Instant now, Duration length) {
    return new QueryWindow(now.minus(length), now);
  }

  public Duration length() {
    return Duration.between(start, end);
  }
}
