package io.github.themoah.sigmon.model;

/**
 * Statistics held for one metric: the baseline computed from the historical window
 * and the mean/stdDev of the most recent window.
 *
 * @param baselineMean mean of the historical window
 * @param baselineStdDev population standard deviation of the historical window
 * @param currentMean mean of the latest recent window (0 until the first update)
 * @param currentStdDev population standard deviation of the latest recent window
 */
public record BaselineStats(
  double baselineMean,
  double baselineStdDev,
  double currentMean,
  double currentStdDev
) {

  public BaselineStats {
    requireNonNegative("baselineStdDev", baselineStdDev);
    requireNonNegative("currentStdDev", currentStdDev);
  }

  /**
   * Creates stats for a freshly computed baseline with no current window yet.
   */
  public static BaselineStats baseline(double mean, double stdDev) {
    return new BaselineStats(mean, stdDev, 0.0, 0.0);
  }

  /**
   * Returns a copy with the current-window values replaced.
   */
  public BaselineStats withCurrent(double mean, double stdDev) {
    return new BaselineStats(baselineMean, baselineStdDev, mean, stdDev);
  }

  /**
   * Returns true if the historical window had no variance at all.
   */
  public boolean hasZeroVariance() {
    return baselineStdDev == 0.0;
  }

  private static void requireNonNegative(String name, double value) {
    // NaN fails this comparison as well
    if (!(value >= 0.0)) {
      throw new IllegalArgumentException(name + " must be >= 0, got " + value);
    }
  }
}
