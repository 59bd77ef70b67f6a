package io.github.themoah.sigmon.engine;

import io.github.themoah.sigmon.model.MetricSample;
import java.util.List;

/**
 * Statistical helpers for baseline computation and z-score scoring.
 */
public final class StatisticalUtils {

  private StatisticalUtils() {}

  /**
   * Calculates the mean and population standard deviation (divide by n, not n-1)
   * of the sample values.
   *
   * <p>NaN and infinite values are ignored. A window whose values are all identical yields
   * a standard deviation of exactly 0, even where floating point summation would leave a
   * residue.
   *
   * @param samples the samples to analyze
   * @return statistics containing mean and standard deviation, or (0, 0) for no finite samples
   */
  public static Stats calculateStats(List<MetricSample> samples) {
    if (samples == null || samples.isEmpty()) {
      return new Stats(0.0, 0.0);
    }

    int n = 0;
    double sum = 0.0;
    double min = Double.POSITIVE_INFINITY;
    double max = Double.NEGATIVE_INFINITY;
    for (MetricSample sample : samples) {
      double value = sample.value();
      if (!Double.isFinite(value)) {
        continue;
      }
      n++;
      sum += value;
      min = Math.min(min, value);
      max = Math.max(max, value);
    }

    if (n == 0) {
      return new Stats(0.0, 0.0);
    }
    if (min == max) {
      return new Stats(min, 0.0);
    }

    double mean = sum / n;

    double sumSquaredDiffs = 0.0;
    for (MetricSample sample : samples) {
      if (!Double.isFinite(sample.value())) {
        continue;
      }
      double diff = sample.value() - mean;
      sumSquaredDiffs += diff * diff;
    }

    return new Stats(mean, Math.sqrt(sumSquaredDiffs / n));
  }

  /**
   * Calculates how many standard deviations {@code value} lies from {@code mean}.
   *
   * <p>With a zero standard deviation the result is 0 when the value equals the mean and
   * a signed infinity otherwise, so no division by zero takes place.
   *
   * @param value the value
   * @param mean the reference mean
   * @param stdDev the reference standard deviation, {@code >= 0}
   * @return the z-score
   */
  public static double zScore(double value, double mean, double stdDev) {
    double deviation = value - mean;
    if (stdDev == 0.0) {
      if (deviation == 0.0) {
        return 0.0;
      }
      if (Double.isNaN(deviation)) {
        return Double.NaN;
      }
      return Math.copySign(Double.POSITIVE_INFINITY, deviation);
    }
    return deviation / stdDev;
  }

  /**
   * Returns true if the z-score strictly exceeds the threshold in absolute value.
   * Non-finite z-scores exceed every finite threshold.
   *
   * @param zScore the z-score
   * @param threshold the threshold, finite and {@code >= 0}
   */
  public static boolean exceedsThreshold(double zScore, double threshold) {
    return !Double.isFinite(zScore) || Math.abs(zScore) > threshold;
  }

  /**
   * Statistics result record containing mean and standard deviation.
   *
   * @param mean the arithmetic mean
   * @param stdDev the population standard deviation
   */
  public record Stats(double mean, double stdDev) {}
}
