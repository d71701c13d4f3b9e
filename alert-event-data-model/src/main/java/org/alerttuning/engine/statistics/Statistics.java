package org.alerttuning.engine.statistics;

import java.util.Collection;

/**
 * Descriptive statistics over numeric samples. Every operation returns 0 for an empty input
 * rather than failing.
 */
public final class Statistics {

  private Statistics() {}

  public static double mean(Collection<? extends Number> values) {
    if (values == null || values.isEmpty()) {
      return 0.0;
    }
    double sum = 0.0;
    for (Number value : values) {
      sum += value.doubleValue();
    }
    return sum / values.size();
  }

  public static double median(Collection<? extends Number> values) {
    if (values == null || values.isEmpty()) {
      return 0.0;
    }
    double[] sorted = sorted(values);
    int mid = sorted.length / 2;
    return sorted.length % 2 == 0 ? (sorted[mid - 1] + sorted[mid]) / 2 : sorted[mid];
  }

  /** Population standard deviation (divides by n). */
  public static double stdDev(Collection<? extends Number> values) {
    if (values == null || values.isEmpty()) {
      return 0.0;
    }
    double mean = mean(values);
    double sumSquaredDiffs = 0.0;
    for (Number value : values) {
      double diff = value.doubleValue() - mean;
      sumSquaredDiffs += diff * diff;
    }
    return Math.sqrt(sumSquaredDiffs / values.size());
  }

  /**
   * Nearest-rank percentile: the smallest sample such that at least {@code p} percent of the
   * samples are less than or equal to it.
   *
   * @param p percentile in the range [0, 100]
   */
  public static double percentile(Collection<? extends Number> values, double p) {
    if (values == null || values.isEmpty()) {
      return 0.0;
    }
    double[] sorted = sorted(values);
    int index = (int) Math.ceil((p / 100) * sorted.length) - 1;
    return sorted[Math.min(sorted.length - 1, Math.max(0, index))];
  }

  public static double min(Collection<? extends Number> values) {
    if (values == null || values.isEmpty()) {
      return 0.0;
    }
    return values.stream().mapToDouble(Number::doubleValue).min().orElse(0.0);
  }

  public static double max(Collection<? extends Number> values) {
    if (values == null || values.isEmpty()) {
      return 0.0;
    }
    return values.stream().mapToDouble(Number::doubleValue).max().orElse(0.0);
  }

  private static double[] sorted(Collection<? extends Number> values) {
    return values.stream().mapToDouble(Number::doubleValue).sorted().toArray();
  }
}
