package com.mk.fx.qa.llm.load.metrics;

import static com.google.common.base.Preconditions.checkArgument;

import java.util.List;

/** Order statistics over an ascending list of latencies. */
public final class Percentiles {

  private Percentiles() {
    // Utility class, no instantiation
  }

  /**
   * Value at index {@code floor(n * p)}, clamped to the last element. Nearest rank without
   * interpolation.
   */
  public static long at(List<Long> sortedAscending, double p) {
    checkArgument(!sortedAscending.isEmpty(), "No values");
    checkArgument(p >= 0.0 && p <= 1.0, "Percentile must be within [0, 1]: %s", p);
    var n = sortedAscending.size();
    var index = Math.min(n - 1, (int) Math.floor(n * p));
    return sortedAscending.get(index);
  }

  /** Middle value; the mean of the two middle values when the count is even. */
  public static double median(List<Long> sortedAscending) {
    checkArgument(!sortedAscending.isEmpty(), "No values");
    var n = sortedAscending.size();
    if (n % 2 == 1) {
      return sortedAscending.get(n / 2);
    }
    return (sortedAscending.get(n / 2 - 1) + sortedAscending.get(n / 2)) / 2.0;
  }

  public static double mean(List<Long> values) {
    checkArgument(!values.isEmpty(), "No values");
    long sum = 0;
    for (long value : values) {
      sum += value;
    }
    return (double) sum / values.size();
  }
}
