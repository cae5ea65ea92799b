package com.verlumen.nonogram.convergence;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;
import java.time.Duration;
import java.util.Arrays;

/** Fitness summary of one generation's population. Immutable once recorded. */
@AutoValue
public abstract class GenerationStats {
  public static GenerationStats create(
      long generation, int best, double median, int worst, int populationSize, Duration elapsed) {
    checkArgument(generation >= 1, "Generation must be positive: %s", generation);
    checkArgument(best <= worst, "Best score %s is worse than worst score %s", best, worst);
    return new AutoValue_GenerationStats(generation, best, median, worst, populationSize, elapsed);
  }

  /** Summarizes a population's scores; the array is not modified. */
  public static GenerationStats of(long generation, int[] scores, Duration elapsed) {
    checkArgument(scores.length > 0, "Cannot summarize an empty population");
    int[] sorted = scores.clone();
    Arrays.sort(sorted);
    return create(
        generation, sorted[0], median(sorted), sorted[sorted.length - 1], sorted.length, elapsed);
  }

  /** Median of sorted scores; the mean of the two middle scores for even sizes. */
  static double median(int[] sorted) {
    int middle = sorted.length / 2;
    if (sorted.length % 2 == 0) {
      return (sorted[middle - 1] + sorted[middle]) / 2.0;
    }
    return sorted[middle];
  }

  /** 1-based generation index. */
  public abstract long generation();

  public abstract int best();

  public abstract double median();

  public abstract int worst();

  public abstract int populationSize();

  /** Wall-clock time since the run started. */
  public abstract Duration elapsed();
}
