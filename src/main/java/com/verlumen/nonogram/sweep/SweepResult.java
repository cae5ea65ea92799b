package com.verlumen.nonogram.sweep;

import static com.google.common.collect.ImmutableListMultimap.toImmutableListMultimap;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ImmutableTable;
import java.util.Comparator;
import java.util.Optional;

/**
 * Samples of a configuration sweep, keyed by configuration label and seed. The per-configuration
 * lists are the groups an analysis of variance compares; no statistical test is run here.
 */
@AutoValue
public abstract class SweepResult {
  private static final Comparator<RunSample> BY_QUALITY =
      Comparator.comparingInt(RunSample::bestFitness)
          .thenComparingLong(RunSample::generations);

  static SweepResult create(ImmutableTable<String, Long, RunSample> samples) {
    return new AutoValue_SweepResult(samples);
  }

  /** Rows are configuration labels, columns are seeds. */
  public abstract ImmutableTable<String, Long, RunSample> samples();

  /** Final best fitness of every run, grouped by configuration in seed order. */
  public ImmutableListMultimap<String, Integer> bestFitnessByConfiguration() {
    return samples().values().stream()
        .collect(toImmutableListMultimap(RunSample::configuration, RunSample::bestFitness));
  }

  /** Generations to solve, grouped by configuration; unsolved runs contribute nothing. */
  public ImmutableListMultimap<String, Long> generationsToSolveByConfiguration() {
    return samples().values().stream()
        .filter(sample -> sample.generationsToSolve().isPresent())
        .collect(
            toImmutableListMultimap(
                RunSample::configuration, sample -> sample.generationsToSolve().getAsLong()));
  }

  /** The run with the lowest fitness, ties broken by fewest generations. */
  public Optional<RunSample> best() {
    return samples().values().stream().min(BY_QUALITY);
  }
}
