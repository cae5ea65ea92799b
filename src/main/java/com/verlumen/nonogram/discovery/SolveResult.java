package com.verlumen.nonogram.discovery;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.verlumen.nonogram.convergence.GenerationStats;
import com.verlumen.nonogram.puzzle.CandidateGrid;
import java.time.Duration;

/** Outcome of a finished genetic search. */
@AutoValue
public abstract class SolveResult {
  public static SolveResult create(
      RunStatus status,
      CandidateGrid bestGrid,
      int bestFitness,
      long generations,
      long seed,
      Duration elapsed,
      ImmutableList<GenerationStats> history) {
    return new AutoValue_SolveResult(
        status, bestGrid.copy(), bestFitness, generations, seed, elapsed, history);
  }

  public abstract RunStatus status();

  abstract CandidateGrid grid();

  public abstract int bestFitness();

  /** Generations evolved before the search stopped. */
  public abstract long generations();

  /** Seed of the run's random source; rerunning with it reproduces this result. */
  public abstract long seed();

  public abstract Duration elapsed();

  /** Per-generation statistics, oldest first. */
  public abstract ImmutableList<GenerationStats> history();

  /** Best grid found, as a copy the caller may modify. */
  public CandidateGrid bestGrid() {
    return grid().copy();
  }

  public boolean isSolved() {
    return status() == RunStatus.SOLVED;
  }
}
