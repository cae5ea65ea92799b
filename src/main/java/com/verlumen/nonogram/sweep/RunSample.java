package com.verlumen.nonogram.sweep;

import com.google.auto.value.AutoValue;
import com.verlumen.nonogram.discovery.RunStatus;
import com.verlumen.nonogram.discovery.SolveResult;
import java.util.OptionalLong;

/** One {configuration, seed} cell of a sweep. */
@AutoValue
public abstract class RunSample {
  static RunSample of(String configuration, SolveResult result) {
    return new AutoValue_RunSample(
        configuration,
        result.seed(),
        result.status(),
        result.bestFitness(),
        result.generations());
  }

  public abstract String configuration();

  public abstract long seed();

  public abstract RunStatus status();

  public abstract int bestFitness();

  public abstract long generations();

  /** Generations needed to solve the puzzle; empty when the run did not solve it. */
  public OptionalLong generationsToSolve() {
    return status() == RunStatus.SOLVED ? OptionalLong.of(generations()) : OptionalLong.empty();
  }
}
