package com.verlumen.nonogram.discovery;

import com.google.auto.value.AutoValue;
import java.time.Duration;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Hyperparameters of one genetic search. Values are not range-checked here; the orchestrator
 * rejects out-of-range settings with a {@link ConfigException} before any generation runs.
 */
@AutoValue
public abstract class SolverConfig {
  public static Builder builder() {
    return new AutoValue_SolverConfig.Builder()
        .setPopulationSize(GAConstants.DEFAULT_POPULATION_SIZE)
        .setEliteCount(GAConstants.DEFAULT_ELITE_COUNT)
        .setTournamentSize(GAConstants.DEFAULT_TOURNAMENT_SIZE)
        .setCrossoverRate(GAConstants.DEFAULT_CROSSOVER_RATE)
        .setMutationRate(GAConstants.DEFAULT_MUTATION_RATE)
        .setMaxGenerations(GAConstants.DEFAULT_MAX_GENERATIONS)
        .setStagnationLimit(GAConstants.DEFAULT_STAGNATION_LIMIT)
        .setSeedingStrategy(SeedingStrategy.ROW_SEEDED)
        .setCrossoverStrategy(CrossoverStrategy.UNIFORM_ROWS)
        .setMutationStrategy(MutationStrategy.RANDOM_CELL)
        .setSlideTries(GAConstants.DEFAULT_SLIDE_TRIES)
        .setParallelEvaluation(true);
  }

  public static SolverConfig defaults() {
    return builder().build();
  }

  public abstract int populationSize();

  /** Best individuals copied unchanged into every next generation. */
  public abstract int eliteCount();

  public abstract int tournamentSize();

  public abstract double crossoverRate();

  public abstract double mutationRate();

  public abstract int maxGenerations();

  /** Generations without a strict improvement of the best score before giving up; 0 disables. */
  public abstract int stagnationLimit();

  public abstract Optional<Long> randomSeed();

  public abstract SeedingStrategy seedingStrategy();

  public abstract CrossoverStrategy crossoverStrategy();

  public abstract MutationStrategy mutationStrategy();

  /** Slide attempts per row for {@link MutationStrategy#SEGMENT_SLIDE}. */
  public abstract int slideTries();

  /** Fixed color mismatch penalty; when absent the scored line's length is used. */
  public abstract OptionalInt colorMismatchPenalty();

  /** Wall-clock budget checked at generation boundaries. */
  public abstract Optional<Duration> timeLimit();

  public abstract boolean parallelEvaluation();

  public abstract Builder toBuilder();

  /**
   * Checks every hyperparameter range.
   *
   * @return this configuration
   * @throws ConfigException listing every out-of-range value
   */
  public SolverConfig validate() {
    ConfigValidator.validate(this);
    return this;
  }

  /** Builder for {@link SolverConfig}, pre-populated with the defaults. */
  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setPopulationSize(int populationSize);

    public abstract Builder setEliteCount(int eliteCount);

    public abstract Builder setTournamentSize(int tournamentSize);

    public abstract Builder setCrossoverRate(double crossoverRate);

    public abstract Builder setMutationRate(double mutationRate);

    public abstract Builder setMaxGenerations(int maxGenerations);

    public abstract Builder setStagnationLimit(int stagnationLimit);

    public abstract Builder setRandomSeed(Long randomSeed);

    public abstract Builder setSeedingStrategy(SeedingStrategy seedingStrategy);

    public abstract Builder setCrossoverStrategy(CrossoverStrategy crossoverStrategy);

    public abstract Builder setMutationStrategy(MutationStrategy mutationStrategy);

    public abstract Builder setSlideTries(int slideTries);

    public abstract Builder setColorMismatchPenalty(int colorMismatchPenalty);

    public abstract Builder setTimeLimit(Duration timeLimit);

    public abstract Builder setParallelEvaluation(boolean parallelEvaluation);

    public abstract SolverConfig build();
  }
}
