package com.verlumen.nonogram.discovery;

import com.google.common.collect.ImmutableList;

/** Range checks for {@link SolverConfig}. */
final class ConfigValidator {
  static void validate(SolverConfig config) {
    ImmutableList.Builder<String> problems = ImmutableList.builder();
    if (config.populationSize() < 2) {
      problems.add("population_size must be at least 2, was " + config.populationSize());
    }
    if (config.eliteCount() < 1) {
      problems.add("elite_count must be at least 1, was " + config.eliteCount());
    }
    if (config.eliteCount() >= config.populationSize()) {
      problems.add(
          String.format(
              "elite_count (%d) must be smaller than population_size (%d)",
              config.eliteCount(), config.populationSize()));
    }
    if (config.tournamentSize() < 2 || config.tournamentSize() > config.populationSize()) {
      problems.add(
          String.format(
              "tournament_size must be in [2, population_size], was %d",
              config.tournamentSize()));
    }
    checkRate(problems, "crossover_rate", config.crossoverRate());
    checkRate(problems, "mutation_rate", config.mutationRate());
    if (config.maxGenerations() < 1) {
      problems.add("max_generations must be at least 1, was " + config.maxGenerations());
    }
    if (config.stagnationLimit() < 0) {
      problems.add("stagnation_limit must not be negative, was " + config.stagnationLimit());
    }
    if (config.slideTries() < 1) {
      problems.add("slide_tries must be at least 1, was " + config.slideTries());
    }
    config
        .colorMismatchPenalty()
        .ifPresent(
            penalty -> {
              if (penalty < 1) {
                problems.add("color_mismatch_penalty must be positive, was " + penalty);
              }
            });
    config
        .timeLimit()
        .ifPresent(
            limit -> {
              if (limit.isNegative() || limit.isZero()) {
                problems.add("time_limit must be positive, was " + limit);
              }
            });

    ImmutableList<String> found = problems.build();
    if (!found.isEmpty()) {
      throw new ConfigException(found);
    }
  }

  private static void checkRate(ImmutableList.Builder<String> problems, String name, double rate) {
    if (!(rate >= 0.0 && rate <= 1.0)) {
      problems.add(name + " must be in [0, 1], was " + rate);
    }
  }

  private ConfigValidator() {}
}
