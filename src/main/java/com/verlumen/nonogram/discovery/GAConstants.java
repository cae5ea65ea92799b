package com.verlumen.nonogram.discovery;

/**
 * Default hyperparameters of the genetic search.
 * Extracted to a separate class to avoid duplication and facilitate changes.
 */
final class GAConstants {
  static final int DEFAULT_POPULATION_SIZE = 500;
  static final int DEFAULT_ELITE_COUNT = 5;
  static final int DEFAULT_TOURNAMENT_SIZE = 3;
  static final double DEFAULT_CROSSOVER_RATE = 0.6;
  static final double DEFAULT_MUTATION_RATE = 0.05;
  static final int DEFAULT_MAX_GENERATIONS = 300;
  static final int DEFAULT_STAGNATION_LIMIT = 100;
  static final int DEFAULT_SLIDE_TRIES = 3;
  static final double ROW_SWAP_PROBABILITY = 0.5;

  private GAConstants() {}
}
