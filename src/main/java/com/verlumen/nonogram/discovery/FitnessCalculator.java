package com.verlumen.nonogram.discovery;

import com.verlumen.nonogram.puzzle.Puzzle;
import io.jenetics.Genotype;
import io.jenetics.IntegerGene;
import java.util.function.Function;

/** Defines the contract for scoring genotypes against a puzzle. */
interface FitnessCalculator {
  /**
   * Creates a fitness function for the genetic algorithm.
   *
   * @param puzzle the puzzle being solved
   * @param config the run's configuration, consulted for the color mismatch penalty
   * @return a pure function from genotype to score, lower is better and 0 solves the puzzle
   */
  Function<Genotype<IntegerGene>, Integer> createFitnessFunction(
      Puzzle puzzle, SolverConfig config);
}
