package com.verlumen.nonogram.discovery;

import com.verlumen.nonogram.puzzle.Puzzle;
import io.jenetics.Genotype;
import io.jenetics.IntegerGene;
import io.jenetics.engine.Engine;
import io.jenetics.util.Factory;

/** Defines the contract for creating genetic algorithm engines. */
interface GAEngineFactory {
  /**
   * Creates a genetic algorithm engine configured for the given puzzle.
   *
   * @param puzzle the puzzle to solve
   * @param config a validated configuration
   * @return a minimizing engine whose score 0 means solved
   */
  Engine<IntegerGene, Integer> createEngine(Puzzle puzzle, SolverConfig config);

  /** Creates the factory the first population is drawn from. */
  Factory<Genotype<IntegerGene>> createGenotypeFactory(Puzzle puzzle, SolverConfig config);
}
