package com.verlumen.nonogram.discovery;

import com.verlumen.nonogram.puzzle.Puzzle;

/**
 * Runs genetic searches for nonogram solutions.
 *
 * <p>Implementations typically:
 *
 * <ul>
 *   <li>Reject out-of-range configurations before any work starts.
 *   <li>Build a Jenetics engine for the puzzle and seed its random source.
 *   <li>Evolve until the puzzle is solved, the run is cancelled or a budget is used up.
 * </ul>
 */
public interface GeneticAlgorithmOrchestrator {
  /**
   * Starts a search in the background.
   *
   * @param puzzle a validated puzzle
   * @param config the hyperparameters
   * @return a handle to observe, cancel and await the run
   * @throws ConfigException if {@code config} holds out-of-range values
   */
  RunHandle start(Puzzle puzzle, SolverConfig config);

  /**
   * Runs a search on the calling thread and returns its result.
   *
   * @throws ConfigException if {@code config} holds out-of-range values
   */
  SolveResult solve(Puzzle puzzle, SolverConfig config);
}
