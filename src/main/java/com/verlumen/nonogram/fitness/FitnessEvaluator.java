package com.verlumen.nonogram.fitness;

import com.verlumen.nonogram.puzzle.CandidateGrid;
import com.verlumen.nonogram.puzzle.Puzzle;

/**
 * Scores how far a coloring is from satisfying a puzzle. Implementations are pure and safe to
 * call concurrently on distinct grids.
 */
public interface FitnessEvaluator {
  /**
   * Evaluates a candidate grid.
   *
   * @param grid the coloring to score; must match the puzzle's dimensions
   * @param puzzle the puzzle whose clues are the target
   * @return a non-negative score, {@code 0} exactly when every row and column matches its clues
   */
  int evaluate(CandidateGrid grid, Puzzle puzzle);
}
