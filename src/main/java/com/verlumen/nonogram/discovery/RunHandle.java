package com.verlumen.nonogram.discovery;

import com.verlumen.nonogram.convergence.GenerationStats;

/** Control surface of a genetic search running in the background. */
public interface RunHandle {
  /**
   * Requests that the search stop at the next generation boundary. Idempotent, and a no-op once
   * the search is terminal.
   */
  void cancel();

  RunState state();

  /** Seed of the run's random source, drawn at start when none was configured. */
  long seed();

  /**
   * Statistics of each generation, in order. Iteration blocks for the next generation while the
   * search is live and ends once it is terminal; each new iterator starts from generation 1.
   */
  Iterable<GenerationStats> progress();

  /**
   * Waits for the search to finish.
   *
   * @throws java.util.concurrent.CompletionException if the search failed
   */
  SolveResult result();
}
