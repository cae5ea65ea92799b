package com.verlumen.nonogram.sweep;

import com.google.common.collect.ImmutableList;
import com.verlumen.nonogram.discovery.SolveResult;
import com.verlumen.nonogram.discovery.SolverConfig;
import com.verlumen.nonogram.puzzle.Puzzle;
import java.util.List;
import java.util.Map;

/** Runs several independent genetic searches and collects their outcomes. */
public interface RunCoordinator {
  /**
   * Runs the same configuration once per seed, one run after the other.
   *
   * @return one result per seed, in seed order
   */
  ImmutableList<SolveResult> restarts(Puzzle puzzle, SolverConfig config, List<Long> seeds);

  /**
   * Runs every {configuration, seed} pair concurrently and waits for all of them.
   *
   * @param configurations configurations keyed by a unique label
   * @throws com.verlumen.nonogram.discovery.ConfigException if any configuration is invalid; no
   *     run is started in that case
   */
  SweepResult sweep(Puzzle puzzle, Map<String, SolverConfig> configurations, List<Long> seeds);

  /** Cancels every active run; cancelled runs are still reported. */
  void cancel();
}
