package com.verlumen.nonogram.sweep;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableTable;
import com.google.common.flogger.FluentLogger;
import com.google.inject.Inject;
import com.verlumen.nonogram.discovery.GeneticAlgorithmOrchestrator;
import com.verlumen.nonogram.discovery.RunHandle;
import com.verlumen.nonogram.discovery.SolveResult;
import com.verlumen.nonogram.discovery.SolverConfig;
import com.verlumen.nonogram.puzzle.Puzzle;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Starts runs through the {@link GeneticAlgorithmOrchestrator} and keeps track of the live ones so
 * that {@link #cancel()} can reach them. Once cancelled, the coordinator cancels every run it
 * starts afterwards as well.
 */
final class RunCoordinatorImpl implements RunCoordinator {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final GeneticAlgorithmOrchestrator orchestrator;
  private final Set<RunHandle> activeRuns = ConcurrentHashMap.newKeySet();
  private volatile boolean cancelled;

  @Inject
  RunCoordinatorImpl(GeneticAlgorithmOrchestrator orchestrator) {
    this.orchestrator = orchestrator;
  }

  @Override
  public ImmutableList<SolveResult> restarts(
      Puzzle puzzle, SolverConfig config, List<Long> seeds) {
    config.validate();
    ImmutableList.Builder<SolveResult> results = ImmutableList.builder();
    for (long seed : seeds) {
      RunHandle handle = launch(puzzle, config.toBuilder().setRandomSeed(seed).build());
      SolveResult result = awaitAndRelease(handle);
      logger.atInfo().log(
          "Restart with seed %d: %s, best fitness %d",
          seed, result.status(), result.bestFitness());
      results.add(result);
    }
    return results.build();
  }

  @Override
  public SweepResult sweep(
      Puzzle puzzle, Map<String, SolverConfig> configurations, List<Long> seeds) {
    checkArgument(
        ImmutableSet.copyOf(seeds).size() == seeds.size(), "Seeds must be distinct: %s", seeds);
    configurations.values().forEach(SolverConfig::validate);
    logger.atInfo().log(
        "Sweeping %d configurations over %d seeds", configurations.size(), seeds.size());

    Map<String, Map<Long, RunHandle>> handles = new LinkedHashMap<>();
    for (Map.Entry<String, SolverConfig> entry : configurations.entrySet()) {
      Map<Long, RunHandle> bySeed = new LinkedHashMap<>();
      for (long seed : seeds) {
        SolverConfig seeded = entry.getValue().toBuilder().setRandomSeed(seed).build();
        bySeed.put(seed, launch(puzzle, seeded));
      }
      handles.put(entry.getKey(), bySeed);
    }

    ImmutableTable.Builder<String, Long, RunSample> samples = ImmutableTable.builder();
    for (Map.Entry<String, Map<Long, RunHandle>> row : handles.entrySet()) {
      String label = row.getKey();
      for (Map.Entry<Long, RunHandle> cell : row.getValue().entrySet()) {
        long seed = cell.getKey();
        SolveResult result;
        try {
          result = awaitAndRelease(cell.getValue());
        } catch (RuntimeException e) {
          logger.atSevere().withCause(e).log(
              "[%s] seed %d failed; abandoning the sweep", label, seed);
          abandon(handles);
          throw e;
        }
        RunSample sample = RunSample.of(label, result);
        logger.atInfo().log(
            "[%s] seed %d: %s, best fitness %d after %d generations",
            label, seed, sample.status(), sample.bestFitness(), sample.generations());
        samples.put(label, seed, sample);
      }
    }
    return SweepResult.create(samples.buildOrThrow());
  }

  @Override
  public void cancel() {
    cancelled = true;
    logger.atInfo().log("Cancelling %d active runs", activeRuns.size());
    activeRuns.forEach(RunHandle::cancel);
  }

  private RunHandle launch(Puzzle puzzle, SolverConfig config) {
    RunHandle handle = orchestrator.start(puzzle, config);
    activeRuns.add(handle);
    if (cancelled) {
      handle.cancel();
    }
    return handle;
  }

  /** Cancels every run of a failed sweep and stops tracking them. */
  private void abandon(Map<String, Map<Long, RunHandle>> handles) {
    for (Map<Long, RunHandle> bySeed : handles.values()) {
      for (RunHandle handle : bySeed.values()) {
        handle.cancel();
        activeRuns.remove(handle);
      }
    }
  }

  private SolveResult awaitAndRelease(RunHandle handle) {
    try {
      return handle.result();
    } finally {
      activeRuns.remove(handle);
    }
  }
}
