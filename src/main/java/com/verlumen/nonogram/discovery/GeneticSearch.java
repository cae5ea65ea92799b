package com.verlumen.nonogram.discovery;

import com.google.common.base.Stopwatch;
import com.google.common.flogger.FluentLogger;
import com.verlumen.nonogram.convergence.ConvergenceTracker;
import com.verlumen.nonogram.convergence.GenerationStats;
import com.verlumen.nonogram.puzzle.Puzzle;
import io.jenetics.Genotype;
import io.jenetics.IntegerGene;
import io.jenetics.Phenotype;
import io.jenetics.engine.Engine;
import io.jenetics.engine.EvolutionResult;
import io.jenetics.engine.EvolutionStart;
import io.jenetics.util.Factory;
import io.jenetics.util.ISeq;
import io.jenetics.util.RandomRegistry;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One run of the genetic search, driven generation by generation so that cancellation,
 * stagnation and time limits are checked between generations.
 *
 * <p>A search is single use. {@link #run()} executes on exactly one thread; {@link #cancel()},
 * {@link #state()} and the tracker may be used from any thread.
 */
final class GeneticSearch {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final Puzzle puzzle;
  private final SolverConfig config;
  private final long seed;
  private final Engine<IntegerGene, Integer> engine;
  private final Factory<Genotype<IntegerGene>> genotypeFactory;
  private final GenotypeConverter genotypeConverter;
  private final ConvergenceTracker tracker = new ConvergenceTracker();
  private final AtomicBoolean cancelRequested = new AtomicBoolean();
  private volatile RunState state = RunState.INITIALIZED;

  GeneticSearch(
      Puzzle puzzle,
      SolverConfig config,
      long seed,
      Engine<IntegerGene, Integer> engine,
      Factory<Genotype<IntegerGene>> genotypeFactory,
      GenotypeConverter genotypeConverter) {
    this.puzzle = puzzle;
    this.config = config;
    this.seed = seed;
    this.engine = engine;
    this.genotypeFactory = genotypeFactory;
    this.genotypeConverter = genotypeConverter;
  }

  SolveResult run() {
    Stopwatch stopwatch = Stopwatch.createStarted();
    state = RunState.EVOLVING;
    logger.atInfo().log(
        "Starting search on a %dx%d puzzle with seed %d",
        puzzle.width(), puzzle.height(), seed);
    try {
      SolveResult result = RandomRegistry.with(new Random(seed), random -> evolve(stopwatch));
      state = result.status().toState();
      logger.atInfo().log(
          "Search finished %s after %d generations with best fitness %d in %s",
          result.status(), result.generations(), result.bestFitness(), result.elapsed());
      return result;
    } catch (RuntimeException e) {
      state = RunState.FAILED;
      logger.atSevere().withCause(e).log("Search with seed %d failed", seed);
      throw e;
    } finally {
      tracker.close();
    }
  }

  private SolveResult evolve(Stopwatch stopwatch) {
    List<Phenotype<IntegerGene, Integer>> initial = new ArrayList<>(config.populationSize());
    for (int i = 0; i < config.populationSize(); i++) {
      initial.add(Phenotype.of(genotypeFactory.newInstance(), 1));
    }
    EvolutionStart<IntegerGene, Integer> start = EvolutionStart.of(ISeq.of(initial), 1);

    Phenotype<IntegerGene, Integer> best = null;
    int stagnantGenerations = 0;
    long generation = 0;
    while (true) {
      EvolutionResult<IntegerGene, Integer> result = engine.evolve(start);
      generation++;
      int[] scores = result.population().stream().mapToInt(p -> p.fitness()).toArray();
      tracker.record(GenerationStats.of(generation, scores, stopwatch.elapsed()));

      Phenotype<IntegerGene, Integer> current = result.bestPhenotype();
      if (best == null || current.fitness() < best.fitness()) {
        best = current;
        stagnantGenerations = 0;
      } else {
        stagnantGenerations++;
      }
      logger.atFine().log("Generation %d: best %d", generation, best.fitness());

      Optional<RunStatus> status =
          terminalStatus(best.fitness(), generation, stagnantGenerations, stopwatch);
      if (status.isPresent()) {
        return SolveResult.create(
            status.get(),
            genotypeConverter.toGrid(best.genotype()),
            best.fitness(),
            generation,
            seed,
            stopwatch.elapsed(),
            tracker.snapshot());
      }
      start = result.next();
    }
  }

  /** Checks solved, then cancelled, then the budgets. */
  private Optional<RunStatus> terminalStatus(
      int bestFitness, long generation, int stagnantGenerations, Stopwatch stopwatch) {
    if (bestFitness == 0) {
      return Optional.of(RunStatus.SOLVED);
    }
    if (cancelRequested.get()) {
      return Optional.of(RunStatus.CANCELLED);
    }
    if (generation >= config.maxGenerations()) {
      return Optional.of(RunStatus.EXHAUSTED);
    }
    if (config.stagnationLimit() > 0 && stagnantGenerations >= config.stagnationLimit()) {
      logger.atInfo().log("No improvement for %d generations", stagnantGenerations);
      return Optional.of(RunStatus.EXHAUSTED);
    }
    Optional<Duration> timeLimit = config.timeLimit();
    if (timeLimit.isPresent() && stopwatch.elapsed().compareTo(timeLimit.get()) >= 0) {
      logger.atInfo().log("Time limit %s reached", timeLimit.get());
      return Optional.of(RunStatus.EXHAUSTED);
    }
    return Optional.empty();
  }

  /** Requests cancellation; honored at the next generation boundary. */
  void cancel() {
    cancelRequested.set(true);
  }

  RunState state() {
    return state;
  }

  long seed() {
    return seed;
  }

  ConvergenceTracker tracker() {
    return tracker;
  }
}
