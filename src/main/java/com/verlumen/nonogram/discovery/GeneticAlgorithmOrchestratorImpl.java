package com.verlumen.nonogram.discovery;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.inject.Inject;
import com.verlumen.nonogram.puzzle.Puzzle;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Implementation of the GeneticAlgorithmOrchestrator interface. This class validates requests and
 * assembles each run but delegates engine construction and the generation loop to specialized
 * classes.
 */
final class GeneticAlgorithmOrchestratorImpl implements GeneticAlgorithmOrchestrator {
  private final GAEngineFactory engineFactory;
  private final GenotypeConverter genotypeConverter;
  private final ExecutorService runExecutor;

  @Inject
  GeneticAlgorithmOrchestratorImpl(
      GAEngineFactory engineFactory,
      GenotypeConverter genotypeConverter,
      @RunExecutor ExecutorService runExecutor) {
    this.engineFactory = engineFactory;
    this.genotypeConverter = genotypeConverter;
    this.runExecutor = runExecutor;
  }

  @Override
  public RunHandle start(Puzzle puzzle, SolverConfig config) {
    GeneticSearch search = createSearch(puzzle, config);
    return new RunHandleImpl(search, CompletableFuture.supplyAsync(search::run, runExecutor));
  }

  @Override
  public SolveResult solve(Puzzle puzzle, SolverConfig config) {
    return createSearch(puzzle, config).run();
  }

  private GeneticSearch createSearch(Puzzle puzzle, SolverConfig config) {
    checkNotNull(puzzle, "Puzzle cannot be null");
    checkNotNull(config, "Config cannot be null");
    ConfigValidator.validate(config);

    long seed = config.randomSeed().orElseGet(() -> ThreadLocalRandom.current().nextLong());
    return new GeneticSearch(
        puzzle,
        config,
        seed,
        engineFactory.createEngine(puzzle, config),
        engineFactory.createGenotypeFactory(puzzle, config),
        genotypeConverter);
  }
}
