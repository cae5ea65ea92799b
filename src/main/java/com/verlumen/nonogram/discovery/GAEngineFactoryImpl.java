package com.verlumen.nonogram.discovery;

import com.google.common.util.concurrent.MoreExecutors;
import com.google.inject.Inject;
import com.verlumen.nonogram.puzzle.Puzzle;
import io.jenetics.Alterer;
import io.jenetics.EliteSelector;
import io.jenetics.Genotype;
import io.jenetics.IntegerGene;
import io.jenetics.TournamentSelector;
import io.jenetics.engine.Engine;
import io.jenetics.util.Factory;
import java.util.concurrent.ExecutorService;

final class GAEngineFactoryImpl implements GAEngineFactory {
  private final FitnessCalculator fitnessCalculator;
  private final GenotypeConverter genotypeConverter;
  private final ExecutorService evaluationExecutor;

  @Inject
  GAEngineFactoryImpl(
      FitnessCalculator fitnessCalculator,
      GenotypeConverter genotypeConverter,
      @EvaluationExecutor ExecutorService evaluationExecutor) {
    this.fitnessCalculator = fitnessCalculator;
    this.genotypeConverter = genotypeConverter;
    this.evaluationExecutor = evaluationExecutor;
  }

  @Override
  public Engine<IntegerGene, Integer> createEngine(Puzzle puzzle, SolverConfig config) {
    ExecutorService executor =
        config.parallelEvaluation()
            ? evaluationExecutor
            : MoreExecutors.newDirectExecutorService();
    ParallelEvaluator evaluator =
        new ParallelEvaluator(fitnessCalculator.createFitnessFunction(puzzle, config), executor);

    // Survivors are exactly the elite; tournaments fill the remaining slots.
    int populationSize = config.populationSize();
    double offspringFraction =
        (double) (populationSize - config.eliteCount()) / populationSize;

    // Selection and alteration run on the calling thread, where the run's seeded random source
    // is registered.
    return new Engine.Builder<>(evaluator, createGenotypeFactory(puzzle, config))
        .populationSize(populationSize)
        .offspringFraction(offspringFraction)
        .survivorsSelector(new EliteSelector<>(config.eliteCount()))
        .offspringSelector(new TournamentSelector<>(config.tournamentSize()))
        .alterers(
            new RowCrossover(config.crossoverRate(), config.crossoverStrategy()),
            createMutator(puzzle, config))
        .maximalPhenotypeAge(Long.MAX_VALUE)
        .executor(Runnable::run)
        .minimizing()
        .build();
  }

  @Override
  public Factory<Genotype<IntegerGene>> createGenotypeFactory(
      Puzzle puzzle, SolverConfig config) {
    return new GridGenotypeFactory(puzzle, config.seedingStrategy(), genotypeConverter);
  }

  private Alterer<IntegerGene, Integer> createMutator(Puzzle puzzle, SolverConfig config) {
    int paletteSize = puzzle.palette().size();
    switch (config.mutationStrategy()) {
      case SEGMENT_SLIDE:
        return new SegmentSlideMutator(
            config.mutationRate(), config.slideTries(), genotypeConverter, paletteSize);
      case RANDOM_CELL:
      default:
        return new CellMutator(config.mutationRate(), genotypeConverter, paletteSize);
    }
  }
}
