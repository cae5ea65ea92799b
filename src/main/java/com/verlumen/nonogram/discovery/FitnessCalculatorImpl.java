package com.verlumen.nonogram.discovery;

import com.google.inject.Inject;
import com.verlumen.nonogram.fitness.FitnessEvaluator;
import com.verlumen.nonogram.fitness.SegmentAlignmentEvaluator;
import com.verlumen.nonogram.puzzle.Puzzle;
import io.jenetics.Genotype;
import io.jenetics.IntegerGene;
import java.util.function.Function;

/**
 * Implementation of the FitnessCalculator interface which decodes each genotype into a grid and
 * scores it with a {@link FitnessEvaluator}.
 */
final class FitnessCalculatorImpl implements FitnessCalculator {
  private final FitnessEvaluator defaultEvaluator;
  private final GenotypeConverter genotypeConverter;

  @Inject
  FitnessCalculatorImpl(FitnessEvaluator defaultEvaluator, GenotypeConverter genotypeConverter) {
    this.defaultEvaluator = defaultEvaluator;
    this.genotypeConverter = genotypeConverter;
  }

  @Override
  public Function<Genotype<IntegerGene>, Integer> createFitnessFunction(
      Puzzle puzzle, SolverConfig config) {
    FitnessEvaluator evaluator =
        config.colorMismatchPenalty().isPresent()
            ? SegmentAlignmentEvaluator.withColorMismatchPenalty(
                config.colorMismatchPenalty().getAsInt())
            : defaultEvaluator;
    return genotype -> evaluator.evaluate(genotypeConverter.toGrid(genotype), puzzle);
  }
}
