package com.verlumen.nonogram.discovery;

import com.verlumen.nonogram.puzzle.CandidateGrid;
import io.jenetics.Alterer;
import io.jenetics.AltererResult;
import io.jenetics.IntegerGene;
import io.jenetics.Phenotype;
import io.jenetics.util.ISeq;
import io.jenetics.util.RandomRegistry;
import io.jenetics.util.Seq;
import java.util.ArrayList;
import java.util.List;
import java.util.random.RandomGenerator;

/**
 * Base class for mutations expressed on candidate grids. Each offspring is decoded, mutated and
 * re-encoded; individuals the mutation leaves untouched keep their phenotype and fitness.
 */
abstract class GridMutator implements Alterer<IntegerGene, Integer> {
  private final GenotypeConverter genotypeConverter;
  private final int paletteSize;

  GridMutator(GenotypeConverter genotypeConverter, int paletteSize) {
    this.genotypeConverter = genotypeConverter;
    this.paletteSize = paletteSize;
  }

  /**
   * Mutates {@code grid} in place.
   *
   * @return the number of changed cells
   */
  abstract int mutate(CandidateGrid grid, RandomGenerator random);

  int paletteSize() {
    return paletteSize;
  }

  @Override
  public final AltererResult<IntegerGene, Integer> alter(
      Seq<Phenotype<IntegerGene, Integer>> population, long generation) {
    RandomGenerator random = RandomRegistry.random();
    List<Phenotype<IntegerGene, Integer>> mutated = new ArrayList<>(population.length());
    int alterations = 0;
    for (Phenotype<IntegerGene, Integer> individual : population) {
      CandidateGrid grid = genotypeConverter.toGrid(individual.genotype());
      int changes = mutate(grid, random);
      if (changes == 0) {
        mutated.add(individual);
        continue;
      }
      mutated.add(Phenotype.of(genotypeConverter.toGenotype(grid, paletteSize), generation));
      alterations += changes;
    }
    return new AltererResult<>(ISeq.of(mutated), alterations);
  }
}
