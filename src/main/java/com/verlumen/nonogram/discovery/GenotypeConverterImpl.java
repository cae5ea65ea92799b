package com.verlumen.nonogram.discovery;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.inject.Inject;
import com.verlumen.nonogram.puzzle.CandidateGrid;
import io.jenetics.Chromosome;
import io.jenetics.Genotype;
import io.jenetics.IntegerChromosome;
import io.jenetics.IntegerGene;
import java.util.ArrayList;
import java.util.List;

final class GenotypeConverterImpl implements GenotypeConverter {
  @Inject
  GenotypeConverterImpl() {}

  @Override
  public CandidateGrid toGrid(Genotype<IntegerGene> genotype) {
    int height = genotype.length();
    int width = genotype.get(0).length();
    int[][] cells = new int[height][width];
    for (int row = 0; row < height; row++) {
      Chromosome<IntegerGene> chromosome = genotype.get(row);
      checkArgument(
          chromosome.length() == width,
          "Chromosome %s has %s genes, expected %s",
          row,
          chromosome.length(),
          width);
      for (int column = 0; column < width; column++) {
        cells[row][column] = chromosome.get(column).intValue();
      }
    }
    return CandidateGrid.of(cells);
  }

  @Override
  public Genotype<IntegerGene> toGenotype(CandidateGrid grid, int paletteSize) {
    checkArgument(paletteSize >= 1, "Palette size must be positive: %s", paletteSize);
    List<IntegerChromosome> chromosomes = new ArrayList<>(grid.height());
    for (int row = 0; row < grid.height(); row++) {
      IntegerGene[] genes = new IntegerGene[grid.width()];
      for (int column = 0; column < grid.width(); column++) {
        int color = grid.get(row, column);
        checkArgument(
            color >= 0 && color < paletteSize,
            "Cell (%s, %s) holds color %s outside a palette of %s",
            row,
            column,
            color,
            paletteSize);
        genes[column] = IntegerGene.of(color, 0, paletteSize);
      }
      chromosomes.add(IntegerChromosome.of(genes));
    }
    return Genotype.of(chromosomes);
  }
}
