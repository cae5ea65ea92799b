package com.verlumen.nonogram.discovery;

import com.verlumen.nonogram.puzzle.CandidateGrid;
import io.jenetics.Genotype;
import io.jenetics.IntegerGene;

/**
 * Converts between the genetic algorithm's genotypes and candidate grids. A genotype holds one
 * chromosome per row and one gene per cell, the allele being the cell's color index.
 */
interface GenotypeConverter {
  /**
   * Decodes a genotype into a freshly allocated grid.
   *
   * @param genotype the genotype produced by the engine
   * @return a grid the caller owns
   */
  CandidateGrid toGrid(Genotype<IntegerGene> genotype);

  /**
   * Encodes a grid.
   *
   * @param grid the grid to encode
   * @param paletteSize number of colors; alleles range over {@code [0, paletteSize)}
   * @return a genotype with {@code grid.height()} chromosomes of {@code grid.width()} genes
   */
  Genotype<IntegerGene> toGenotype(CandidateGrid grid, int paletteSize);
}
