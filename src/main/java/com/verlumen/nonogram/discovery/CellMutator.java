package com.verlumen.nonogram.discovery;

import static com.google.common.base.Preconditions.checkArgument;

import com.verlumen.nonogram.puzzle.CandidateGrid;
import java.util.random.RandomGenerator;

/** Repaints each cell, with the mutation rate, in a uniformly random palette color. */
final class CellMutator extends GridMutator {
  private final double mutationRate;

  CellMutator(double mutationRate, GenotypeConverter genotypeConverter, int paletteSize) {
    super(genotypeConverter, paletteSize);
    checkArgument(
        mutationRate >= 0.0 && mutationRate <= 1.0,
        "Mutation rate must be in [0, 1]: %s",
        mutationRate);
    this.mutationRate = mutationRate;
  }

  @Override
  int mutate(CandidateGrid grid, RandomGenerator random) {
    if (mutationRate == 0.0) {
      return 0;
    }
    int changes = 0;
    for (int row = 0; row < grid.height(); row++) {
      for (int column = 0; column < grid.width(); column++) {
        if (random.nextDouble() >= mutationRate) {
          continue;
        }
        int color = random.nextInt(paletteSize());
        if (color != grid.get(row, column)) {
          grid.set(row, column, color);
          changes++;
        }
      }
    }
    return changes;
  }
}
