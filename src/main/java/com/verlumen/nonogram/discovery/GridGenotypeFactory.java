package com.verlumen.nonogram.discovery;

import com.google.common.collect.ImmutableList;
import com.verlumen.nonogram.puzzle.CandidateGrid;
import com.verlumen.nonogram.puzzle.LineEncoder;
import com.verlumen.nonogram.puzzle.Palette;
import com.verlumen.nonogram.puzzle.Puzzle;
import com.verlumen.nonogram.puzzle.Segment;
import io.jenetics.Genotype;
import io.jenetics.IntegerGene;
import io.jenetics.util.Factory;
import io.jenetics.util.RandomRegistry;
import java.util.random.RandomGenerator;

/**
 * Draws individuals of the first population according to a {@link SeedingStrategy}. Randomness
 * comes from the {@link RandomRegistry}, so seeded runs are reproducible.
 */
final class GridGenotypeFactory implements Factory<Genotype<IntegerGene>> {
  private final Puzzle puzzle;
  private final SeedingStrategy strategy;
  private final GenotypeConverter genotypeConverter;

  GridGenotypeFactory(
      Puzzle puzzle, SeedingStrategy strategy, GenotypeConverter genotypeConverter) {
    this.puzzle = puzzle;
    this.strategy = strategy;
    this.genotypeConverter = genotypeConverter;
  }

  @Override
  public Genotype<IntegerGene> newInstance() {
    RandomGenerator random = RandomRegistry.random();
    CandidateGrid grid =
        strategy == SeedingStrategy.ROW_SEEDED
            ? rowSeededGrid(puzzle, random)
            : uniformGrid(puzzle, random);
    return genotypeConverter.toGenotype(grid, puzzle.palette().size());
  }

  static CandidateGrid uniformGrid(Puzzle puzzle, RandomGenerator random) {
    CandidateGrid grid = CandidateGrid.blank(puzzle.width(), puzzle.height());
    int colors = puzzle.palette().size();
    for (int row = 0; row < puzzle.height(); row++) {
      for (int column = 0; column < puzzle.width(); column++) {
        grid.set(row, column, random.nextInt(colors));
      }
    }
    return grid;
  }

  /** Lays out every row's clue with random gaps, ignoring the column clues. */
  static CandidateGrid rowSeededGrid(Puzzle puzzle, RandomGenerator random) {
    CandidateGrid grid = CandidateGrid.blank(puzzle.width(), puzzle.height());
    for (int row = 0; row < puzzle.height(); row++) {
      int[] cells = layOut(puzzle.rowClues().get(row), puzzle.width(), random);
      for (int column = 0; column < puzzle.width(); column++) {
        grid.set(row, column, cells[column]);
      }
    }
    return grid;
  }

  /**
   * Places {@code segments} in order on a line of {@code length} cells. The free cells are spread
   * over the slots before, between and after the segments; same-colored neighbours additionally
   * keep their mandatory gap.
   */
  static int[] layOut(ImmutableList<Segment> segments, int length, RandomGenerator random) {
    int[] line = new int[length];
    int free = Math.toIntExact(length - LineEncoder.minimumLength(segments));
    int[] extraGaps = new int[segments.size() + 1];
    for (int cell = 0; cell < free; cell++) {
      extraGaps[random.nextInt(extraGaps.length)]++;
    }

    int position = 0;
    for (int i = 0; i < segments.size(); i++) {
      Segment segment = segments.get(i);
      position += extraGaps[i];
      if (i > 0 && segments.get(i - 1).color() == segment.color()) {
        line[position++] = Palette.BACKGROUND;
      }
      for (int cell = 0; cell < segment.length(); cell++) {
        line[position++] = segment.color();
      }
    }
    return line;
  }
}
