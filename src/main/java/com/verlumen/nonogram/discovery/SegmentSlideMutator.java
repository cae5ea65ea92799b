package com.verlumen.nonogram.discovery;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.verlumen.nonogram.puzzle.CandidateGrid;
import com.verlumen.nonogram.puzzle.Palette;
import java.util.random.RandomGenerator;

/**
 * Slides segments by one cell into adjacent background. A slide never merges a segment with a
 * same-colored neighbour, so each row keeps the clue it had; combined with row seeding only the
 * column clues remain to be solved.
 */
final class SegmentSlideMutator extends GridMutator {
  private final double mutationRate;
  private final int slideTries;

  SegmentSlideMutator(
      double mutationRate, int slideTries, GenotypeConverter genotypeConverter, int paletteSize) {
    super(genotypeConverter, paletteSize);
    checkArgument(
        mutationRate >= 0.0 && mutationRate <= 1.0,
        "Mutation rate must be in [0, 1]: %s",
        mutationRate);
    checkArgument(slideTries >= 1, "Slide tries must be positive: %s", slideTries);
    this.mutationRate = mutationRate;
    this.slideTries = slideTries;
  }

  @Override
  int mutate(CandidateGrid grid, RandomGenerator random) {
    int changes = 0;
    for (int row = 0; row < grid.height(); row++) {
      for (int attempt = 0; attempt < slideTries; attempt++) {
        if (random.nextDouble() >= mutationRate) {
          continue;
        }
        ImmutableList<Slide> slides = slides(grid.row(row));
        if (slides.isEmpty()) {
          continue;
        }
        Slide slide = slides.get(random.nextInt(slides.size()));
        int moved = grid.get(row, slide.from());
        grid.set(row, slide.from(), grid.get(row, slide.to()));
        grid.set(row, slide.to(), moved);
        changes += 2;
      }
    }
    return changes;
  }

  /**
   * Lists every legal one-cell slide of {@code line}, left to right; a segment's left slide comes
   * before its right slide. Swapping the two cells of a slide moves one segment by one cell.
   */
  static ImmutableList<Slide> slides(int[] line) {
    ImmutableList.Builder<Slide> slides = ImmutableList.builder();
    int start = 0;
    while (start < line.length) {
      int color = line[start];
      if (color == Palette.BACKGROUND) {
        start++;
        continue;
      }
      int end = start;
      while (end + 1 < line.length && line[end + 1] == color) {
        end++;
      }
      // Left: the background cell before the segment takes its last cell.
      if (start - 1 >= 0
          && line[start - 1] == Palette.BACKGROUND
          && !(start - 2 >= 0 && line[start - 2] == color)) {
        slides.add(Slide.of(start - 1, end));
      }
      // Right: the background cell after the segment takes its first cell.
      if (end + 1 < line.length
          && line[end + 1] == Palette.BACKGROUND
          && !(end + 2 < line.length && line[end + 2] == color)) {
        slides.add(Slide.of(start, end + 1));
      }
      start = end + 1;
    }
    return slides.build();
  }

  /** A pair of cells whose swap slides a segment. */
  @AutoValue
  abstract static class Slide {
    static Slide of(int from, int to) {
      return new AutoValue_SegmentSlideMutator_Slide(from, to);
    }

    abstract int from();

    abstract int to();
  }
}
