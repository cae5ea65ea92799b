package com.verlumen.nonogram.puzzle;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;

/**
 * An immutable, validated nonogram: dimensions, palette and the clue sequence of every row and
 * column. Instances only come out of {@link PuzzleValidator}, so every clue fits its line.
 */
@AutoValue
public abstract class Puzzle {
  static Puzzle create(
      int width,
      int height,
      Palette palette,
      ImmutableList<ImmutableList<Segment>> rowClues,
      ImmutableList<ImmutableList<Segment>> columnClues) {
    return new AutoValue_Puzzle(width, height, palette, rowClues, columnClues);
  }

  /**
   * Derives a puzzle from an authored grid. The grid's own clues always fit, so this only fails
   * if the grid uses a color the palette lacks.
   */
  public static Puzzle fromGrid(Palette palette, CandidateGrid grid) {
    checkNotNull(grid, "Grid cannot be null");
    return PuzzleValidator.validate(
        grid.width(), grid.height(), palette, grid.rowClues(), grid.columnClues());
  }

  public abstract int width();

  public abstract int height();

  public abstract Palette palette();

  public abstract ImmutableList<ImmutableList<Segment>> rowClues();

  public abstract ImmutableList<ImmutableList<Segment>> columnClues();

  public ImmutableList<Segment> clues(LineKind kind, int index) {
    return kind == LineKind.ROW ? rowClues().get(index) : columnClues().get(index);
  }

  /** Number of lines of the given orientation. */
  public int lineCount(LineKind kind) {
    return kind == LineKind.ROW ? height() : width();
  }

  /** Number of cells in one line of the given orientation. */
  public int lineLength(LineKind kind) {
    return kind == LineKind.ROW ? width() : height();
  }
}
