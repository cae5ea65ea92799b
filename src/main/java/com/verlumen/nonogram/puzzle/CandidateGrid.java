package com.verlumen.nonogram.puzzle;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkElementIndex;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import java.util.Arrays;

/**
 * A mutable coloring of a puzzle's cells, indexed {@code [row][column]}.
 *
 * <p>Grids never share storage: every factory and {@link #copy()} produces an independent value,
 * so whichever component holds a grid owns it exclusively.
 */
public final class CandidateGrid {
  private final int width;
  private final int height;
  private final int[][] cells;

  private CandidateGrid(int width, int height, int[][] cells) {
    this.width = width;
    this.height = height;
    this.cells = cells;
  }

  /** Creates a grid of background cells. */
  public static CandidateGrid blank(int width, int height) {
    checkArgument(width >= 1 && height >= 1, "Grid must be at least 1x1: %sx%s", width, height);
    return new CandidateGrid(width, height, new int[height][width]);
  }

  /** Creates a grid holding a copy of {@code rows}. */
  public static CandidateGrid of(int[][] rows) {
    checkNotNull(rows, "Rows cannot be null");
    checkArgument(rows.length >= 1, "Grid must have at least one row");
    int width = rows[0].length;
    checkArgument(width >= 1, "Grid must have at least one column");
    int[][] cells = new int[rows.length][];
    for (int row = 0; row < rows.length; row++) {
      checkArgument(
          rows[row].length == width,
          "Row %s has %s cells but row 0 has %s",
          row,
          rows[row].length,
          width);
      cells[row] = rows[row].clone();
    }
    return new CandidateGrid(width, rows.length, cells);
  }

  public int width() {
    return width;
  }

  public int height() {
    return height;
  }

  public int get(int row, int column) {
    checkElementIndex(row, height, "row");
    checkElementIndex(column, width, "column");
    return cells[row][column];
  }

  public void set(int row, int column, int color) {
    checkElementIndex(row, height, "row");
    checkElementIndex(column, width, "column");
    cells[row][column] = color;
  }

  /** Returns a copy of one row. */
  public int[] row(int row) {
    checkElementIndex(row, height, "row");
    return cells[row].clone();
  }

  /** Returns a copy of one column, top to bottom. */
  public int[] column(int column) {
    checkElementIndex(column, width, "column");
    int[] line = new int[height];
    for (int row = 0; row < height; row++) {
      line[row] = cells[row][column];
    }
    return line;
  }

  /** Returns the line at {@code index} in the given orientation. */
  public int[] line(LineKind kind, int index) {
    return kind == LineKind.ROW ? row(index) : column(index);
  }

  /** Returns a copy of all rows. */
  public int[][] toArray() {
    int[][] copy = new int[height][];
    for (int row = 0; row < height; row++) {
      copy[row] = cells[row].clone();
    }
    return copy;
  }

  public CandidateGrid copy() {
    return new CandidateGrid(width, height, toArray());
  }

  /** Clues this grid actually displays along its rows. */
  public ImmutableList<ImmutableList<Segment>> rowClues() {
    ImmutableList.Builder<ImmutableList<Segment>> clues = ImmutableList.builder();
    for (int row = 0; row < height; row++) {
      clues.add(LineEncoder.encode(cells[row]));
    }
    return clues.build();
  }

  /** Clues this grid actually displays along its columns. */
  public ImmutableList<ImmutableList<Segment>> columnClues() {
    ImmutableList.Builder<ImmutableList<Segment>> clues = ImmutableList.builder();
    for (int column = 0; column < width; column++) {
      clues.add(LineEncoder.encode(column(column)));
    }
    return clues.build();
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof CandidateGrid)) {
      return false;
    }
    CandidateGrid that = (CandidateGrid) other;
    return width == that.width && height == that.height && Arrays.deepEquals(cells, that.cells);
  }

  @Override
  public int hashCode() {
    return Arrays.deepHashCode(cells);
  }

  /** Renders one line per row; background is {@code .}, colors are their index. */
  @Override
  public String toString() {
    StringBuilder text = new StringBuilder();
    for (int[] row : cells) {
      for (int color : row) {
        text.append(color == Palette.BACKGROUND ? "." : Integer.toString(color)).append(' ');
      }
      text.setLength(text.length() - 1);
      text.append('\n');
    }
    return text.toString();
  }
}
