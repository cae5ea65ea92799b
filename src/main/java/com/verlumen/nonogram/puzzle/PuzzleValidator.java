package com.verlumen.nonogram.puzzle;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/** Validates raw puzzle definitions and builds {@link Puzzle} values from them. */
public final class PuzzleValidator {
  /**
   * Validates a definition.
   *
   * @return the puzzle, if every clue references a palette color and fits its line
   * @throws PuzzleValidationException listing every problem found; a zero dimension or an empty
   *     palette is reported alone since nothing else can be checked meaningfully
   */
  public static Puzzle validate(
      int width,
      int height,
      Palette palette,
      List<? extends List<Segment>> rowClues,
      List<? extends List<Segment>> columnClues) {
    checkNotNull(palette, "Palette cannot be null");
    checkNotNull(rowClues, "Row clues cannot be null");
    checkNotNull(columnClues, "Column clues cannot be null");

    if (width < 1 || height < 1) {
      throw new PuzzleValidationException(ImmutableList.of(ValidationError.zeroDimension()));
    }
    if (palette.isEmpty()) {
      throw new PuzzleValidationException(ImmutableList.of(ValidationError.emptyPalette()));
    }

    ImmutableList.Builder<ValidationError> errors = ImmutableList.builder();
    Set<Integer> unknownColors = new TreeSet<>();
    if (rowClues.size() != height) {
      errors.add(ValidationError.clueCountMismatch(LineKind.ROW));
    }
    if (columnClues.size() != width) {
      errors.add(ValidationError.clueCountMismatch(LineKind.COLUMN));
    }
    checkLines(LineKind.ROW, rowClues, width, palette, errors, unknownColors);
    checkLines(LineKind.COLUMN, columnClues, height, palette, errors, unknownColors);
    for (int color : unknownColors) {
      errors.add(ValidationError.unknownColor(color));
    }

    ImmutableList<ValidationError> found = errors.build();
    if (found.isEmpty()) {
      found = checkColorCounts(palette, rowClues, columnClues);
    }
    if (!found.isEmpty()) {
      throw new PuzzleValidationException(found);
    }
    return Puzzle.create(width, height, palette, copyOf(rowClues), copyOf(columnClues));
  }

  private static void checkLines(
      LineKind kind,
      List<? extends List<Segment>> lines,
      int lineLength,
      Palette palette,
      ImmutableList.Builder<ValidationError> errors,
      Set<Integer> unknownColors) {
    for (int index = 0; index < lines.size(); index++) {
      List<Segment> segments = checkNotNull(lines.get(index), "%s %s clues are null", kind, index);
      boolean wellFormed = true;
      for (Segment segment : segments) {
        if (segment.length() < 1 || segment.color() == Palette.BACKGROUND) {
          wellFormed = false;
        } else if (!palette.contains(segment.color())) {
          unknownColors.add(segment.color());
        }
      }
      if (!wellFormed) {
        errors.add(ValidationError.invalidSegment(kind, index));
      } else if (LineEncoder.minimumLength(segments) > lineLength) {
        errors.add(ValidationError.lineOverflow(kind, index));
      }
    }
  }

  private static ImmutableList<ValidationError> checkColorCounts(
      Palette palette,
      List<? extends List<Segment>> rowClues,
      List<? extends List<Segment>> columnClues) {
    long[] rowCells = cellsPerColor(palette, rowClues);
    long[] columnCells = cellsPerColor(palette, columnClues);
    ImmutableList.Builder<ValidationError> errors = ImmutableList.builder();
    for (int color = 0; color < palette.size(); color++) {
      if (rowCells[color] != columnCells[color]) {
        errors.add(ValidationError.colorCountMismatch(color));
      }
    }
    return errors.build();
  }

  private static long[] cellsPerColor(Palette palette, List<? extends List<Segment>> lines) {
    long[] cells = new long[palette.size()];
    for (List<Segment> segments : lines) {
      for (Segment segment : segments) {
        cells[segment.color()] += segment.length();
      }
    }
    return cells;
  }

  private static ImmutableList<ImmutableList<Segment>> copyOf(
      List<? extends List<Segment>> lines) {
    ImmutableList.Builder<ImmutableList<Segment>> copy = ImmutableList.builder();
    for (List<Segment> segments : lines) {
      copy.add(ImmutableList.copyOf(segments));
    }
    return copy.build();
  }

  private PuzzleValidator() {}
}
