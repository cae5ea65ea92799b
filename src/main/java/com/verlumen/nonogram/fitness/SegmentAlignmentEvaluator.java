package com.verlumen.nonogram.fitness;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.verlumen.nonogram.puzzle.CandidateGrid;
import com.verlumen.nonogram.puzzle.LineEncoder;
import com.verlumen.nonogram.puzzle.LineKind;
import com.verlumen.nonogram.puzzle.Puzzle;
import java.util.OptionalInt;

/**
 * Sums, over every row and column, the alignment cost between the run-length encoding of the
 * line and its declared clue.
 *
 * <p>Unless a fixed penalty is configured, a color mismatch costs the length of the line being
 * scored, which makes any color mismatch worse than any pure length mismatch on that line.
 */
public final class SegmentAlignmentEvaluator implements FitnessEvaluator {
  private final OptionalInt colorMismatchPenalty;

  private SegmentAlignmentEvaluator(OptionalInt colorMismatchPenalty) {
    this.colorMismatchPenalty = colorMismatchPenalty;
  }

  public static SegmentAlignmentEvaluator create() {
    return new SegmentAlignmentEvaluator(OptionalInt.empty());
  }

  public static SegmentAlignmentEvaluator withColorMismatchPenalty(int penalty) {
    checkArgument(penalty >= 1, "Color mismatch penalty must be positive: %s", penalty);
    return new SegmentAlignmentEvaluator(OptionalInt.of(penalty));
  }

  @Override
  public int evaluate(CandidateGrid grid, Puzzle puzzle) {
    checkNotNull(grid, "Grid cannot be null");
    checkNotNull(puzzle, "Puzzle cannot be null");
    checkArgument(
        grid.width() == puzzle.width() && grid.height() == puzzle.height(),
        "Grid is %sx%s but the puzzle is %sx%s",
        grid.width(),
        grid.height(),
        puzzle.width(),
        puzzle.height());
    return Math.toIntExact(
        linesCost(grid, puzzle, LineKind.ROW) + linesCost(grid, puzzle, LineKind.COLUMN));
  }

  private long linesCost(CandidateGrid grid, Puzzle puzzle, LineKind kind) {
    int penalty = colorMismatchPenalty.orElse(puzzle.lineLength(kind));
    long total = 0;
    for (int index = 0; index < puzzle.lineCount(kind); index++) {
      total +=
          SegmentAligner.alignmentCost(
              LineEncoder.encode(grid.line(kind, index)), puzzle.clues(kind, index), penalty);
    }
    return total;
  }
}
