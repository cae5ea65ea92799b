package com.verlumen.nonogram.fitness;

import com.verlumen.nonogram.puzzle.Segment;
import java.util.List;

/**
 * Minimum-cost alignment between the segments a line shows and the segments its clue declares.
 *
 * <p>Costs: matching equal colors costs the length difference, matching different colors costs
 * the color penalty plus the longer length, and an unmatched segment costs its own length.
 */
final class SegmentAligner {
  static long alignmentCost(List<Segment> actual, List<Segment> expected, int colorPenalty) {
    int rows = actual.size();
    int columns = expected.size();
    long[] previous = new long[columns + 1];
    long[] current = new long[columns + 1];

    for (int j = 1; j <= columns; j++) {
      previous[j] = previous[j - 1] + expected.get(j - 1).length();
    }
    for (int i = 1; i <= rows; i++) {
      Segment shown = actual.get(i - 1);
      current[0] = previous[0] + shown.length();
      for (int j = 1; j <= columns; j++) {
        Segment declared = expected.get(j - 1);
        long substitute = previous[j - 1] + matchCost(shown, declared, colorPenalty);
        long deleteShown = previous[j] + shown.length();
        long insertDeclared = current[j - 1] + declared.length();
        current[j] = Math.min(substitute, Math.min(deleteShown, insertDeclared));
      }
      long[] swap = previous;
      previous = current;
      current = swap;
    }
    return previous[columns];
  }

  static long matchCost(Segment shown, Segment declared, int colorPenalty) {
    if (shown.color() == declared.color()) {
      return Math.abs((long) shown.length() - declared.length());
    }
    return (long) colorPenalty + Math.max(shown.length(), declared.length());
  }

  private SegmentAligner() {}
}
