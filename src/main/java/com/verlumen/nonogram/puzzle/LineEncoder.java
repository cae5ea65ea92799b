package com.verlumen.nonogram.puzzle;

import com.google.common.collect.ImmutableList;
import java.util.List;

/** Run-length encoding of puzzle lines into clue segments. */
public final class LineEncoder {
  /**
   * Encodes a line of color indices. Consecutive equal non-background cells merge into one
   * segment; background cells only separate segments.
   */
  public static ImmutableList<Segment> encode(int[] line) {
    ImmutableList.Builder<Segment> segments = ImmutableList.builder();
    int runColor = Palette.BACKGROUND;
    int runLength = 0;
    for (int color : line) {
      if (color == runColor) {
        runLength++;
        continue;
      }
      if (runColor != Palette.BACKGROUND) {
        segments.add(Segment.of(runColor, runLength));
      }
      runColor = color;
      runLength = 1;
    }
    if (runColor != Palette.BACKGROUND && runLength > 0) {
      segments.add(Segment.of(runColor, runLength));
    }
    return segments.build();
  }

  /**
   * Smallest line that can hold {@code segments}: their total length plus one background cell
   * between each pair of neighbours sharing a color. Summed as a long so that clue lengths near
   * {@code Integer.MAX_VALUE} cannot wrap around.
   */
  public static long minimumLength(List<Segment> segments) {
    long total = mandatoryGaps(segments);
    for (Segment segment : segments) {
      total += segment.length();
    }
    return total;
  }

  /** Number of mandatory background cells inside {@code segments}. */
  public static int mandatoryGaps(List<Segment> segments) {
    int gaps = 0;
    for (int i = 1; i < segments.size(); i++) {
      if (segments.get(i - 1).color() == segments.get(i).color()) {
        gaps++;
      }
    }
    return gaps;
  }

  private LineEncoder() {}
}
