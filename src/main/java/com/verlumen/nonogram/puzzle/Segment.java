package com.verlumen.nonogram.puzzle;

import com.google.auto.value.AutoValue;

/** One clue entry: a run of {@code length} consecutive cells painted with {@code color}. */
@AutoValue
public abstract class Segment {
  public static Segment of(int color, int length) {
    return new AutoValue_Segment(color, length);
  }

  public abstract int color();

  public abstract int length();

  @Override
  public final String toString() {
    return color() + "x" + length();
  }
}
