package com.verlumen.nonogram.puzzle;

import com.google.auto.value.AutoValue;
import java.util.Optional;
import java.util.OptionalInt;

/** A single reason why a puzzle definition was rejected. */
@AutoValue
public abstract class ValidationError {
  /** Kinds of definition problems. */
  public enum Kind {
    ZERO_DIMENSION,
    EMPTY_PALETTE,
    CLUE_COUNT_MISMATCH,
    INVALID_SEGMENT,
    UNKNOWN_COLOR,
    LINE_OVERFLOW,
    COLOR_COUNT_MISMATCH
  }

  public static ValidationError zeroDimension() {
    return create(Kind.ZERO_DIMENSION, Optional.empty(), OptionalInt.empty(), OptionalInt.empty());
  }

  public static ValidationError emptyPalette() {
    return create(Kind.EMPTY_PALETTE, Optional.empty(), OptionalInt.empty(), OptionalInt.empty());
  }

  public static ValidationError clueCountMismatch(LineKind lineKind) {
    return create(
        Kind.CLUE_COUNT_MISMATCH, Optional.of(lineKind), OptionalInt.empty(), OptionalInt.empty());
  }

  public static ValidationError invalidSegment(LineKind lineKind, int lineIndex) {
    return create(
        Kind.INVALID_SEGMENT,
        Optional.of(lineKind),
        OptionalInt.of(lineIndex),
        OptionalInt.empty());
  }

  public static ValidationError unknownColor(int colorIndex) {
    return create(
        Kind.UNKNOWN_COLOR, Optional.empty(), OptionalInt.empty(), OptionalInt.of(colorIndex));
  }

  public static ValidationError lineOverflow(LineKind lineKind, int lineIndex) {
    return create(
        Kind.LINE_OVERFLOW, Optional.of(lineKind), OptionalInt.of(lineIndex), OptionalInt.empty());
  }

  public static ValidationError colorCountMismatch(int colorIndex) {
    return create(
        Kind.COLOR_COUNT_MISMATCH,
        Optional.empty(),
        OptionalInt.empty(),
        OptionalInt.of(colorIndex));
  }

  private static ValidationError create(
      Kind kind, Optional<LineKind> lineKind, OptionalInt lineIndex, OptionalInt colorIndex) {
    return new AutoValue_ValidationError(kind, lineKind, lineIndex, colorIndex);
  }

  public abstract Kind kind();

  public abstract Optional<LineKind> lineKind();

  public abstract OptionalInt lineIndex();

  public abstract OptionalInt colorIndex();

  @Override
  public final String toString() {
    StringBuilder description = new StringBuilder(kind().name());
    lineKind().ifPresent(kind -> description.append(' ').append(kind));
    lineIndex().ifPresent(index -> description.append(" #").append(index));
    colorIndex().ifPresent(color -> description.append(" color ").append(color));
    return description.toString();
  }
}
