package com.verlumen.nonogram.puzzle;

/** Orientation of a puzzle line. */
public enum LineKind {
  ROW,
  COLUMN
}
