package com.verlumen.nonogram.discovery;

/** How the first population is drawn. */
public enum SeedingStrategy {
  /**
   * Every row holds its declared segments at random legal offsets, so rows start out satisfied
   * and only column clues drive the search.
   */
  ROW_SEEDED,
  /** Every cell is drawn uniformly over the palette, background included. */
  UNIFORM_RANDOM
}
