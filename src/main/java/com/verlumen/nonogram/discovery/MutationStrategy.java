package com.verlumen.nonogram.discovery;

/** How offspring are perturbed after crossover. */
public enum MutationStrategy {
  /** Each cell is independently repainted with a uniformly random palette color. */
  RANDOM_CELL,
  /** Segments slide one cell into adjacent background; row clues are preserved. */
  SEGMENT_SLIDE
}
