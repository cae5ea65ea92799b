package com.verlumen.nonogram.discovery;

/** How two parents exchange rows. */
public enum CrossoverStrategy {
  /** Each row comes from either parent with probability 0.5. */
  UNIFORM_ROWS,
  /** The rows between two random cut points are exchanged. */
  TWO_POINT_ROWS,
  /** Each pairing picks one of the other two strategies at random. */
  MIXED
}
