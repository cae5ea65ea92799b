package com.verlumen.nonogram.discovery;

/** Lifecycle of one genetic search. */
public enum RunState {
  INITIALIZED,
  EVOLVING,
  /** The best individual scored 0. */
  SOLVED,
  /** Generation, stagnation or time budget used up. */
  EXHAUSTED,
  CANCELLED,
  /** The search threw; {@link RunHandle#result()} rethrows the cause. */
  FAILED;

  public boolean isTerminal() {
    return this != INITIALIZED && this != EVOLVING;
  }
}
