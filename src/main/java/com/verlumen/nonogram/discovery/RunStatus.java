package com.verlumen.nonogram.discovery;

/** How a finished search ended. */
public enum RunStatus {
  SOLVED,
  EXHAUSTED,
  CANCELLED;

  RunState toState() {
    return RunState.valueOf(name());
  }
}
