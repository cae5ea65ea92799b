package com.verlumen.nonogram.discovery;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;

/** Thrown when a {@link SolverConfig} holds out-of-range hyperparameters. */
public final class ConfigException extends IllegalArgumentException {
  private static final long serialVersionUID = 1L;

  private final ImmutableList<String> problems;

  ConfigException(ImmutableList<String> problems) {
    super("Invalid solver configuration: " + Joiner.on("; ").join(problems));
    this.problems = problems;
  }

  public ImmutableList<String> problems() {
    return problems;
  }
}
