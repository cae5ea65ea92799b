package com.verlumen.nonogram.puzzle;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;

/** Thrown when a puzzle definition is malformed or unsatisfiable by construction. */
public final class PuzzleValidationException extends IllegalArgumentException {
  private static final long serialVersionUID = 1L;

  private final ImmutableList<ValidationError> errors;

  PuzzleValidationException(ImmutableList<ValidationError> errors) {
    super("Invalid puzzle definition: " + Joiner.on(", ").join(errors));
    checkArgument(!errors.isEmpty(), "At least one validation error is required");
    this.errors = errors;
  }

  public ImmutableList<ValidationError> errors() {
    return errors;
  }

  /** Returns whether any recorded error has the given kind. */
  public boolean hasError(ValidationError.Kind kind) {
    return errors.stream().anyMatch(error -> error.kind() == kind);
  }
}
