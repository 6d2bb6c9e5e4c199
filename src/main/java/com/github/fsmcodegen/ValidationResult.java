package com.github.fsmcodegen;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * This object encapsulates the outcome of validating an fsm model.
 *
 * Valid models report {@link #isValid()} as true and carry no problems. Invalid models carry every
 * problem found in a single pass, in the order the validator found them, so that tooling can report
 * them all at once.
 *
 * Users should not try to sub-class and extend this, it would serve little purpose.
 */
public final class ValidationResult {
  private static final ValidationResult VALID = new ValidationResult(Collections.emptyList());

  private final List<String> problems;

  private ValidationResult(final List<String> problems) {
    this.problems = problems;
  }

  public static ValidationResult valid() {
    return VALID;
  }

  public static ValidationResult of(final List<String> problems) {
    if (problems == null || problems.isEmpty()) {
      return VALID;
    }
    return new ValidationResult(Collections.unmodifiableList(new ArrayList<>(problems)));
  }

  public boolean isValid() {
    return problems.isEmpty();
  }

  public List<String> getProblems() {
    return problems;
  }

  /**
   * Throws an {@link FsmException.Code#INVALID_MODEL} exception listing all problems if this result
   * is not valid.
   */
  public void orThrow(final String modelName) throws FsmException {
    if (!isValid()) {
      throw new FsmException(FsmException.Code.INVALID_MODEL,
          "Fsm '" + modelName + "' is invalid: " + String.join("; ", problems));
    }
  }

  @Override
  public String toString() {
    return "ValidationResult [valid=" + isValid() + ", problems=" + problems + "]";
  }
}
