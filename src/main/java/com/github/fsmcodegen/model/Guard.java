package com.github.fsmcodegen.model;

import java.util.Objects;

/**
 * An opaque boolean expression. The compiler never evaluates it, generated code asks the host.
 */
public final class Guard {
  public static final String ELSE = "else";

  private final String expression;

  public Guard(final String expression) {
    this.expression = Objects.requireNonNull(expression, "expression").trim();
  }

  public String getExpression() {
    return expression;
  }

  /**
   * The catch-all guard of a choice branch.
   */
  public boolean isElse() {
    return ELSE.equals(expression);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Guard)) {
      return false;
    }
    return expression.equals(((Guard) o).expression);
  }

  @Override
  public int hashCode() {
    return expression.hashCode();
  }

  @Override
  public String toString() {
    return "[" + expression + "]";
  }
}
