package com.github.fsmcodegen.model;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * {@code set variable = value} attached to a transition. The value is either an integer literal or
 * the payload parameter of the triggering event.
 */
public final class Assignment {
  private static final Pattern integerPattern = Pattern.compile("-?[0-9]+");

  private final String variable;
  private final String value;

  public Assignment(final String variable, final String value) {
    this.variable = Objects.requireNonNull(variable, "variable");
    this.value = Objects.requireNonNull(value, "value");
  }

  public String getVariable() {
    return variable;
  }

  public String getValue() {
    return value;
  }

  public boolean isLiteral() {
    return integerPattern.matcher(value).matches();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Assignment)) {
      return false;
    }
    Assignment other = (Assignment) o;
    return variable.equals(other.variable) && value.equals(other.value);
  }

  @Override
  public int hashCode() {
    return Objects.hash(variable, value);
  }

  @Override
  public String toString() {
    return "set " + variable + " = " + value;
  }
}
