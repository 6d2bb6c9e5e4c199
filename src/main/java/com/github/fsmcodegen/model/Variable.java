package com.github.fsmcodegen.model;

import java.util.Objects;

/**
 * An extended-state variable carried alongside the discrete state.
 */
public final class Variable {
  private final String name;
  private final long initialValue;

  public Variable(final String name, final long initialValue) {
    this.name = Objects.requireNonNull(name, "name");
    this.initialValue = initialValue;
  }

  public String getName() {
    return name;
  }

  public long getInitialValue() {
    return initialValue;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Variable)) {
      return false;
    }
    Variable other = (Variable) o;
    return name.equals(other.name) && initialValue == other.initialValue;
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, initialValue);
  }

  @Override
  public String toString() {
    return name + " = " + initialValue;
  }
}
