package com.github.fsmcodegen.model;

/**
 * Where a diagram tool last placed a state. Carried through untouched, nothing in the compiler
 * reads it.
 */
public final class LayoutHint {
  private final double x;
  private final double y;

  public LayoutHint(final double x, final double y) {
    this.x = x;
    this.y = y;
  }

  public double getX() {
    return x;
  }

  public double getY() {
    return y;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof LayoutHint)) {
      return false;
    }
    LayoutHint other = (LayoutHint) o;
    return Double.compare(x, other.x) == 0 && Double.compare(y, other.y) == 0;
  }

  @Override
  public int hashCode() {
    return 31 * Double.hashCode(x) + Double.hashCode(y);
  }

  @Override
  public String toString() {
    return "(" + x + ", " + y + ")";
  }
}
