package com.github.fsmcodegen.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A guarded multi-way branch. Branches are evaluated in declaration order and the first one whose
 * guard holds wins; an {@code else} branch always holds and must come last.
 */
public final class ChoicePoint {
  private final String name;
  private final List<ChoiceBranch> branches;

  public ChoicePoint(final String name, final List<ChoiceBranch> branches) {
    this.name = Objects.requireNonNull(name, "name");
    this.branches = branches == null ? Collections.emptyList()
        : Collections.unmodifiableList(new ArrayList<>(branches));
  }

  public String getName() {
    return name;
  }

  public List<ChoiceBranch> getBranches() {
    return branches;
  }

  /**
   * The form a transition target takes when it leads into this choice point.
   */
  public String reference() {
    return Transition.choiceReference(name);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof ChoicePoint)) {
      return false;
    }
    ChoicePoint other = (ChoicePoint) o;
    return name.equals(other.name) && branches.equals(other.branches);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, branches);
  }

  @Override
  public String toString() {
    return "ChoicePoint [name=" + name + ", branches=" + branches + "]";
  }
}
