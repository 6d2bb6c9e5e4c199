package com.github.fsmcodegen.model;

import java.util.Objects;
import java.util.Optional;

public final class ChoiceBranch {
  private final Guard guard;
  private final String target;
  private final Optional<Action> action;

  public ChoiceBranch(final Guard guard, final String target, final Optional<Action> action) {
    this.guard = Objects.requireNonNull(guard, "guard");
    this.target = Objects.requireNonNull(target, "target");
    this.action = action == null ? Optional.empty() : action;
  }

  public Guard getGuard() {
    return guard;
  }

  public String getTarget() {
    return target;
  }

  public Optional<Action> getAction() {
    return action;
  }

  public boolean isElse() {
    return guard.isElse();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof ChoiceBranch)) {
      return false;
    }
    ChoiceBranch other = (ChoiceBranch) o;
    return guard.equals(other.guard) && target.equals(other.target)
        && action.equals(other.action);
  }

  @Override
  public int hashCode() {
    return Objects.hash(guard, target, action);
  }

  @Override
  public String toString() {
    return guard + " -> " + target + action.map(a -> " / " + a).orElse("");
  }
}
