package com.github.fsmcodegen.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * This object represents immutable metadata about a state. Entry and exit actions are ordered
 * lists, run in declaration order; a state with a single entry action is just the list of length
 * one.
 */
public final class State {
  private final String name;
  private final Optional<String> description;
  private final StateKind kind;
  private final List<Action> entryActions;
  private final List<Action> exitActions;
  // events handled without leaving this state
  private final List<Transition> internalTransitions;
  private final Optional<FsmModel> subMachine;
  private final Optional<LayoutHint> layoutHint;

  public String getName() {
    return name;
  }

  public Optional<String> getDescription() {
    return description;
  }

  public StateKind getKind() {
    return kind;
  }

  public List<Action> getEntryActions() {
    return entryActions;
  }

  public List<Action> getExitActions() {
    return exitActions;
  }

  public List<Transition> getInternalTransitions() {
    return internalTransitions;
  }

  public Optional<FsmModel> getSubMachine() {
    return subMachine;
  }

  public Optional<LayoutHint> getLayoutHint() {
    return layoutHint;
  }

  public boolean isFinal() {
    return kind == StateKind.FINAL;
  }

  /**
   * A builder pre-filled with this state, used to merge a redeclaration into it.
   */
  public StateBuilder toBuilder() {
    final StateBuilder builder = new StateBuilder(name);
    builder.description = description.orElse(null);
    builder.kind = kind;
    builder.entryActions.addAll(entryActions);
    builder.exitActions.addAll(exitActions);
    builder.internalTransitions.addAll(internalTransitions);
    builder.subMachine = subMachine.orElse(null);
    builder.layoutHint = layoutHint.orElse(null);
    return builder;
  }

  public final static class StateBuilder {
    private final String name;
    private String description;
    private StateKind kind = StateKind.SIMPLE;
    private final List<Action> entryActions = new ArrayList<>();
    private final List<Action> exitActions = new ArrayList<>();
    private final List<Transition> internalTransitions = new ArrayList<>();
    private FsmModel subMachine;
    private LayoutHint layoutHint;

    public StateBuilder description(final String description) {
      this.description = description;
      return this;
    }

    public StateBuilder kind(final StateKind kind) {
      this.kind = Objects.requireNonNull(kind, "kind");
      return this;
    }

    public StateBuilder entryAction(final Action action) {
      entryActions.add(Objects.requireNonNull(action, "action"));
      return this;
    }

    public StateBuilder exitAction(final Action action) {
      exitActions.add(Objects.requireNonNull(action, "action"));
      return this;
    }

    /**
     * Internal transitions always have this state as both source and target, whatever the given
     * transition says.
     */
    public StateBuilder internalTransition(final Transition transition) {
      Objects.requireNonNull(transition, "transition");
      if (transition.getSource().equals(name) && transition.getTarget().equals(name)
          && transition.isInternal()) {
        internalTransitions.add(transition);
        return this;
      }
      final Transition.TransitionBuilder builder =
          Transition.newBuilder(name, name).kind(TransitionKind.INTERNAL)
              .event(transition.getEvent().orElse(null)).guard(transition.getGuard().orElse(null))
              .action(transition.getAction().orElse(null))
              .guardRejectedAction(transition.getGuardRejectedAction().orElse(null));
      for (Assignment assignment : transition.getAssignments()) {
        builder.assignment(assignment);
      }
      internalTransitions.add(builder.build());
      return this;
    }

    public StateBuilder subMachine(final FsmModel subMachine) {
      this.subMachine = subMachine;
      if (subMachine != null) {
        this.kind = StateKind.COMPOSITE;
      }
      return this;
    }

    public StateBuilder layoutHint(final LayoutHint layoutHint) {
      this.layoutHint = layoutHint;
      return this;
    }

    public String getName() {
      return name;
    }

    public State build() {
      return new State(this);
    }

    private StateBuilder(final String name) {
      this.name = Objects.requireNonNull(name, "name");
    }
  }

  public static StateBuilder newBuilder(final String name) {
    return new StateBuilder(name);
  }

  private State(final StateBuilder builder) {
    this.name = builder.name;
    this.description = Optional.ofNullable(builder.description);
    this.kind = builder.kind;
    this.entryActions = immutable(builder.entryActions);
    this.exitActions = immutable(builder.exitActions);
    this.internalTransitions = immutable(builder.internalTransitions);
    this.subMachine = Optional.ofNullable(builder.subMachine);
    this.layoutHint = Optional.ofNullable(builder.layoutHint);
  }

  private static <T> List<T> immutable(final List<T> items) {
    return items.isEmpty() ? Collections.emptyList()
        : Collections.unmodifiableList(new ArrayList<>(items));
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof State)) {
      return false;
    }
    State other = (State) o;
    return name.equals(other.name) && description.equals(other.description)
        && kind == other.kind && entryActions.equals(other.entryActions)
        && exitActions.equals(other.exitActions)
        && internalTransitions.equals(other.internalTransitions)
        && subMachine.equals(other.subMachine) && layoutHint.equals(other.layoutHint);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, description, kind, entryActions, exitActions, internalTransitions,
        subMachine, layoutHint);
  }

  @Override
  public String toString() {
    return "State [name=" + name + ", kind=" + kind + ", entryActions=" + entryActions
        + ", exitActions=" + exitActions + ", internalTransitions=" + internalTransitions.size()
        + "]";
  }
}
