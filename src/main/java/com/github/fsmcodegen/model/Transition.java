package com.github.fsmcodegen.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * This object represents immutable metadata about a transition between two states. Source and
 * target are plain names so that a model can be assembled before every state is declared; the
 * validator is what resolves them.
 *
 * Besides real state names, the source may be the initial pseudostate {@code [*]} or the wildcard
 * {@code *}, and the target may be {@code [*]} (terminal), {@code *} (only with a wildcard source)
 * or a choice point reference {@code <<name>>}.
 */
public final class Transition {
  public static final String ANY_STATE = "*";
  public static final String INITIAL_PSEUDOSTATE = "[*]";
  static final String choiceOpen = "<<";
  static final String choiceClose = ">>";

  private final String source;
  private final String target;
  private final Optional<Event> event;
  private final Optional<Guard> guard;
  private final Optional<Action> action;
  // fired when the guard evaluates false
  private final Optional<Action> guardRejectedAction;
  private final List<Assignment> assignments;
  private final TransitionKind kind;

  public static String choiceReference(final String choiceName) {
    return choiceOpen + choiceName + choiceClose;
  }

  public String getSource() {
    return source;
  }

  public String getTarget() {
    return target;
  }

  public Optional<Event> getEvent() {
    return event;
  }

  public Optional<Guard> getGuard() {
    return guard;
  }

  public Optional<Action> getAction() {
    return action;
  }

  public Optional<Action> getGuardRejectedAction() {
    return guardRejectedAction;
  }

  public List<Assignment> getAssignments() {
    return assignments;
  }

  public TransitionKind getKind() {
    return kind;
  }

  public boolean isWildcard() {
    return ANY_STATE.equals(source);
  }

  public boolean isInternal() {
    return kind == TransitionKind.INTERNAL;
  }

  public boolean isGuarded() {
    return guard.isPresent();
  }

  public boolean targetsChoice() {
    return isChoiceReference(target);
  }

  public boolean targetsTerminal() {
    return INITIAL_PSEUDOSTATE.equals(target);
  }

  /**
   * Name of the choice point this transition leads into, if it leads into one.
   */
  public Optional<String> choiceName() {
    if (!targetsChoice()) {
      return Optional.empty();
    }
    return Optional
        .of(target.substring(choiceOpen.length(), target.length() - choiceClose.length()));
  }

  public static boolean isChoiceReference(final String name) {
    return name != null && name.length() > choiceOpen.length() + choiceClose.length()
        && name.startsWith(choiceOpen) && name.endsWith(choiceClose);
  }

  /**
   * True for names that never denote a declared state.
   */
  public static boolean isPseudoName(final String name) {
    return INITIAL_PSEUDOSTATE.equals(name) || ANY_STATE.equals(name) || isChoiceReference(name);
  }

  public final static class TransitionBuilder {
    private final String source;
    private final String target;
    private Event event;
    private Guard guard;
    private Action action;
    private Action guardRejectedAction;
    private final List<Assignment> assignments = new ArrayList<>();
    private TransitionKind kind = TransitionKind.EXTERNAL;

    public TransitionBuilder event(final Event event) {
      this.event = event;
      return this;
    }

    public TransitionBuilder event(final String eventName) {
      this.event = eventName == null ? null : new Event(eventName);
      return this;
    }

    public TransitionBuilder guard(final Guard guard) {
      this.guard = guard;
      return this;
    }

    public TransitionBuilder guard(final String expression) {
      this.guard = expression == null ? null : new Guard(expression);
      return this;
    }

    public TransitionBuilder action(final Action action) {
      this.action = action;
      return this;
    }

    public TransitionBuilder guardRejectedAction(final Action guardRejectedAction) {
      this.guardRejectedAction = guardRejectedAction;
      return this;
    }

    public TransitionBuilder assignment(final Assignment assignment) {
      this.assignments.add(Objects.requireNonNull(assignment, "assignment"));
      return this;
    }

    public TransitionBuilder kind(final TransitionKind kind) {
      this.kind = Objects.requireNonNull(kind, "kind");
      return this;
    }

    public Transition build() {
      return new Transition(this);
    }

    private TransitionBuilder(final String source, final String target) {
      this.source = Objects.requireNonNull(source, "source");
      this.target = Objects.requireNonNull(target, "target");
    }
  }

  public static TransitionBuilder newBuilder(final String source, final String target) {
    return new TransitionBuilder(source, target);
  }

  private Transition(final TransitionBuilder builder) {
    this.source = builder.source;
    this.target = builder.target;
    this.event = Optional.ofNullable(builder.event);
    this.guard = Optional.ofNullable(builder.guard);
    this.action = Optional.ofNullable(builder.action);
    this.guardRejectedAction = Optional.ofNullable(builder.guardRejectedAction);
    this.assignments = builder.assignments.isEmpty() ? Collections.emptyList()
        : Collections.unmodifiableList(new ArrayList<>(builder.assignments));
    this.kind = builder.kind;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Transition)) {
      return false;
    }
    Transition other = (Transition) o;
    return source.equals(other.source) && target.equals(other.target)
        && event.equals(other.event) && guard.equals(other.guard)
        && action.equals(other.action) && guardRejectedAction.equals(other.guardRejectedAction)
        && assignments.equals(other.assignments) && kind == other.kind;
  }

  @Override
  public int hashCode() {
    return Objects.hash(source, target, event, guard, action, guardRejectedAction, assignments,
        kind);
  }

  @Override
  public String toString() {
    return "Transition [source=" + source + ", target=" + target + ", event="
        + event.map(Event::getName).orElse("<none>") + ", guard="
        + guard.map(Guard::getExpression).orElse("<none>") + ", action="
        + action.map(Action::toString).orElse("<none>") + ", kind=" + kind + "]";
  }
}
