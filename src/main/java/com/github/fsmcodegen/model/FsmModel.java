package com.github.fsmcodegen.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

import com.github.fsmcodegen.ValidationResult;

/**
 * The language-neutral description of one state machine, as produced by the parser for each
 * {@code fsm} block or assembled programmatically through {@link FsmModelBuilder}. A built model is
 * immutable and compares structurally, so two parses of the same text are equal.
 *
 * The model does not hold a curated event list as ground truth: {@link #collectEvents()} derives it
 * from the transitions. Declared events only add payload information.
 */
public final class FsmModel {
  private final String name;
  private final Optional<String> description;
  private final Optional<String> initialState;
  private final List<State> states;
  private final List<Transition> transitions;
  private final List<ChoicePoint> choicePoints;
  private final List<Timer> timers;
  private final List<Event> declaredEvents;
  private final List<Variable> variables;

  public String getName() {
    return name;
  }

  public Optional<String> getDescription() {
    return description;
  }

  public Optional<String> getInitialState() {
    return initialState;
  }

  public List<State> getStates() {
    return states;
  }

  public List<Transition> getTransitions() {
    return transitions;
  }

  public List<ChoicePoint> getChoicePoints() {
    return choicePoints;
  }

  public List<Timer> getTimers() {
    return timers;
  }

  public List<Event> getDeclaredEvents() {
    return declaredEvents;
  }

  public List<Variable> getVariables() {
    return variables;
  }

  public Optional<State> findState(final String stateName) {
    for (State state : states) {
      if (state.getName().equals(stateName)) {
        return Optional.of(state);
      }
    }
    return Optional.empty();
  }

  public Optional<ChoicePoint> findChoicePoint(final String choiceName) {
    for (ChoicePoint choicePoint : choicePoints) {
      if (choicePoint.getName().equals(choiceName)) {
        return Optional.of(choicePoint);
      }
    }
    return Optional.empty();
  }

  public Optional<Timer> findTimer(final String timerName) {
    for (Timer timer : timers) {
      if (timer.getName().equals(timerName)) {
        return Optional.of(timer);
      }
    }
    return Optional.empty();
  }

  public Optional<Variable> findVariable(final String variableName) {
    for (Variable variable : variables) {
      if (variable.getName().equals(variableName)) {
        return Optional.of(variable);
      }
    }
    return Optional.empty();
  }

  public Optional<Event> findDeclaredEvent(final String eventName) {
    for (Event event : declaredEvents) {
      if (event.getName().equals(eventName)) {
        return Optional.of(event);
      }
    }
    return Optional.empty();
  }

  /**
   * Events of every transition and internal transition, deduplicated by name and sorted by name.
   * Payload parameters come from the matching event declarations.
   */
  public List<Event> collectEvents() {
    final TreeMap<String, Event> byName = new TreeMap<>();
    for (Transition transition : transitions) {
      addEvent(byName, transition);
    }
    for (State state : states) {
      for (Transition internal : state.getInternalTransitions()) {
        addEvent(byName, internal);
      }
    }
    return Collections.unmodifiableList(new ArrayList<>(byName.values()));
  }

  private void addEvent(final TreeMap<String, Event> byName, final Transition transition) {
    if (!transition.getEvent().isPresent()) {
      return;
    }
    final String eventName = transition.getEvent().get().getName();
    if (!byName.containsKey(eventName)) {
      byName.put(eventName, findDeclaredEvent(eventName).orElse(transition.getEvent().get()));
    }
  }

  /**
   * Checks referential integrity and structural completeness. Never throws, every problem found is
   * reported in the returned result.
   */
  public ValidationResult validate() {
    return ValidationResult.of(new ModelValidator(this).validate());
  }

  public final static class FsmModelBuilder {
    private final String name;
    private String description;
    private String initialState;
    private final List<State> states = new ArrayList<>();
    private final List<Transition> transitions = new ArrayList<>();
    private final List<ChoicePoint> choicePoints = new ArrayList<>();
    private final List<Timer> timers = new ArrayList<>();
    private final List<Event> declaredEvents = new ArrayList<>();
    private final List<Variable> variables = new ArrayList<>();

    public FsmModelBuilder description(final String description) {
      this.description = description;
      return this;
    }

    public FsmModelBuilder initialState(final String initialState) {
      this.initialState = initialState;
      return this;
    }

    public FsmModelBuilder state(final State state) {
      states.add(Objects.requireNonNull(state, "state"));
      return this;
    }

    public FsmModelBuilder transition(final Transition transition) {
      transitions.add(Objects.requireNonNull(transition, "transition"));
      return this;
    }

    public FsmModelBuilder choicePoint(final ChoicePoint choicePoint) {
      choicePoints.add(Objects.requireNonNull(choicePoint, "choicePoint"));
      return this;
    }

    public FsmModelBuilder timer(final Timer timer) {
      timers.add(Objects.requireNonNull(timer, "timer"));
      return this;
    }

    public FsmModelBuilder event(final Event event) {
      declaredEvents.add(Objects.requireNonNull(event, "event"));
      return this;
    }

    public FsmModelBuilder variable(final Variable variable) {
      variables.add(Objects.requireNonNull(variable, "variable"));
      return this;
    }

    public FsmModel build() {
      return new FsmModel(this);
    }

    private FsmModelBuilder(final String name) {
      this.name = Objects.requireNonNull(name, "name");
    }
  }

  public static FsmModelBuilder newBuilder(final String name) {
    return new FsmModelBuilder(name);
  }

  private FsmModel(final FsmModelBuilder builder) {
    this.name = builder.name;
    this.description = Optional.ofNullable(builder.description);
    this.initialState = Optional.ofNullable(builder.initialState);
    this.states = immutable(builder.states);
    this.transitions = immutable(builder.transitions);
    this.choicePoints = immutable(builder.choicePoints);
    this.timers = immutable(builder.timers);
    this.declaredEvents = immutable(builder.declaredEvents);
    this.variables = immutable(builder.variables);
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
    if (!(o instanceof FsmModel)) {
      return false;
    }
    FsmModel other = (FsmModel) o;
    return name.equals(other.name) && description.equals(other.description)
        && initialState.equals(other.initialState) && states.equals(other.states)
        && transitions.equals(other.transitions) && choicePoints.equals(other.choicePoints)
        && timers.equals(other.timers) && declaredEvents.equals(other.declaredEvents)
        && variables.equals(other.variables);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, description, initialState, states, transitions, choicePoints,
        timers, declaredEvents, variables);
  }

  @Override
  public String toString() {
    return "FsmModel [name=" + name + ", initialState=" + initialState.orElse("<none>")
        + ", states=" + states.size() + ", transitions=" + transitions.size() + ", choicePoints="
        + choicePoints.size() + ", timers=" + timers.size() + "]";
  }
}
