package com.github.fsmcodegen.codegen;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

import com.github.fsmcodegen.FsmException;
import com.github.fsmcodegen.model.ChoicePoint;
import com.github.fsmcodegen.model.FsmModel;
import com.github.fsmcodegen.model.State;
import com.github.fsmcodegen.model.Transition;

/**
 * Dispatch table keyed by {@code (state, event)}. Each row lists the cases that may handle the
 * event in that state, in the order dispatch tries them:
 *
 * 1. internal transitions of the state<br>
 * 2. external transitions of the state, in declaration order<br>
 * 3. wildcard fault rules ({@code * --> Target}), not expanded into their own target, into final
 * states or into the terminal pseudostate<br>
 * 4. wildcard internal handlers ({@code * --> *})<br>
 *
 * A state's own rule for an event shadows a wildcard rule for that event. The first case that is
 * unconditional or whose guard holds wins. Transitions without an event are
 * completion transitions: they are kept for documentation but never land in a row.
 */
public final class TransitionTable {
  public enum CaseKind {
    WILDCARD, INTERNAL, GUARDED, EXTERNAL;
  }

  public static final class DispatchCase {
    private final CaseKind kind;
    private final Transition transition;
    private final Optional<ChoicePoint> choicePoint;

    private DispatchCase(final CaseKind kind, final Transition transition,
        final Optional<ChoicePoint> choicePoint) {
      this.kind = kind;
      this.transition = transition;
      this.choicePoint = choicePoint;
    }

    public CaseKind getKind() {
      return kind;
    }

    public Transition getTransition() {
      return transition;
    }

    public Optional<ChoicePoint> getChoicePoint() {
      return choicePoint;
    }

    /**
     * Whether the state changes when this case fires.
     */
    public boolean isExternal() {
      return !transition.isInternal() && !Transition.ANY_STATE.equals(transition.getTarget());
    }

    /**
     * A wildcard rule into a specific state, counted as a fault by the interrupt target.
     */
    public boolean isFault() {
      return kind == CaseKind.WILDCARD && isExternal();
    }

    /**
     * Unconditional cases always fire, so nothing after them in a row is reachable. A choice
     * without an else branch may find no satisfied branch and is therefore conditional.
     */
    public boolean isUnconditional() {
      if (transition.isGuarded()) {
        return false;
      }
      if (choicePoint.isPresent()) {
        return choicePoint.get().getBranches().stream().anyMatch(branch -> branch.isElse());
      }
      return true;
    }

    @Override
    public String toString() {
      return kind + ":" + Labels.edge(transition);
    }
  }

  public static final class Row {
    private final String state;
    private final String event;
    private final List<DispatchCase> cases;

    private Row(final String state, final String event, final List<DispatchCase> cases) {
      this.state = state;
      this.event = event;
      this.cases = Collections.unmodifiableList(cases);
    }

    public String getState() {
      return state;
    }

    public String getEvent() {
      return event;
    }

    public List<DispatchCase> getCases() {
      return cases;
    }

    @Override
    public String toString() {
      return "(" + state + ", " + event + ") " + cases;
    }
  }

  // state name -> event name -> row, both in dispatch order
  private final Map<String, Map<String, Row>> rows;
  private final List<Transition> completionTransitions;

  private TransitionTable(final Map<String, Map<String, Row>> rows,
      final List<Transition> completionTransitions) {
    this.rows = rows;
    this.completionTransitions = Collections.unmodifiableList(completionTransitions);
  }

  /**
   * Builds the table for a validated model. Failure here means the model references something
   * validation should have rejected.
   */
  public static TransitionTable build(final FsmModel model) throws FsmException {
    final Map<String, Map<String, List<DispatchCase>>> cases = new LinkedHashMap<>();
    for (State state : model.getStates()) {
      cases.put(state.getName(), new TreeMap<>());
    }
    final List<Transition> completions = new ArrayList<>();
    final List<Transition> wildcardFaults = new ArrayList<>();
    final List<Transition> wildcardInternals = new ArrayList<>();
    final List<Transition> externals = new ArrayList<>();
    for (Transition transition : model.getTransitions()) {
      if (Transition.INITIAL_PSEUDOSTATE.equals(transition.getSource())) {
        continue;
      }
      if (!transition.getEvent().isPresent()) {
        completions.add(transition);
      } else if (transition.isWildcard()) {
        if (transition.isInternal() || Transition.ANY_STATE.equals(transition.getTarget())) {
          wildcardInternals.add(transition);
        } else {
          wildcardFaults.add(transition);
        }
      } else {
        externals.add(transition);
      }
    }
    for (State state : model.getStates()) {
      for (Transition internal : state.getInternalTransitions()) {
        if (internal.getEvent().isPresent()) {
          add(cases, state.getName(), internal,
              new DispatchCase(CaseKind.INTERNAL, internal, Optional.empty()));
        }
      }
    }
    for (Transition external : externals) {
      final CaseKind kind = external.isInternal() ? CaseKind.INTERNAL
          : external.isGuarded() ? CaseKind.GUARDED : CaseKind.EXTERNAL;
      add(cases, external.getSource(), external,
          new DispatchCase(kind, external, choiceOf(model, external)));
    }
    for (Transition fault : wildcardFaults) {
      final Optional<ChoicePoint> choice = choiceOf(model, fault);
      for (State state : model.getStates()) {
        if (state.isFinal() || state.getName().equals(fault.getTarget())) {
          continue;
        }
        add(cases, state.getName(), fault, new DispatchCase(CaseKind.WILDCARD, fault, choice));
      }
    }
    for (Transition handler : wildcardInternals) {
      for (State state : model.getStates()) {
        add(cases, state.getName(), handler,
            new DispatchCase(CaseKind.WILDCARD, handler, Optional.empty()));
      }
    }
    final Map<String, Map<String, Row>> rows = new LinkedHashMap<>();
    for (Map.Entry<String, Map<String, List<DispatchCase>>> state : cases.entrySet()) {
      final Map<String, Row> stateRows = new LinkedHashMap<>();
      for (Map.Entry<String, List<DispatchCase>> event : state.getValue().entrySet()) {
        stateRows.put(event.getKey(), new Row(state.getKey(), event.getKey(), event.getValue()));
      }
      rows.put(state.getKey(), Collections.unmodifiableMap(stateRows));
    }
    return new TransitionTable(Collections.unmodifiableMap(rows), completions);
  }

  private static void add(final Map<String, Map<String, List<DispatchCase>>> cases,
      final String stateName, final Transition transition, final DispatchCase dispatchCase)
      throws FsmException {
    final Map<String, List<DispatchCase>> stateCases = cases.get(stateName);
    if (stateCases == null) {
      throw new FsmException(FsmException.Code.GENERATION_FAILURE, "Transition '"
          + Labels.edge(transition) + "' leaves state '" + stateName
          + "' which is not part of the model");
    }
    stateCases.computeIfAbsent(transition.getEvent().get().getName(), event -> new ArrayList<>())
        .add(dispatchCase);
  }

  private static Optional<ChoicePoint> choiceOf(final FsmModel model, final Transition transition)
      throws FsmException {
    if (!transition.targetsChoice()) {
      return Optional.empty();
    }
    final Optional<ChoicePoint> choice = model.findChoicePoint(transition.choiceName().get());
    if (!choice.isPresent()) {
      throw new FsmException(FsmException.Code.GENERATION_FAILURE,
          "Transition '" + Labels.edge(transition) + "' leads into an unknown choice point");
    }
    return choice;
  }

  /**
   * Rows of one state in event name order; empty for states that handle nothing.
   */
  public List<Row> rowsOf(final String state) {
    final Map<String, Row> stateRows = rows.get(state);
    return stateRows == null ? Collections.emptyList() : new ArrayList<>(stateRows.values());
  }

  public Optional<Row> row(final String state, final String event) {
    final Map<String, Row> stateRows = rows.get(state);
    return stateRows == null ? Optional.empty() : Optional.ofNullable(stateRows.get(event));
  }

  public List<Transition> getCompletionTransitions() {
    return completionTransitions;
  }
}
