package com.github.fsmcodegen.model;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Collects every structural problem of a model in one pass. Nothing here short-circuits: each check
 * runs regardless of what earlier checks found.
 */
final class ModelValidator {
  private final FsmModel model;
  private final Set<String> stateNames = new HashSet<>();
  private final List<String> problems = new ArrayList<>();

  ModelValidator(final FsmModel model) {
    this.model = model;
    for (State state : model.getStates()) {
      stateNames.add(state.getName());
    }
  }

  List<String> validate() {
    checkInitialState();
    checkDuplicateStates();
    for (Transition transition : model.getTransitions()) {
      checkSource(transition);
      checkTarget(transition);
      checkPayloadUse(transition);
    }
    checkInternalTransitions();
    checkChoicePoints();
    checkTimers();
    checkUnconditionalHandlers();
    checkSubMachines();
    return problems;
  }

  private void checkInitialState() {
    if (!model.getInitialState().isPresent()) {
      problems.add("No initial state defined");
    } else if (!stateNames.contains(model.getInitialState().get())) {
      problems.add("Initial state '" + model.getInitialState().get() + "' not found");
    }
  }

  private void checkDuplicateStates() {
    final Set<String> seen = new HashSet<>();
    for (State state : model.getStates()) {
      if (!seen.add(state.getName())) {
        problems.add("Duplicate state '" + state.getName() + "'");
      }
    }
  }

  private void checkSource(final Transition transition) {
    final String source = transition.getSource();
    if (Transition.INITIAL_PSEUDOSTATE.equals(source) || Transition.ANY_STATE.equals(source)) {
      return;
    }
    if (!stateNames.contains(source)) {
      problems.add("Transition source state '" + source + "' not found");
    }
  }

  private void checkTarget(final Transition transition) {
    final String target = transition.getTarget();
    if (Transition.INITIAL_PSEUDOSTATE.equals(target)) {
      return;
    }
    if (Transition.ANY_STATE.equals(target)) {
      if (!transition.isWildcard()) {
        problems.add("Transition from '" + transition.getSource()
            + "' targets '*' but only wildcard transitions may");
      }
      return;
    }
    if (transition.targetsChoice()) {
      final String choiceName = transition.choiceName().get();
      if (!model.findChoicePoint(choiceName).isPresent()) {
        problems.add("Transition target choice point '" + choiceName + "' not found");
      }
      return;
    }
    if (!stateNames.contains(target)) {
      problems.add("Transition target state '" + target + "' not found");
    }
  }

  // guard-rejected actions and assignments only make sense with an event and a guard behind them
  private void checkPayloadUse(final Transition transition) {
    final String where = describe(transition);
    if (transition.getGuardRejectedAction().isPresent() && !transition.isGuarded()) {
      problems.add(where + " declares a guard-rejected action but has no guard");
    }
    final Optional<String> payload = transition.getEvent()
        .flatMap(event -> model.findDeclaredEvent(event.getName()))
        .flatMap(Event::getPayloadName);
    for (Assignment assignment : transition.getAssignments()) {
      if (!model.findVariable(assignment.getVariable()).isPresent()) {
        problems.add(where + " assigns undeclared variable '" + assignment.getVariable() + "'");
      }
      if (!assignment.isLiteral()
          && !(payload.isPresent() && payload.get().equals(assignment.getValue()))) {
        problems.add(where + " assigns '" + assignment.getValue() + "' to '"
            + assignment.getVariable()
            + "' which is neither an integer nor the payload of the triggering event");
      }
    }
  }

  private void checkInternalTransitions() {
    for (State state : model.getStates()) {
      for (Transition internal : state.getInternalTransitions()) {
        if (!internal.getEvent().isPresent()) {
          problems.add("Internal transition of state '" + state.getName() + "' has no event");
        }
        checkPayloadUse(internal);
      }
    }
  }

  private void checkChoicePoints() {
    final Set<String> seen = new HashSet<>();
    for (ChoicePoint choicePoint : model.getChoicePoints()) {
      final String name = choicePoint.getName();
      if (!seen.add(name)) {
        problems.add("Duplicate choice point '" + name + "'");
      }
      final List<ChoiceBranch> branches = choicePoint.getBranches();
      if (branches.isEmpty()) {
        problems.add("Choice point '" + name + "' has no branches");
        continue;
      }
      int elseCount = 0;
      for (int i = 0; i < branches.size(); i++) {
        final ChoiceBranch branch = branches.get(i);
        if (branch.isElse()) {
          elseCount++;
          if (i != branches.size() - 1 && elseCount == 1) {
            problems.add("Choice point '" + name
                + "' has an else branch before its last branch, later branches are unreachable");
          }
        }
        if (!Transition.INITIAL_PSEUDOSTATE.equals(branch.getTarget())
            && !stateNames.contains(branch.getTarget())) {
          problems.add("Choice point '" + name + "' branch target state '" + branch.getTarget()
              + "' not found");
        }
      }
      if (elseCount > 1) {
        problems.add("Choice point '" + name + "' has more than one else branch");
      }
    }
  }

  private void checkTimers() {
    final Set<String> seen = new HashSet<>();
    for (Timer timer : model.getTimers()) {
      if (!seen.add(timer.getName())) {
        problems.add("Duplicate timer '" + timer.getName() + "'");
      }
      if (timer.getDurationMillis() <= 0) {
        problems.add("Timer '" + timer.getName() + "' has non-positive duration "
            + timer.getDurationMillis());
      }
      if (timer.getAutoStartState().isPresent()
          && !stateNames.contains(timer.getAutoStartState().get())) {
        problems.add("Timer '" + timer.getName() + "' auto-start state '"
            + timer.getAutoStartState().get() + "' not found");
      }
    }
    for (State state : model.getStates()) {
      final List<Action> markers = new ArrayList<>(state.getEntryActions());
      markers.addAll(state.getExitActions());
      for (Action action : markers) {
        final Optional<String> timerName =
            action.startedTimer().isPresent() ? action.startedTimer() : action.stoppedTimer();
        if (timerName.isPresent() && !model.findTimer(timerName.get()).isPresent()) {
          problems.add("State '" + state.getName() + "' references undeclared timer '"
              + timerName.get() + "'");
        }
      }
    }
  }

  // an unguarded handler always fires, so a second one for the same (state, event) is dead
  private void checkUnconditionalHandlers() {
    final Map<String, Integer> counts = new LinkedHashMap<>();
    for (Transition transition : model.getTransitions()) {
      countUnconditional(counts, transition);
    }
    for (State state : model.getStates()) {
      for (Transition internal : state.getInternalTransitions()) {
        countUnconditional(counts, internal);
      }
    }
    for (Map.Entry<String, Integer> entry : counts.entrySet()) {
      if (entry.getValue() > 1) {
        final String[] key = entry.getKey().split("\u0000", 2);
        problems.add("State '" + key[0] + "' has more than one unconditional handler for event '"
            + key[1] + "'");
      }
    }
  }

  private static void countUnconditional(final Map<String, Integer> counts,
      final Transition transition) {
    if (transition.isWildcard() || transition.isGuarded() || !transition.getEvent().isPresent()
        || Transition.INITIAL_PSEUDOSTATE.equals(transition.getSource())) {
      return;
    }
    final String key =
        transition.getSource() + "\u0000" + transition.getEvent().get().getName();
    counts.merge(key, 1, Integer::sum);
  }

  private void checkSubMachines() {
    for (State state : model.getStates()) {
      if (state.getSubMachine().isPresent()) {
        for (String problem : new ModelValidator(state.getSubMachine().get()).validate()) {
          problems.add("State '" + state.getName() + "': " + problem);
        }
      }
    }
  }

  private static String describe(final Transition transition) {
    return "Transition " + transition.getSource() + " --> " + transition.getTarget()
        + transition.getEvent().map(event -> " on '" + event.getName() + "'").orElse("");
  }
}
