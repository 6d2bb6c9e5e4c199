package com.github.fsmcodegen.codegen;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.github.fsmcodegen.FsmException;
import com.github.fsmcodegen.model.Action;
import com.github.fsmcodegen.model.ChoiceBranch;
import com.github.fsmcodegen.model.ChoicePoint;
import com.github.fsmcodegen.model.Event;
import com.github.fsmcodegen.model.FsmModel;
import com.github.fsmcodegen.model.Guard;
import com.github.fsmcodegen.model.State;
import com.github.fsmcodegen.model.Timer;
import com.github.fsmcodegen.model.Transition;

/**
 * The capability interface a host has to implement: one boolean method per distinct guard, one
 * void method per distinct action, and timer hooks when any state starts or stops a timer or a
 * timer has an auto-start state.
 *
 * Identifier guards keep their name ({@code is_valid_code} becomes {@code isValidCode()}), a
 * negated identifier calls the same method negated, and any other expression gets a name spelled
 * out from its tokens ({@code reading > 10000} becomes {@code readingGt10000()}).
 */
final class ActionContract {
  static final String startTimerMethod = "startTimer";
  static final String stopTimerMethod = "stopTimer";

  private static final Pattern identifier = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
  private static final Pattern token = Pattern
      .compile("([A-Za-z_][A-Za-z0-9_]*)|([0-9]+(?:\\.[0-9]+)?)|(>=|<=|==|!=|&&|\\|\\||[<>!])");
  private static final Map<String, String> operatorWords = new HashMap<>();
  static {
    operatorWords.put(">", "Gt");
    operatorWords.put("<", "Lt");
    operatorWords.put(">=", "Ge");
    operatorWords.put("<=", "Le");
    operatorWords.put("==", "Eq");
    operatorWords.put("!=", "Ne");
    operatorWords.put("!", "Not");
    operatorWords.put("&&", "And");
    operatorWords.put("||", "Or");
  }

  static final class GuardMethod {
    private final String name;
    private final String expression;
    private final Optional<String> payloadParameter;

    private GuardMethod(final String name, final String expression,
        final Optional<String> payloadParameter) {
      this.name = name;
      this.expression = expression;
      this.payloadParameter = payloadParameter;
    }

    String getName() {
      return name;
    }

    String getExpression() {
      return expression;
    }

    Optional<String> getPayloadParameter() {
      return payloadParameter;
    }
  }

  static final class ActionMethod {
    private final String actionName;
    private final String name;
    private final boolean varargs;

    private ActionMethod(final String actionName, final String name, final boolean varargs) {
      this.actionName = actionName;
      this.name = name;
      this.varargs = varargs;
    }

    String getActionName() {
      return actionName;
    }

    String getName() {
      return name;
    }

    boolean isVarargs() {
      return varargs;
    }
  }

  // keyed by guard expression with the negation and whitespace stripped
  private final Map<String, GuardMethod> guards;
  private final Map<String, ActionMethod> actions;
  private final boolean timerControl;

  private ActionContract(final Map<String, GuardMethod> guards,
      final Map<String, ActionMethod> actions, final boolean timerControl) {
    this.guards = guards;
    this.actions = actions;
    this.timerControl = timerControl;
  }

  /**
   * Collects the contract of a model. With {@code payloadAware} set, guards mentioning the payload
   * parameter of a declared event take that payload as a {@code long} argument.
   */
  static ActionContract of(final FsmModel model, final boolean payloadAware)
      throws FsmException {
    final Set<String> payloadNames = new TreeSet<>();
    if (payloadAware) {
      for (Event event : model.getDeclaredEvents()) {
        event.getPayloadName().ifPresent(payloadNames::add);
      }
    }
    final List<Guard> guardUses = new ArrayList<>();
    final List<Action> allActions = new ArrayList<>();
    for (State state : model.getStates()) {
      allActions.addAll(state.getEntryActions());
      allActions.addAll(state.getExitActions());
      for (Transition internal : state.getInternalTransitions()) {
        collect(internal, guardUses, allActions);
      }
    }
    for (Transition transition : model.getTransitions()) {
      collect(transition, guardUses, allActions);
    }
    for (ChoicePoint choicePoint : model.getChoicePoints()) {
      for (ChoiceBranch branch : choicePoint.getBranches()) {
        if (!branch.isElse()) {
          guardUses.add(branch.getGuard());
        }
        branch.getAction().ifPresent(allActions::add);
      }
    }
    // timer markers and auto-started timers go through the timer hooks, not a method of their own
    boolean timerControl = false;
    for (Timer timer : model.getTimers()) {
      timerControl |= timer.getAutoStartState().isPresent();
    }
    final List<Action> actionUses = new ArrayList<>();
    for (Action action : allActions) {
      if (action.isTimerControl()) {
        timerControl = true;
      } else {
        actionUses.add(action);
      }
    }

    final Map<String, String> owners = new HashMap<>();
    if (timerControl) {
      owners.put(startTimerMethod, "timer hook");
      owners.put(stopTimerMethod, "timer hook");
    }
    final Map<String, GuardMethod> guards = new TreeMap<>();
    for (Guard guard : guardUses) {
      final String key = key(guard.getExpression());
      if (guards.containsKey(key)) {
        continue;
      }
      final String name = identifier.matcher(key).matches() ? Names.lowerCamel(key) : spell(key);
      claim(owners, name, "guard [" + guard.getExpression() + "]");
      guards.put(key, new GuardMethod(name, key, payloadParameter(key, payloadNames)));
    }
    final Map<String, Boolean> varargs = new TreeMap<>();
    for (Action action : actionUses) {
      varargs.merge(action.getName(), action.hasParams(), Boolean::logicalOr);
    }
    final Map<String, ActionMethod> actions = new TreeMap<>();
    for (Map.Entry<String, Boolean> action : varargs.entrySet()) {
      final String name = Names.lowerCamel(action.getKey());
      claim(owners, name, "action '" + action.getKey() + "'");
      actions.put(action.getKey(), new ActionMethod(action.getKey(), name, action.getValue()));
    }
    return new ActionContract(guards, actions, timerControl);
  }

  private static void collect(final Transition transition, final List<Guard> guardUses,
      final List<Action> actionUses) {
    transition.getGuard().ifPresent(guardUses::add);
    transition.getAction().ifPresent(actionUses::add);
    transition.getGuardRejectedAction().ifPresent(actionUses::add);
  }

  private static void claim(final Map<String, String> owners, final String name,
      final String owner) throws FsmException {
    final String previous = owners.putIfAbsent(name, owner);
    if (previous != null && !previous.equals(owner)) {
      throw new FsmException(FsmException.Code.GENERATION_FAILURE,
          "The " + previous + " and the " + owner + " both map to the method '" + name + "'");
    }
  }

  static String key(final String expression) {
    final String compact = expression.replaceAll("\\s+", "");
    if (compact.startsWith("!") && identifier.matcher(compact.substring(1)).matches()) {
      return compact.substring(1);
    }
    return compact;
  }

  static boolean isNegated(final String expression) {
    final String compact = expression.replaceAll("\\s+", "");
    return compact.startsWith("!") && identifier.matcher(compact.substring(1)).matches();
  }

  /**
   * Spells an expression out as a method name, one word per token.
   */
  static String spell(final String expression) {
    final StringBuilder name = new StringBuilder();
    final Matcher matcher = token.matcher(expression);
    while (matcher.find()) {
      final List<String> pieces = new ArrayList<>();
      if (matcher.group(1) != null) {
        pieces.addAll(Names.words(matcher.group(1)));
      } else if (matcher.group(2) != null) {
        pieces.add(matcher.group(2).replace('.', 'p'));
      } else {
        pieces.add(operatorWords.get(matcher.group(3)));
      }
      for (String piece : pieces) {
        name.append(name.length() == 0 ? piece.toLowerCase()
            : Character.toUpperCase(piece.charAt(0)) + piece.substring(1).toLowerCase());
      }
    }
    if (name.length() == 0) {
      return "guard";
    }
    return Character.isDigit(name.charAt(0)) ? "is" + name : name.toString();
  }

  private static Optional<String> payloadParameter(final String key,
      final Set<String> payloadNames) {
    final List<String> mentioned = new ArrayList<>();
    final Matcher matcher = identifier.matcher(key);
    while (matcher.find()) {
      if (payloadNames.contains(matcher.group()) && !mentioned.contains(matcher.group())) {
        mentioned.add(matcher.group());
      }
    }
    if (mentioned.isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(mentioned.size() == 1 ? Names.lowerCamel(mentioned.get(0)) : "payload");
  }

  GuardMethod guard(final Guard guard) {
    return guards.get(key(guard.getExpression()));
  }

  ActionMethod action(final Action action) {
    return actions.get(action.getName());
  }

  Collection<GuardMethod> guards() {
    final List<GuardMethod> sorted = new ArrayList<>(guards.values());
    sorted.sort((left, right) -> left.getName().compareTo(right.getName()));
    return Collections.unmodifiableList(sorted);
  }

  Collection<ActionMethod> actions() {
    final List<ActionMethod> sorted = new ArrayList<>(actions.values());
    sorted.sort((left, right) -> left.getName().compareTo(right.getName()));
    return Collections.unmodifiableList(sorted);
  }

  boolean hasTimerControl() {
    return timerControl;
  }
}
