package com.github.fsmcodegen.codegen;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.regex.Pattern;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.fsmcodegen.FsmException;
import com.github.fsmcodegen.GeneratorConfiguration;
import com.github.fsmcodegen.codegen.ActionContract.ActionMethod;
import com.github.fsmcodegen.codegen.ActionContract.GuardMethod;
import com.github.fsmcodegen.codegen.TransitionTable.DispatchCase;
import com.github.fsmcodegen.codegen.TransitionTable.Row;
import com.github.fsmcodegen.model.Action;
import com.github.fsmcodegen.model.ChoiceBranch;
import com.github.fsmcodegen.model.ChoicePoint;
import com.github.fsmcodegen.model.Event;
import com.github.fsmcodegen.model.FsmModel;
import com.github.fsmcodegen.model.Guard;
import com.github.fsmcodegen.model.State;
import com.github.fsmcodegen.model.Timer;
import com.github.fsmcodegen.model.Transition;
import com.github.fsmcodegen.model.Variable;

/**
 * Emission shared by every java target: the state, event, result and timer enums, the actions
 * interface, the two level dispatch switch and the entry/exit switches. Targets add their own
 * members (queues, producer handles, extended state) through the hooks.
 *
 * Dispatch is written as one method per state switching on the event. Within a case the dispatch
 * cases of the table row are written in order as guarded blocks that return; an unconditional case
 * ends the row, and a row that runs out of cases reports its guards as rejected.
 */
abstract class AbstractJavaGenerator implements CodeGenerator {
  private static final Logger logger =
      LogManager.getLogger(AbstractJavaGenerator.class.getSimpleName());
  private static final Pattern numberPattern = Pattern.compile("-?[0-9]+(\\.[0-9]+)?");

  protected final GeneratorConfiguration configuration;

  AbstractJavaGenerator(final GeneratorConfiguration configuration) {
    this.configuration = Objects.requireNonNull(configuration, "configuration");
  }

  /**
   * Everything derived from the model that the writers need, computed once per generate call.
   */
  static final class Unit {
    final FsmModel model;
    final String className;
    final TransitionTable table;
    final ActionContract contract;
    final Map<String, String> stateIds;
    final List<Event> events;
    final Map<String, String> eventIds;
    final Map<String, String> timerIds;
    final Map<String, String> variableIds;

    private Unit(final FsmModel model, final String className, final TransitionTable table,
        final ActionContract contract, final Map<String, String> stateIds,
        final List<Event> events, final Map<String, String> eventIds,
        final Map<String, String> timerIds, final Map<String, String> variableIds) {
      this.model = model;
      this.className = className;
      this.table = table;
      this.contract = contract;
      this.stateIds = stateIds;
      this.events = events;
      this.eventIds = eventIds;
      this.timerIds = timerIds;
      this.variableIds = variableIds;
    }

    String state(final String stateName) {
      return stateIds.get(stateName);
    }

    String event(final String eventName) {
      return eventIds.get(eventName);
    }

    Optional<String> payloadOf(final String eventName) {
      for (Event event : events) {
        if (event.getName().equals(eventName)) {
          return event.getPayloadName();
        }
      }
      return Optional.empty();
    }

    String initialState() {
      return state(model.getInitialState().get());
    }
  }

  @Override
  public String className(final FsmModel model) {
    final String base = Names.upperCamel(model.getName());
    final String suffix = getTarget().getClassSuffix();
    return base.endsWith(suffix) ? base : base + suffix;
  }

  @Override
  public final String generate(final FsmModel model) throws FsmException {
    Objects.requireNonNull(model, "model");
    if (!model.getInitialState().isPresent()) {
      throw new FsmException(FsmException.Code.GENERATION_FAILURE,
          "Fsm '" + model.getName() + "' has no initial state to construct the machine in");
    }
    final Unit unit = unit(model);
    final JavaWriter out = new JavaWriter();
    writeHeader(out, unit);
    writeClassComment(out, unit);
    out.line("public final class " + unit.className + " {");
    writeTransitionComment(out, unit);
    writeStateEnum(out, unit);
    out.blank();
    writeEventTypes(out, unit);
    out.blank();
    writeDispatchResult(out);
    out.blank();
    if (!model.getTimers().isEmpty()) {
      writeTimerEnum(out, unit);
      out.blank();
    }
    writeActions(out, unit);
    out.blank();
    writeMembers(out, unit);
    out.blank();
    writeDispatch(out, unit);
    out.blank();
    writeStateActions(out, unit, true);
    out.blank();
    writeStateActions(out, unit, false);
    writeTypes(out, unit);
    out.line("}");
    final String source = out.toString();
    logger.debug("Generated {} for fsm '{}', {} chars", unit.className, model.getName(),
        source.length());
    return source;
  }

  private Unit unit(final FsmModel model) throws FsmException {
    final TransitionTable table = TransitionTable.build(model);
    final ActionContract contract = ActionContract.of(model, isPayloadAware());

    final List<String> stateNames = new ArrayList<>();
    for (State state : model.getStates()) {
      stateNames.add(state.getName());
    }
    if (targetsTerminal(model)) {
      stateNames.add(Transition.INITIAL_PSEUDOSTATE);
    }
    final Map<String, String> stateIds = Names.assign(stateNames, Names::constant, "states");

    final TreeMap<String, Event> universe = new TreeMap<>();
    for (Event event : model.collectEvents()) {
      universe.putIfAbsent(event.getName(), event);
    }
    for (Event event : model.getDeclaredEvents()) {
      universe.putIfAbsent(event.getName(), event);
    }
    for (Timer timer : model.getTimers()) {
      universe.putIfAbsent(timer.getEvent().getName(), timer.getEvent());
    }
    for (String reserved : reservedEvents()) {
      universe.putIfAbsent(reserved, new Event(reserved));
    }
    final List<Event> events = new ArrayList<>(universe.values());
    final Map<String, String> eventIds =
        Names.assign(universe.keySet(), Names::constant, "events");

    final List<String> timerNames = new ArrayList<>();
    for (Timer timer : model.getTimers()) {
      timerNames.add(timer.getName());
    }
    final Map<String, String> timerIds = Names.assign(timerNames, Names::constant, "timers");

    final List<String> variableNames = new ArrayList<>();
    for (Variable variable : model.getVariables()) {
      variableNames.add(variable.getName());
    }
    final Map<String, String> variableIds =
        Names.assign(variableNames, Names::lowerCamel, "variables");
    checkMemberNames(variableIds);

    return new Unit(model, className(model), table, contract, stateIds,
        Collections.unmodifiableList(events), eventIds, timerIds, variableIds);
  }

  private static boolean targetsTerminal(final FsmModel model) {
    for (Transition transition : model.getTransitions()) {
      if (transition.targetsTerminal()) {
        return true;
      }
    }
    for (ChoicePoint choicePoint : model.getChoicePoints()) {
      for (ChoiceBranch branch : choicePoint.getBranches()) {
        if (Transition.INITIAL_PSEUDOSTATE.equals(branch.getTarget())) {
          return true;
        }
      }
    }
    return false;
  }

  // hooks

  /**
   * Whether events carry payloads and the machine carries extended state.
   */
  protected boolean isPayloadAware() {
    return false;
  }

  /**
   * Events every generated unit of this target knows, whether or not the model mentions them.
   */
  protected List<String> reservedEvents() {
    return Collections.emptyList();
  }

  /**
   * Name of the nested enum listing the events.
   */
  protected String eventEnumName() {
    return "Event";
  }

  /**
   * Expression the per-state dispatch methods switch on.
   */
  protected String eventSwitchSubject() {
    return "event";
  }

  protected String payloadExpression() {
    throw new UnsupportedOperationException(getTarget() + " events carry no payload");
  }

  protected String dispatchVisibility() {
    return "private";
  }

  protected abstract Set<String> imports();

  protected abstract List<String> classDocumentation(Unit unit);

  /**
   * Fields, constructors and the public surface of the machine.
   */
  protected abstract void writeMembers(JavaWriter out, Unit unit);

  /**
   * Nested types written after all members.
   */
  protected void writeTypes(final JavaWriter out, final Unit unit) {}

  /**
   * Extra statements run when a wildcard fault rule changes the state.
   */
  protected void writeFaultRecorded(final JavaWriter out) {}

  protected void writeAssignments(final JavaWriter out, final Unit unit,
      final Transition transition) {}

  /**
   * A reserved event handled as a no-op in every state that has no rule for it.
   */
  protected Optional<String> noOpEvent() {
    return Optional.empty();
  }

  /**
   * Fails when an extended-state variable would shadow a generated member.
   */
  protected void checkMemberNames(final Map<String, String> variableIds) throws FsmException {}

  // shared writers

  private void writeHeader(final JavaWriter out, final Unit unit) {
    out.line("// Generated from fsm '" + Names.commentSafe(unit.model.getName()) + "' for the "
        + getTarget() + " target. Do not edit by hand.");
    if (configuration.getPackageName().isPresent()) {
      out.line("package " + configuration.getPackageName().get() + ";");
    }
    out.blank();
    for (String type : new TreeSet<>(imports())) {
      out.line("import " + type + ";");
    }
    out.blank();
  }

  private void writeClassComment(final JavaWriter out, final Unit unit) {
    out.line("/**");
    out.line(" * " + Names.commentSafe(
        unit.model.getDescription().orElse("State machine " + unit.model.getName() + ".")));
    for (String line : classDocumentation(unit)) {
      out.line(line.isEmpty() ? " *" : " * " + line);
    }
    out.line(" */");
  }

  private void writeTransitionComment(final JavaWriter out, final Unit unit) {
    final FsmModel model = unit.model;
    out.line("// [*] --> " + Names.commentSafe(model.getInitialState().get()));
    for (Transition transition : model.getTransitions()) {
      out.line("// " + Names.commentSafe(Labels.edge(transition)));
    }
    for (State state : model.getStates()) {
      for (Transition internal : state.getInternalTransitions()) {
        out.line("// " + Names.commentSafe(state.getName() + " (internal) : "
            + Labels.of(internal)));
      }
    }
    for (ChoicePoint choicePoint : model.getChoicePoints()) {
      for (ChoiceBranch branch : choicePoint.getBranches()) {
        out.line("// <<" + Names.commentSafe(choicePoint.getName()) + ">> "
            + Names.commentSafe(Labels.of(branch)));
      }
    }
    for (Transition completion : unit.table.getCompletionTransitions()) {
      out.line("// not dispatched, completion transition without event: "
          + Names.commentSafe(Labels.edge(completion)));
    }
    out.blank();
  }

  private void writeStateEnum(final JavaWriter out, final Unit unit) {
    out.line("public enum State {");
    writeConstants(out, new ArrayList<>(unit.stateIds.values()));
    out.line("}");
  }

  /**
   * The event enum. Targets with richer events write their own types around it.
   */
  protected void writeEventTypes(final JavaWriter out, final Unit unit) {
    out.line("public enum " + eventEnumName() + " {");
    writeConstants(out, new ArrayList<>(unit.eventIds.values()));
    out.line("}");
  }

  private static void writeConstants(final JavaWriter out, final List<String> constants) {
    for (int i = 0; i < constants.size(); i++) {
      out.line(constants.get(i) + (i == constants.size() - 1 ? ";" : ","));
    }
  }

  private void writeDispatchResult(final JavaWriter out) {
    out.line("public enum DispatchResult {");
    out.line("// the state changed");
    out.line("TRANSITIONED,");
    out.line("// an internal transition ran, the state did not change");
    out.line("HANDLED,");
    out.line("// a guard evaluated false, nothing but its rejection action ran");
    out.line("GUARD_REJECTED,");
    out.line("// no rule for this event in the current state");
    out.line("NOT_HANDLED;");
    out.line("}");
  }

  private void writeTimerEnum(final JavaWriter out, final Unit unit) {
    final String eventType = eventEnumName();
    out.line("/**");
    out.line(" * Timers the host runs on behalf of the machine. Expiry is posted back as the");
    out.line(" * timer's event.");
    out.line(" */");
    out.line("public enum Timer {");
    final List<Timer> timers = unit.model.getTimers();
    for (int i = 0; i < timers.size(); i++) {
      final Timer timer = timers.get(i);
      out.line(unit.timerIds.get(timer.getName()) + "(" + timer.getDurationMillis() + "L, "
          + timer.isPeriodic() + ", " + eventType + "." + unit.event(timer.getEvent().getName())
          + ")" + (i == timers.size() - 1 ? ";" : ","));
    }
    out.blank();
    out.line("private final long durationMillis;");
    out.line("private final boolean periodic;");
    out.line("private final " + eventType + " event;");
    out.blank();
    out.line("private Timer(final long durationMillis, final boolean periodic, final " + eventType
        + " event) {");
    out.line("this.durationMillis = durationMillis;");
    out.line("this.periodic = periodic;");
    out.line("this.event = event;");
    out.line("}");
    out.blank();
    out.line("public long durationMillis() {");
    out.line("return durationMillis;");
    out.line("}");
    out.blank();
    out.line("public boolean periodic() {");
    out.line("return periodic;");
    out.line("}");
    out.blank();
    out.line("public " + eventType + " event() {");
    out.line("return event;");
    out.line("}");
    out.line("}");
  }

  private void writeActions(final JavaWriter out, final Unit unit) {
    out.line("/**");
    out.line(" * Everything the machine needs from its host. Guards must not have side effects.");
    out.line(" */");
    out.line("public interface Actions {");
    boolean first = true;
    for (GuardMethod guard : unit.contract.guards()) {
      if (!first) {
        out.blank();
      }
      first = false;
      out.line("// [" + Names.commentSafe(guard.getExpression()) + "]");
      out.line("boolean " + guard.getName() + "("
          + guard.getPayloadParameter().map(parameter -> "long " + parameter).orElse("") + ");");
    }
    for (ActionMethod action : unit.contract.actions()) {
      if (!first) {
        out.blank();
      }
      first = false;
      out.line("void " + action.getName() + "(" + (action.isVarargs() ? "Object... args" : "")
          + ");");
    }
    if (unit.contract.hasTimerControl()) {
      if (!first) {
        out.blank();
      }
      out.line("void " + ActionContract.startTimerMethod + "(Timer timer);");
      out.blank();
      out.line("void " + ActionContract.stopTimerMethod + "(Timer timer);");
    }
    out.line("}");
  }

  /**
   * Constructor statements putting the machine in its initial state, entry actions included.
   */
  protected final void writeInitialEntry(final JavaWriter out, final Unit unit) {
    out.line("this.state = State." + unit.initialState() + ";");
    out.line("enter(State." + unit.initialState() + ");");
  }

  private void writeDispatch(final JavaWriter out, final Unit unit) {
    out.line(dispatchVisibility() + " DispatchResult dispatch(final Event event) {");
    out.line("Objects.requireNonNull(event, \"event\");");
    out.line("switch (state) {");
    for (Map.Entry<String, String> state : unit.stateIds.entrySet()) {
      out.line("case " + state.getValue() + ":");
      out.nested("return " + dispatchMethod(state.getKey()) + "(event);");
    }
    out.line("}");
    out.line("return DispatchResult.NOT_HANDLED;");
    out.line("}");
    for (String state : unit.stateIds.keySet()) {
      out.blank();
      writeStateDispatch(out, unit, state);
    }
  }

  private static String dispatchMethod(final String stateName) {
    return "on" + (Transition.INITIAL_PSEUDOSTATE.equals(stateName) ? "Terminated"
        : Names.upperCamel(stateName));
  }

  private void writeStateDispatch(final JavaWriter out, final Unit unit, final String stateName) {
    final List<Row> rows = unit.table.rowsOf(stateName);
    final Optional<String> noOp = noOpEvent()
        .filter(event -> !unit.table.row(stateName, event).isPresent());
    out.line("private DispatchResult " + dispatchMethod(stateName) + "(final Event event) {");
    if (!rows.isEmpty() || noOp.isPresent()) {
      out.line("switch (" + eventSwitchSubject() + ") {");
      for (Row row : rows) {
        out.line("case " + unit.event(row.getEvent()) + ":");
        out.indent();
        boolean terminal = false;
        for (DispatchCase dispatchCase : row.getCases()) {
          if (writeCase(out, unit, stateName, dispatchCase)) {
            terminal = true;
            break;
          }
        }
        if (!terminal) {
          out.line("return DispatchResult.GUARD_REJECTED;");
        }
        out.dedent();
      }
      if (noOp.isPresent()) {
        out.line("case " + unit.event(noOp.get()) + ":");
        out.nested("return DispatchResult.HANDLED;");
      }
      out.line("}");
    }
    out.line("return DispatchResult.NOT_HANDLED;");
    out.line("}");
  }

  /**
   * @return true if the written code always returns, so nothing after it is reachable
   */
  private boolean writeCase(final JavaWriter out, final Unit unit, final String stateName,
      final DispatchCase dispatchCase) {
    final Transition transition = dispatchCase.getTransition();
    out.line("// " + dispatchCase.getKind() + " " + Names.commentSafe(Labels.edge(transition)));
    if (transition.isGuarded()) {
      out.line("if (" + guardCall(unit, transition.getGuard().get()) + ") {");
    }
    boolean terminal = true;
    if (dispatchCase.getChoicePoint().isPresent()) {
      terminal = false;
      for (ChoiceBranch branch : dispatchCase.getChoicePoint().get().getBranches()) {
        if (branch.isElse()) {
          writeFiring(out, unit, stateName, dispatchCase, branch.getTarget(), branch.getAction());
          terminal = true;
          break;
        }
        out.line("if (" + guardCall(unit, branch.getGuard()) + ") {");
        writeFiring(out, unit, stateName, dispatchCase, branch.getTarget(), branch.getAction());
        out.line("}");
      }
    } else {
      writeFiring(out, unit, stateName, dispatchCase, transition.getTarget(), Optional.empty());
    }
    if (!transition.isGuarded()) {
      return terminal;
    }
    out.line("}");
    if (transition.getGuardRejectedAction().isPresent()) {
      writeCall(out, unit, transition.getGuardRejectedAction().get(), Optional.of(transition));
      out.line("return DispatchResult.GUARD_REJECTED;");
      return true;
    }
    return false;
  }

  private void writeFiring(final JavaWriter out, final Unit unit, final String stateName,
      final DispatchCase dispatchCase, final String target, final Optional<Action> branchAction) {
    final Transition transition = dispatchCase.getTransition();
    final Optional<Transition> trigger = Optional.of(transition);
    if (!dispatchCase.isExternal()) {
      if (transition.getAction().isPresent()) {
        writeCall(out, unit, transition.getAction().get(), trigger);
      }
      writeAssignments(out, unit, transition);
      out.line("return DispatchResult.HANDLED;");
      return;
    }
    out.line("exit(State." + unit.state(stateName) + ");");
    if (transition.getAction().isPresent()) {
      writeCall(out, unit, transition.getAction().get(), trigger);
    }
    if (branchAction.isPresent()) {
      writeCall(out, unit, branchAction.get(), trigger);
    }
    writeAssignments(out, unit, transition);
    out.line("state = State." + unit.state(target) + ";");
    if (dispatchCase.isFault()) {
      writeFaultRecorded(out);
    }
    out.line("enter(State." + unit.state(target) + ");");
    out.line("return DispatchResult.TRANSITIONED;");
  }

  private String guardCall(final Unit unit, final Guard guard) {
    final GuardMethod method = unit.contract.guard(guard);
    final String arguments = method.getPayloadParameter().isPresent() ? payloadExpression() : "";
    return (ActionContract.isNegated(guard.getExpression()) ? "!" : "") + "actions."
        + method.getName() + "(" + arguments + ")";
  }

  private void writeCall(final JavaWriter out, final Unit unit, final Action action,
      final Optional<Transition> trigger) {
    if (action.startedTimer().isPresent()) {
      out.line("actions." + ActionContract.startTimerMethod + "(Timer."
          + unit.timerIds.get(action.startedTimer().get()) + ");");
      return;
    }
    if (action.stoppedTimer().isPresent()) {
      out.line("actions." + ActionContract.stopTimerMethod + "(Timer."
          + unit.timerIds.get(action.stoppedTimer().get()) + ");");
      return;
    }
    final List<String> arguments = new ArrayList<>();
    for (String parameter : action.getParams()) {
      arguments.add(argument(unit, parameter, trigger));
    }
    out.line("actions." + unit.contract.action(action).getName() + "("
        + String.join(", ", arguments) + ");");
  }

  /**
   * Renders an action argument as written in the source. Strings and numbers pass through,
   * identifiers become the triggering event's payload or an extended-state variable where the
   * target supports those, and a string literal of their own name otherwise.
   */
  private String argument(final Unit unit, final String parameter,
      final Optional<Transition> trigger) {
    if (parameter.startsWith("\"")) {
      return parameter;
    }
    if (numberPattern.matcher(parameter).matches()) {
      return parameter.indexOf('.') < 0 ? parameter + "L" : parameter;
    }
    if (isPayloadAware()) {
      final Optional<String> payload = trigger.flatMap(Transition::getEvent)
          .flatMap(event -> unit.payloadOf(event.getName()));
      if (payload.isPresent() && payload.get().equals(parameter)) {
        return payloadExpression();
      }
      if (unit.variableIds.containsKey(parameter)) {
        return unit.variableIds.get(parameter);
      }
    }
    return Names.javaString(parameter);
  }

  private void writeStateActions(final JavaWriter out, final Unit unit, final boolean entry) {
    out.line("private void " + (entry ? "enter" : "exit") + "(final State target) {");
    final Map<State, List<Action>> states = new LinkedHashMap<>();
    for (State state : unit.model.getStates()) {
      final List<Action> actions =
          entry ? entryActions(unit.model, state) : state.getExitActions();
      if (!actions.isEmpty()) {
        states.put(state, actions);
      }
    }
    if (states.isEmpty()) {
      out.line("// no state has " + (entry ? "entry" : "exit") + " actions");
    } else {
      out.line("switch (target) {");
      for (Map.Entry<State, List<Action>> state : states.entrySet()) {
        out.line("case " + unit.state(state.getKey().getName()) + ":");
        out.indent();
        for (Action action : state.getValue()) {
          writeCall(out, unit, action, Optional.empty());
        }
        out.line("break;");
        out.dedent();
      }
      out.line("default:");
      out.nested("break;");
      out.line("}");
    }
    out.line("}");
  }

  /**
   * The state's entry actions followed by a start for every timer auto-started in the state that no
   * {@code start_timer} marker of the state starts already.
   */
  static List<Action> entryActions(final FsmModel model, final State state) {
    final List<Action> actions = new ArrayList<>(state.getEntryActions());
    final Set<String> started = new TreeSet<>();
    for (Action action : actions) {
      action.startedTimer().ifPresent(started::add);
    }
    for (Timer timer : model.getTimers()) {
      final Optional<String> autoStart = timer.getAutoStartState();
      if (autoStart.isPresent() && autoStart.get().equals(state.getName())
          && started.add(timer.getName())) {
        actions.add(Action.startTimer(timer.getName()));
      }
    }
    return actions;
  }

  /**
   * Getter lines for read-only properties, shared by the targets.
   */
  protected static void writeGetter(final JavaWriter out, final String type, final String name,
      final String field) {
    out.line("public " + type + " " + name + "() {");
    out.line("return " + field + ";");
    out.line("}");
  }
}
