package com.github.fsmcodegen.parser;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import org.antlr.v4.runtime.Token;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.fsmcodegen.model.Action;
import com.github.fsmcodegen.model.Assignment;
import com.github.fsmcodegen.model.ChoiceBranch;
import com.github.fsmcodegen.model.ChoicePoint;
import com.github.fsmcodegen.model.Event;
import com.github.fsmcodegen.model.FsmModel;
import com.github.fsmcodegen.model.Guard;
import com.github.fsmcodegen.model.State;
import com.github.fsmcodegen.model.StateKind;
import com.github.fsmcodegen.model.Timer;
import com.github.fsmcodegen.model.TimerMode;
import com.github.fsmcodegen.model.Transition;
import com.github.fsmcodegen.model.TransitionKind;
import com.github.fsmcodegen.model.Variable;

/**
 * Visits the syntax tree of one {@code fsm} block and lowers it into the IR. Problems the grammar
 * cannot express, such as a fractional timer duration, are reported as syntax errors at the
 * offending token.
 *
 * Notes:<br>
 * 1. States mentioned anywhere but never declared are materialized as simple states, in order of
 * first mention.<br>
 * 2. Declaring a state twice merges the declarations: a later description replaces the earlier one,
 * entry/exit actions and internal transitions are appended.<br>
 * 3. {@code start_timer t} becomes the entry action {@code start_timer_t(t)} and makes the state
 * the timer's auto-start state unless an earlier state already claimed it.
 * {@code stop_timer t} becomes the exit action {@code stop_timer_t(t)}.<br>
 * 4. A state body holding ordinary fsm items turns the state composite, with those items lowered
 * into a nested model named after the state.<br>
 */
final class ModelLowering extends FsmDslBaseVisitor<Void> {
  private static final Logger logger = LogManager.getLogger(ModelLowering.class.getSimpleName());

  private final String name;
  private final Map<String, State.StateBuilder> states = new LinkedHashMap<>();
  private final List<Transition> transitions = new ArrayList<>();
  private final List<ChoicePoint> choicePoints = new ArrayList<>();
  private final List<Timer> timers = new ArrayList<>();
  private final List<Event> events = new ArrayList<>();
  private final List<Variable> variables = new ArrayList<>();
  private final Map<String, String> autoStarts = new LinkedHashMap<>();
  private String initialState;

  private ModelLowering(final String name) {
    this.name = name;
  }

  static FsmModel lower(final FsmDslParser.FsmContext fsm) {
    final ModelLowering lowering = new ModelLowering(fsm.name().getText());
    for (FsmDslParser.FsmItemContext item : fsm.fsmItem()) {
      lowering.visit(item);
    }
    return lowering.build(description(fsm.description()));
  }

  @Override
  public Void visitInitial(final FsmDslParser.InitialContext ctx) {
    if (ctx.COLON() != null) {
      throw FsmParser.error(ctx.COLON().getSymbol(),
          "The initial pseudo-transition cannot carry a label");
    }
    initialState = ctx.name().getText();
    declare(initialState);
    return null;
  }

  @Override
  public Void visitStateDecl(final FsmDslParser.StateDeclContext ctx) {
    final String stateName = ctx.stateName.getText();
    final State.StateBuilder state = declare(stateName);
    final Optional<String> description = description(ctx.description());
    if (description.isPresent()) {
      state.description(description.get());
    }
    if (ctx.stereotype() != null) {
      state.kind(kindOf(ctx.stereotype().kind));
    }
    final ModelLowering nested = new ModelLowering(stateName);
    boolean composite = false;
    for (FsmDslParser.StateItemContext item : ctx.stateItem()) {
      if (item.stateAction() != null) {
        final FsmDslParser.StateActionContext stateAction = item.stateAction();
        if (stateAction.kind.getType() == FsmDslLexer.ENTRY) {
          state.entryAction(action(stateAction.call()));
        } else {
          state.exitAction(action(stateAction.call()));
        }
      } else if (item.timerMarker() != null) {
        final FsmDslParser.TimerMarkerContext marker = item.timerMarker();
        final String timer = marker.timer.getText();
        if (marker.kind.getType() == FsmDslLexer.START_TIMER) {
          state.entryAction(Action.startTimer(timer));
          autoStarts.putIfAbsent(timer, stateName);
        } else {
          state.exitAction(Action.stopTimer(timer));
        }
      } else if (item.internalTransition() != null) {
        final FsmDslParser.InternalTransitionContext internal = item.internalTransition();
        final Transition.TransitionBuilder transition =
            Transition.newBuilder(stateName, stateName).kind(TransitionKind.INTERNAL)
                .event(internal.eventName().getText());
        state.internalTransition(labelTail(transition, internal.labelTail()).build());
      } else if (item.SEMI() == null) {
        nested.visit(item);
        composite = true;
      }
    }
    if (composite) {
      state.subMachine(nested.build(Optional.empty()));
    }
    return null;
  }

  @Override
  public Void visitTransition(final FsmDslParser.TransitionContext ctx) {
    final String source = ctx.endpoint().getText();
    final String target = target(ctx.target());
    declare(source);
    declare(target);
    final Transition.TransitionBuilder transition = Transition.newBuilder(source, target);
    if (Transition.ANY_STATE.equals(source) && Transition.ANY_STATE.equals(target)) {
      transition.kind(TransitionKind.INTERNAL);
    }
    if (ctx.COLON() != null) {
      final FsmDslParser.LabelContext label = ctx.label();
      if (label.eventName() == null && label.labelTail().getChildCount() == 0) {
        throw FsmParser.error(ctx.COLON().getSymbol(),
            "Expected event, guard or action after ':'");
      }
      if (label.eventName() != null) {
        transition.event(label.eventName().getText());
      }
      labelTail(transition, label.labelTail());
    }
    transitions.add(transition.build());
    return null;
  }

  @Override
  public Void visitTimerDecl(final FsmDslParser.TimerDeclContext ctx) {
    final Token duration = ctx.duration;
    if (duration.getText().startsWith("-") || duration.getText().indexOf('.') >= 0) {
      throw FsmParser.error(duration,
          "Timer duration must be a whole, non-negative number of milliseconds");
    }
    final TimerMode mode = ctx.timerMode != null && ctx.timerMode.getType() == FsmDslLexer.PERIODIC
        ? TimerMode.PERIODIC : TimerMode.ONE_SHOT;
    timers.add(new Timer(ctx.timerName.getText(), parseLong(duration),
        new Event(ctx.event.getText()), mode));
    return null;
  }

  @Override
  public Void visitChoiceDecl(final FsmDslParser.ChoiceDeclContext ctx) {
    final List<ChoiceBranch> branches = new ArrayList<>();
    for (FsmDslParser.BranchContext branch : ctx.branch()) {
      final String target = branch.name() != null ? branch.name().getText()
          : branch.PSEUDOSTATE().getText();
      declare(target);
      branches.add(new ChoiceBranch(new Guard(guard(branch.GUARD().getSymbol())), target,
          Optional.ofNullable(branch.call()).map(ModelLowering::action)));
    }
    choicePoints.add(new ChoicePoint(ctx.choiceName.getText(), branches));
    return null;
  }

  @Override
  public Void visitEventDecl(final FsmDslParser.EventDeclContext ctx) {
    events.add(new Event(ctx.declared.getText(),
        Optional.ofNullable(ctx.payload).map(FsmDslParser.NameContext::getText)));
    return null;
  }

  @Override
  public Void visitVarDecl(final FsmDslParser.VarDeclContext ctx) {
    long initialValue = 0L;
    if (ctx.initialValue != null) {
      if (ctx.initialValue.getText().indexOf('.') >= 0) {
        throw FsmParser.error(ctx.initialValue, "Variable initial value must be an integer");
      }
      initialValue = parseLong(ctx.initialValue);
    }
    variables.add(new Variable(ctx.variable.getText(), initialValue));
    return null;
  }

  private static Transition.TransitionBuilder labelTail(
      final Transition.TransitionBuilder transition, final FsmDslParser.LabelTailContext tail) {
    if (tail.GUARD() != null) {
      transition.guard(guard(tail.GUARD().getSymbol()));
    }
    if (tail.action != null) {
      transition.action(action(tail.action));
    }
    if (tail.rejected != null) {
      transition.guardRejectedAction(action(tail.rejected));
    }
    for (FsmDslParser.AssignmentContext assignment : tail.assignment()) {
      final FsmDslParser.AssignedValueContext value = assignment.assignedValue();
      if (value.NUMBER() != null && value.getText().indexOf('.') >= 0) {
        throw FsmParser.error(value.start,
            "Expected integer or payload name after '=' but found " + value.getText());
      }
      transition.assignment(new Assignment(assignment.variable.getText(), value.getText()));
    }
    return transition;
  }

  private static Action action(final FsmDslParser.CallContext call) {
    final List<String> args = new ArrayList<>();
    for (FsmDslParser.ArgumentContext argument : call.argument()) {
      args.add(argument.getText());
    }
    return new Action(call.callee.getText(), args);
  }

  // brackets stripped, whitespace runs collapsed
  private static String guard(final Token token) {
    final String text = token.getText();
    final String guard = text.substring(1, text.length() - 1).trim().replaceAll("\\s+", " ");
    if (guard.isEmpty()) {
      throw FsmParser.error(token, "Empty guard expression");
    }
    return guard;
  }

  private static String target(final FsmDslParser.TargetContext target) {
    return target.choice != null ? Transition.choiceReference(target.choice.getText())
        : target.getText();
  }

  private static Optional<String> description(final FsmDslParser.DescriptionContext description) {
    return description == null ? Optional.empty()
        : Optional.of(FsmParser.unquote(description.STRING().getText()));
  }

  private static StateKind kindOf(final FsmDslParser.NameContext stereotype) {
    switch (stereotype.getText().toLowerCase(Locale.ROOT)) {
      case "final":
        return StateKind.FINAL;
      case "history":
        return StateKind.HISTORY;
      case "deephistory":
        return StateKind.DEEP_HISTORY;
      default:
        throw FsmParser.error(stereotype.start, "Unknown state stereotype '"
            + stereotype.getText() + "', expected final, history or deephistory");
    }
  }

  private static long parseLong(final Token token) {
    try {
      return Long.parseLong(token.getText());
    } catch (NumberFormatException problem) {
      throw FsmParser.error(token, "Number '" + token.getText() + "' is out of range");
    }
  }

  private State.StateBuilder declare(final String stateName) {
    State.StateBuilder state = states.get(stateName);
    if (state == null && !Transition.isPseudoName(stateName)) {
      state = State.newBuilder(stateName);
      states.put(stateName, state);
      logger.debug("[fsm:{}] declared state '{}'", name, stateName);
    }
    return state;
  }

  private FsmModel build(final Optional<String> description) {
    final FsmModel.FsmModelBuilder model =
        FsmModel.newBuilder(name).description(description.orElse(null)).initialState(initialState);
    for (State.StateBuilder state : states.values()) {
      model.state(state.build());
    }
    for (Transition transition : transitions) {
      model.transition(transition);
    }
    for (ChoicePoint choicePoint : choicePoints) {
      model.choicePoint(choicePoint);
    }
    for (Timer timer : timers) {
      final String autoStart = autoStarts.get(timer.getName());
      model.timer(autoStart == null || timer.getAutoStartState().isPresent() ? timer
          : timer.withAutoStartState(autoStart));
    }
    for (Event event : events) {
      model.event(event);
    }
    for (Variable variable : variables) {
      model.variable(variable);
    }
    return model.build();
  }
}
