package com.github.fsmcodegen.parser;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import org.junit.Test;

import com.github.fsmcodegen.FsmException;
import com.github.fsmcodegen.FsmParseException;
import com.github.fsmcodegen.model.Action;
import com.github.fsmcodegen.model.ChoicePoint;
import com.github.fsmcodegen.model.FsmModel;
import com.github.fsmcodegen.model.State;
import com.github.fsmcodegen.model.StateKind;
import com.github.fsmcodegen.model.Timer;
import com.github.fsmcodegen.model.TimerMode;
import com.github.fsmcodegen.model.Transition;
import com.github.fsmcodegen.model.TransitionKind;

/**
 * Tests to maintain the sanity and correctness of FsmParser.
 */
public class FsmParserTest {
  static {
    System.setProperty("log4j.configurationFile", "log4j.properties");
  }

  private final FsmParser parser = new FsmParser();

  @Test
  public void testSimpleFsm() throws FsmParseException {
    final List<FsmModel> fsms = parser.parse(String.join("\n", "fsm Simple {", "  [*] --> Idle",
        "  state Idle", "  state Running", "  Idle --> Running : Start", "}"));
    assertEquals(1, fsms.size());
    final FsmModel fsm = fsms.get(0);
    assertEquals("Simple", fsm.getName());
    assertEquals(Optional.of("Idle"), fsm.getInitialState());
    assertEquals(2, fsm.getStates().size());
    // the initial pseudo-transition is not a transition of its own
    assertEquals(1, fsm.getTransitions().size());
  }

  @Test
  public void testStateDescription() throws FsmParseException {
    final FsmModel fsm = parseOne(
        "fsm Test : \"Top\\tlevel\" { [*] --> Active\n state Active: \"The system is active\" }");
    assertEquals(Optional.of("Top\tlevel"), fsm.getDescription());
    assertEquals(Optional.of("The system is active"),
        fsm.findState("Active").get().getDescription());
  }

  @Test
  public void testEntryAndExitActions() throws FsmParseException {
    final FsmModel fsm = parseOne("fsm Test {\n [*] --> Active\n state Active {\n"
        + "  entry / on_enter()\n  exit / on_exit(\"bye\", 3)\n  entry / also_on_enter\n }\n}");
    final State active = fsm.findState("Active").get();
    assertEquals(Arrays.asList(new Action("on_enter"), new Action("also_on_enter")),
        active.getEntryActions());
    assertEquals(Arrays.asList(new Action("on_exit", Arrays.asList("\"bye\"", "3"))),
        active.getExitActions());
  }

  @Test
  public void testTransitionLabels() throws FsmParseException {
    final FsmModel fsm = parseOne("fsm Test {\n [*] --> A\n A --> B : ButtonPress\n"
        + " B --> C : Submit [is_valid]\n C --> D : Go / do_something()\n"
        + " D --> A : Submit [ is_valid && !busy ] / process(1, -2.5, x)\n E --> A : [ready]\n}");
    final Transition event = find(fsm, "A", "B");
    assertEquals("ButtonPress", event.getEvent().get().getName());
    assertFalse(event.getGuard().isPresent());

    final Transition guarded = find(fsm, "B", "C");
    assertEquals("is_valid", guarded.getGuard().get().getExpression());

    final Transition action = find(fsm, "C", "D");
    assertEquals("do_something", action.getAction().get().getName());

    final Transition full = find(fsm, "D", "A");
    assertEquals("Submit", full.getEvent().get().getName());
    assertEquals("is_valid && !busy", full.getGuard().get().getExpression());
    assertEquals(Arrays.asList("1", "-2.5", "x"), full.getAction().get().getParams());

    final Transition completion = find(fsm, "E", "A");
    assertFalse(completion.getEvent().isPresent());
    assertEquals("ready", completion.getGuard().get().getExpression());
  }

  @Test
  public void testTimers() throws FsmParseException {
    final FsmModel fsm = parseOne("fsm Test {\n timer timeout = 5000 -> Expired\n"
        + " timer heartbeat = 1000 -> Tick periodic\n [*] --> Idle\n}");
    assertEquals(2, fsm.getTimers().size());
    final Timer timeout = fsm.findTimer("timeout").get();
    assertEquals(5000L, timeout.getDurationMillis());
    assertEquals("Expired", timeout.getEvent().getName());
    assertEquals(TimerMode.ONE_SHOT, timeout.getMode());
    final Timer heartbeat = fsm.findTimer("heartbeat").get();
    assertEquals(1000L, heartbeat.getDurationMillis());
    assertEquals(TimerMode.PERIODIC, heartbeat.getMode());
  }

  @Test
  public void testTimerMarkers() throws FsmParseException {
    final FsmModel fsm = parseOne("fsm Test {\n timer t = 100 --> Expired\n [*] --> A\n"
        + " state A {\n  start_timer t\n  stop_timer t\n }\n state B { start_timer t }\n"
        + " A --> B : Expired\n}");
    final State a = fsm.findState("A").get();
    assertEquals(Arrays.asList(Action.startTimer("t")), a.getEntryActions());
    assertEquals(Arrays.asList(Action.stopTimer("t")), a.getExitActions());
    // the first state starting a timer owns its auto start
    assertEquals(Optional.of("A"), fsm.findTimer("t").get().getAutoStartState());
  }

  @Test
  public void testChoicePoint() throws FsmParseException {
    final FsmModel fsm = parseOne("fsm Test {\n [*] --> Check\n choice Validate {\n"
        + "  [is_ok] -> Success\n  [is_warning] -> Warning / log_warning()\n"
        + "  [else] -> Error\n }\n Check --> <<Validate>> : Done\n}");
    assertEquals(1, fsm.getChoicePoints().size());
    final ChoicePoint choice = fsm.getChoicePoints().get(0);
    assertEquals("Validate", choice.getName());
    assertEquals(3, choice.getBranches().size());
    assertTrue(choice.getBranches().get(2).isElse());
    assertEquals("<<Validate>>", find(fsm, "Check", "<<Validate>>").getTarget());
    // branch targets are declared like any other mentioned state
    assertTrue(fsm.findState("Warning").isPresent());
    assertTrue(fsm.validate().isValid());
  }

  @Test
  public void testSelfTransition() throws FsmParseException {
    final FsmModel fsm =
        parseOne("fsm Test {\n [*] --> Active\n Active --> Active : Tick / update()\n}");
    final Transition self = find(fsm, "Active", "Active");
    assertEquals("Tick", self.getEvent().get().getName());
    assertEquals(TransitionKind.EXTERNAL, self.getKind());
  }

  @Test
  public void testMultipleFsms() throws FsmParseException {
    final List<FsmModel> fsms =
        parser.parse("fsm First {\n [*] --> A\n}\n\nfsm Second {\n [*] --> B\n}");
    assertEquals(2, fsms.size());
    assertEquals("First", fsms.get(0).getName());
    assertEquals("Second", fsms.get(1).getName());
  }

  @Test
  public void testComments() throws FsmParseException {
    final List<FsmModel> fsms = parser.parse("// This is a comment\nfsm Test {\n"
        + " /* Multi-line\n    comment */\n [*] --> Idle // Inline comment\n state Idle\n}");
    assertEquals(1, fsms.size());
    assertEquals(1, fsms.get(0).getStates().size());
  }

  @Test
  public void testEmptyFsm() throws FsmParseException {
    final FsmModel fsm = parseOne("fsm Empty {\n}");
    assertEquals("Empty", fsm.getName());
    assertTrue(fsm.getStates().isEmpty());
    assertFalse(fsm.getInitialState().isPresent());
  }

  @Test
  public void testImplicitStates() throws FsmParseException {
    final FsmModel fsm = parseOne("fsm Test {\n [*] --> A\n A --> B : Go\n B --> C : Next\n}");
    assertEquals(Arrays.asList("A", "B", "C"), names(fsm));
  }

  @Test
  public void testRedeclaredStateMerges() throws FsmParseException {
    final FsmModel fsm = parseOne("fsm Test {\n [*] --> A\n A --> B : Go\n"
        + " state B : \"second\"\n state B { entry / hello() }\n}");
    assertEquals(Arrays.asList("A", "B"), names(fsm));
    final State b = fsm.findState("B").get();
    assertEquals(Optional.of("second"), b.getDescription());
    assertEquals(1, b.getEntryActions().size());
  }

  @Test
  public void testSupplementalSyntax() throws FsmParseException {
    final FsmModel fsm = parseOne("fsm Motor {\n event SetSpeed(rpm); var speed = 10; var count\n"
        + " [*] -> Idle\n state Idle {\n  SetSpeed / apply(rpm) set speed = rpm\n"
        + "  Poll [ready] / poll() else / skip()\n }\n state Done <<final>>\n"
        + " state Memory <<deepHistory>>\n * --> Fault : Estop\n * --> * : Ping / pong()\n"
        + " Idle --> [*] : Quit set count = 1\n}");
    assertEquals(Optional.of("rpm"), fsm.findDeclaredEvent("SetSpeed").get().getPayloadName());
    assertEquals(10L, fsm.findVariable("speed").get().getInitialValue());
    assertEquals(0L, fsm.findVariable("count").get().getInitialValue());

    final State idle = fsm.findState("Idle").get();
    assertEquals(2, idle.getInternalTransitions().size());
    final Transition setSpeed = idle.getInternalTransitions().get(0);
    assertEquals(TransitionKind.INTERNAL, setSpeed.getKind());
    assertEquals("rpm", setSpeed.getAssignments().get(0).getValue());
    assertEquals("skip", idle.getInternalTransitions().get(1).getGuardRejectedAction().get()
        .getName());

    assertEquals(StateKind.FINAL, fsm.findState("Done").get().getKind());
    assertEquals(StateKind.DEEP_HISTORY, fsm.findState("Memory").get().getKind());
    assertTrue(find(fsm, "*", "Fault").isWildcard());
    assertEquals(TransitionKind.INTERNAL, find(fsm, "*", "*").getKind());
    assertTrue(find(fsm, "Idle", "[*]").targetsTerminal());
    // neither pseudostate becomes a state
    assertEquals(Arrays.asList("Idle", "Done", "Memory", "Fault"), names(fsm));
    assertTrue(fsm.validate().isValid());
  }

  @Test
  public void testCompositeState() throws FsmParseException {
    final FsmModel fsm = parseOne("fsm Outer {\n [*] --> Busy\n state Busy {\n"
        + "  entry / begin()\n  [*] --> Working\n  Working --> Waiting : Pause\n }\n}");
    final State busy = fsm.findState("Busy").get();
    assertEquals(StateKind.COMPOSITE, busy.getKind());
    final FsmModel nested = busy.getSubMachine().get();
    assertEquals("Busy", nested.getName());
    assertEquals(Optional.of("Working"), nested.getInitialState());
    assertEquals(1, nested.getTransitions().size());
    assertEquals(1, busy.getEntryActions().size());
  }

  @Test
  public void testKeywordsStayUsableAsNames() throws FsmParseException {
    final FsmModel fsm =
        parseOne("fsm Test {\n [*] --> state\n state --> timer : event\n timer --> state\n}");
    assertEquals(Arrays.asList("state", "timer"), names(fsm));
    assertEquals("event", find(fsm, "state", "timer").getEvent().get().getName());
  }

  @Test
  public void testDeterministic() throws FsmParseException {
    final String source = "fsm Test {\n [*] --> A\n A --> B : Go [ok] / run(1)\n}";
    assertEquals(parser.parse(source), parser.parse(source));
  }

  @Test
  public void testSyntaxErrors() {
    expectErrorAt("fsm { }", 1, 5);
    expectErrorAt("machine Test { }", 1, 1);
    expectErrorAt("fsm Test {\n [*] --> A\n", 3, 1);
    expectErrorAt("fsm Test {\n A B\n}", 2, 4);
    expectErrorAt("fsm Test {\n state S {\n entry /\n }\n}", 4, 2);
  }

  @Test
  public void testLoweringErrors() {
    expectError("fsm Test {\n A --> B :\n}", 2, 10, "Expected event, guard or action after ':'");
    expectError("fsm Test {\n timer t = 1.5 -> E\n}", 2, 12,
        "Timer duration must be a whole, non-negative number of milliseconds");
    expectError("fsm Test {\n timer t = -5 -> E\n}", 2, 12,
        "Timer duration must be a whole, non-negative number of milliseconds");
    expectError("fsm Test {\n state S <<odd>>\n}", 2, 12,
        "Unknown state stereotype 'odd', expected final, history or deephistory");
    expectError("fsm Test {\n [*] --> A : Go\n}", 2, 12,
        "The initial pseudo-transition cannot carry a label");
    expectError("fsm Test {\n var v = 2.5\n}", 2, 10, "Variable initial value must be an integer");
    expectError("fsm Test {\n var v = 99999999999999999999\n}", 2, 10,
        "Number '99999999999999999999' is out of range");
  }

  @Test
  public void testSyntaxErrorCode() {
    try {
      parser.parse("fsm");
      fail("Expected a syntax error");
    } catch (FsmParseException expected) {
      assertEquals(FsmException.Code.SYNTAX_ERROR, expected.getCode());
      assertTrue(expected.getMessage().startsWith("Syntax error at line 1, column 4: "));
    }
  }

  private void expectErrorAt(final String source, final int line, final int column) {
    try {
      parser.parse(source);
      fail("Expected a syntax error for " + source);
    } catch (FsmParseException expected) {
      assertEquals(FsmException.Code.SYNTAX_ERROR, expected.getCode());
      assertEquals(line, expected.getLine());
      assertEquals(column, expected.getColumn());
    }
  }

  private void expectError(final String source, final int line, final int column,
      final String detail) {
    try {
      parser.parse(source);
      fail("Expected a syntax error for " + source);
    } catch (FsmParseException expected) {
      assertEquals(detail, expected.getDetail());
      assertEquals(line, expected.getLine());
      assertEquals(column, expected.getColumn());
    }
  }

  private FsmModel parseOne(final String source) throws FsmParseException {
    final List<FsmModel> fsms = parser.parse(source);
    assertEquals(1, fsms.size());
    return fsms.get(0);
  }

  private static Transition find(final FsmModel fsm, final String source, final String target) {
    for (Transition transition : fsm.getTransitions()) {
      if (transition.getSource().equals(source) && transition.getTarget().equals(target)) {
        return transition;
      }
    }
    throw new AssertionError("No transition " + source + " --> " + target);
  }

  private static List<String> names(final FsmModel fsm) {
    final List<String> names = new java.util.ArrayList<>();
    for (State state : fsm.getStates()) {
      names.add(state.getName());
    }
    return names;
  }
}
