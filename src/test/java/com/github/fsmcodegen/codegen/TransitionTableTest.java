package com.github.fsmcodegen.codegen;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import org.junit.Test;

import com.github.fsmcodegen.FsmException;
import com.github.fsmcodegen.codegen.TransitionTable.CaseKind;
import com.github.fsmcodegen.codegen.TransitionTable.DispatchCase;
import com.github.fsmcodegen.codegen.TransitionTable.Row;
import com.github.fsmcodegen.model.Action;
import com.github.fsmcodegen.model.ChoiceBranch;
import com.github.fsmcodegen.model.ChoicePoint;
import com.github.fsmcodegen.model.FsmModel;
import com.github.fsmcodegen.model.Guard;
import com.github.fsmcodegen.model.State;
import com.github.fsmcodegen.model.Transition;
import com.github.fsmcodegen.parser.FsmParser;

public class TransitionTableTest {

  @Test
  public void testRowOrder() throws FsmException {
    final TransitionTable table = table("fsm T {\n [*] --> Idle\n"
        + " state Idle { Ping / count() }\n state Done <<final>>\n"
        + " Idle --> Busy : Ping [ready]\n Idle --> Busy : Go\n * --> Fault : Ping\n"
        + " * --> * : Ping / log()\n Busy --> Done : Finish\n}");
    final Row ping = table.row("Idle", "Ping").get();
    assertEquals(Arrays.asList(CaseKind.INTERNAL, CaseKind.GUARDED, CaseKind.WILDCARD,
        CaseKind.WILDCARD), kinds(ping));
    assertTrue(ping.getCases().get(2).isFault());
    assertFalse(ping.getCases().get(3).isExternal());

    // rows come in event name order
    final List<String> events = new ArrayList<>();
    for (Row row : table.rowsOf("Idle")) {
      events.add(row.getEvent());
    }
    assertEquals(Arrays.asList("Go", "Ping"), events);
  }

  @Test
  public void testStateRuleShadowsWildcardFault() throws FsmException {
    final TransitionTable table = table("fsm T {\n [*] --> Running\n"
        + " Running --> Stopped : EmergencyStop\n Stopped --> Running : Start\n"
        + " * --> Fault : EmergencyStop\n}");
    final List<DispatchCase> running = table.row("Running", "EmergencyStop").get().getCases();
    assertEquals("Stopped", running.get(0).getTransition().getTarget());
    assertTrue(running.get(1).isFault());
    // without a rule of its own the state goes straight to the fault
    final DispatchCase stopped = table.row("Stopped", "EmergencyStop").get().getCases().get(0);
    assertEquals("Fault", stopped.getTransition().getTarget());
  }

  @Test
  public void testWildcardFaultsSkipTargetAndFinalStates() throws FsmException {
    final TransitionTable table = table("fsm T {\n [*] --> A\n state Done <<final>>\n"
        + " A --> Done : Finish\n * --> Fault : Estop\n}");
    assertTrue(table.row("A", "Estop").isPresent());
    assertFalse(table.row("Fault", "Estop").isPresent());
    assertFalse(table.row("Done", "Estop").isPresent());
    // final states still get wildcard internal handlers, but there are none here
    assertTrue(table.rowsOf("Done").isEmpty());
  }

  @Test
  public void testCompletionTransitionsStayOutOfRows() throws FsmException {
    final TransitionTable table = table("fsm T {\n [*] --> A\n A --> B\n A --> B : [ready]\n}");
    assertTrue(table.rowsOf("A").isEmpty());
    assertEquals(2, table.getCompletionTransitions().size());
  }

  @Test
  public void testChoiceCases() throws FsmException {
    final TransitionTable table = table("fsm T {\n [*] --> A\n"
        + " choice Open { [ok] -> B\n [else] -> C }\n choice Strict { [ok] -> B }\n"
        + " A --> <<Open>> : Go\n A --> <<Strict>> : Try\n}");
    final DispatchCase open = table.row("A", "Go").get().getCases().get(0);
    assertEquals("Open", open.getChoicePoint().get().getName());
    assertTrue(open.isUnconditional());
    // without an else branch a choice may find nothing to take
    assertFalse(table.row("A", "Try").get().getCases().get(0).isUnconditional());
  }

  @Test
  public void testUnknownReferencesFail() {
    final FsmModel unknownState = FsmModel.newBuilder("T").initialState("A")
        .state(State.newBuilder("A").build())
        .transition(Transition.newBuilder("Ghost", "A").event("Go").build()).build();
    expectFailure(unknownState);

    final FsmModel unknownChoice = FsmModel.newBuilder("T").initialState("A")
        .state(State.newBuilder("A").build())
        .choicePoint(new ChoicePoint("Other", Arrays.asList(
            new ChoiceBranch(new Guard("else"), "A", Optional.of(new Action("x"))))))
        .transition(Transition.newBuilder("A", Transition.choiceReference("Missing"))
            .event("Go").build())
        .build();
    expectFailure(unknownChoice);
  }

  private static void expectFailure(final FsmModel model) {
    try {
      TransitionTable.build(model);
      fail("Expected a generation failure");
    } catch (FsmException expected) {
      assertEquals(FsmException.Code.GENERATION_FAILURE, expected.getCode());
    }
  }

  private static List<CaseKind> kinds(final Row row) {
    final List<CaseKind> kinds = new ArrayList<>();
    for (DispatchCase dispatchCase : row.getCases()) {
      kinds.add(dispatchCase.getKind());
    }
    return kinds;
  }

  static TransitionTable table(final String source) throws FsmException {
    return TransitionTable.build(new FsmParser().parse(source).get(0));
  }
}
