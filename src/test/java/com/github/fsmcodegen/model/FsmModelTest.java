package com.github.fsmcodegen.model;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import org.junit.Test;

/**
 * Tests for the IR builders and the derived views of a model.
 */
public class FsmModelTest {

  @Test
  public void testCollectEventsIsSortedAndDistinct() {
    final FsmModel model = FsmModel.newBuilder("Test").initialState("A")
        .state(State.newBuilder("A").internalTransition(
            Transition.newBuilder("A", "A").event("Ping").kind(TransitionKind.INTERNAL).build())
            .build())
        .state(State.newBuilder("B").build())
        .transition(Transition.newBuilder("A", "B").event("Zed").build())
        .transition(Transition.newBuilder("B", "A").event("Go").guard("ok").build())
        .transition(Transition.newBuilder("B", "A").event("Go").build())
        .transition(Transition.newBuilder("B", "A").build())
        .event(new Event("Zed", Optional.of("amount"))).build();
    final List<String> names = new ArrayList<>();
    for (Event event : model.collectEvents()) {
      names.add(event.getName());
    }
    assertEquals(Arrays.asList("Go", "Ping", "Zed"), names);
    // payload information comes from the declaration
    assertEquals(Optional.of("amount"), model.collectEvents().get(2).getPayloadName());
  }

  @Test
  public void testInternalTransitionIsPinnedToItsState() {
    final State state = State.newBuilder("Idle")
        .internalTransition(Transition.newBuilder("Other", "Elsewhere").event("Tick")
            .action(new Action("count")).build())
        .build();
    final Transition internal = state.getInternalTransitions().get(0);
    assertEquals("Idle", internal.getSource());
    assertEquals("Idle", internal.getTarget());
    assertEquals(TransitionKind.INTERNAL, internal.getKind());
    assertEquals(Optional.of(new Action("count")), internal.getAction());
  }

  @Test
  public void testSubMachineMakesComposite() {
    final FsmModel nested = FsmModel.newBuilder("Inner").initialState("X")
        .state(State.newBuilder("X").build()).build();
    final State state = State.newBuilder("Outer").subMachine(nested)
        .layoutHint(new LayoutHint(10, 20)).build();
    assertEquals(StateKind.COMPOSITE, state.getKind());
    assertEquals(Optional.of(nested), state.getSubMachine());
    assertEquals(10, state.getLayoutHint().get().getX(), 0);
  }

  @Test
  public void testTransitionPredicates() {
    final Transition wildcard = Transition.newBuilder("*", "Fault").event("Estop").build();
    assertTrue(wildcard.isWildcard());
    assertFalse(wildcard.isGuarded());

    final Transition choice =
        Transition.newBuilder("A", Transition.choiceReference("Pick")).event("Go").build();
    assertTrue(choice.targetsChoice());
    assertEquals(Optional.of("Pick"), choice.choiceName());
    assertTrue(Transition.isPseudoName("<<Pick>>"));
    assertTrue(Transition.isPseudoName("[*]"));
    assertFalse(Transition.isPseudoName("Pick"));

    assertTrue(Transition.newBuilder("A", "[*]").build().targetsTerminal());
  }

  @Test
  public void testTimerMarkers() {
    assertEquals(Optional.of("t"), Action.startTimer("t").startedTimer());
    assertEquals(Optional.of("t"), Action.stopTimer("t").stoppedTimer());
    assertFalse(new Action("start_timer_t").isTimerControl());
    assertFalse(new Action("start_timer_t", Arrays.asList("u")).isTimerControl());
  }

  @Test
  public void testGuardAndAssignment() {
    assertEquals("a && b", new Guard("  a && b ").getExpression());
    assertTrue(new Guard("else").isElse());
    assertTrue(new Assignment("speed", "-20").isLiteral());
    assertFalse(new Assignment("speed", "rpm").isLiteral());
  }

  @Test
  public void testStructuralEquality() {
    assertEquals(sample(), sample());
    assertEquals(sample().hashCode(), sample().hashCode());
    final FsmModel other = FsmModel.newBuilder("Test").initialState("B")
        .state(State.newBuilder("A").build()).state(State.newBuilder("B").build()).build();
    assertNotEquals(sample(), other);
  }

  @Test
  public void testFinders() {
    final FsmModel model = sample();
    assertTrue(model.findState("A").isPresent());
    assertFalse(model.findState("Z").isPresent());
    assertTrue(model.findTimer("t").isPresent());
    assertTrue(model.findVariable("count").isPresent());
  }

  private static FsmModel sample() {
    return FsmModel.newBuilder("Test").description("sample").initialState("A")
        .state(State.newBuilder("A").entryAction(new Action("hello")).build())
        .state(State.newBuilder("B").build())
        .transition(Transition.newBuilder("A", "B").event("Go").guard("ok")
            .action(new Action("run", Arrays.asList("1"))).build())
        .timer(new Timer("t", 100L, new Event("Expired"), TimerMode.PERIODIC))
        .variable(new Variable("count", 0L)).build();
  }
}
