package com.github.fsmcodegen.codegen;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import com.github.fsmcodegen.FsmException;
import com.github.fsmcodegen.GeneratorConfiguration;
import com.github.fsmcodegen.Target;
import com.github.fsmcodegen.model.Assignment;
import com.github.fsmcodegen.model.Event;
import com.github.fsmcodegen.model.Transition;
import com.github.fsmcodegen.model.Variable;

/**
 * Interrupt driven machine. Producers stand in for interrupt handlers, so posting goes through a
 * preallocated lock-free ring that never blocks, never grows and does not allocate; an overflowing
 * event is handed back to the producer. Events carry one scalar payload, the machine carries
 * extended-state variables and counts the faults raised by wildcard rules.
 */
final class InterruptQueueGenerator extends AbstractJavaGenerator {
  private static final Set<String> reservedMembers = new HashSet<>(Arrays.asList("actions",
      "queue", "state", "faultCount", "post", "runOnce", "runAll", "pending", "dispatch", "enter",
      "exit"));

  InterruptQueueGenerator(final GeneratorConfiguration configuration) {
    super(configuration);
  }

  @Override
  public Target getTarget() {
    return Target.INTERRUPT_QUEUE;
  }

  @Override
  protected boolean isPayloadAware() {
    return true;
  }

  @Override
  protected List<String> reservedEvents() {
    return Collections.singletonList(configuration.getTickEventName());
  }

  @Override
  protected Optional<String> noOpEvent() {
    return Optional.of(configuration.getTickEventName());
  }

  @Override
  protected String eventEnumName() {
    return "Signal";
  }

  @Override
  protected String eventSwitchSubject() {
    return "event.signal()";
  }

  @Override
  protected String payloadExpression() {
    return "event.payload()";
  }

  @Override
  protected Set<String> imports() {
    return new HashSet<>(Arrays.asList("java.util.Objects", "java.util.Optional",
        "java.util.concurrent.atomic.AtomicLong", "java.util.concurrent.atomic.AtomicLongArray"));
  }

  @Override
  protected List<String> classDocumentation(final Unit unit) {
    return Arrays.asList("",
        "Interrupt driven machine. Producers, including interrupt-like contexts, post through a",
        "fixed-capacity lock-free ring: posting never blocks, never allocates and hands an event",
        "that does not fit back to its producer. Exactly one consumer thread calls runOnce or",
        "runAll. The " + configuration.getTickEventName()
            + " signal is accepted in every state and does nothing unless a rule says otherwise.");
  }

  @Override
  protected void checkMemberNames(final Map<String, String> variableIds) throws FsmException {
    for (Map.Entry<String, String> variable : variableIds.entrySet()) {
      if (reservedMembers.contains(variable.getValue())) {
        throw new FsmException(FsmException.Code.GENERATION_FAILURE, "The variable '"
            + variable.getKey() + "' clashes with the generated member '" + variable.getValue()
            + "'");
      }
    }
  }

  @Override
  protected void writeEventTypes(final JavaWriter out, final Unit unit) {
    super.writeEventTypes(out, unit);
    out.blank();
    out.line("/**");
    out.line(" * A signal and its payload, zero for signals that carry none. Immutable.");
    out.line(" */");
    out.line("public static final class Event {");
    out.line("private static final Event[] plain = new Event[Signal.values().length];");
    out.line("static {");
    out.line("for (Signal signal : Signal.values()) {");
    out.line("plain[signal.ordinal()] = new Event(signal, 0L);");
    out.line("}");
    out.line("}");
    out.blank();
    out.line("private final Signal signal;");
    out.line("private final long payload;");
    out.blank();
    out.line("private Event(final Signal signal, final long payload) {");
    out.line("this.signal = signal;");
    out.line("this.payload = payload;");
    out.line("}");
    out.blank();
    out.line("/**");
    out.line(" * The shared payload-free event for the signal, obtaining it does not allocate.");
    out.line(" */");
    out.line("public static Event of(final Signal signal) {");
    out.line("return plain[Objects.requireNonNull(signal, \"signal\").ordinal()];");
    out.line("}");
    out.blank();
    out.line("public static Event withPayload(final Signal signal, final long payload) {");
    out.line("return new Event(Objects.requireNonNull(signal, \"signal\"), payload);");
    out.line("}");
    for (Event event : unit.events) {
      if (!event.carriesPayload()) {
        continue;
      }
      final String parameter = Names.lowerCamel(event.getPayloadName().get());
      out.blank();
      out.line("public static Event " + Names.lowerCamel(event.getName()) + "(final long "
          + parameter + ") {");
      out.line("return new Event(Signal." + unit.event(event.getName()) + ", " + parameter + ");");
      out.line("}");
    }
    out.blank();
    writeGetter(out, "Signal", "signal", "signal");
    out.blank();
    writeGetter(out, "long", "payload", "payload");
    out.blank();
    out.line("@Override");
    out.line("public String toString() {");
    out.line("return signal + \"(\" + payload + \")\";");
    out.line("}");
    out.line("}");
  }

  @Override
  protected void writeMembers(final JavaWriter out, final Unit unit) {
    out.line("public static final int DEFAULT_QUEUE_CAPACITY = "
        + configuration.getQueueCapacity() + ";");
    out.blank();
    out.line("private final Actions actions;");
    out.line("private final EventQueue queue;");
    out.line("private volatile State state;");
    out.line("private volatile long faultCount;");
    for (Variable variable : unit.model.getVariables()) {
      out.line("private volatile long " + unit.variableIds.get(variable.getName()) + " = "
          + variable.getInitialValue() + "L;");
    }
    out.blank();
    out.line("public " + unit.className + "(final Actions actions) {");
    out.line("this(actions, DEFAULT_QUEUE_CAPACITY);");
    out.line("}");
    out.blank();
    out.line("/**");
    out.line(" * Runs the entry actions of the initial state before returning.");
    out.line(" *");
    out.line(" * @param queueCapacity fixed capacity of the event queue, at least 2");
    out.line(" */");
    out.line("public " + unit.className + "(final Actions actions, final int queueCapacity) {");
    out.line("this.actions = Objects.requireNonNull(actions, \"actions\");");
    out.line("this.queue = new EventQueue(queueCapacity);");
    writeInitialEntry(out, unit);
    out.line("}");
    out.blank();
    out.line("/**");
    out.line(" * Enqueues without blocking or allocating, safe from any thread.");
    out.line(" *");
    out.line(" * @return empty if the event was queued, otherwise the event that did not fit");
    out.line(" */");
    out.line("public Optional<Event> post(final Event event) {");
    out.line("Objects.requireNonNull(event, \"event\");");
    out.line("return queue.offer(event) ? Optional.empty() : Optional.of(event);");
    out.line("}");
    out.blank();
    out.line("public Optional<Event> post(final Signal signal) {");
    out.line("return post(Event.of(signal));");
    out.line("}");
    out.blank();
    out.line("/**");
    out.line(" * Dispatches the oldest pending event. Consumer thread only.");
    out.line(" *");
    out.line(" * @return the dispatch result, empty if nothing was pending");
    out.line(" */");
    out.line("public Optional<DispatchResult> runOnce() {");
    out.line("final Event event = queue.poll();");
    out.line("return event == null ? Optional.empty() : Optional.of(dispatch(event));");
    out.line("}");
    out.blank();
    out.line("/**");
    out.line(" * Dispatches until the queue is empty. Consumer thread only.");
    out.line(" *");
    out.line(" * @return the number of events dispatched");
    out.line(" */");
    out.line("public int runAll() {");
    out.line("int processed = 0;");
    out.line("while (runOnce().isPresent()) {");
    out.line("processed++;");
    out.line("}");
    out.line("return processed;");
    out.line("}");
    out.blank();
    writeGetter(out, "int", "pending", "queue.size()");
    out.blank();
    writeGetter(out, "State", "state", "state");
    out.blank();
    out.line("/**");
    out.line(" * Number of transitions taken by wildcard fault rules so far.");
    out.line(" */");
    writeGetter(out, "long", "faultCount", "faultCount");
    for (Variable variable : unit.model.getVariables()) {
      final String field = unit.variableIds.get(variable.getName());
      out.blank();
      writeGetter(out, "long", field, field);
    }
  }

  @Override
  protected void writeFaultRecorded(final JavaWriter out) {
    out.line("faultCount++;");
  }

  @Override
  protected void writeAssignments(final JavaWriter out, final Unit unit,
      final Transition transition) {
    for (Assignment assignment : transition.getAssignments()) {
      out.line(unit.variableIds.get(assignment.getVariable()) + " = "
          + (assignment.isLiteral() ? assignment.getValue() + "L" : payloadExpression()) + ";");
    }
  }

  @Override
  protected void writeTypes(final JavaWriter out, final Unit unit) {
    out.blank();
    out.line("/**");
    out.line(" * Bounded multi-producer single-consumer ring. Every slot carries a sequence");
    out.line(" * number: a producer claims the tail position with a compare-and-set and");
    out.line(" * publishes the slot by advancing its sequence, the consumer frees it by moving");
    out.line(" * the sequence one lap ahead. Slots are allocated once, up front.");
    out.line(" */");
    out.line("private static final class EventQueue {");
    out.line("private final Event[] slots;");
    out.line("private final AtomicLongArray sequences;");
    out.line("private final AtomicLong tail = new AtomicLong();");
    out.line("private final int capacity;");
    out.line("// consumer only");
    out.line("private volatile long head;");
    out.blank();
    out.line("private EventQueue(final int capacity) {");
    out.line("// with a single slot a published event and a free slot look alike");
    out.line("if (capacity < 2) {");
    out.line("throw new IllegalArgumentException(\"queueCapacity must be at least 2 but was \" "
        + "+ capacity);");
    out.line("}");
    out.line("this.capacity = capacity;");
    out.line("this.slots = new Event[capacity];");
    out.line("this.sequences = new AtomicLongArray(capacity);");
    out.line("for (int i = 0; i < capacity; i++) {");
    out.line("sequences.set(i, i);");
    out.line("}");
    out.line("}");
    out.blank();
    out.line("private boolean offer(final Event event) {");
    out.line("long position = tail.get();");
    out.line("while (true) {");
    out.line("final int index = (int) (position % capacity);");
    out.line("final long difference = sequences.get(index) - position;");
    out.line("if (difference == 0) {");
    out.line("if (tail.compareAndSet(position, position + 1)) {");
    out.line("slots[index] = event;");
    out.line("sequences.set(index, position + 1);");
    out.line("return true;");
    out.line("}");
    out.line("position = tail.get();");
    out.line("} else if (difference < 0) {");
    out.line("return false;");
    out.line("} else {");
    out.line("position = tail.get();");
    out.line("}");
    out.line("}");
    out.line("}");
    out.blank();
    out.line("private Event poll() {");
    out.line("final long position = head;");
    out.line("final int index = (int) (position % capacity);");
    out.line("if (sequences.get(index) != position + 1) {");
    out.line("return null;");
    out.line("}");
    out.line("final Event event = slots[index];");
    out.line("slots[index] = null;");
    out.line("sequences.set(index, position + capacity);");
    out.line("head = position + 1;");
    out.line("return event;");
    out.line("}");
    out.blank();
    out.line("private int size() {");
    out.line("final long size = tail.get() - head;");
    out.line("return (int) Math.max(0L, Math.min(size, capacity));");
    out.line("}");
    out.line("}");
  }
}
