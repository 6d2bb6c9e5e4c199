package com.github.fsmcodegen.codegen;

import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import com.github.fsmcodegen.GeneratorConfiguration;
import com.github.fsmcodegen.Target;

/**
 * Cooperative active object: producers post into a bounded queue, one consumer drains it and owns
 * the dispatcher. Transition semantics are those of the synchronous target.
 */
final class ActiveObjectGenerator extends AbstractJavaGenerator {

  ActiveObjectGenerator(final GeneratorConfiguration configuration) {
    super(configuration);
  }

  @Override
  public Target getTarget() {
    return Target.ACTIVE_OBJECT;
  }

  @Override
  protected Set<String> imports() {
    return new HashSet<>(Arrays.asList("java.util.Objects", "java.util.Optional",
        "java.util.concurrent.ArrayBlockingQueue", "java.util.concurrent.BlockingQueue"));
  }

  @Override
  protected List<String> classDocumentation(final Unit unit) {
    return Arrays.asList("",
        "Active object. Any number of threads may post, through the object itself or through",
        "Poster handles; posting never blocks and reports a full queue by returning false. Exactly",
        "one consumer thread calls runOnce or runAll, which dispatch in arrival order.");
  }

  @Override
  protected void writeMembers(final JavaWriter out, final Unit unit) {
    out.line("public static final int DEFAULT_QUEUE_CAPACITY = "
        + configuration.getQueueCapacity() + ";");
    out.blank();
    out.line("private final Actions actions;");
    out.line("private final BlockingQueue<Event> queue;");
    out.line("private volatile State state;");
    out.blank();
    out.line("public " + unit.className + "(final Actions actions) {");
    out.line("this(actions, DEFAULT_QUEUE_CAPACITY);");
    out.line("}");
    out.blank();
    out.line("/**");
    out.line(" * Runs the entry actions of the initial state before returning.");
    out.line(" */");
    out.line("public " + unit.className + "(final Actions actions, final int queueCapacity) {");
    out.line("if (queueCapacity < 1) {");
    out.line("throw new IllegalArgumentException(\"queueCapacity must be positive but was \" "
        + "+ queueCapacity);");
    out.line("}");
    out.line("this.actions = Objects.requireNonNull(actions, \"actions\");");
    out.line("this.queue = new ArrayBlockingQueue<>(queueCapacity);");
    writeInitialEntry(out, unit);
    out.line("}");
    out.blank();
    out.line("/**");
    out.line(" * Enqueues without blocking, safe from any thread.");
    out.line(" *");
    out.line(" * @return false if the queue is full, in which case the event is dropped");
    out.line(" */");
    out.line("public boolean post(final Event event) {");
    out.line("return queue.offer(Objects.requireNonNull(event, \"event\"));");
    out.line("}");
    out.blank();
    out.line("/**");
    out.line(" * A posting handle for another producer.");
    out.line(" */");
    out.line("public Poster poster() {");
    out.line("return new Poster(queue);");
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
  }

  @Override
  protected void writeTypes(final JavaWriter out, final Unit unit) {
    out.blank();
    out.line("/**");
    out.line(" * Cloneable producer handle feeding the same queue.");
    out.line(" */");
    out.line("public static final class Poster {");
    out.line("private final BlockingQueue<Event> queue;");
    out.blank();
    out.line("private Poster(final BlockingQueue<Event> queue) {");
    out.line("this.queue = queue;");
    out.line("}");
    out.blank();
    out.line("public boolean post(final Event event) {");
    out.line("return queue.offer(Objects.requireNonNull(event, \"event\"));");
    out.line("}");
    out.blank();
    out.line("public Poster copy() {");
    out.line("return new Poster(queue);");
    out.line("}");
    out.line("}");
  }
}
