package com.github.fsmcodegen.codegen;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Set;

import com.github.fsmcodegen.GeneratorConfiguration;
import com.github.fsmcodegen.Target;

/**
 * Synchronous dispatch: one call, one step, on the caller's thread. Nothing is queued and nothing
 * blocks.
 */
final class StandardGenerator extends AbstractJavaGenerator {

  StandardGenerator(final GeneratorConfiguration configuration) {
    super(configuration);
  }

  @Override
  public Target getTarget() {
    return Target.STANDARD;
  }

  @Override
  protected String dispatchVisibility() {
    return "public";
  }

  @Override
  protected Set<String> imports() {
    return Collections.singleton("java.util.Objects");
  }

  @Override
  protected List<String> classDocumentation(final Unit unit) {
    return Arrays.asList("",
        "Synchronous dispatcher. Each call to dispatch runs one step on the calling thread;",
        "callers sharing an instance across threads provide their own mutual exclusion.");
  }

  @Override
  protected void writeMembers(final JavaWriter out, final Unit unit) {
    out.line("private final Actions actions;");
    out.line("private State state;");
    out.blank();
    out.line("/**");
    out.line(" * Runs the entry actions of the initial state before returning.");
    out.line(" */");
    out.line("public " + unit.className + "(final Actions actions) {");
    out.line("this.actions = Objects.requireNonNull(actions, \"actions\");");
    writeInitialEntry(out, unit);
    out.line("}");
    out.blank();
    writeGetter(out, "State", "state", "state");
  }
}
