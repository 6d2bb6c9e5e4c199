package com.github.fsmcodegen.codegen;

import com.github.fsmcodegen.FsmException;
import com.github.fsmcodegen.GeneratorConfiguration;
import com.github.fsmcodegen.Target;
import com.github.fsmcodegen.model.FsmModel;

/**
 * Emits the source of one self-contained state machine for a single target architecture.
 * Implementations expect a model that already passed validation.
 */
public interface CodeGenerator {

  Target getTarget();

  /**
   * @return the complete source of one java compilation unit
   */
  String generate(FsmModel model) throws FsmException;

  /**
   * Name of the top-level class {@link #generate(FsmModel)} emits for the model.
   */
  String className(FsmModel model);

  static CodeGenerator forTarget(final Target target,
      final GeneratorConfiguration configuration) {
    switch (target) {
      case STANDARD:
        return new StandardGenerator(configuration);
      case ACTIVE_OBJECT:
        return new ActiveObjectGenerator(configuration);
      case INTERRUPT_QUEUE:
        return new InterruptQueueGenerator(configuration);
      default:
        throw new IllegalArgumentException("Unsupported target " + target);
    }
  }
}
