package com.github.fsmcodegen;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.fsmcodegen.FsmException.Code;
import com.github.fsmcodegen.codegen.CodeGenerator;
import com.github.fsmcodegen.codegen.TransitionTable;
import com.github.fsmcodegen.model.FsmModel;
import com.github.fsmcodegen.model.State;
import com.github.fsmcodegen.model.Transition;
import com.github.fsmcodegen.parser.FsmParser;

/**
 * Default {@link FsmCompiler}. Parsing and generation are delegated to the parser and to the
 * {@link CodeGenerator} of the requested target; this class validates in between and reports what
 * each target leaves out.
 */
public final class FsmCompilerImpl implements FsmCompiler {
  private static final Logger logger = LogManager.getLogger(FsmCompilerImpl.class.getSimpleName());

  private final GeneratorConfiguration config;
  private final FsmParser parser = new FsmParser();

  FsmCompilerImpl(final GeneratorConfiguration config) {
    this.config = Objects.requireNonNull(config, "config");
    logInfo(null, null, "Fsm compiler wired with " + config);
  }

  @Override
  public List<FsmModel> parse(final String source) throws FsmParseException {
    final List<FsmModel> models = parser.parse(source);
    for (FsmModel model : models) {
      logInfo(model.getName(), null, "Parsed " + model.getStates().size() + " states and "
          + model.getTransitions().size() + " transitions");
    }
    return models;
  }

  @Override
  public List<FsmModel> parse(final Path sourceFile) throws FsmException {
    Objects.requireNonNull(sourceFile, "sourceFile");
    final String source;
    try {
      source = new String(Files.readAllBytes(sourceFile), StandardCharsets.UTF_8);
    } catch (IOException problem) {
      throw new FsmException(Code.IO_FAILURE, "Failed to read " + sourceFile, problem);
    }
    logDebug(null, null, "Read " + source.length() + " chars from " + sourceFile);
    return parse(source);
  }

  @Override
  public ValidationResult validate(final FsmModel model) {
    Objects.requireNonNull(model, "model");
    final ValidationResult result = model.validate();
    if (result.isValid()) {
      logDebug(model.getName(), null, "Validated");
    } else {
      logInfo(model.getName(), null,
          "Validation found " + result.getProblems().size() + " problems: " + result.getProblems());
    }
    return result;
  }

  @Override
  public String generate(final FsmModel model, final Target target) throws FsmException {
    Objects.requireNonNull(model, "model");
    Objects.requireNonNull(target, "target");
    validate(model).orThrow(model.getName());
    warnAboutIgnoredFeatures(model, target);
    final CodeGenerator generator = CodeGenerator.forTarget(target, config);
    final String source = generator.generate(model);
    logInfo(model.getName(), target, "Generated " + generator.className(model) + ", "
        + source.length() + " chars");
    return source;
  }

  @Override
  public String className(final FsmModel model, final Target target) {
    return CodeGenerator.forTarget(target, config).className(model);
  }

  @Override
  public GeneratorConfiguration getConfiguration() {
    return config;
  }

  private static void warnAboutIgnoredFeatures(final FsmModel model, final Target target)
      throws FsmException {
    if (target != Target.INTERRUPT_QUEUE) {
      if (!model.getVariables().isEmpty() || hasAssignments(model)) {
        logWarning(model.getName(), target,
            "Extended state variables and assignments are only generated for "
                + Target.INTERRUPT_QUEUE);
      }
      if (model.collectEvents().stream().anyMatch(event -> event.carriesPayload())) {
        logWarning(model.getName(), target,
            "Event payloads are only generated for " + Target.INTERRUPT_QUEUE);
      }
    }
    final List<Transition> completions = TransitionTable.build(model).getCompletionTransitions();
    if (!completions.isEmpty()) {
      logWarning(model.getName(), target, completions.size()
          + " transitions without an event are documented but never dispatched");
    }
    for (State state : model.getStates()) {
      if (state.getSubMachine().isPresent()) {
        logWarning(model.getName(), target, "Nested fsm of composite state '" + state.getName()
            + "' is not generated");
      }
    }
  }

  private static boolean hasAssignments(final FsmModel model) {
    for (Transition transition : model.getTransitions()) {
      if (!transition.getAssignments().isEmpty()) {
        return true;
      }
    }
    for (State state : model.getStates()) {
      for (Transition internal : state.getInternalTransitions()) {
        if (!internal.getAssignments().isEmpty()) {
          return true;
        }
      }
    }
    return false;
  }

  private static String prefix(final String fsmName, final Target target) {
    return new StringBuilder().append("[fsm:").append(fsmName).append("][target:").append(target)
        .append("] ").toString();
  }

  private static void logInfo(final String fsmName, final Target target, final String message) {
    logger.info(prefix(fsmName, target) + message);
  }

  private static void logDebug(final String fsmName, final Target target, final String message) {
    if (logger.isDebugEnabled()) {
      logger.debug(prefix(fsmName, target) + message);
    }
  }

  private static void logWarning(final String fsmName, final Target target,
      final String message) {
    logger.warn(prefix(fsmName, target) + message);
  }

}
