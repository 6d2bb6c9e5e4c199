package com.github.fsmcodegen;

import java.nio.file.Path;
import java.util.List;

import com.github.fsmcodegen.model.FsmModel;

/**
 * Front door of the fsm compiler: parses fsm source into models, validates them and generates
 * state machine source for one of the supported {@link Target}s.
 *
 * Notes for users:<br>
 * 1. a compiler instance holds nothing but its immutable configuration, so it is thread-safe and
 * can be shared freely<br>
 *
 * 2. validation problems are returned as values, never thrown. Only generation refuses an invalid
 * model, with an {@link FsmException.Code#INVALID_MODEL} exception listing every problem<br>
 *
 * 3. generation is deterministic: the same model and configuration always produce the same
 * source<br>
 */
public interface FsmCompiler {

  /**
   * Parse every fsm block of the source, in source order. The first syntax error aborts.
   */
  List<FsmModel> parse(final String source) throws FsmParseException;

  /**
   * Read a .fsm file as UTF-8 and parse it. Read failures are reported with code
   * {@link FsmException.Code#IO_FAILURE}.
   */
  List<FsmModel> parse(final Path sourceFile) throws FsmException;

  /**
   * Collect every semantic problem of the model in one pass.
   */
  ValidationResult validate(final FsmModel model);

  /**
   * Validate the model and emit one self-contained java compilation unit for the target.
   */
  String generate(final FsmModel model, final Target target) throws FsmException;

  /**
   * Name of the top-level class {@link #generate(FsmModel, Target)} emits.
   */
  String className(final FsmModel model, final Target target);

  /**
   * Returns the config that this compiler is wired with.
   */
  GeneratorConfiguration getConfiguration();

  /**
   * A simple builder to let users use fluent APIs to build compilers.
   */
  public final static class FsmCompilerBuilder {
    private GeneratorConfiguration config;

    public static FsmCompilerBuilder newBuilder() {
      return new FsmCompilerBuilder();
    }

    public FsmCompilerBuilder config(final GeneratorConfiguration config) {
      this.config = config;
      return this;
    }

    public FsmCompiler build() {
      return new FsmCompilerImpl(config == null ? GeneratorConfiguration.defaults() : config);
    }

    private FsmCompilerBuilder() {}
  }

}
