package com.github.fsmcodegen.cli;

import java.io.PrintStream;
import java.io.PrintWriter;
import java.nio.file.Paths;
import java.util.List;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.fsmcodegen.FsmCompiler;
import com.github.fsmcodegen.FsmException;
import com.github.fsmcodegen.codegen.Labels;
import com.github.fsmcodegen.model.FsmModel;
import com.github.fsmcodegen.model.State;
import com.github.fsmcodegen.model.Transition;

/**
 * Parses one .fsm file and prints a summary of every fsm it declares.
 *
 * Exit codes: 0 on success, 1 on a usage error, 2 when the file cannot be read or parsed.
 */
public final class FsmCli {
  private static final Logger logger = LogManager.getLogger(FsmCli.class.getSimpleName());
  private static final String usage = "fsm-codegen [-h] <file.fsm>";

  static final int EXIT_OK = 0;
  static final int EXIT_USAGE = 1;
  static final int EXIT_FAILURE = 2;

  private FsmCli() {}

  public static void main(final String[] args) {
    System.exit(run(args, System.out, System.err));
  }

  static int run(final String[] args, final PrintStream out, final PrintStream err) {
    final Options options = new Options();
    options.addOption("h", "help", false, "Print this help");
    final CommandLine commandLine;
    try {
      commandLine = new DefaultParser().parse(options, args);
    } catch (ParseException problem) {
      err.println(problem.getMessage());
      printUsage(options, err);
      return EXIT_USAGE;
    }
    if (commandLine.hasOption('h')) {
      printUsage(options, out);
      return EXIT_OK;
    }
    final List<String> files = commandLine.getArgList();
    if (files.size() != 1) {
      printUsage(options, err);
      return EXIT_USAGE;
    }

    final FsmCompiler compiler = FsmCompiler.FsmCompilerBuilder.newBuilder().build();
    final List<FsmModel> models;
    try {
      models = compiler.parse(Paths.get(files.get(0)));
    } catch (FsmException problem) {
      logger.debug("Failed to load " + files.get(0), problem);
      err.println("Error: " + problem.getMessage());
      return EXIT_FAILURE;
    }
    for (FsmModel model : models) {
      summarize(model, out);
    }
    return EXIT_OK;
  }

  static void summarize(final FsmModel model, final PrintStream out) {
    out.println("FSM: " + model.getName());
    if (model.getDescription().isPresent()) {
      out.println("  Description: " + model.getDescription().get());
    }
    out.println("  States: " + model.getStates().size());
    for (State state : model.getStates()) {
      out.println("    - " + state.getName() + " (" + state.getKind() + ")");
    }
    out.println("  Transitions: " + model.getTransitions().size());
    for (Transition transition : model.getTransitions()) {
      out.println("    - " + Labels.edge(transition));
    }
    out.println("  Initial: " + model.getInitialState().orElse("<none>"));
  }

  private static void printUsage(final Options options, final PrintStream stream) {
    final PrintWriter writer = new PrintWriter(stream);
    new HelpFormatter().printHelp(writer, HelpFormatter.DEFAULT_WIDTH, usage, null, options,
        HelpFormatter.DEFAULT_LEFT_PAD, HelpFormatter.DEFAULT_DESC_PAD, null);
    writer.flush();
  }
}
