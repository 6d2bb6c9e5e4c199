package com.github.fsmcodegen;

import static org.junit.Assert.assertEquals;

import java.io.IOException;

import org.junit.Test;
import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.State;

import com.github.fsmcodegen.model.FsmModel;

@State(Scope.Benchmark)
public class FsmCompilerBenchmarkTest {
  static {
    System.setProperty("log4j.configurationFile", "log4j.properties");
  }

  private final FsmCompiler compiler = FsmCompiler.FsmCompilerBuilder.newBuilder().build();
  private final String source;

  public FsmCompilerBenchmarkTest() {
    try {
      source = Fixtures.read(Fixtures.MOTOR);
    } catch (IOException problem) {
      throw new IllegalStateException(problem);
    }
  }

  @Benchmark
  public int testParseAndGenerate() throws FsmException {
    // 1. parse the source into models
    int chars = 0;
    for (FsmModel model : compiler.parse(source)) {
      // 2. generate every target
      for (Target target : Target.values()) {
        chars += compiler.generate(model, target).length();
      }
    }
    return chars;
  }

  @Test
  public void testSingleRun() throws FsmException {
    final int first = testParseAndGenerate();
    assertEquals(first, testParseAndGenerate());
  }

  public static void main(String args[]) throws FsmException {
    FsmCompilerBenchmarkTest test = new FsmCompilerBenchmarkTest();
    test.testParseAndGenerate();
  }

}
