package com.github.fsmcodegen.parser;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.antlr.v4.runtime.Token;
import org.junit.Test;

import com.github.fsmcodegen.FsmParseException;

/**
 * Tests to maintain the sanity of tokenization.
 */
public class FsmDslLexerTest {
  private final FsmParser parser = new FsmParser();

  @Test
  public void testArrowsAndPseudostate() {
    assertEquals(Arrays.asList(FsmDslLexer.PSEUDOSTATE, FsmDslLexer.ARROW, FsmDslLexer.IDENT,
        FsmDslLexer.THIN_ARROW, FsmDslLexer.STAR), types("[*] --> Idle -> *"));
  }

  @Test
  public void testChoiceBrackets() {
    assertEquals(Arrays.asList(FsmDslLexer.IDENT, FsmDslLexer.ARROW, FsmDslLexer.DOUBLE_LT,
        FsmDslLexer.IDENT, FsmDslLexer.DOUBLE_GT), types("Check --> <<Validate>>"));
  }

  @Test
  public void testKeywordsNeedWholeWords() {
    assertEquals(Arrays.asList(FsmDslLexer.STATE, FsmDslLexer.IDENT, FsmDslLexer.START_TIMER,
        FsmDslLexer.IDENT), types("state stateful start_timer start_timers"));
  }

  @Test
  public void testNumbers() {
    final List<? extends Token> tokens = FsmParser.lexer("5000 -1 2.5").getAllTokens();
    assertEquals("5000", tokens.get(0).getText());
    assertEquals("-1", tokens.get(1).getText());
    assertEquals(FsmDslLexer.NUMBER, tokens.get(2).getType());
    assertEquals("2.5", tokens.get(2).getText());
  }

  @Test
  public void testStringKeepsQuotesAndEscapes() {
    final Token string = FsmParser.lexer("\"say \\\"hi\\\"\"").nextToken();
    assertEquals(FsmDslLexer.STRING, string.getType());
    assertEquals("\"say \\\"hi\\\"\"", string.getText());
    assertEquals("say \"hi\"", FsmParser.unquote(string.getText()));
  }

  @Test
  public void testCommentsAreSkipped() {
    assertEquals(Arrays.asList(FsmDslLexer.FSM, FsmDslLexer.IDENT),
        types("// line\nfsm /* block\n comment */ Test"));
  }

  @Test
  public void testPositions() {
    final Token pseudostate = FsmParser.lexer("fsm Test {\n  [*] --> A\n}").getAllTokens().get(3);
    assertEquals(FsmDslLexer.PSEUDOSTATE, pseudostate.getType());
    assertEquals(2, pseudostate.getLine());
    assertEquals(2, pseudostate.getCharPositionInLine());
  }

  @Test
  public void testGuardIsOneToken() {
    final List<? extends Token> tokens =
        FsmParser.lexer("[ reading  >  10000 && flags[0] ] / act").getAllTokens();
    assertEquals(FsmDslLexer.GUARD, tokens.get(0).getType());
    assertEquals("[ reading  >  10000 && flags[0] ]", tokens.get(0).getText());
    assertEquals(FsmDslLexer.SLASH, tokens.get(1).getType());
  }

  @Test
  public void testErrors() {
    expectError("fsm Test { # }", 1, 12);
    expectError("fsm Test {\n state S : \"open\n}", 2, 12);
    expectError("fsm Test {\n state S : \"bad \\q\"\n}", 2, 12);
    expectError("fsm Test {\n A --> B : Go [ a > 1\n}", 2, 15);
    expectError("fsm Test {\n A --> B : Go [ a >\n 1 ]\n}", 2, 15);
    expectError("fsm Test { /* never closed", 1, 12);
  }

  @Test
  public void testEmptyGuard() {
    try {
      parser.parse("fsm Test {\n A --> B : [   ]\n}");
      fail("Expected a syntax error");
    } catch (FsmParseException expected) {
      assertEquals("Empty guard expression", expected.getDetail());
      assertEquals(2, expected.getLine());
      assertEquals(12, expected.getColumn());
    }
  }

  private void expectError(final String source, final int line, final int column) {
    try {
      parser.parse(source);
      fail("Expected a syntax error for " + source);
    } catch (FsmParseException expected) {
      assertEquals(line, expected.getLine());
      assertEquals(column, expected.getColumn());
    }
  }

  private static List<Integer> types(final String source) {
    final List<Integer> types = new ArrayList<>();
    for (Token token : FsmParser.lexer(source).getAllTokens()) {
      types.add(token.getType());
    }
    return types;
  }
}
