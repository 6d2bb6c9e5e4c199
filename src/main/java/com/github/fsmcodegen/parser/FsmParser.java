package com.github.fsmcodegen.parser;

import java.util.ArrayList;
import java.util.List;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.misc.ParseCancellationException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.fsmcodegen.FsmParseException;
import com.github.fsmcodegen.model.FsmModel;

/**
 * Parser for the fsm language, built on the ANTLR grammar {@code FsmDsl.g4}. Each {@code fsm}
 * block of the source is lowered into an {@link FsmModel}. The first syntax error aborts the whole
 * source unit; there is no recovery.
 *
 * Keywords are only reserved by the lexer, every rule taking a name accepts them too, so they
 * remain usable as state and event names.
 *
 * Instances hold no state between calls and are safe to share.
 */
public final class FsmParser {
  private static final Logger logger = LogManager.getLogger(FsmParser.class.getSimpleName());

  /**
   * Parses every {@code fsm} block of the source, in source order.
   */
  public List<FsmModel> parse(final String source) throws FsmParseException {
    try {
      final List<FsmModel> models = new ArrayList<>();
      for (FsmDslParser.FsmContext fsm : syntaxTree(source).fsm()) {
        final FsmModel model = ModelLowering.lower(fsm);
        logger.debug("Parsed fsm '{}' with {} states and {} transitions", model.getName(),
            model.getStates().size(), model.getTransitions().size());
        models.add(model);
      }
      return models;
    } catch (ParseCancellationException cancelled) {
      if (cancelled.getCause() instanceof FsmParseException) {
        throw (FsmParseException) cancelled.getCause();
      }
      throw cancelled;
    }
  }

  /**
   * Lexes and parses the source into the grammar's {@code unit} tree. Errors surface as a
   * {@link ParseCancellationException} caused by an {@link FsmParseException}.
   */
  static FsmDslParser.UnitContext syntaxTree(final String source) {
    final FsmDslLexer lexer = lexer(source);
    final FsmDslParser parser = new FsmDslParser(new CommonTokenStream(lexer));
    parser.removeErrorListeners();
    parser.addErrorListener(FailFast.INSTANCE);
    return parser.unit();
  }

  /**
   * A lexer over the source that fails on the first unrecognized character.
   */
  static FsmDslLexer lexer(final String source) {
    final FsmDslLexer lexer = new FsmDslLexer(CharStreams.fromString(source == null ? "" : source));
    lexer.removeErrorListeners();
    lexer.addErrorListener(FailFast.INSTANCE);
    return lexer;
  }

  static ParseCancellationException error(final Token token, final String detail) {
    return error(token.getLine(), token.getCharPositionInLine(), detail);
  }

  private static ParseCancellationException error(final int line, final int charPositionInLine,
      final String detail) {
    return new ParseCancellationException(
        new FsmParseException(line, charPositionInLine + 1, detail));
  }

  static String unquote(final String literal) {
    final StringBuilder text = new StringBuilder();
    for (int i = 1; i < literal.length() - 1; i++) {
      char c = literal.charAt(i);
      if (c == '\\') {
        c = literal.charAt(++i);
        switch (c) {
          case 'n':
            c = '\n';
            break;
          case 't':
            c = '\t';
            break;
          case 'r':
            c = '\r';
            break;
          default:
            break;
        }
      }
      text.append(c);
    }
    return text.toString();
  }

  // listener callbacks cannot throw checked exceptions, parse() unwraps the cancellation
  private static final class FailFast extends BaseErrorListener {
    private static final FailFast INSTANCE = new FailFast();

    @Override
    public void syntaxError(final Recognizer<?, ?> recognizer, final Object offendingSymbol,
        final int line, final int charPositionInLine, final String msg,
        final RecognitionException problem) {
      throw error(line, charPositionInLine, msg);
    }
  }
}
