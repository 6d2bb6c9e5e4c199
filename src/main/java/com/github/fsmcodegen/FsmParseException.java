package com.github.fsmcodegen;

/**
 * Syntax error in fsm source. Carries the 1-based line and column of the offending token. The
 * parser does not attempt recovery, so the first one of these aborts the whole source unit.
 */
public final class FsmParseException extends FsmException {
  private static final long serialVersionUID = 1L;
  private final int line;
  private final int column;
  private final String detail;

  public FsmParseException(final int line, final int column, final String detail) {
    super(Code.SYNTAX_ERROR, format(line, column, detail));
    this.line = line;
    this.column = column;
    this.detail = detail;
  }

  public int getLine() {
    return line;
  }

  public int getColumn() {
    return column;
  }

  /**
   * The explanatory message without the location prefix.
   */
  public String getDetail() {
    return detail;
  }

  private static String format(final int line, final int column, final String detail) {
    return "Syntax error at line " + line + ", column " + column + ": " + detail;
  }
}
