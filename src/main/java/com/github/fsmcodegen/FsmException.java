package com.github.fsmcodegen;

/**
 * Unified exception that's thrown and handled by the fsm compiler. The idea is to use the code enum
 * to encapsulate the various error conditions across parsing, generation and configuration. Note
 * that validation problems are never thrown on their own, they are reported as values via
 * {@link ValidationResult} and only get wrapped into an {@link Code#INVALID_MODEL} exception when
 * a caller asks for code to be generated from an invalid model.
 */
public class FsmException extends Exception {
  private static final long serialVersionUID = 1L;
  private final Code code;

  public FsmException(final Code code) {
    super(code.getDescription());
    this.code = code;
  }

  public FsmException(final Code code, final String message) {
    super(message);
    this.code = code;
  }

  public FsmException(final Code code, final String message, final Throwable throwable) {
    super(message, throwable);
    this.code = code;
  }

  public FsmException(final Code code, final Throwable throwable) {
    super(throwable);
    this.code = code;
  }

  public Code getCode() {
    return code;
  }

  public static enum Code {
    // 1.
    SYNTAX_ERROR("Failed to parse fsm source. Check the reported line and column."),
    // 2.
    INVALID_MODEL("Fsm model failed validation and cannot be used for code generation"),
    // 3.
    INVALID_GENERATOR_CONFIG("Generator configuration is invalid"),
    // 4.
    GENERATION_FAILURE(
        "Failed to derive generation tables from a validated model. This is a contract "
            + "violation, not a user error."),
    // 5.
    IO_FAILURE("Failed to read fsm source"),
    // 6.
    UNKNOWN_FAILURE(
        "Fsm compiler failed. Check exception stacktrace for more details of the failure");

    private String description;

    private Code(String description) {
      this.description = description;
    }

    public String getDescription() {
      return description;
    }
  }

}
