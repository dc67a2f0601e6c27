package com.github.flowmachine;

/**
 * Unified single exception that's thrown and handled across the flow toolchain. The code enum
 * encapsulates the various failure conditions. Callers that must never fail, like the editor's save
 * and load paths, receive it wrapped inside a result object instead of having it thrown.
 */
public final class FlowException extends Exception {
  private static final long serialVersionUID = 1L;
  private final Code code;

  public FlowException(final Code code) {
    super(code.getDescription());
    this.code = code;
  }

  public FlowException(final Code code, final String message) {
    super(message);
    this.code = code;
  }

  public FlowException(final Code code, final String message, final Throwable throwable) {
    super(message, throwable);
    this.code = code;
  }

  public Code getCode() {
    return code;
  }

  public static enum Code {
    // 1.
    INVALID_MODEL("Flow model is structurally invalid and cannot be compiled"),
    // 2.
    INVALID_EXPRESSION("Condition expression could not be parsed"),
    // 3.
    UNSUPPORTED_VERSION("Flow file carries an unsupported format version"),
    // 4.
    INVALID_CONFIG("Configuration is invalid"),
    // 5.
    IO_FAILURE("Failed to read or write a file. Check exception stacktrace for more details.");

    private String description;

    private Code(String description) {
      this.description = description;
    }

    public String getDescription() {
      return description;
    }
  }

}
