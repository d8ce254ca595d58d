package com.github.xmachine;

/**
 * Unified single exception that's thrown by the generator when a run cannot continue. The code
 * enum encapsulates the various fatal conditions. Expected outcomes such as a rejected input or an
 * exhausted search are never reported through this exception, they are ordinary return values.
 */
public final class XMachineException extends Exception {
  private static final long serialVersionUID = 1L;
  private final Code code;

  public XMachineException(final Code code) {
    super(code.getDescription());
    this.code = code;
  }

  public XMachineException(final Code code, final String message) {
    super(message);
    this.code = code;
  }

  public XMachineException(final Code code, final Throwable throwable) {
    super(throwable);
    this.code = code;
  }

  public XMachineException(final Code code, final String message, final Throwable throwable) {
    super(message, throwable);
    this.code = code;
  }

  public Code getCode() {
    return code;
  }

  public static enum Code {
    // 1.
    NON_DETERMINISTIC_MODEL(
        "Processing function returned different results for an identical (state, memory, input)"),
    // 2.
    MALFORMED_ALPHABET("Input alphabet is null, empty or contains null or duplicate symbols"),
    // 3.
    INVALID_MODEL("Machine model definition is invalid"),
    // 4.
    MODEL_FAILURE("Processing function failed. Check exception stacktrace for more details"),
    // 5.
    INVALID_GENERATOR_CONFIG("Generator configuration is invalid"),
    // 6.
    REPLAY_MISMATCH("Replaying a generated test against the model did not match exploration"),
    // 7.
    INTERRUPTED("Generator was interrupted"),
    // 8.
    UNKNOWN_FAILURE(
        "Generator failed. Check exception stacktrace for more details of the failure");

    private String description;

    private Code(String description) {
      this.description = description;
    }

    public String getDescription() {
      return description;
    }
  }

}
