package com.github.flowmachine;

/**
 * This object encapsulates the outcome of a one-shot toolchain operation such as saving, loading or
 * exporting a flow.
 *
 * Successes are encoded with {@link #successful} set to true. Failures report
 * {@link #isSuccessful()} as false and typically carry an associated {@link #error}.
 * {@link #description} is optional.
 */
public final class OperationResult {
  private final String description;
  private final FlowException error;
  private final boolean successful;

  public OperationResult(final boolean successful, final String description,
      final FlowException error) {
    this.successful = successful;
    this.description = description;
    this.error = error;
  }

  public static OperationResult success(final String description) {
    return new OperationResult(true, description, null);
  }

  public static OperationResult failure(final FlowException error) {
    return new OperationResult(false, error.getMessage(), error);
  }

  public String getDescription() {
    return description;
  }

  public FlowException getError() {
    return error;
  }

  public boolean isSuccessful() {
    return successful;
  }

  @Override
  public String toString() {
    return "OperationResult [description=" + description + ", error=" + error + ", successful="
        + successful + "]";
  }
}
