package com.codeheadsystems.qbt.client.exceptions;

/**
 * Thrown when a retried operation ends without success: either a permanent error stopped it
 * early or every attempt failed.  The classified cause of the last attempt is the
 * {@link #getCause() cause}.
 */
public class OperationFailedException extends RuntimeException {

  private final String label;
  private final int attempts;
  private final boolean exhausted;

  /**
   * Instantiates a new Operation failed exception.
   *
   * @param label     the operation label
   * @param attempts  how many times the operation ran
   * @param exhausted true if the retry budget ran out, false if a permanent error stopped it
   * @param cause     the classified cause of the final attempt
   */
  public OperationFailedException(final String label,
                                  final int attempts,
                                  final boolean exhausted,
                                  final QbtClientException cause) {
    super(exhausted
        ? label + " failed after " + attempts + " attempts: " + cause.getMessage()
        : label + " failed: " + cause.getMessage(), cause);
    this.label = label;
    this.attempts = attempts;
    this.exhausted = exhausted;
  }

  public String label() {
    return label;
  }

  public int attempts() {
    return attempts;
  }

  public boolean isExhausted() {
    return exhausted;
  }

  public QbtClientException classifiedCause() {
    return (QbtClientException) getCause();
  }

  public ErrorCode code() {
    return classifiedCause().code();
  }

  public boolean isPermanent() {
    return classifiedCause().isPermanent();
  }
}
