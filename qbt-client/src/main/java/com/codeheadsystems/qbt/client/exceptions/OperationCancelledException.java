package com.codeheadsystems.qbt.client.exceptions;

/**
 * Thrown when the caller cancelled an operation, its deadline passed, or the calling thread
 * was interrupted.  Distinct from {@link OperationFailedException} so callers can tell a
 * cancellation apart from the last transient error.
 */
public class OperationCancelledException extends RuntimeException {

  /**
   * Instantiates a new Operation cancelled exception.
   *
   * @param message the message
   * @param cause   the cause, may be null
   */
  public OperationCancelledException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
