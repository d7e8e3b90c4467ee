package com.codeheadsystems.qbt.client.exceptions;

import java.util.Objects;

/**
 * A classified client error: what kind of failure happened, a human-readable description, the
 * underlying cause (if any) and whether retrying can help.
 * <p>
 * Instances are produced by the error classifier and by the session manager.  The permanence
 * flag normally follows {@link ErrorCode#isPermanent()}, but is carried per instance so that a
 * rejected session cookie can be reported as a transient {@link ErrorCode#AUTH_FAILURE}.
 */
public class QbtClientException extends RuntimeException {

  private final ErrorCode code;
  private final String detail;
  private final boolean permanent;
  private final int statusCode;

  /**
   * Instantiates a new Qbt client exception with the code's default permanence.
   *
   * @param code   the code
   * @param detail the detail
   * @param cause  the cause, may be null
   */
  public QbtClientException(final ErrorCode code, final String detail, final Throwable cause) {
    this(code, detail, cause, code.isPermanent(), 0);
  }

  /**
   * Instantiates a new Qbt client exception.
   *
   * @param code       the code
   * @param detail     the detail
   * @param cause      the cause, may be null
   * @param permanent  whether the failure requires user intervention
   * @param statusCode the HTTP status that produced the error, or 0
   */
  public QbtClientException(final ErrorCode code,
                            final String detail,
                            final Throwable cause,
                            final boolean permanent,
                            final int statusCode) {
    super(format(code, detail, cause), cause);
    this.code = Objects.requireNonNull(code, "code");
    this.detail = detail;
    this.permanent = permanent;
    this.statusCode = statusCode;
  }

  /**
   * The error returned without a network call once authentication has permanently failed.
   *
   * @return the qbt client exception
   */
  public static QbtClientException authPermanentlyFailed() {
    return new QbtClientException(ErrorCode.AUTH_FAILURE,
        "Authentication has permanently failed - update credentials and reset the auth failure", null);
  }

  /**
   * A rejected session on an authenticated call.  Transient: the next attempt logs in again.
   *
   * @param statusCode the 401 or 403 status
   * @return the qbt client exception
   */
  public static QbtClientException sessionRejected(final int statusCode) {
    return new QbtClientException(ErrorCode.AUTH_FAILURE,
        "Session rejected with status " + statusCode, null, false, statusCode);
  }

  private static String format(ErrorCode code, String detail, Throwable cause) {
    if (cause != null) {
      return code + ": " + detail + " (" + cause + ")";
    }
    return code + ": " + detail;
  }

  /**
   * Returns a copy of this error that the retry loop will treat as transient.
   *
   * @return this instance if already transient, else a transient copy
   */
  public QbtClientException asTransient() {
    if (!permanent) {
      return this;
    }
    return new QbtClientException(code, detail, getCause(), false, statusCode);
  }

  public ErrorCode code() {
    return code;
  }

  public String detail() {
    return detail;
  }

  public boolean isPermanent() {
    return permanent;
  }

  /**
   * The HTTP status that produced this error.
   *
   * @return the status, or 0 when the error did not come from an HTTP response
   */
  public int statusCode() {
    return statusCode;
  }
}
