package com.codeheadsystems.qbt.client.exceptions;

/**
 * The kinds of failure the client distinguishes.  Each kind carries its default permanence:
 * a permanent failure needs a human to fix credentials or configuration and is never retried,
 * a transient one may go away on its own.
 */
public enum ErrorCode {

  /** Bad credentials, HTTP 401/403 on login, or the service's {@code Fails.} login reply. */
  AUTH_FAILURE(true),
  /** Connect or request deadline exceeded, or HTTP 504. */
  TIMEOUT(false),
  /** The service's host name could not be resolved. */
  DNS_ERROR(true),
  /** Plaintext HTTP was spoken to a TLS-only endpoint, or the reverse. */
  HTTPS_REQUIRED(true),
  /** Certificate verification or TLS handshake failure. */
  SSL_ERROR(true),
  /** The service does not speak the Web API version this client needs. */
  VERSION_INCOMPATIBLE(true),
  /** The remote host actively refused the connection. */
  CONNECTION_REFUSED(false),
  /** No route to the remote host. */
  NETWORK_UNREACHABLE(false),
  /** HTTP 502 from a proxy in front of the service. */
  BAD_GATEWAY(false),
  /** HTTP 503. */
  SERVICE_UNAVAILABLE(false),
  /** Anything that matched no other kind. */
  UNKNOWN(false);

  private final boolean permanent;

  ErrorCode(final boolean permanent) {
    this.permanent = permanent;
  }

  /**
   * Whether errors of this kind require user intervention by default.
   *
   * @return true if permanent
   */
  public boolean isPermanent() {
    return permanent;
  }
}
