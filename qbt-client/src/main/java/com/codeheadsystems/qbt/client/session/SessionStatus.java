package com.codeheadsystems.qbt.client.session;

/**
 * Coarse connection state reported to callers.
 */
public enum SessionStatus {
  /** No login attempted yet, or the auth failure was reset. */
  INITIALIZING,
  /** Logged in. */
  CONNECTED,
  /** The session was invalidated or the credentials were rejected. */
  UNAUTHORIZED,
  /** The accessibility probe failed. */
  UNREACHABLE
}
