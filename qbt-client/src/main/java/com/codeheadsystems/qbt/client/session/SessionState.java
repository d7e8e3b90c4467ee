package com.codeheadsystems.qbt.client.session;

import com.codeheadsystems.qbt.client.exceptions.ErrorCode;
import com.codeheadsystems.qbt.client.exceptions.QbtClientException;
import java.net.HttpCookie;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Mutable session state owned by one client instance.
 * <p>
 * The validity flag, authentication time and status share a read/write lock.  The auth-failure
 * latch and the last error each have their own lock so that reading them never waits on a
 * login in progress.  Recording an {@link ErrorCode#AUTH_FAILURE} latches the auth failure.
 */
public class SessionState {

  private final Clock clock;
  private final SessionCache cache;

  private final ReentrantReadWriteLock sessionLock = new ReentrantReadWriteLock();
  private boolean valid;
  private Instant lastAuthenticationTime;
  private SessionStatus status = SessionStatus.INITIALIZING;

  private final ReentrantLock authFailedLock = new ReentrantLock();
  private boolean authPermanentlyFailed;

  private final ReentrantLock lastErrorLock = new ReentrantLock();
  private QbtClientException lastError;

  /**
   * Instantiates a new Session state.
   *
   * @param clock         the clock
   * @param sessionExpiry the cookie expiry window
   */
  public SessionState(final Clock clock, final Duration sessionExpiry) {
    this.clock = clock;
    this.cache = new SessionCache(clock, sessionExpiry);
  }

  public SessionCache cache() {
    return cache;
  }

  // ── Session ───────────────────────────────────────────────────────────────

  /**
   * Records a successful login.
   *
   * @param cookies the cookies the login returned
   */
  public void markAuthenticated(final Collection<HttpCookie> cookies) {
    sessionLock.writeLock().lock();
    try {
      cache.update(cookies);
      valid = true;
      lastAuthenticationTime = clock.instant();
      status = SessionStatus.CONNECTED;
    } finally {
      sessionLock.writeLock().unlock();
    }
    recordError(null);
  }

  /**
   * Records that the held session was confirmed by the service.
   *
   * @param cookies refreshed cookies, possibly empty
   */
  public void markValid(final Collection<HttpCookie> cookies) {
    sessionLock.writeLock().lock();
    try {
      cache.update(cookies);
      valid = true;
      status = SessionStatus.CONNECTED;
    } finally {
      sessionLock.writeLock().unlock();
    }
  }

  /**
   * Drops the validity flag but keeps the cookies.
   */
  public void markInvalid() {
    sessionLock.writeLock().lock();
    try {
      valid = false;
    } finally {
      sessionLock.writeLock().unlock();
    }
  }

  /**
   * Drops the validity flag and the cookies.
   */
  public void invalidate() {
    sessionLock.writeLock().lock();
    try {
      valid = false;
      cache.clear();
      status = SessionStatus.UNAUTHORIZED;
    } finally {
      sessionLock.writeLock().unlock();
    }
  }

  public boolean isValid() {
    sessionLock.readLock().lock();
    try {
      return valid;
    } finally {
      sessionLock.readLock().unlock();
    }
  }

  /**
   * Whether there is any session to lose: a valid flag or cached cookies.
   *
   * @return true if a session is held
   */
  public boolean isHoldingSession() {
    sessionLock.readLock().lock();
    try {
      return valid || !cache.isEmpty();
    } finally {
      sessionLock.readLock().unlock();
    }
  }

  /**
   * Whether the last login is older than the given window.
   *
   * @param expiry the window
   * @return true if a login happened and is older than {@code expiry}
   */
  public boolean isSessionExpired(final Duration expiry) {
    sessionLock.readLock().lock();
    try {
      return lastAuthenticationTime != null
          && Duration.between(lastAuthenticationTime, clock.instant()).compareTo(expiry) > 0;
    } finally {
      sessionLock.readLock().unlock();
    }
  }

  public Optional<Instant> lastAuthenticationTime() {
    sessionLock.readLock().lock();
    try {
      return Optional.ofNullable(lastAuthenticationTime);
    } finally {
      sessionLock.readLock().unlock();
    }
  }

  public SessionStatus status() {
    sessionLock.readLock().lock();
    try {
      return status;
    } finally {
      sessionLock.readLock().unlock();
    }
  }

  public void setStatus(final SessionStatus newStatus) {
    sessionLock.writeLock().lock();
    try {
      status = newStatus;
    } finally {
      sessionLock.writeLock().unlock();
    }
  }

  /**
   * The cookies to attach to an authenticated request.
   *
   * @return name to value
   */
  public Map<String, String> artifacts() {
    return cache.artifacts();
  }

  /**
   * Merges refreshed cookies without touching the flag.
   *
   * @param cookies the cookies
   */
  public void mergeCookies(final List<HttpCookie> cookies) {
    if (!cookies.isEmpty()) {
      cache.update(cookies);
    }
  }

  // ── Auth failure latch ────────────────────────────────────────────────────

  public void latchAuthFailure() {
    authFailedLock.lock();
    try {
      authPermanentlyFailed = true;
    } finally {
      authFailedLock.unlock();
    }
  }

  public boolean isAuthPermanentlyFailed() {
    authFailedLock.lock();
    try {
      return authPermanentlyFailed;
    } finally {
      authFailedLock.unlock();
    }
  }

  public void resetAuthFailure() {
    authFailedLock.lock();
    try {
      authPermanentlyFailed = false;
    } finally {
      authFailedLock.unlock();
    }
  }

  // ── Last error ────────────────────────────────────────────────────────────

  /**
   * Records the last observed error.  Null clears it.
   *
   * @param error the error
   */
  public void recordError(final QbtClientException error) {
    lastErrorLock.lock();
    try {
      lastError = error;
    } finally {
      lastErrorLock.unlock();
    }
    if (error != null && error.code() == ErrorCode.AUTH_FAILURE) {
      latchAuthFailure();
    }
  }

  public Optional<QbtClientException> lastError() {
    lastErrorLock.lock();
    try {
      return Optional.ofNullable(lastError);
    } finally {
      lastErrorLock.unlock();
    }
  }
}
