package com.codeheadsystems.qbt.client.session;

import java.net.HttpCookie;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.stream.Collectors;

/**
 * Holds the session cookies issued by the service, keyed by cookie name.
 * <p>
 * The expiry window restarts on construction and on every {@link #clear()}; it is not extended
 * by use.  Reads share a lock, updates are exclusive.
 */
public class SessionCache {

  private final Clock clock;
  private final Duration expiry;
  private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
  private final Map<String, HttpCookie> cookies = new LinkedHashMap<>();
  private Instant expiresAt;
  private Instant lastUsed;

  /**
   * Instantiates a new, empty Session cache.
   *
   * @param clock  the clock
   * @param expiry the expiry window
   */
  public SessionCache(final Clock clock, final Duration expiry) {
    this.clock = clock;
    this.expiry = expiry;
    final Instant now = clock.instant();
    this.expiresAt = now.plus(expiry);
    this.lastUsed = now;
  }

  /**
   * Merges cookies by name, later values replacing earlier ones.  Cookies the server has
   * expired ({@code Max-Age=0}) are removed.
   *
   * @param received the received cookies
   */
  public void update(final Collection<HttpCookie> received) {
    lock.writeLock().lock();
    try {
      for (HttpCookie cookie : received) {
        if (cookie.hasExpired()) {
          cookies.remove(cookie.getName());
        } else {
          cookies.put(cookie.getName(), cookie);
        }
      }
      lastUsed = clock.instant();
    } finally {
      lock.writeLock().unlock();
    }
  }

  /**
   * Empties the cache and restarts the expiry window.
   */
  public void clear() {
    lock.writeLock().lock();
    try {
      cookies.clear();
      expiresAt = clock.instant().plus(expiry);
    } finally {
      lock.writeLock().unlock();
    }
  }

  public int size() {
    lock.readLock().lock();
    try {
      return cookies.size();
    } finally {
      lock.readLock().unlock();
    }
  }

  public boolean isEmpty() {
    return size() == 0;
  }

  /**
   * Immutable snapshot of the cookie values.
   *
   * @return name to value
   */
  public Map<String, String> artifacts() {
    lock.readLock().lock();
    try {
      return cookies.values().stream()
          .collect(Collectors.toUnmodifiableMap(HttpCookie::getName, HttpCookie::getValue, (a, b) -> b));
    } finally {
      lock.readLock().unlock();
    }
  }

  /**
   * The cookies in {@code Cookie} request header form.
   *
   * @return e.g. {@code SID=abc}; empty when the cache is
   */
  public String cookieHeader() {
    lock.readLock().lock();
    try {
      return cookies.values().stream()
          .map(c -> c.getName() + "=" + c.getValue())
          .collect(Collectors.joining("; "));
    } finally {
      lock.readLock().unlock();
    }
  }

  public Instant expiresAt() {
    lock.readLock().lock();
    try {
      return expiresAt;
    } finally {
      lock.readLock().unlock();
    }
  }

  public Instant lastUsed() {
    lock.readLock().lock();
    try {
      return lastUsed;
    } finally {
      lock.readLock().unlock();
    }
  }

  public boolean isExpired() {
    return clock.instant().isAfter(expiresAt());
  }
}
