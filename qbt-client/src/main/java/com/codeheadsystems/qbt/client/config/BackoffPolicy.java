package com.codeheadsystems.qbt.client.config;

import java.time.Duration;
import java.util.Objects;

/**
 * Exponential backoff without jitter: {@code delay(n) = min(baseDelay * factor^n, maxDelay)}.
 * <p>
 * Computed in closed form in double-precision nanoseconds, so large attempt numbers clamp to
 * {@code maxDelay} instead of overflowing.  For fixed inputs the sequence is non-decreasing.
 *
 * @param baseDelay     delay before the first retry
 * @param backoffFactor growth factor, at least 1.0
 * @param maxDelay      upper bound of any single delay
 */
public record BackoffPolicy(Duration baseDelay, double backoffFactor, Duration maxDelay) {

  public BackoffPolicy {
    Objects.requireNonNull(baseDelay, "baseDelay");
    Objects.requireNonNull(maxDelay, "maxDelay");
    if (baseDelay.isNegative() || maxDelay.isNegative()) {
      throw new IllegalArgumentException("Delays must not be negative");
    }
    if (!(backoffFactor >= 1.0) || Double.isInfinite(backoffFactor)) {
      throw new IllegalArgumentException("backoffFactor must be a finite number >= 1.0: " + backoffFactor);
    }
  }

  /**
   * The delay to wait after the given failed attempt.
   *
   * @param attempt zero-based attempt number
   * @return the delay, never more than {@code maxDelay}
   */
  public Duration delayForAttempt(final int attempt) {
    if (attempt < 0) {
      throw new IllegalArgumentException("attempt must not be negative: " + attempt);
    }
    final long maxNanos = maxDelay.toNanos();
    final double nanos = baseDelay.toNanos() * Math.pow(backoffFactor, attempt);
    if (!Double.isFinite(nanos) || nanos >= maxNanos) {
      return maxDelay;
    }
    return Duration.ofNanos((long) nanos);
  }
}
