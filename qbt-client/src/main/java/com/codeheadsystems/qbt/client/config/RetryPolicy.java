package com.codeheadsystems.qbt.client.config;

import java.util.Objects;
import java.util.Set;

/**
 * How many times, how far apart and on which HTTP statuses an operation is retried.
 *
 * @param maxRetries           retries beyond the first attempt
 * @param backoff              the delay schedule
 * @param retryableStatusCodes statuses that count as transient failures
 */
public record RetryPolicy(int maxRetries, BackoffPolicy backoff, Set<Integer> retryableStatusCodes) {

  /**
   * Request timeout, rate limited, and the 5xx statuses a restart or proxy produces.
   */
  public static final Set<Integer> DEFAULT_RETRYABLE_STATUS_CODES = Set.of(408, 429, 500, 502, 503, 504);

  public RetryPolicy {
    if (maxRetries < 0) {
      throw new IllegalArgumentException("maxRetries must not be negative: " + maxRetries);
    }
    Objects.requireNonNull(backoff, "backoff");
    retryableStatusCodes = Set.copyOf(retryableStatusCodes);
  }

  public static RetryPolicy fromConfig(final QbtClientConfig config) {
    return new RetryPolicy(config.maxRetries(),
        new BackoffPolicy(config.retryBackoff(), config.backoffFactor(), config.maxBackoff()),
        config.retryableStatusCodes());
  }

  public int totalAttempts() {
    return maxRetries + 1;
  }

  public boolean isRetryableStatus(final int statusCode) {
    return retryableStatusCodes.contains(statusCode);
  }
}
