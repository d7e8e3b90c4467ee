package com.codeheadsystems.qbt.client.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.net.URI;
import java.time.Duration;
import java.util.Objects;
import java.util.Set;

/**
 * Connection and retry configuration for a {@code QbtClient}.
 * <p>
 * Unset, zero or negative values are replaced by defaults in the compact constructor, so a
 * config bound from a partial JSON or YAML document is always complete.  Durations bind from
 * ISO-8601 strings ({@code "PT30S"}) once the {@code JavaTimeModule} is registered.
 *
 * @param baseUri              the service root, e.g. {@code http://localhost:8080}
 * @param username             the Web UI user
 * @param password             the Web UI password
 * @param requestTimeout       per-request timeout
 * @param maxRetries           retries beyond the first attempt
 * @param retryBackoff         delay before the first retry
 * @param maxBackoff           upper bound of any single delay
 * @param backoffFactor        growth factor between delays, at least 1.0
 * @param retryableStatusCodes HTTP statuses that are retried
 * @param sessionExpiry        how long a session is trusted without re-authenticating
 * @param sweepInterval        how often the expiry sweep runs
 * @param debug                per-attempt debug tracing
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record QbtClientConfig(
    @JsonProperty("baseUri") URI baseUri,
    @JsonProperty("username") String username,
    @JsonProperty("password") String password,
    @JsonProperty("requestTimeout") Duration requestTimeout,
    @JsonProperty("maxRetries") int maxRetries,
    @JsonProperty("retryBackoff") Duration retryBackoff,
    @JsonProperty("maxBackoff") Duration maxBackoff,
    @JsonProperty("backoffFactor") double backoffFactor,
    @JsonProperty("retryableStatusCodes") Set<Integer> retryableStatusCodes,
    @JsonProperty("sessionExpiry") Duration sessionExpiry,
    @JsonProperty("sweepInterval") Duration sweepInterval,
    @JsonProperty("debug") boolean debug) {

  public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(30);
  public static final int DEFAULT_MAX_RETRIES = 3;
  public static final Duration DEFAULT_RETRY_BACKOFF = Duration.ofSeconds(1);
  public static final Duration DEFAULT_MAX_BACKOFF = Duration.ofSeconds(30);
  public static final double DEFAULT_BACKOFF_FACTOR = 2.0;
  public static final Duration DEFAULT_SESSION_EXPIRY = Duration.ofHours(24);
  public static final Duration DEFAULT_SWEEP_INTERVAL = Duration.ofMinutes(5);

  public QbtClientConfig {
    Objects.requireNonNull(baseUri, "baseUri");
    username = username == null ? "" : username;
    password = password == null ? "" : password;
    requestTimeout = positiveOr(requestTimeout, DEFAULT_REQUEST_TIMEOUT);
    maxRetries = maxRetries <= 0 ? DEFAULT_MAX_RETRIES : maxRetries;
    retryBackoff = positiveOr(retryBackoff, DEFAULT_RETRY_BACKOFF);
    maxBackoff = positiveOr(maxBackoff, DEFAULT_MAX_BACKOFF);
    backoffFactor = backoffFactor < 1.0 || !Double.isFinite(backoffFactor)
        ? DEFAULT_BACKOFF_FACTOR : backoffFactor;
    retryableStatusCodes = retryableStatusCodes == null || retryableStatusCodes.isEmpty()
        ? RetryPolicy.DEFAULT_RETRYABLE_STATUS_CODES
        : Set.copyOf(retryableStatusCodes);
    sessionExpiry = positiveOr(sessionExpiry, DEFAULT_SESSION_EXPIRY);
    sweepInterval = positiveOr(sweepInterval, DEFAULT_SWEEP_INTERVAL);
  }

  /**
   * A config with every tunable at its default.
   *
   * @param baseUri  the service root
   * @param username the username
   * @param password the password
   * @return the qbt client config
   */
  public static QbtClientConfig of(final String baseUri, final String username, final String password) {
    return new QbtClientConfig(URI.create(baseUri), username, password,
        null, 0, null, null, 0, null, null, null, false);
  }

  /**
   * Copy with a different retry budget and backoff.
   *
   * @param retries      retries beyond the first attempt
   * @param backoff      delay before the first retry
   * @param maxBackoff   upper bound of any single delay
   * @return the qbt client config
   */
  public QbtClientConfig withRetries(final int retries, final Duration backoff, final Duration maxBackoff) {
    return new QbtClientConfig(baseUri, username, password, requestTimeout, retries, backoff, maxBackoff,
        backoffFactor, retryableStatusCodes, sessionExpiry, sweepInterval, debug);
  }

  public QbtClientConfig withRequestTimeout(final Duration timeout) {
    return new QbtClientConfig(baseUri, username, password, timeout, maxRetries, retryBackoff, maxBackoff,
        backoffFactor, retryableStatusCodes, sessionExpiry, sweepInterval, debug);
  }

  public QbtClientConfig withCredentials(final String newUsername, final String newPassword) {
    return new QbtClientConfig(baseUri, newUsername, newPassword, requestTimeout, maxRetries, retryBackoff,
        maxBackoff, backoffFactor, retryableStatusCodes, sessionExpiry, sweepInterval, debug);
  }

  public QbtClientConfig withSessionExpiry(final Duration expiry, final Duration interval) {
    return new QbtClientConfig(baseUri, username, password, requestTimeout, maxRetries, retryBackoff,
        maxBackoff, backoffFactor, retryableStatusCodes, expiry, interval, debug);
  }

  public QbtClientConfig withDebug(final boolean enabled) {
    return new QbtClientConfig(baseUri, username, password, requestTimeout, maxRetries, retryBackoff,
        maxBackoff, backoffFactor, retryableStatusCodes, sessionExpiry, sweepInterval, enabled);
  }

  /**
   * Resolves a Web API path against the base URI.
   *
   * @param path absolute path such as {@code /api/v2/app/version}, may carry a query string
   * @return the uri
   */
  public URI resolve(final String path) {
    String base = baseUri.toString();
    if (base.endsWith("/")) {
      base = base.substring(0, base.length() - 1);
    }
    return URI.create(base + path);
  }

  private static Duration positiveOr(Duration value, Duration fallback) {
    return value == null || value.isZero() || value.isNegative() ? fallback : value;
  }

  @Override
  public String toString() {
    return "QbtClientConfig[baseUri=" + baseUri
        + ", username=" + username
        + ", password=****"
        + ", requestTimeout=" + requestTimeout
        + ", maxRetries=" + maxRetries
        + ", retryBackoff=" + retryBackoff
        + ", maxBackoff=" + maxBackoff
        + ", backoffFactor=" + backoffFactor
        + ", retryableStatusCodes=" + retryableStatusCodes
        + ", sessionExpiry=" + sessionExpiry
        + ", sweepInterval=" + sweepInterval
        + ", debug=" + debug + "]";
  }
}
