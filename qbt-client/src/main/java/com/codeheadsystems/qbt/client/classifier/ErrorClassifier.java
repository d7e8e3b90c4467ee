package com.codeheadsystems.qbt.client.classifier;

import com.codeheadsystems.qbt.client.exceptions.ErrorCode;
import com.codeheadsystems.qbt.client.exceptions.QbtClientException;
import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.net.http.HttpTimeoutException;
import java.security.cert.CertificateException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.TimeoutException;
import javax.inject.Inject;
import javax.inject.Singleton;
import javax.net.ssl.SSLException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps raw failures and HTTP statuses onto {@link QbtClientException}s.
 * <p>
 * Classification of a {@link Throwable} runs in three stages, first match wins:
 * <ol>
 *   <li>an already-classified {@link QbtClientException} anywhere in the cause chain is
 *       returned unchanged, so classifying twice is a no-op;</li>
 *   <li>structured transport signals in the cause chain (unknown host, refused or unroutable
 *       connection, timeouts, TLS failures);</li>
 *   <li>an ordered table of {@link MessagePattern}s matched against the messages of the
 *       cause chain, for errors that only carry text.</li>
 * </ol>
 * Anything unmatched is {@link ErrorCode#UNKNOWN} and transient.  The classifier has no state
 * and never performs I/O.
 */
@Singleton
public class ErrorClassifier {

  /**
   * The message returned by the service's login endpoint for bad credentials.
   */
  public static final String LOGIN_FAILURE_SENTINEL = "Fails.";

  /**
   * The default free-text table, in match order.
   */
  public static final List<MessagePattern> DEFAULT_PATTERNS = List.of(
      new MessagePattern("timeout", ErrorCode.TIMEOUT, "Request timed out"),
      new MessagePattern("timed out", ErrorCode.TIMEOUT, "Request timed out"),
      new MessagePattern("deadline exceeded", ErrorCode.TIMEOUT, "Request timed out"),
      new MessagePattern("certificate", ErrorCode.SSL_ERROR,
          "SSL/TLS connection failed - check certificate configuration"),
      new MessagePattern("x509", ErrorCode.SSL_ERROR,
          "SSL/TLS connection failed - check certificate configuration"),
      new MessagePattern("tls", ErrorCode.SSL_ERROR,
          "SSL/TLS connection failed - check certificate configuration"),
      new MessagePattern("ssl", ErrorCode.SSL_ERROR,
          "SSL/TLS connection failed - check certificate configuration"),
      new MessagePattern("malformed http response", ErrorCode.HTTPS_REQUIRED,
          "Protocol mismatch - try using HTTPS instead of HTTP"),
      new MessagePattern("plaintext connection", ErrorCode.HTTPS_REQUIRED,
          "Protocol mismatch - check whether the endpoint expects HTTP or HTTPS"),
      new MessagePattern("connection refused", ErrorCode.CONNECTION_REFUSED,
          "Connection refused - server may be down"),
      new MessagePattern("no such host", ErrorCode.DNS_ERROR, "DNS resolution failed - check hostname"),
      new MessagePattern("name or service not known", ErrorCode.DNS_ERROR,
          "DNS resolution failed - check hostname"),
      new MessagePattern("lookup", ErrorCode.DNS_ERROR, "DNS resolution failed - check hostname"),
      new MessagePattern("dns", ErrorCode.DNS_ERROR, "DNS resolution failed - check hostname"),
      new MessagePattern(LOGIN_FAILURE_SENTINEL, ErrorCode.AUTH_FAILURE, "Invalid username or password"),
      new MessagePattern("unauthorized", ErrorCode.AUTH_FAILURE, "Invalid username or password"),
      new MessagePattern("authentication failed", ErrorCode.AUTH_FAILURE, "Invalid username or password"),
      new MessagePattern("invalid username", ErrorCode.AUTH_FAILURE, "Invalid username or password"),
      new MessagePattern("invalid password", ErrorCode.AUTH_FAILURE, "Invalid username or password"),
      new MessagePattern("invalid credentials", ErrorCode.AUTH_FAILURE, "Invalid username or password"));

  private static final Logger log = LoggerFactory.getLogger(ErrorClassifier.class);
  private static final int MAX_CAUSE_DEPTH = 16;

  private final List<MessagePattern> patterns;

  /**
   * Instantiates a new Error classifier with the default pattern table.
   */
  @Inject
  public ErrorClassifier() {
    this(DEFAULT_PATTERNS);
  }

  /**
   * Instantiates a new Error classifier with a custom pattern table.
   *
   * @param patterns the patterns, in match order
   */
  public ErrorClassifier(final List<MessagePattern> patterns) {
    log.info("ErrorClassifier({} patterns)", patterns.size());
    this.patterns = List.copyOf(patterns);
  }

  /**
   * Classifies a raw failure.
   *
   * @param throwable the failure
   * @return the classified error; the same instance if one is already in the cause chain
   */
  public QbtClientException classify(final Throwable throwable) {
    if (throwable == null) {
      throw new IllegalArgumentException("Cannot classify a null error");
    }
    final List<Throwable> chain = causeChain(throwable);

    for (Throwable t : chain) {
      if (t instanceof QbtClientException classified) {
        return classified;
      }
    }

    for (Throwable t : chain) {
      Optional<QbtClientException> structured = classifyStructured(t, throwable);
      if (structured.isPresent()) {
        return structured.get();
      }
    }

    final String messages = lowerCaseMessages(chain);
    for (MessagePattern pattern : patterns) {
      if (pattern.matches(messages)) {
        return new QbtClientException(pattern.code(), pattern.description(), throwable);
      }
    }

    log.trace("classify(): no match for {}", throwable.toString());
    return new QbtClientException(ErrorCode.UNKNOWN, "Unknown error occurred", throwable);
  }

  /**
   * Classifies an HTTP status that the caller considers a failure.
   *
   * @param statusCode the status code
   * @param body       the response body, may be null
   * @return the classified error
   */
  public QbtClientException classifyStatus(final int statusCode, final String body) {
    final String text = body == null ? "" : body;
    return switch (statusCode) {
      case 401, 403 -> new QbtClientException(ErrorCode.AUTH_FAILURE,
          "Authentication failed with status " + statusCode, null, true, statusCode);
      case 502 -> new QbtClientException(ErrorCode.BAD_GATEWAY,
          "Bad Gateway (502): " + text, null, false, statusCode);
      case 503 -> new QbtClientException(ErrorCode.SERVICE_UNAVAILABLE,
          "Service Unavailable (503): " + text, null, false, statusCode);
      case 504 -> new QbtClientException(ErrorCode.TIMEOUT,
          "Gateway Timeout (504): " + text, null, false, statusCode);
      default -> new QbtClientException(ErrorCode.UNKNOWN,
          "Request failed with status " + statusCode + ": " + text, null, false, statusCode);
    };
  }

  /**
   * Whether retrying can help with the given failure.
   *
   * @param throwable the failure, may be null
   * @return true if classified as transient; false for null
   */
  public boolean isRetryable(final Throwable throwable) {
    return throwable != null && !classify(throwable).isPermanent();
  }

  /**
   * Whether the given failure requires user intervention.
   *
   * @param throwable the failure, may be null
   * @return true if classified as permanent; false for null
   */
  public boolean isPermanent(final Throwable throwable) {
    return throwable != null && classify(throwable).isPermanent();
  }

  /**
   * The error code of a failure.
   *
   * @param throwable the failure, may be null
   * @return the code, empty for null
   */
  public Optional<ErrorCode> errorCode(final Throwable throwable) {
    if (throwable == null) {
      return Optional.empty();
    }
    return Optional.of(classify(throwable).code());
  }

  private Optional<QbtClientException> classifyStructured(Throwable t, Throwable original) {
    if (t instanceof UnknownHostException) {
      return Optional.of(new QbtClientException(ErrorCode.DNS_ERROR,
          "Failed to resolve hostname: " + t.getMessage(), original));
    }
    if (t instanceof NoRouteToHostException) {
      return Optional.of(networkUnreachable(original));
    }
    if (t instanceof ConnectException) {
      String msg = lowerCase(t.getMessage());
      if (msg.contains("no route to host") || msg.contains("network is unreachable")) {
        return Optional.of(networkUnreachable(original));
      }
      return Optional.of(new QbtClientException(ErrorCode.CONNECTION_REFUSED,
          "Connection refused - server may be down or port is incorrect", original));
    }
    if (t instanceof HttpTimeoutException
        || t instanceof SocketTimeoutException
        || t instanceof TimeoutException) {
      return Optional.of(new QbtClientException(ErrorCode.TIMEOUT, "Request timed out", original));
    }
    if (t instanceof SSLException) {
      String msg = lowerCase(t.getMessage());
      if (msg.contains("plaintext connection") || msg.contains("unrecognized ssl message")) {
        return Optional.of(new QbtClientException(ErrorCode.HTTPS_REQUIRED,
            "Protocol mismatch - check whether the endpoint expects HTTP or HTTPS", original));
      }
      return Optional.of(new QbtClientException(ErrorCode.SSL_ERROR,
          "SSL/TLS handshake failed", original));
    }
    if (t instanceof CertificateException) {
      return Optional.of(new QbtClientException(ErrorCode.SSL_ERROR,
          "SSL certificate verification failed", original));
    }
    return Optional.empty();
  }

  private QbtClientException networkUnreachable(Throwable original) {
    return new QbtClientException(ErrorCode.NETWORK_UNREACHABLE,
        "Network unreachable - check network connectivity", original);
  }

  private static List<Throwable> causeChain(Throwable throwable) {
    final List<Throwable> chain = new ArrayList<>();
    final Set<Throwable> seen = Collections.newSetFromMap(new IdentityHashMap<>());
    Throwable current = throwable;
    while (current != null && chain.size() < MAX_CAUSE_DEPTH && seen.add(current)) {
      chain.add(current);
      current = current.getCause();
    }
    return chain;
  }

  private static String lowerCaseMessages(List<Throwable> chain) {
    final StringBuilder sb = new StringBuilder();
    for (Throwable t : chain) {
      if (t.getMessage() != null) {
        sb.append(t.getMessage().toLowerCase(Locale.ROOT)).append('\n');
      }
    }
    return sb.toString();
  }

  private static String lowerCase(String message) {
    return message == null ? "" : message.toLowerCase(Locale.ROOT);
  }
}
