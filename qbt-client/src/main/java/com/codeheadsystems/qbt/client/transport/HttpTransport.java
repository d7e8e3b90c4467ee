package com.codeheadsystems.qbt.client.transport;

import com.codeheadsystems.qbt.client.config.QbtClientConfig;
import com.codeheadsystems.qbt.client.exceptions.OperationCancelledException;
import java.io.IOException;
import java.net.HttpCookie;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link QbtTransport} on top of {@link HttpClient}.
 * <p>
 * Requests are sent asynchronously so that cancelling the {@link CallContext} aborts the
 * in-flight exchange.  The effective timeout is the smaller of the request's own timeout (or the
 * configured one) and the time left on the context.  Session cookies are sent as a single
 * {@code Cookie} header; the client is expected to have no cookie handler of its own.
 */
@Singleton
public class HttpTransport implements QbtTransport {

  private static final Logger log = LoggerFactory.getLogger(HttpTransport.class);
  private static final Duration MIN_TIMEOUT = Duration.ofMillis(1);

  private final HttpClient httpClient;
  private final Supplier<QbtClientConfig> configSupplier;

  /**
   * Instantiates a new Http transport.
   *
   * @param httpClient     the http client
   * @param configSupplier supplies the current configuration
   */
  @Inject
  public HttpTransport(final HttpClient httpClient,
                       final Supplier<QbtClientConfig> configSupplier) {
    log.info("HttpTransport()");
    this.httpClient = httpClient;
    this.configSupplier = configSupplier;
  }

  @Override
  public TransportResponse perform(final TransportRequest request, final CallContext context)
      throws IOException {
    if (context.isCancelled()) {
      throw new OperationCancelledException(request.describe() + " cancelled", null);
    }
    final QbtClientConfig config = configSupplier.get();
    final HttpRequest httpRequest = buildRequest(config, request, context);
    log.trace("perform({})", request.describe());

    final CompletableFuture<HttpResponse<String>> future =
        httpClient.sendAsync(httpRequest, HttpResponse.BodyHandlers.ofString());
    try (CallContext.Registration ignored = context.onCancel(() -> future.cancel(true))) {
      final HttpResponse<String> response = future.get();
      final List<HttpCookie> cookies = request.captureSession()
          ? parseCookies(response.headers().allValues("set-cookie"))
          : List.of();
      return new TransportResponse(response.statusCode(), response.headers().map(), response.body(), cookies);
    } catch (CancellationException e) {
      throw new OperationCancelledException(request.describe() + " cancelled", e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      context.cancel();
      throw new OperationCancelledException(request.describe() + " interrupted", e);
    } catch (ExecutionException e) {
      final Throwable cause = e.getCause();
      if (cause instanceof IOException ioException) {
        throw ioException;
      }
      if (cause instanceof RuntimeException runtimeException) {
        throw runtimeException;
      }
      throw new IOException(request.describe() + " failed", cause);
    }
  }

  private HttpRequest buildRequest(QbtClientConfig config, TransportRequest request, CallContext context) {
    Duration timeout = request.timeout() != null ? request.timeout() : config.requestTimeout();
    final Duration left = context.remaining().orElse(timeout);
    if (left.compareTo(timeout) < 0) {
      timeout = left.compareTo(MIN_TIMEOUT) < 0 ? MIN_TIMEOUT : left;
    }
    final HttpRequest.Builder builder = HttpRequest.newBuilder()
        .uri(config.resolve(request.path()))
        .timeout(timeout);
    request.headers().forEach(builder::header);
    if (!request.sessionArtifacts().isEmpty()) {
      builder.header("Cookie", cookieHeader(request.sessionArtifacts()));
    }
    if ("GET".equals(request.method())) {
      builder.GET();
    } else {
      builder.method(request.method(), request.body() == null
          ? HttpRequest.BodyPublishers.noBody()
          : HttpRequest.BodyPublishers.ofString(request.body()));
    }
    return builder.build();
  }

  static String cookieHeader(Map<String, String> artifacts) {
    return artifacts.entrySet().stream()
        .map(e -> e.getKey() + "=" + e.getValue())
        .collect(Collectors.joining("; "));
  }

  private static List<HttpCookie> parseCookies(List<String> headerValues) {
    final List<HttpCookie> cookies = new ArrayList<>();
    for (String value : headerValues) {
      try {
        cookies.addAll(HttpCookie.parse(value));
      } catch (IllegalArgumentException e) {
        log.warn("Ignoring malformed Set-Cookie header: {}", e.getMessage());
      }
    }
    return cookies;
  }
}
