package com.codeheadsystems.qbt.client;

import com.codeheadsystems.qbt.client.accessor.TorrentAccessor;
import com.codeheadsystems.qbt.client.classifier.ErrorClassifier;
import com.codeheadsystems.qbt.client.config.QbtClientConfig;
import com.codeheadsystems.qbt.client.exceptions.QbtClientException;
import com.codeheadsystems.qbt.client.retry.RemoteOperation;
import com.codeheadsystems.qbt.client.retry.RetryExecutor;
import com.codeheadsystems.qbt.client.retry.RetryLoop;
import com.codeheadsystems.qbt.client.session.ConnectionStatus;
import com.codeheadsystems.qbt.client.session.SessionManager;
import com.codeheadsystems.qbt.client.session.SessionState;
import com.codeheadsystems.qbt.client.session.SessionStatus;
import com.codeheadsystems.qbt.client.transport.CallContext;
import com.codeheadsystems.qbt.client.transport.HttpTransport;
import com.codeheadsystems.qbt.client.transport.QbtTransport;
import com.codeheadsystems.qbt.client.transport.TransportRequest;
import com.codeheadsystems.qbt.client.transport.TransportResponse;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.net.http.HttpClient;
import java.time.Clock;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Client for one torrent service instance.
 * <p>
 * Wires the session and retry engine around a transport and exposes its single execution
 * primitive, the session status and the typed {@link TorrentAccessor}.  The expiry sweep
 * starts with the client; {@link #close()} logs out and stops it.
 * <pre>{@code
 * try (QbtClient client = new QbtClient(QbtClientConfig.of("http://localhost:8080", "admin", "secret"))) {
 *   client.torrents().listTorrents(null).forEach(t -> System.out.println(t.name()));
 * }
 * }</pre>
 */
public class QbtClient implements AutoCloseable {

  private static final Logger log = LoggerFactory.getLogger(QbtClient.class);

  private final AtomicReference<QbtClientConfig> config;
  private final SessionState sessionState;
  private final SessionManager sessionManager;
  private final RetryExecutor retryExecutor;
  private final TorrentAccessor torrentAccessor;

  /**
   * A client on a new {@link HttpClient} with the system clock.
   *
   * @param config the config
   */
  public QbtClient(final QbtClientConfig config) {
    this(config, newHttpClient(config), objectMapper(), Clock.systemUTC());
  }

  /**
   * A client on the given {@link HttpClient}.  The client must not have a cookie handler.
   *
   * @param config       the config
   * @param httpClient   the http client
   * @param objectMapper the object mapper
   * @param clock        the clock
   */
  public QbtClient(final QbtClientConfig config,
                   final HttpClient httpClient,
                   final ObjectMapper objectMapper,
                   final Clock clock) {
    this(new AtomicReference<>(Objects.requireNonNull(config, "config")), httpClient, objectMapper, clock);
  }

  private QbtClient(final AtomicReference<QbtClientConfig> config,
                    final HttpClient httpClient,
                    final ObjectMapper objectMapper,
                    final Clock clock) {
    this(config, new HttpTransport(httpClient, config::get), objectMapper, clock);
  }

  /**
   * A client on an arbitrary transport.
   *
   * @param config       the config
   * @param transport    the transport
   * @param objectMapper the object mapper
   * @param clock        the clock
   */
  public QbtClient(final QbtClientConfig config,
                   final QbtTransport transport,
                   final ObjectMapper objectMapper,
                   final Clock clock) {
    this(new AtomicReference<>(Objects.requireNonNull(config, "config")), transport, objectMapper, clock);
  }

  private QbtClient(final AtomicReference<QbtClientConfig> config,
                    final QbtTransport transport,
                    final ObjectMapper objectMapper,
                    final Clock clock) {
    log.info("QbtClient({})", config.get().baseUri());
    this.config = config;
    final ErrorClassifier classifier = new ErrorClassifier();
    this.sessionState = new SessionState(clock, config.get().sessionExpiry());
    final RetryLoop retryLoop = new RetryLoop(config::get, classifier, sessionState);
    this.sessionManager = new SessionManager(transport, classifier, sessionState, retryLoop, config::get);
    this.retryExecutor = new RetryExecutor(retryLoop, sessionManager, transport, classifier, config::get);
    this.torrentAccessor = new TorrentAccessor(retryExecutor, objectMapper, classifier);
    sessionManager.startExpirySweep();
  }

  /**
   * The object mapper the client decodes responses with.
   *
   * @return a new object mapper
   */
  public static ObjectMapper objectMapper() {
    return new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
  }

  private static HttpClient newHttpClient(QbtClientConfig config) {
    return HttpClient.newBuilder()
        .connectTimeout(config.requestTimeout())
        .followRedirects(HttpClient.Redirect.NORMAL)
        .build();
  }

  // ── Execution ─────────────────────────────────────────────────────────────

  public TransportResponse execute(final String label, final TransportRequest request) {
    return execute(label, request, CallContext.background());
  }

  /**
   * Performs a request with session handling and retries.
   *
   * @param label   the label used in errors and logs
   * @param request the request
   * @param context the call context
   * @return the response
   */
  public TransportResponse execute(final String label, final TransportRequest request, final CallContext context) {
    return retryExecutor.execute(label, context, request);
  }

  public <T> T executeWithRetry(final String label, final RemoteOperation<T> operation) {
    return executeWithRetry(label, operation, CallContext.background());
  }

  /**
   * Runs an arbitrary operation with session handling and retries.
   *
   * @param label     the label
   * @param operation the operation
   * @param context   the call context
   * @param <T>       the result type
   * @return the result
   */
  public <T> T executeWithRetry(final String label, final RemoteOperation<T> operation, final CallContext context) {
    return retryExecutor.executeWithRetry(label, context, operation);
  }

  public TorrentAccessor torrents() {
    return torrentAccessor;
  }

  // ── Status ────────────────────────────────────────────────────────────────

  public SessionStatus getStatus() {
    return sessionState.status();
  }

  public ConnectionStatus getConnectionStatus() {
    return ConnectionStatus.of(sessionState.status(), sessionState.lastError());
  }

  public Optional<QbtClientException> getLastError() {
    return sessionState.lastError();
  }

  public boolean isAuthPermanentlyFailed() {
    return sessionState.isAuthPermanentlyFailed();
  }

  /**
   * Clears the auth failure latch and the last error so the next call logs in again.
   */
  public void resetAuthFailure() {
    log.info("resetAuthFailure()");
    sessionState.resetAuthFailure();
    sessionState.recordError(null);
    sessionState.setStatus(SessionStatus.INITIALIZING);
  }

  public void invalidateSession() {
    sessionManager.invalidate();
  }

  public boolean isSessionValid() {
    return sessionManager.isSessionValid();
  }

  public QbtClientConfig getConfig() {
    return config.get();
  }

  /**
   * Replaces the configuration and drops the current session.  Retry settings apply from the
   * next call; the session expiry window of the cookie cache is fixed at construction.
   *
   * @param newConfig the new config
   */
  public void update(final QbtClientConfig newConfig) {
    log.info("update({})", newConfig);
    config.set(Objects.requireNonNull(newConfig, "newConfig"));
    sessionManager.invalidate();
  }

  /**
   * Logs out within the request timeout, then invalidates the session and stops the sweep.
   *
   * @throws QbtClientException if the logout request failed; the session is dropped and the
   *                            sweep stopped regardless
   */
  @Override
  public void close() {
    log.info("close()");
    sessionManager.close();
  }
}
