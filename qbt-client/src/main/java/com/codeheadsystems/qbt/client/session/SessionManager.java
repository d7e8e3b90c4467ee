package com.codeheadsystems.qbt.client.session;

import com.codeheadsystems.qbt.client.classifier.ErrorClassifier;
import com.codeheadsystems.qbt.client.config.QbtClientConfig;
import com.codeheadsystems.qbt.client.exceptions.ErrorCode;
import com.codeheadsystems.qbt.client.exceptions.QbtClientException;
import com.codeheadsystems.qbt.client.retry.RetryLoop;
import com.codeheadsystems.qbt.client.transport.CallContext;
import com.codeheadsystems.qbt.client.transport.FormBody;
import com.codeheadsystems.qbt.client.transport.QbtTransport;
import com.codeheadsystems.qbt.client.transport.TransportRequest;
import com.codeheadsystems.qbt.client.transport.TransportResponse;
import java.io.IOException;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the login session with the service.
 * <p>
 * A login first probes the unauthenticated version endpoint so that an unreachable server is
 * reported as such rather than as a login failure.  Bad credentials latch the auth failure and
 * every later login fails without touching the network until the latch is reset.
 * <p>
 * An optional background sweep drops sessions older than the configured expiry, since the
 * service expires them silently.
 */
@Singleton
public class SessionManager implements AutoCloseable {

  public static final String VERSION_PATH = "/api/v2/app/version";
  public static final String LOGIN_PATH = "/api/v2/auth/login";
  public static final String LOGOUT_PATH = "/api/v2/auth/logout";
  public static final Duration VALIDATION_TIMEOUT = Duration.ofSeconds(5);

  private static final Logger log = LoggerFactory.getLogger(SessionManager.class);

  private final QbtTransport transport;
  private final ErrorClassifier classifier;
  private final SessionState state;
  private final RetryLoop retryLoop;
  private final Supplier<QbtClientConfig> configSupplier;
  private final Object sweepMonitor = new Object();
  private ScheduledExecutorService sessionSweeper;

  /**
   * Instantiates a new Session manager.
   *
   * @param transport      the transport
   * @param classifier     the classifier
   * @param state          the session state
   * @param retryLoop      the retry loop used for logins
   * @param configSupplier the config supplier
   */
  @Inject
  public SessionManager(final QbtTransport transport,
                        final ErrorClassifier classifier,
                        final SessionState state,
                        final RetryLoop retryLoop,
                        final Supplier<QbtClientConfig> configSupplier) {
    log.info("SessionManager()");
    this.transport = transport;
    this.classifier = classifier;
    this.state = state;
    this.retryLoop = retryLoop;
    this.configSupplier = configSupplier;
  }

  // ── Login ─────────────────────────────────────────────────────────────────

  /**
   * Logs in once, without retries.
   *
   * @param context the call context
   * @throws QbtClientException the classified failure
   */
  public void login(final CallContext context) {
    if (state.isAuthPermanentlyFailed()) {
      throw QbtClientException.authPermanentlyFailed();
    }
    probe(context);

    final QbtClientConfig config = configSupplier.get();
    log.debug("login(user={})", config.username());
    final TransportRequest request = TransportRequest.postForm(LOGIN_PATH, FormBody.create()
            .add("username", config.username())
            .add("password", config.password()))
        .withHeader("Referer", config.baseUri().toString())
        .withCaptureSession(true);
    final TransportResponse response;
    try {
      response = transport.perform(request, context);
    } catch (IOException e) {
      throw fail(classifier.classify(e), SessionStatus.UNREACHABLE);
    }
    if (response.statusCode() != 200) {
      final QbtClientException error = classifier.classifyStatus(response.statusCode(), response.body());
      throw fail(error, error.code() == ErrorCode.AUTH_FAILURE ? SessionStatus.UNAUTHORIZED : null);
    }
    if (response.body().contains(ErrorClassifier.LOGIN_FAILURE_SENTINEL)) {
      log.warn("login(): credentials rejected for user {}", config.username());
      throw fail(new QbtClientException(ErrorCode.AUTH_FAILURE, "Invalid username or password",
          null, true, response.statusCode()), SessionStatus.UNAUTHORIZED);
    }
    state.markAuthenticated(response.cookies());
    log.info("login(): authenticated as {} with {} cookie(s)", config.username(), state.cache().size());
  }

  /**
   * Returns immediately when the session is valid, otherwise logs in with retries.  Each caller
   * runs its own login loop under its own context; concurrent callers are not coalesced.
   *
   * @param context the call context
   */
  public void ensureAuthenticated(final CallContext context) {
    if (state.isValid()) {
      return;
    }
    retryLoop.retry("login", context, attempt -> {
      if (!state.isValid()) {
        login(context);
      }
      return null;
    });
  }

  private void probe(CallContext context) {
    final TransportResponse response;
    try {
      response = transport.perform(TransportRequest.get(VERSION_PATH), context);
    } catch (IOException e) {
      throw fail(classifier.classify(e), SessionStatus.UNREACHABLE);
    }
    if (response.statusCode() >= 500) {
      throw fail(classifier.classifyStatus(response.statusCode(), response.body()), SessionStatus.UNREACHABLE);
    }
    if (response.statusCode() == 404) {
      throw fail(new QbtClientException(ErrorCode.VERSION_INCOMPATIBLE,
          "Web API v2 not found at " + configSupplier.get().baseUri(), null, true, 404), null);
    }
  }

  private QbtClientException fail(QbtClientException error, SessionStatus status) {
    state.recordError(error);
    if (status != null) {
      state.setStatus(status);
    }
    return error;
  }

  // ── Validation and invalidation ───────────────────────────────────────────

  /**
   * Whether the held session is still accepted.  Checks the local flag first, then that cookies
   * are held and unexpired, then asks the service with a short timeout.
   *
   * @return true if the session is usable
   */
  public boolean isSessionValid() {
    if (state.isValid()) {
      return true;
    }
    if (state.cache().isEmpty()) {
      return false;
    }
    if (state.cache().isExpired()) {
      state.markInvalid();
      return false;
    }
    final TransportRequest request = TransportRequest.get(VERSION_PATH)
        .withSessionArtifacts(state.artifacts())
        .withCaptureSession(true)
        .withTimeout(VALIDATION_TIMEOUT);
    final TransportResponse response;
    try {
      response = transport.perform(request, CallContext.withTimeout(VALIDATION_TIMEOUT));
    } catch (IOException e) {
      log.debug("isSessionValid(): validation request failed: {}", e.getMessage());
      return false;
    }
    if (response.statusCode() == 200) {
      state.markValid(response.cookies());
      return true;
    }
    return false;
  }

  /**
   * Drops the session locally.
   */
  public void invalidate() {
    log.debug("invalidate()");
    state.invalidate();
  }

  public Map<String, String> sessionArtifacts() {
    return state.artifacts();
  }

  /**
   * Best-effort logout.  The local session is invalidated whatever the outcome.  Skipped when
   * no session is held.
   *
   * @param context the call context
   * @return the classified failure of the logout request, empty if it succeeded or was skipped
   */
  public Optional<QbtClientException> logout(final CallContext context) {
    try {
      if (!state.isHoldingSession()) {
        return Optional.empty();
      }
      final TransportResponse response = transport.perform(TransportRequest.postForm(LOGOUT_PATH, FormBody.create())
          .withSessionArtifacts(state.artifacts())
          .withTimeout(configSupplier.get().requestTimeout()), context);
      if (response.statusCode() != 200) {
        log.warn("logout(): service answered {}", response.statusCode());
        return Optional.of(classifier.classifyStatus(response.statusCode(), response.body()));
      }
      log.debug("logout(): done");
      return Optional.empty();
    } catch (IOException | RuntimeException e) {
      log.warn("logout(): best-effort logout failed: {}", e.getMessage());
      return Optional.of(classifier.classify(e));
    } finally {
      invalidate();
    }
  }

  // ── Expiry sweep ──────────────────────────────────────────────────────────

  /**
   * Starts the background sweep.  Does nothing if it is already running.
   */
  public void startExpirySweep() {
    synchronized (sweepMonitor) {
      if (sessionSweeper != null) {
        return;
      }
      final long intervalMillis = configSupplier.get().sweepInterval().toMillis();
      sessionSweeper = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "qbt-session-sweeper");
        t.setDaemon(true);
        return t;
      });
      sessionSweeper.scheduleAtFixedRate(this::sweepExpired, intervalMillis, intervalMillis, TimeUnit.MILLISECONDS);
      log.debug("startExpirySweep(every {} ms)", intervalMillis);
    }
  }

  /**
   * Invalidates a held session whose login is older than the configured expiry.
   *
   * @return true if the session was invalidated
   */
  public boolean sweepExpired() {
    if (state.isHoldingSession() && state.isSessionExpired(configSupplier.get().sessionExpiry())) {
      log.info("sweepExpired(): session older than {}, invalidating", configSupplier.get().sessionExpiry());
      invalidate();
      return true;
    }
    return false;
  }

  public boolean isSweepRunning() {
    synchronized (sweepMonitor) {
      return sessionSweeper != null && !sessionSweeper.isShutdown();
    }
  }

  /**
   * Stops the background sweep.
   */
  public void stopExpirySweep() {
    synchronized (sweepMonitor) {
      if (sessionSweeper != null) {
        sessionSweeper.shutdownNow();
        sessionSweeper = null;
      }
    }
  }

  /**
   * Logs out within the request timeout, then stops the sweep.  A failed logout is thrown once
   * the session is dropped and the sweep stopped.
   *
   * @throws QbtClientException if the logout request failed
   */
  @Override
  public void close() {
    final Optional<QbtClientException> failure;
    try {
      failure = logout(CallContext.withTimeout(configSupplier.get().requestTimeout()));
    } finally {
      stopExpirySweep();
    }
    if (failure.isPresent()) {
      throw failure.get();
    }
  }
}
