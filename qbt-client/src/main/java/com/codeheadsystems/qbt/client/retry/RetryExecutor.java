package com.codeheadsystems.qbt.client.retry;

import com.codeheadsystems.qbt.client.classifier.ErrorClassifier;
import com.codeheadsystems.qbt.client.config.QbtClientConfig;
import com.codeheadsystems.qbt.client.config.RetryPolicy;
import com.codeheadsystems.qbt.client.exceptions.OperationCancelledException;
import com.codeheadsystems.qbt.client.exceptions.QbtClientException;
import com.codeheadsystems.qbt.client.session.SessionManager;
import com.codeheadsystems.qbt.client.transport.CallContext;
import com.codeheadsystems.qbt.client.transport.QbtTransport;
import com.codeheadsystems.qbt.client.transport.TransportRequest;
import com.codeheadsystems.qbt.client.transport.TransportResponse;
import java.util.function.Supplier;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The single execution primitive every remote call goes through.
 * <p>
 * Each attempt first makes sure a session exists, then performs the request with the current
 * session cookies attached.  A 401 or 403 means the service dropped the session: it is
 * invalidated locally and the attempt counts as a transient failure, so the next attempt logs in
 * again.  Statuses in the retryable set are transient too.  Any other status is returned to the
 * caller as is.
 */
@Singleton
public class RetryExecutor {

  private static final Logger log = LoggerFactory.getLogger(RetryExecutor.class);

  private final RetryLoop retryLoop;
  private final SessionManager sessionManager;
  private final QbtTransport transport;
  private final ErrorClassifier classifier;
  private final Supplier<QbtClientConfig> configSupplier;

  /**
   * Instantiates a new Retry executor.
   *
   * @param retryLoop      the retry loop
   * @param sessionManager the session manager
   * @param transport      the transport
   * @param classifier     the classifier
   * @param configSupplier the config supplier
   */
  @Inject
  public RetryExecutor(final RetryLoop retryLoop,
                       final SessionManager sessionManager,
                       final QbtTransport transport,
                       final ErrorClassifier classifier,
                       final Supplier<QbtClientConfig> configSupplier) {
    log.info("RetryExecutor()");
    this.retryLoop = retryLoop;
    this.sessionManager = sessionManager;
    this.transport = transport;
    this.classifier = classifier;
    this.configSupplier = configSupplier;
  }

  /**
   * Performs an HTTP request with session handling and retries.
   *
   * @param label   the label, usually {@code METHOD path}
   * @param context the call context
   * @param request the request; session cookies are attached per attempt
   * @return the first response that is neither a session rejection nor a retryable status
   */
  public TransportResponse execute(final String label,
                                   final CallContext context,
                                   final TransportRequest request) {
    log.debug("execute({})", label);
    final RetryPolicy policy = RetryPolicy.fromConfig(configSupplier.get());
    return executeWithRetry(label, context, ctx -> {
      final TransportResponse response =
          transport.perform(request.withSessionArtifacts(sessionManager.sessionArtifacts()), ctx);
      final int status = response.statusCode();
      if (status == 401 || status == 403) {
        sessionManager.invalidate();
        throw QbtClientException.sessionRejected(status);
      }
      if (policy.isRetryableStatus(status)) {
        throw classifier.classifyStatus(status, response.body()).asTransient();
      }
      return response;
    });
  }

  /**
   * Runs an arbitrary remote operation with session handling and retries.
   *
   * @param label     the label
   * @param context   the call context
   * @param operation the operation
   * @param <T>       the result type
   * @return the operation's result
   */
  public <T> T executeWithRetry(final String label,
                                final CallContext context,
                                final RemoteOperation<T> operation) {
    return retryLoop.retry(label, context, attempt -> {
      sessionManager.ensureAuthenticated(context);
      if (context.isCancelled()) {
        throw new OperationCancelledException(label + " cancelled", null);
      }
      return operation.call(context);
    });
  }
}
