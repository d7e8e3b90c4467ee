package com.codeheadsystems.qbt.client.retry;

import com.codeheadsystems.qbt.client.classifier.ErrorClassifier;
import com.codeheadsystems.qbt.client.config.QbtClientConfig;
import com.codeheadsystems.qbt.client.config.RetryPolicy;
import com.codeheadsystems.qbt.client.exceptions.OperationCancelledException;
import com.codeheadsystems.qbt.client.exceptions.OperationFailedException;
import com.codeheadsystems.qbt.client.exceptions.QbtClientException;
import com.codeheadsystems.qbt.client.session.SessionState;
import com.codeheadsystems.qbt.client.transport.CallContext;
import java.io.IOException;
import java.time.Duration;
import java.util.function.Supplier;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The backoff loop shared by logins and remote calls.
 * <p>
 * Runs an {@link Attempt} at most {@code maxRetries + 1} times.  Before each attempt the call
 * context and the auth-failure latch are checked.  Failures are classified; a permanent one
 * ends the loop at once, a transient one is followed by a cancellable backoff sleep.  The
 * policy is read from the current configuration at the start of each loop.
 */
@Singleton
public class RetryLoop {

  private static final Logger log = LoggerFactory.getLogger(RetryLoop.class);

  private final Supplier<QbtClientConfig> configSupplier;
  private final ErrorClassifier classifier;
  private final SessionState sessionState;

  /**
   * Instantiates a new Retry loop.
   *
   * @param configSupplier the config supplier
   * @param classifier     the classifier
   * @param sessionState   the session state
   */
  @Inject
  public RetryLoop(final Supplier<QbtClientConfig> configSupplier,
                   final ErrorClassifier classifier,
                   final SessionState sessionState) {
    log.info("RetryLoop()");
    this.configSupplier = configSupplier;
    this.classifier = classifier;
    this.sessionState = sessionState;
  }

  /**
   * Runs the attempt until it succeeds, fails permanently, or the retry budget is spent.
   *
   * @param label   the operation label used in messages
   * @param context the call context
   * @param attempt the attempt
   * @param <T>     the result type
   * @return the first successful result
   * @throws OperationFailedException    on a permanent failure or exhaustion
   * @throws OperationCancelledException if the context is cancelled
   */
  public <T> T retry(final String label, final CallContext context, final Attempt<T> attempt) {
    final QbtClientConfig config = configSupplier.get();
    final RetryPolicy policy = RetryPolicy.fromConfig(config);
    final boolean debug = config.debug();
    QbtClientException last = null;

    for (int n = 0; n <= policy.maxRetries(); n++) {
      if (context.isCancelled()) {
        throw new OperationCancelledException(label + " cancelled", last);
      }
      if (sessionState.isAuthPermanentlyFailed()) {
        throw new OperationFailedException(label, n, false, QbtClientException.authPermanentlyFailed());
      }
      try {
        final T result = attempt.run(n);
        if (debug) {
          log.debug("{}: attempt {}/{} succeeded", label, n + 1, policy.totalAttempts());
        }
        return result;
      } catch (OperationCancelledException e) {
        throw e;
      } catch (IOException | RuntimeException e) {
        last = classifier.classify(e);
      }
      if (last.isPermanent()) {
        if (debug) {
          log.debug("{}: attempt {}/{} failed permanently: {}", label, n + 1, policy.totalAttempts(),
              last.getMessage());
        }
        throw new OperationFailedException(label, n + 1, false, last);
      }
      if (n < policy.maxRetries()) {
        final Duration delay = policy.backoff().delayForAttempt(n);
        if (debug) {
          log.debug("{}: attempt {}/{} failed, retrying in {} ms: {}", label, n + 1, policy.totalAttempts(),
              delay.toMillis(), last.getMessage());
        }
        if (!context.sleep(delay)) {
          throw new OperationCancelledException(label + " cancelled during retry", last);
        }
      }
    }
    log.warn("{} failed after {} attempts: {}", label, policy.totalAttempts(), last.getMessage());
    throw new OperationFailedException(label, policy.totalAttempts(), true, last);
  }
}
