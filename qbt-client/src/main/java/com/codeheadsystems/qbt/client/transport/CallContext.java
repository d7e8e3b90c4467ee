package com.codeheadsystems.qbt.client.transport;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Cancellation and deadline carrier for one logical call.
 * <p>
 * A context is cancelled when {@link #cancel()} is called, when its deadline passes, or when a
 * thread blocked in {@link #sleep(Duration)} is interrupted.  Blocking work registers a hook
 * with {@link #onCancel(Runnable)} to be aborted promptly on explicit cancellation.
 */
public final class CallContext {

  private final long deadlineNanos;
  private final boolean hasDeadline;
  private final CountDownLatch cancelled = new CountDownLatch(1);
  private final CopyOnWriteArrayList<Runnable> cancelHooks = new CopyOnWriteArrayList<>();

  private CallContext(final boolean hasDeadline, final long deadlineNanos) {
    this.hasDeadline = hasDeadline;
    this.deadlineNanos = deadlineNanos;
  }

  /**
   * A context with no deadline that is only cancelled explicitly.
   *
   * @return the call context
   */
  public static CallContext background() {
    return new CallContext(false, 0L);
  }

  /**
   * A context that is cancelled once the timeout elapses.
   *
   * @param timeout the timeout
   * @return the call context
   */
  public static CallContext withTimeout(final Duration timeout) {
    Objects.requireNonNull(timeout, "timeout");
    return new CallContext(true, System.nanoTime() + timeout.toNanos());
  }

  /**
   * Cancels the context and runs the registered hooks once.
   */
  public void cancel() {
    if (cancelled.getCount() == 0) {
      return;
    }
    cancelled.countDown();
    for (Runnable hook : cancelHooks) {
      hook.run();
    }
  }

  public boolean isCancelled() {
    return cancelled.getCount() == 0 || (hasDeadline && System.nanoTime() - deadlineNanos >= 0);
  }

  /**
   * Time left before the deadline.
   *
   * @return the remaining time, empty when there is no deadline
   */
  public Optional<Duration> remaining() {
    if (!hasDeadline) {
      return Optional.empty();
    }
    return Optional.of(Duration.ofNanos(Math.max(0L, deadlineNanos - System.nanoTime())));
  }

  /**
   * Waits for the given time unless the context is cancelled first.
   *
   * @param duration how long to wait
   * @return true if the full duration elapsed, false if the context was cancelled
   */
  public boolean sleep(final Duration duration) {
    if (isCancelled()) {
      return false;
    }
    long waitNanos = duration.toNanos();
    final Optional<Duration> left = remaining();
    final boolean deadlineFirst = left.isPresent() && left.get().toNanos() < waitNanos;
    if (deadlineFirst) {
      waitNanos = left.get().toNanos();
    }
    try {
      if (cancelled.await(waitNanos, TimeUnit.NANOSECONDS)) {
        return false;
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      cancel();
      return false;
    }
    return !deadlineFirst;
  }

  /**
   * Registers a hook to run when the context is explicitly cancelled.  Runs immediately if the
   * context already is.
   *
   * @param hook the hook
   * @return a registration that removes the hook when closed
   */
  public Registration onCancel(final Runnable hook) {
    cancelHooks.add(hook);
    if (cancelled.getCount() == 0 && cancelHooks.remove(hook)) {
      hook.run();
    }
    return () -> cancelHooks.remove(hook);
  }

  /**
   * Handle for a registered cancel hook.
   */
  public interface Registration extends AutoCloseable {
    @Override
    void close();
  }
}
