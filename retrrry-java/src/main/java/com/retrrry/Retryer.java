package com.retrrry;

import static com.google.common.base.Preconditions.checkNotNull;

import com.retrrry.common.Clock;
import com.retrrry.common.Sleeper;
import java.time.Duration;
import java.util.concurrent.Callable;
import javax.annotation.Nonnull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs an operation repeatedly according to a {@link RetryPolicy}.
 *
 * <p>Each call to {@link #call(Callable)} blocks the calling thread, including while sleeping
 * between attempts, and keeps its own state. A single instance can therefore be shared by any
 * number of threads.
 *
 * <p>A call ends in exactly one of three ways:
 *
 * <ul>
 *   <li>the outcome is not retryable: the value is returned, or the exception rethrown unchanged;
 *   <li>the stop strategy fires on a retryable outcome: a {@link RetryException} is thrown if the
 *       policy wraps, otherwise the last exception is rethrown or the last value returned;
 *   <li>the backoff sleep is interrupted: the {@link InterruptedException} is thrown.
 * </ul>
 *
 * @param <T> the operation's result type
 */
public final class Retryer<T> {
  private static final Logger logger = LoggerFactory.getLogger(Retryer.class);

  private final RetryPolicy<T> policy;
  private final Clock clock;
  private final Sleeper sleeper;

  public Retryer(@Nonnull RetryPolicy<T> policy) {
    this(policy, Clock.system(), Sleeper.threadSleeper());
  }

  private Retryer(RetryPolicy<T> policy, Clock clock, Sleeper sleeper) {
    this.policy = checkNotNull(policy, "policy");
    this.clock = checkNotNull(clock, "clock");
    this.sleeper = checkNotNull(sleeper, "sleeper");
  }

  /** A retryer running the zero-configuration policy: retry any exception forever, no wait. */
  public static <T> Retryer<T> defaults() {
    return new Retryer<>(RetryPolicy.defaults());
  }

  public static <T> Retryer<T> fromOptions(@Nonnull RetryOptions<T> options) {
    return new Retryer<>(options.toPolicy());
  }

  /**
   * Creates a retryer with explicit time capabilities, for callers that need to control how time
   * passes, such as tests.
   */
  public static <T> Retryer<T> create(
      @Nonnull RetryPolicy<T> policy, @Nonnull Clock clock, @Nonnull Sleeper sleeper) {
    return new Retryer<>(policy, clock, sleeper);
  }

  public RetryPolicy<T> getPolicy() {
    return policy;
  }

  /**
   * Runs the attempt loop for {@code operation}.
   *
   * @param operation the operation to run, invoked once per attempt
   * @return the value of the final attempt
   * @throws RetryException if retries were exhausted and the policy wraps
   * @throws InterruptedException if interrupted while waiting between attempts
   * @throws Exception the operation's own exception, when it is not retried or retries ran out
   */
  public T call(@Nonnull Callable<T> operation) throws Exception {
    checkNotNull(operation, "operation");
    final RetryContext<T> context = new RetryContext<>(clock);
    final RetryListener listener = policy.getListener();

    while (true) {
      final int attemptNumber = context.nextAttemptNumber();
      listener.beforeAttempt(attemptNumber);

      final long startedAt = context.now();
      Attempt<T> attempt;
      try {
        attempt = Attempt.value(attemptNumber, startedAt, operation.call());
      } catch (Exception e) {
        attempt = Attempt.failure(attemptNumber, startedAt, e);
      }
      context.record(attempt);

      if (!policy.getRetryPredicate().shouldRetry(attempt)) {
        return attempt.get();
      }
      listener.afterAttempt(attempt);

      final Duration elapsed = context.delaySinceFirstAttempt();
      if (policy.getStopStrategy().shouldStop(context.getAttemptCount(), elapsed)) {
        logger.debug("Giving up after {} attempts and {}: {}", attemptNumber, elapsed, attempt);
        if (policy.isWrapException()) {
          throw new RetryException(context.getLastAttempt());
        }
        return attempt.get();
      }

      final Duration delay = policy.getWaitStrategy().computeDelay(attemptNumber, elapsed);
      logger.debug("Attempt {} will be retried in {}: {}", attemptNumber, delay, attempt);
      sleeper.sleep(delay);
    }
  }

  /**
   * Decorates {@code operation} so that every invocation of the returned callable runs the attempt
   * loop.
   */
  public Callable<T> wrap(@Nonnull Callable<T> operation) {
    checkNotNull(operation, "operation");
    return () -> call(operation);
  }

  @Override
  public String toString() {
    return "Retryer{" + "policy=" + policy + '}';
  }
}
