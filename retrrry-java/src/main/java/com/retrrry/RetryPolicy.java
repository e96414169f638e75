package com.retrrry;

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.function.Predicate;
import javax.annotation.Nonnull;

/**
 * Immutable description of how a {@link Retryer} behaves: when to stop, how long to wait, which
 * outcomes to retry and whether to wrap the final failure.
 *
 * <p>{@link #defaults()} retries any exception forever without waiting and never wraps.
 *
 * @param <T> the operation's result type
 */
public final class RetryPolicy<T> {

  private static final RetryPolicy<Object> DEFAULTS =
      new RetryPolicy<>(
          StopStrategies.neverStop(),
          WaitStrategies.noWait(),
          RetryPredicate.defaults(),
          false,
          RetryListener.NOOP);

  private final StopStrategy stopStrategy;
  private final WaitStrategy waitStrategy;
  private final RetryPredicate<T> retryPredicate;
  private final boolean wrapException;
  private final RetryListener listener;

  private RetryPolicy(
      StopStrategy stopStrategy,
      WaitStrategy waitStrategy,
      RetryPredicate<T> retryPredicate,
      boolean wrapException,
      RetryListener listener) {
    this.stopStrategy = stopStrategy;
    this.waitStrategy = waitStrategy;
    this.retryPredicate = retryPredicate;
    this.wrapException = wrapException;
    this.listener = listener;
  }

  @SuppressWarnings("unchecked")
  public static <T> RetryPolicy<T> defaults() {
    return (RetryPolicy<T>) DEFAULTS;
  }

  public static <T> Builder<T> builder() {
    return new Builder<>();
  }

  public Builder<T> toBuilder() {
    return new Builder<>(this);
  }

  public StopStrategy getStopStrategy() {
    return stopStrategy;
  }

  public WaitStrategy getWaitStrategy() {
    return waitStrategy;
  }

  public RetryPredicate<T> getRetryPredicate() {
    return retryPredicate;
  }

  public boolean isWrapException() {
    return wrapException;
  }

  public RetryListener getListener() {
    return listener;
  }

  @Override
  public String toString() {
    return "RetryPolicy{"
        + "stop="
        + stopStrategy
        + ", wait="
        + waitStrategy
        + ", wrapException="
        + wrapException
        + '}';
  }

  public static class Builder<T> {
    private StopStrategy stopStrategy;
    private WaitStrategy waitStrategy;
    private RetryPredicate<T> retryPredicate;
    private boolean wrapException;
    private RetryListener listener;

    private Builder() {
      this(RetryPolicy.defaults());
    }

    private Builder(RetryPolicy<T> from) {
      this.stopStrategy = from.stopStrategy;
      this.waitStrategy = from.waitStrategy;
      this.retryPredicate = from.retryPredicate;
      this.wrapException = from.wrapException;
      this.listener = from.listener;
    }

    public Builder<T> stopStrategy(@Nonnull StopStrategy stopStrategy) {
      this.stopStrategy = checkNotNull(stopStrategy, "stopStrategy");
      return this;
    }

    public Builder<T> waitStrategy(@Nonnull WaitStrategy waitStrategy) {
      this.waitStrategy = checkNotNull(waitStrategy, "waitStrategy");
      return this;
    }

    public Builder<T> retryPredicate(@Nonnull RetryPredicate<T> retryPredicate) {
      this.retryPredicate = checkNotNull(retryPredicate, "retryPredicate");
      return this;
    }

    public Builder<T> retryOnException(@Nonnull Predicate<? super Exception> retryOnException) {
      this.retryPredicate = retryPredicate.withRetryOnException(retryOnException);
      return this;
    }

    public Builder<T> retryOnResult(@Nonnull Predicate<? super T> retryOnResult) {
      this.retryPredicate = retryPredicate.withRetryOnResult(retryOnResult);
      return this;
    }

    public Builder<T> wrapException(boolean wrapException) {
      this.wrapException = wrapException;
      return this;
    }

    public Builder<T> listener(@Nonnull RetryListener listener) {
      this.listener = checkNotNull(listener, "listener");
      return this;
    }

    public RetryPolicy<T> build() {
      return new RetryPolicy<>(stopStrategy, waitStrategy, retryPredicate, wrapException, listener);
    }
  }
}
