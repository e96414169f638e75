package com.retrrry;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.function.IntConsumer;
import java.util.function.Predicate;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Named retry options, resolved into a {@link RetryPolicy}.
 *
 * <p>Every option is optional. Options of the same family combine:
 *
 * <ul>
 *   <li>stop: {@link Builder#stopFunc} wins if set, otherwise the loop stops as soon as any of the
 *       configured attempt and delay limits is reached, and never stops if none is;
 *   <li>wait: {@link Builder#waitFunc} wins if set, otherwise the longest of the configured fixed,
 *       random, incrementing and exponential waits is used, plus jitter if configured.
 * </ul>
 *
 * <p>A wait family counts as configured when any one of its options is set. Its other options
 * then take these defaults: random min 0 and max 1 s; incrementing start 0, increment 100 ms and
 * max {@link WaitStrategies#MAX_WAIT}; exponential multiplier 1 ms and max {@link
 * WaitStrategies#MAX_WAIT}.
 *
 * <p>Invalid values are rejected by {@link Builder#build()} with an {@link
 * IllegalArgumentException}.
 *
 * @param <T> the operation's result type
 */
public final class RetryOptions<T> {

  static final Duration DEFAULT_WAIT_RANDOM_MIN = Duration.ZERO;
  static final Duration DEFAULT_WAIT_RANDOM_MAX = Duration.ofSeconds(1);
  static final Duration DEFAULT_WAIT_INCREMENTING_START = Duration.ZERO;
  static final Duration DEFAULT_WAIT_INCREMENTING_INCREMENT = Duration.ofMillis(100);
  static final Duration DEFAULT_WAIT_EXPONENTIAL_MULTIPLIER = Duration.ofMillis(1);

  private final StopStrategy stopStrategy;
  private final WaitStrategy waitStrategy;
  private final RetryPredicate<T> retryPredicate;
  private final boolean wrapException;
  private final RetryListener listener;

  private RetryOptions(
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

  public static <T> Builder<T> builder() {
    return new Builder<>();
  }

  /** Options with nothing set, which resolve to {@link RetryPolicy#defaults()}. */
  public static <T> RetryOptions<T> defaults() {
    return new Builder<T>().build();
  }

  public RetryPolicy<T> toPolicy() {
    return RetryPolicy.<T>builder()
        .stopStrategy(stopStrategy)
        .waitStrategy(waitStrategy)
        .retryPredicate(retryPredicate)
        .wrapException(wrapException)
        .listener(listener)
        .build();
  }

  @Override
  public String toString() {
    return "RetryOptions{"
        + "stop="
        + stopStrategy
        + ", wait="
        + waitStrategy
        + ", wrapException="
        + wrapException
        + '}';
  }

  public static class Builder<T> {
    private Integer stopMaxAttemptNumber;
    private Duration stopMaxDelay;
    private StopStrategy stopFunc;
    private Duration waitFixed;
    private Duration waitRandomMin;
    private Duration waitRandomMax;
    private Duration waitIncrementingStart;
    private Duration waitIncrementingIncrement;
    private Duration waitIncrementingMax;
    private Duration waitExponentialMultiplier;
    private Duration waitExponentialMax;
    private Duration waitJitterMax;
    private WaitStrategy waitFunc;
    private Predicate<? super Exception> retryOnException;
    private Predicate<? super T> retryOnResult;
    private boolean wrapException;
    private IntConsumer beforeAttempts;
    private IntConsumer afterAttempts;

    private Builder() {}

    /** Stop once this many attempts have been made. */
    public Builder<T> stopMaxAttemptNumber(int stopMaxAttemptNumber) {
      this.stopMaxAttemptNumber = stopMaxAttemptNumber;
      return this;
    }

    /** Stop once this much time has passed since the first attempt. */
    public Builder<T> stopMaxDelay(@Nonnull Duration stopMaxDelay) {
      this.stopMaxDelay = checkNotNull(stopMaxDelay, "stopMaxDelay");
      return this;
    }

    /** Custom stop rule, replacing the attempt and delay limits. */
    public Builder<T> stopFunc(@Nonnull StopStrategy stopFunc) {
      this.stopFunc = checkNotNull(stopFunc, "stopFunc");
      return this;
    }

    public Builder<T> waitFixed(@Nonnull Duration waitFixed) {
      this.waitFixed = checkNotNull(waitFixed, "waitFixed");
      return this;
    }

    public Builder<T> waitRandomMin(@Nonnull Duration waitRandomMin) {
      this.waitRandomMin = checkNotNull(waitRandomMin, "waitRandomMin");
      return this;
    }

    public Builder<T> waitRandomMax(@Nonnull Duration waitRandomMax) {
      this.waitRandomMax = checkNotNull(waitRandomMax, "waitRandomMax");
      return this;
    }

    public Builder<T> waitIncrementingStart(@Nonnull Duration waitIncrementingStart) {
      this.waitIncrementingStart = checkNotNull(waitIncrementingStart, "waitIncrementingStart");
      return this;
    }

    public Builder<T> waitIncrementingIncrement(@Nonnull Duration waitIncrementingIncrement) {
      this.waitIncrementingIncrement =
          checkNotNull(waitIncrementingIncrement, "waitIncrementingIncrement");
      return this;
    }

    public Builder<T> waitIncrementingMax(@Nonnull Duration waitIncrementingMax) {
      this.waitIncrementingMax = checkNotNull(waitIncrementingMax, "waitIncrementingMax");
      return this;
    }

    public Builder<T> waitExponentialMultiplier(@Nonnull Duration waitExponentialMultiplier) {
      this.waitExponentialMultiplier =
          checkNotNull(waitExponentialMultiplier, "waitExponentialMultiplier");
      return this;
    }

    public Builder<T> waitExponentialMax(@Nonnull Duration waitExponentialMax) {
      this.waitExponentialMax = checkNotNull(waitExponentialMax, "waitExponentialMax");
      return this;
    }

    /** Adds a random extra wait in {@code [0, waitJitterMax)} to every computed wait. */
    public Builder<T> waitJitterMax(@Nonnull Duration waitJitterMax) {
      this.waitJitterMax = checkNotNull(waitJitterMax, "waitJitterMax");
      return this;
    }

    /** Custom wait rule, replacing the fixed, random, incrementing and exponential options. */
    public Builder<T> waitFunc(@Nonnull WaitStrategy waitFunc) {
      this.waitFunc = checkNotNull(waitFunc, "waitFunc");
      return this;
    }

    public Builder<T> retryOnException(@Nonnull Predicate<? super Exception> retryOnException) {
      this.retryOnException = checkNotNull(retryOnException, "retryOnException");
      return this;
    }

    /** Retry only on exceptions of the given types, including their subclasses. */
    @SafeVarargs
    public final Builder<T> retryOnExceptionOfType(Class<? extends Exception>... types) {
      checkArgument(types.length > 0, "at least one exception type is required");
      this.retryOnException = RetryPredicate.exceptionOfType(types);
      return this;
    }

    public Builder<T> retryOnResult(@Nonnull Predicate<? super T> retryOnResult) {
      this.retryOnResult = checkNotNull(retryOnResult, "retryOnResult");
      return this;
    }

    /** Throw a {@link RetryException} instead of the last outcome once retries are exhausted. */
    public Builder<T> wrapException(boolean wrapException) {
      this.wrapException = wrapException;
      return this;
    }

    /** Called with the attempt number before each attempt. */
    public Builder<T> beforeAttempts(@Nonnull IntConsumer beforeAttempts) {
      this.beforeAttempts = checkNotNull(beforeAttempts, "beforeAttempts");
      return this;
    }

    /** Called with the attempt number after each attempt that is going to be retried. */
    public Builder<T> afterAttempts(@Nonnull IntConsumer afterAttempts) {
      this.afterAttempts = checkNotNull(afterAttempts, "afterAttempts");
      return this;
    }

    public RetryOptions<T> build() {
      RetryPredicate<T> predicate = RetryPredicate.defaults();
      if (retryOnException != null) {
        predicate = predicate.withRetryOnException(retryOnException);
      }
      if (retryOnResult != null) {
        predicate = predicate.withRetryOnResult(retryOnResult);
      }
      return new RetryOptions<>(
          resolveStop(), resolveWait(), predicate, wrapException, resolveListener());
    }

    private StopStrategy resolveStop() {
      final List<StopStrategy> stops = new ArrayList<>();
      if (stopMaxAttemptNumber != null) {
        stops.add(StopStrategies.stopAfterAttempt(stopMaxAttemptNumber));
      }
      if (stopMaxDelay != null) {
        stops.add(StopStrategies.stopAfterDelay(stopMaxDelay));
      }
      if (stopFunc != null) {
        return stopFunc;
      }
      return StopStrategies.anyOf(stops);
    }

    private WaitStrategy resolveWait() {
      final ImmutableList.Builder<WaitStrategy> waits = ImmutableList.builder();
      if (waitFixed != null) {
        waits.add(WaitStrategies.fixedWait(waitFixed));
      }
      if (waitRandomMin != null || waitRandomMax != null) {
        waits.add(
            WaitStrategies.randomWait(
                orDefault(waitRandomMin, DEFAULT_WAIT_RANDOM_MIN),
                orDefault(waitRandomMax, DEFAULT_WAIT_RANDOM_MAX)));
      }
      if (waitIncrementingStart != null
          || waitIncrementingIncrement != null
          || waitIncrementingMax != null) {
        waits.add(
            WaitStrategies.incrementingWait(
                orDefault(waitIncrementingStart, DEFAULT_WAIT_INCREMENTING_START),
                orDefault(waitIncrementingIncrement, DEFAULT_WAIT_INCREMENTING_INCREMENT),
                orDefault(waitIncrementingMax, WaitStrategies.MAX_WAIT)));
      }
      if (waitExponentialMultiplier != null || waitExponentialMax != null) {
        waits.add(
            WaitStrategies.exponentialWait(
                orDefault(waitExponentialMultiplier, DEFAULT_WAIT_EXPONENTIAL_MULTIPLIER),
                orDefault(waitExponentialMax, WaitStrategies.MAX_WAIT)));
      }

      final WaitStrategy base =
          waitFunc != null ? waitFunc : WaitStrategies.longestOf(waits.build());
      if (waitJitterMax != null) {
        return WaitStrategies.withJitter(base, waitJitterMax);
      }
      return base;
    }

    private RetryListener resolveListener() {
      if (beforeAttempts == null && afterAttempts == null) {
        return RetryListener.NOOP;
      }
      final IntConsumer before = beforeAttempts;
      final IntConsumer after = afterAttempts;
      return new RetryListener() {
        @Override
        public void beforeAttempt(int attemptNumber) {
          if (before != null) {
            before.accept(attemptNumber);
          }
        }

        @Override
        public void afterAttempt(Attempt<?> attempt) {
          if (after != null) {
            after.accept(attempt.getAttemptNumber());
          }
        }
      };
    }

    private static Duration orDefault(@Nullable Duration value, Duration defaultValue) {
      return value != null ? value : defaultValue;
    }
  }
}
