package com.retrrry;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import com.google.common.math.LongMath;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Factory for the built-in {@link WaitStrategy} implementations.
 *
 * <p>All strategies returned here are immutable and may be shared between threads. The random ones
 * draw from {@link ThreadLocalRandom}.
 */
public final class WaitStrategies {

  /** Upper bound used when a growing wait is configured without an explicit maximum. */
  public static final Duration MAX_WAIT = Duration.ofMillis(1073741823L);

  private static final WaitStrategy NO_WAIT = new FixedWait(Duration.ZERO);

  private static final Duration MAX_NANOS = Duration.ofNanos(Long.MAX_VALUE);
  private static final Duration MIN_NANOS = Duration.ofNanos(Long.MIN_VALUE);

  private WaitStrategies() {}

  /** Never waits between attempts. This is the default. */
  public static WaitStrategy noWait() {
    return NO_WAIT;
  }

  public static WaitStrategy fixedWait(Duration wait) {
    checkNonNegative(wait, "wait");
    return new FixedWait(wait);
  }

  /**
   * Waits a uniformly random duration in {@code [min, max)}. When {@code min} equals {@code max}
   * the wait is always {@code min}.
   */
  public static WaitStrategy randomWait(Duration min, Duration max) {
    checkNonNegative(min, "min");
    checkNonNegative(max, "max");
    checkArgument(min.compareTo(max) <= 0, "min (%s) must not exceed max (%s)", min, max);
    return new RandomWait(min, max);
  }

  /**
   * Waits {@code multiplier * 2^attemptNumber}, capped at {@code maxWait}. The first retry after
   * attempt 1 therefore waits twice the multiplier.
   */
  public static WaitStrategy exponentialWait(Duration multiplier, Duration maxWait) {
    checkNotNull(multiplier, "multiplier");
    checkArgument(
        !multiplier.isNegative() && !multiplier.isZero(),
        "multiplier must be positive, was %s",
        multiplier);
    checkNonNegative(maxWait, "maxWait");
    return new ExponentialWait(multiplier, maxWait);
  }

  /**
   * Waits {@code start + increment * (attemptNumber - 1)}, kept within {@code [0, maxWait]}.
   * {@code start} and {@code increment} may be negative.
   */
  public static WaitStrategy incrementingWait(
      Duration start, Duration increment, Duration maxWait) {
    checkNotNull(start, "start");
    checkNotNull(increment, "increment");
    checkNonNegative(maxWait, "maxWait");
    return new IncrementingWait(start, increment, maxWait);
  }

  /** Waits as long as the longest of the given strategies. */
  public static WaitStrategy longestOf(WaitStrategy... strategies) {
    return longestOf(ImmutableList.copyOf(strategies));
  }

  public static WaitStrategy longestOf(List<WaitStrategy> strategies) {
    final ImmutableList<WaitStrategy> copy = ImmutableList.copyOf(strategies);
    if (copy.isEmpty()) {
      return NO_WAIT;
    }
    if (copy.size() == 1) {
      return copy.get(0);
    }
    return new LongestOf(copy);
  }

  /** Adds a uniformly random extra wait in {@code [0, maxJitter)} to {@code strategy}. */
  public static WaitStrategy withJitter(WaitStrategy strategy, Duration maxJitter) {
    checkNotNull(strategy, "strategy");
    checkNonNegative(maxJitter, "maxJitter");
    if (maxJitter.isZero()) {
      return strategy;
    }
    return new Jittered(strategy, maxJitter);
  }

  private static void checkNonNegative(Duration duration, String name) {
    checkNotNull(duration, name);
    checkArgument(!duration.isNegative(), "%s must not be negative, was %s", name, duration);
  }

  /** Converts to nanoseconds, saturating at the {@code long} range (about 292 years). */
  static long saturatedNanos(Duration duration) {
    if (duration.compareTo(MAX_NANOS) >= 0) {
      return Long.MAX_VALUE;
    }
    if (duration.compareTo(MIN_NANOS) <= 0) {
      return Long.MIN_VALUE;
    }
    return duration.toNanos();
  }

  private static long randomNanos(long minInclusive, long maxExclusive) {
    if (minInclusive >= maxExclusive) {
      return minInclusive;
    }
    return ThreadLocalRandom.current().nextLong(minInclusive, maxExclusive);
  }

  private static final class FixedWait implements WaitStrategy {
    private final Duration wait;

    private FixedWait(Duration wait) {
      this.wait = wait;
    }

    @Override
    public Duration computeDelay(int attemptNumber, Duration delaySinceFirstAttempt) {
      return wait;
    }

    @Override
    public String toString() {
      return "FixedWait{wait=" + wait + '}';
    }
  }

  private static final class RandomWait implements WaitStrategy {
    private final long minNanos;
    private final long maxNanos;

    private RandomWait(Duration min, Duration max) {
      this.minNanos = saturatedNanos(min);
      this.maxNanos = saturatedNanos(max);
    }

    @Override
    public Duration computeDelay(int attemptNumber, Duration delaySinceFirstAttempt) {
      return Duration.ofNanos(randomNanos(minNanos, maxNanos));
    }

    @Override
    public String toString() {
      return "RandomWait{min="
          + Duration.ofNanos(minNanos)
          + ", max="
          + Duration.ofNanos(maxNanos)
          + '}';
    }
  }

  private static final class ExponentialWait implements WaitStrategy {
    private final long multiplierNanos;
    private final long maxWaitNanos;

    private ExponentialWait(Duration multiplier, Duration maxWait) {
      this.multiplierNanos = saturatedNanos(multiplier);
      this.maxWaitNanos = saturatedNanos(maxWait);
    }

    @Override
    public Duration computeDelay(int attemptNumber, Duration delaySinceFirstAttempt) {
      final long factor = LongMath.saturatedPow(2, Math.max(0, attemptNumber));
      final long delay = LongMath.saturatedMultiply(multiplierNanos, factor);
      return Duration.ofNanos(Math.min(delay, maxWaitNanos));
    }

    @Override
    public String toString() {
      return "ExponentialWait{multiplier="
          + Duration.ofNanos(multiplierNanos)
          + ", maxWait="
          + Duration.ofNanos(maxWaitNanos)
          + '}';
    }
  }

  private static final class IncrementingWait implements WaitStrategy {
    private final long startNanos;
    private final long incrementNanos;
    private final long maxWaitNanos;

    private IncrementingWait(Duration start, Duration increment, Duration maxWait) {
      this.startNanos = saturatedNanos(start);
      this.incrementNanos = saturatedNanos(increment);
      this.maxWaitNanos = saturatedNanos(maxWait);
    }

    @Override
    public Duration computeDelay(int attemptNumber, Duration delaySinceFirstAttempt) {
      final long steps = Math.max(0, attemptNumber - 1);
      final long delay =
          LongMath.saturatedAdd(startNanos, LongMath.saturatedMultiply(incrementNanos, steps));
      return Duration.ofNanos(Math.max(0L, Math.min(delay, maxWaitNanos)));
    }

    @Override
    public String toString() {
      return "IncrementingWait{start="
          + Duration.ofNanos(startNanos)
          + ", increment="
          + Duration.ofNanos(incrementNanos)
          + ", maxWait="
          + Duration.ofNanos(maxWaitNanos)
          + '}';
    }
  }

  private static final class LongestOf implements WaitStrategy {
    private final ImmutableList<WaitStrategy> strategies;

    private LongestOf(ImmutableList<WaitStrategy> strategies) {
      this.strategies = strategies;
    }

    @Override
    public Duration computeDelay(int attemptNumber, Duration delaySinceFirstAttempt) {
      Duration longest = Duration.ZERO;
      for (WaitStrategy strategy : strategies) {
        final Duration delay = strategy.computeDelay(attemptNumber, delaySinceFirstAttempt);
        if (delay.compareTo(longest) > 0) {
          longest = delay;
        }
      }
      return longest;
    }

    @Override
    public String toString() {
      return "LongestOf" + strategies;
    }
  }

  private static final class Jittered implements WaitStrategy {
    private final WaitStrategy delegate;
    private final long maxJitterNanos;

    private Jittered(WaitStrategy delegate, Duration maxJitter) {
      this.delegate = delegate;
      this.maxJitterNanos = saturatedNanos(maxJitter);
    }

    @Override
    public Duration computeDelay(int attemptNumber, Duration delaySinceFirstAttempt) {
      final Duration base = delegate.computeDelay(attemptNumber, delaySinceFirstAttempt);
      if (base.compareTo(MAX_NANOS) >= 0) {
        return base;
      }
      return base.plusNanos(randomNanos(0, maxJitterNanos));
    }

    @Override
    public String toString() {
      return "Jittered{delegate="
          + delegate
          + ", maxJitter="
          + Duration.ofNanos(maxJitterNanos)
          + '}';
    }
  }
}
