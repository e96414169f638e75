package com.retrrry;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import java.time.Duration;
import java.util.List;

/** Factory for the built-in {@link StopStrategy} implementations. */
public final class StopStrategies {

  private static final StopStrategy NEVER_STOP = new NeverStop();

  private StopStrategies() {}

  /** Retries forever. This is the default. */
  public static StopStrategy neverStop() {
    return NEVER_STOP;
  }

  /**
   * Stops once {@code maxAttempts} attempts have been made. {@code 1} means the operation runs once
   * with no retries.
   */
  public static StopStrategy stopAfterAttempt(int maxAttempts) {
    checkArgument(maxAttempts >= 1, "maxAttempts must be at least 1, was %s", maxAttempts);
    return new StopAfterAttempt(maxAttempts);
  }

  /** Stops once the time since the first attempt reaches {@code maxDelay}. */
  public static StopStrategy stopAfterDelay(Duration maxDelay) {
    checkNotNull(maxDelay, "maxDelay");
    checkArgument(!maxDelay.isNegative(), "maxDelay must not be negative, was %s", maxDelay);
    return new StopAfterDelay(maxDelay);
  }

  /** Stops as soon as any of the given strategies says so. */
  public static StopStrategy anyOf(StopStrategy... strategies) {
    return anyOf(ImmutableList.copyOf(strategies));
  }

  public static StopStrategy anyOf(List<StopStrategy> strategies) {
    final ImmutableList<StopStrategy> copy = ImmutableList.copyOf(strategies);
    if (copy.isEmpty()) {
      return NEVER_STOP;
    }
    if (copy.size() == 1) {
      return copy.get(0);
    }
    return new AnyOf(copy);
  }

  private static final class NeverStop implements StopStrategy {
    @Override
    public boolean shouldStop(int attemptNumber, Duration delaySinceFirstAttempt) {
      return false;
    }

    @Override
    public String toString() {
      return "NeverStop";
    }
  }

  private static final class StopAfterAttempt implements StopStrategy {
    private final int maxAttempts;

    private StopAfterAttempt(int maxAttempts) {
      this.maxAttempts = maxAttempts;
    }

    @Override
    public boolean shouldStop(int attemptNumber, Duration delaySinceFirstAttempt) {
      return attemptNumber >= maxAttempts;
    }

    @Override
    public String toString() {
      return "StopAfterAttempt{maxAttempts=" + maxAttempts + '}';
    }
  }

  private static final class StopAfterDelay implements StopStrategy {
    private final Duration maxDelay;

    private StopAfterDelay(Duration maxDelay) {
      this.maxDelay = maxDelay;
    }

    @Override
    public boolean shouldStop(int attemptNumber, Duration delaySinceFirstAttempt) {
      return delaySinceFirstAttempt.compareTo(maxDelay) >= 0;
    }

    @Override
    public String toString() {
      return "StopAfterDelay{maxDelay=" + maxDelay + '}';
    }
  }

  private static final class AnyOf implements StopStrategy {
    private final ImmutableList<StopStrategy> strategies;

    private AnyOf(ImmutableList<StopStrategy> strategies) {
      this.strategies = strategies;
    }

    @Override
    public boolean shouldStop(int attemptNumber, Duration delaySinceFirstAttempt) {
      for (StopStrategy strategy : strategies) {
        if (strategy.shouldStop(attemptNumber, delaySinceFirstAttempt)) {
          return true;
        }
      }
      return false;
    }

    @Override
    public String toString() {
      return "AnyOf" + strategies;
    }
  }
}
