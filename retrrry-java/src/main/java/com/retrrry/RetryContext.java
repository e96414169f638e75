package com.retrrry;

import com.retrrry.common.Clock;
import java.time.Duration;

/** Per-call state of one run of the attempt loop. Confined to the calling thread. */
final class RetryContext<T> {
  private final Clock clock;
  private final long firstAttemptAtNanos;
  private int attemptCount;
  private Attempt<T> lastAttempt;

  RetryContext(Clock clock) {
    this.clock = clock;
    this.firstAttemptAtNanos = clock.nanoTime();
  }

  int nextAttemptNumber() {
    return ++attemptCount;
  }

  void record(Attempt<T> attempt) {
    this.lastAttempt = attempt;
  }

  int getAttemptCount() {
    return attemptCount;
  }

  Attempt<T> getLastAttempt() {
    return lastAttempt;
  }

  long now() {
    return clock.nanoTime();
  }

  Duration delaySinceFirstAttempt() {
    return clock.elapsedSince(firstAttemptAtNanos);
  }
}
