package com.retrrry.common;

import java.time.Duration;

/** Monotonic time source used to measure how long a retry loop has been running. */
public interface Clock {

  /** Current reading in nanoseconds. Only differences between readings are meaningful. */
  long nanoTime();

  default Duration elapsedSince(long startNanos) {
    return Duration.ofNanos(nanoTime() - startNanos);
  }

  static Clock system() {
    return SystemClock.INSTANCE;
  }
}
