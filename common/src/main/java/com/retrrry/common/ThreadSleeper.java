package com.retrrry.common;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

final class ThreadSleeper implements Sleeper {
  static final ThreadSleeper INSTANCE = new ThreadSleeper();

  private static final Duration MAX_NANOS = Duration.ofNanos(Long.MAX_VALUE);

  private ThreadSleeper() {}

  @Override
  public void sleep(Duration duration) throws InterruptedException {
    if (duration.isZero() || duration.isNegative()) {
      // still surface a pending interrupt
      if (Thread.interrupted()) {
        throw new InterruptedException();
      }
      return;
    }
    // durations past the long range of nanoseconds sleep for that range
    final long nanos = duration.compareTo(MAX_NANOS) >= 0 ? Long.MAX_VALUE : duration.toNanos();
    TimeUnit.NANOSECONDS.sleep(nanos);
  }
}
