package com.retrrry.common;

import java.time.Duration;

/**
 * Blocks the calling thread between attempts.
 *
 * <p>Implementations must honour thread interruption so that a caller can abort a long backoff.
 */
public interface Sleeper {

  /**
   * Sleeps for the given duration. A zero or negative duration returns immediately.
   *
   * @param duration how long to block
   * @throws InterruptedException if the thread is interrupted while sleeping
   */
  void sleep(Duration duration) throws InterruptedException;

  static Sleeper threadSleeper() {
    return ThreadSleeper.INSTANCE;
  }
}
