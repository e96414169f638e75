package com.retrrry;

import java.time.Duration;

/** Computes how long to sleep before the next attempt. */
@FunctionalInterface
public interface WaitStrategy {

  /**
   * @param attemptNumber the number of attempts completed so far, starting at 1
   * @param delaySinceFirstAttempt time elapsed since the first attempt started
   * @return the delay before the next attempt, never negative
   */
  Duration computeDelay(int attemptNumber, Duration delaySinceFirstAttempt);
}
