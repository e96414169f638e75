package com.retrrry;

import java.time.Duration;

/** Decides when a retry loop gives up. Implementations must be side-effect free. */
@FunctionalInterface
public interface StopStrategy {

  /**
   * Called after an attempt whose outcome warrants another try.
   *
   * @param attemptNumber the number of attempts made so far, starting at 1
   * @param delaySinceFirstAttempt time elapsed since the first attempt started
   * @return true if no further attempt should be made
   */
  boolean shouldStop(int attemptNumber, Duration delaySinceFirstAttempt);
}
