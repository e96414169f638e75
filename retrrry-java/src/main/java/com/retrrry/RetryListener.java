package com.retrrry;

/**
 * Callbacks around the attempts of a retry loop. Both methods default to doing nothing.
 *
 * <p>An exception thrown by a listener is not caught by the loop and ends the call.
 */
public interface RetryListener {

  RetryListener NOOP = new RetryListener() {};

  /** Called just before the operation is invoked. */
  default void beforeAttempt(int attemptNumber) {}

  /** Called after an attempt whose outcome warrants a retry, before the stop strategy runs. */
  default void afterAttempt(Attempt<?> attempt) {}
}
