package com.retrrry;

import static com.google.common.base.Preconditions.checkNotNull;

import javax.annotation.Nullable;

/**
 * Thrown when retries are exhausted and the policy asks for the last outcome to be wrapped.
 *
 * <p>The last attempt may have returned a value that the result predicate rejected, in which case
 * there is no cause. Otherwise the cause is the exception the last attempt threw.
 *
 * <p>The attempt itself is not serialized: after deserialization {@link #getLastAttempt()} returns
 * {@code null}, while {@link #getAttemptNumber()} and the cause are kept.
 */
public class RetryException extends Exception {

  private static final long serialVersionUID = 1L;

  private final transient Attempt<?> lastAttempt;
  private final int attemptNumber;

  public RetryException(Attempt<?> lastAttempt) {
    super(
        "RetryError[" + checkNotNull(lastAttempt, "lastAttempt") + "]",
        lastAttempt.hasException() ? lastAttempt.getException() : null);
    this.lastAttempt = lastAttempt;
    this.attemptNumber = lastAttempt.getAttemptNumber();
  }

  @Nullable
  public Attempt<?> getLastAttempt() {
    return lastAttempt;
  }

  public int getAttemptNumber() {
    return attemptNumber;
  }
}
