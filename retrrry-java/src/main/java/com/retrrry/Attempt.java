package com.retrrry;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import java.util.Objects;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * The recorded outcome of one execution of a retried operation: either the value it returned or
 * the exception it threw.
 *
 * @param <T> the operation's result type
 */
public abstract class Attempt<T> {

  private final int attemptNumber;
  private final long startedAtNanos;

  private Attempt(int attemptNumber, long startedAtNanos) {
    checkArgument(attemptNumber >= 1, "attemptNumber must be at least 1, was %s", attemptNumber);
    this.attemptNumber = attemptNumber;
    this.startedAtNanos = startedAtNanos;
  }

  public static <T> Attempt<T> value(int attemptNumber, long startedAtNanos, @Nullable T value) {
    return new Value<>(attemptNumber, startedAtNanos, value);
  }

  public static <T> Attempt<T> failure(
      int attemptNumber, long startedAtNanos, @Nonnull Exception exception) {
    return new Failure<>(attemptNumber, startedAtNanos, exception);
  }

  public int getAttemptNumber() {
    return attemptNumber;
  }

  /** Clock reading taken just before the operation was invoked. */
  public long getStartedAtNanos() {
    return startedAtNanos;
  }

  public boolean hasException() {
    return false;
  }

  @Nullable
  public T getResult() {
    throw new IllegalStateException("Attempt " + attemptNumber + " did not return a value");
  }

  public Exception getException() {
    throw new IllegalStateException("Attempt " + attemptNumber + " did not throw");
  }

  /**
   * Returns the value of this attempt, or rethrows the exception it ended with, unchanged.
   *
   * @return the returned value
   * @throws Exception the exception the operation threw
   */
  public abstract T get() throws Exception;

  static final class Value<T> extends Attempt<T> {
    private final T result;

    private Value(int attemptNumber, long startedAtNanos, T result) {
      super(attemptNumber, startedAtNanos);
      this.result = result;
    }

    @Override
    public T getResult() {
      return result;
    }

    @Override
    public T get() {
      return result;
    }

    @Override
    public String toString() {
      return "Attempts: " + getAttemptNumber() + ", Value: " + result;
    }

    @Override
    public boolean equals(Object o) {
      if (this == o) return true;
      if (o == null || getClass() != o.getClass()) return false;
      final Value<?> that = (Value<?>) o;
      return getAttemptNumber() == that.getAttemptNumber()
          && getStartedAtNanos() == that.getStartedAtNanos()
          && Objects.equals(result, that.result);
    }

    @Override
    public int hashCode() {
      return Objects.hash(getAttemptNumber(), getStartedAtNanos(), result);
    }
  }

  static final class Failure<T> extends Attempt<T> {
    private final Exception exception;

    private Failure(int attemptNumber, long startedAtNanos, Exception exception) {
      super(attemptNumber, startedAtNanos);
      this.exception = checkNotNull(exception, "exception");
    }

    @Override
    public boolean hasException() {
      return true;
    }

    @Override
    public Exception getException() {
      return exception;
    }

    @Override
    public T get() throws Exception {
      throw exception;
    }

    @Override
    public String toString() {
      return "Attempts: " + getAttemptNumber() + ", Error: " + exception;
    }

    @Override
    public boolean equals(Object o) {
      if (this == o) return true;
      if (o == null || getClass() != o.getClass()) return false;
      final Failure<?> that = (Failure<?>) o;
      return getAttemptNumber() == that.getAttemptNumber()
          && getStartedAtNanos() == that.getStartedAtNanos()
          && exception.equals(that.exception);
    }

    @Override
    public int hashCode() {
      return Objects.hash(getAttemptNumber(), getStartedAtNanos(), exception);
    }
  }
}
