package com.retrrry;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import java.util.function.Predicate;
import javax.annotation.Nonnull;

/**
 * Decides whether an attempt's outcome warrants another attempt.
 *
 * <p>Failures are judged by the exception predicate and values by the result predicate; each is
 * only ever applied to its own kind of outcome. By default every exception is retried and no
 * returned value is.
 *
 * @param <T> the operation's result type
 */
public final class RetryPredicate<T> {

  private static final Predicate<Object> ALWAYS = o -> true;
  private static final Predicate<Object> NEVER = o -> false;

  private final Predicate<? super Exception> retryOnException;
  private final Predicate<? super T> retryOnResult;

  private RetryPredicate(
      Predicate<? super Exception> retryOnException, Predicate<? super T> retryOnResult) {
    this.retryOnException = retryOnException;
    this.retryOnResult = retryOnResult;
  }

  /** Retries on any exception, never on a returned value. */
  public static <T> RetryPredicate<T> defaults() {
    return new RetryPredicate<>(ALWAYS, NEVER);
  }

  public static <T> RetryPredicate<T> of(
      @Nonnull Predicate<? super Exception> retryOnException,
      @Nonnull Predicate<? super T> retryOnResult) {
    return new RetryPredicate<>(
        checkNotNull(retryOnException, "retryOnException"),
        checkNotNull(retryOnResult, "retryOnResult"));
  }

  /** Matches exceptions that are instances of any of the given types. */
  @SafeVarargs
  public static Predicate<Exception> exceptionOfType(Class<? extends Exception>... types) {
    final ImmutableList<Class<? extends Exception>> copy = ImmutableList.copyOf(types);
    return e -> {
      for (Class<? extends Exception> type : copy) {
        if (type.isInstance(e)) {
          return true;
        }
      }
      return false;
    };
  }

  public RetryPredicate<T> withRetryOnException(
      @Nonnull Predicate<? super Exception> retryOnException) {
    return new RetryPredicate<>(checkNotNull(retryOnException, "retryOnException"), retryOnResult);
  }

  public RetryPredicate<T> withRetryOnResult(@Nonnull Predicate<? super T> retryOnResult) {
    return new RetryPredicate<>(retryOnException, checkNotNull(retryOnResult, "retryOnResult"));
  }

  public boolean shouldRetry(Attempt<T> attempt) {
    if (attempt.hasException()) {
      return retryOnException.test(attempt.getException());
    }
    return retryOnResult.test(attempt.getResult());
  }
}
