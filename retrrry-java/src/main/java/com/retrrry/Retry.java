package com.retrrry;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks an interface method to be retried when called through {@link Retrying#proxy(Class,
 * Object)}.
 *
 * <p>Numeric options left at {@code -1} are not set, except the incrementing start and increment,
 * which may be negative and use {@link Long#MIN_VALUE} instead. With every option left at its
 * default the method is retried on any exception, forever, without waiting.
 *
 * <p>The proxy cannot change a method's {@code throws} clause. A checked exception the method does
 * not declare, such as the {@link RetryException} thrown when {@link #wrapException()} is set or the
 * {@link InterruptedException} of an interrupted backoff, reaches the caller wrapped in an {@link
 * java.lang.reflect.UndeclaredThrowableException}. On interruption the thread's interrupt flag is
 * set again before the exception leaves the proxy.
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.METHOD)
public @interface Retry {

  int stopMaxAttemptNumber() default -1;

  long stopMaxDelayMs() default -1;

  long waitFixedMs() default -1;

  long waitRandomMinMs() default -1;

  long waitRandomMaxMs() default -1;

  long waitIncrementingStartMs() default Long.MIN_VALUE;

  long waitIncrementingIncrementMs() default Long.MIN_VALUE;

  long waitIncrementingMaxMs() default -1;

  long waitExponentialMultiplierMs() default -1;

  long waitExponentialMaxMs() default -1;

  long waitJitterMaxMs() default -1;

  /** Exception types that are retried. Empty means any exception. */
  Class<? extends Exception>[] retryOn() default {};

  /**
   * Throw a {@link RetryException} once retries are exhausted. Declare it on the method, or it
   * arrives as an {@link java.lang.reflect.UndeclaredThrowableException}.
   */
  boolean wrapException() default false;
}
