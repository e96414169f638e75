package com.retrrry;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableMap;
import java.lang.reflect.InvocationHandler;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Proxy;
import java.time.Duration;
import java.util.concurrent.Callable;
import javax.annotation.Nonnull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decorators that put an operation behind a retry loop while keeping its signature.
 *
 * <pre>{@code
 * final Callable<String> fetch =
 *     Retrying.retry(
 *         RetryOptions.<String>builder().stopMaxAttemptNumber(3).build(), client::fetch);
 *
 * final Client retrying = Retrying.proxy(Client.class, client);
 * }</pre>
 */
public final class Retrying {
  private static final Logger logger = LoggerFactory.getLogger(Retrying.class);

  private Retrying() {}

  /** Decorates a single callable with the given options. */
  public static <T> Callable<T> retry(
      @Nonnull RetryOptions<T> options, @Nonnull Callable<T> operation) {
    return Retryer.fromOptions(options).wrap(operation);
  }

  /** Proxies {@code target} so that every interface method runs through {@code retryer}. */
  public static <I> I proxy(
      @Nonnull Class<I> iface, @Nonnull I target, @Nonnull Retryer<Object> retryer) {
    checkNotNull(retryer, "retryer");
    return newProxy(iface, target, method -> retryer);
  }

  /** Proxies {@code target} so that every interface method is retried with {@code options}. */
  public static <I> I proxy(
      @Nonnull Class<I> iface, @Nonnull I target, @Nonnull RetryOptions<Object> options) {
    return proxy(iface, target, Retryer.fromOptions(options));
  }

  /**
   * Proxies {@code target} so that interface methods annotated with {@link Retry} are retried as
   * the annotation describes. Other methods are forwarded as-is.
   */
  public static <I> I proxy(@Nonnull Class<I> iface, @Nonnull I target) {
    checkNotNull(iface, "iface");
    final ImmutableMap.Builder<Method, Retryer<Object>> retryers = ImmutableMap.builder();
    for (Method method : iface.getMethods()) {
      final Retry retry = method.getAnnotation(Retry.class);
      if (retry != null) {
        retryers.put(method, Retryer.fromOptions(toOptions(retry)));
      }
    }
    final ImmutableMap<Method, Retryer<Object>> byMethod = retryers.build();
    logger.debug(
        "Retrying {} of {} methods on {}", byMethod.size(), iface.getMethods().length, iface);
    return newProxy(iface, target, byMethod::get);
  }

  static RetryOptions<Object> toOptions(Retry retry) {
    final RetryOptions.Builder<Object> builder = RetryOptions.builder();
    if (retry.stopMaxAttemptNumber() != -1) {
      builder.stopMaxAttemptNumber(retry.stopMaxAttemptNumber());
    }
    if (retry.stopMaxDelayMs() != -1) {
      builder.stopMaxDelay(Duration.ofMillis(retry.stopMaxDelayMs()));
    }
    if (retry.waitFixedMs() != -1) {
      builder.waitFixed(Duration.ofMillis(retry.waitFixedMs()));
    }
    if (retry.waitRandomMinMs() != -1) {
      builder.waitRandomMin(Duration.ofMillis(retry.waitRandomMinMs()));
    }
    if (retry.waitRandomMaxMs() != -1) {
      builder.waitRandomMax(Duration.ofMillis(retry.waitRandomMaxMs()));
    }
    if (retry.waitIncrementingStartMs() != Long.MIN_VALUE) {
      builder.waitIncrementingStart(Duration.ofMillis(retry.waitIncrementingStartMs()));
    }
    if (retry.waitIncrementingIncrementMs() != Long.MIN_VALUE) {
      builder.waitIncrementingIncrement(Duration.ofMillis(retry.waitIncrementingIncrementMs()));
    }
    if (retry.waitIncrementingMaxMs() != -1) {
      builder.waitIncrementingMax(Duration.ofMillis(retry.waitIncrementingMaxMs()));
    }
    if (retry.waitExponentialMultiplierMs() != -1) {
      builder.waitExponentialMultiplier(Duration.ofMillis(retry.waitExponentialMultiplierMs()));
    }
    if (retry.waitExponentialMaxMs() != -1) {
      builder.waitExponentialMax(Duration.ofMillis(retry.waitExponentialMaxMs()));
    }
    if (retry.waitJitterMaxMs() != -1) {
      builder.waitJitterMax(Duration.ofMillis(retry.waitJitterMaxMs()));
    }
    if (retry.retryOn().length > 0) {
      builder.retryOnExceptionOfType(retry.retryOn());
    }
    return builder.wrapException(retry.wrapException()).build();
  }

  private static <I> I newProxy(Class<I> iface, I target, RetryerLookup lookup) {
    checkNotNull(iface, "iface");
    checkNotNull(target, "target");
    checkArgument(iface.isInterface(), "%s is not an interface", iface.getName());
    final InvocationHandler handler = new RetryingInvocationHandler(target, lookup);
    return iface.cast(
        Proxy.newProxyInstance(iface.getClassLoader(), new Class<?>[] {iface}, handler));
  }

  @FunctionalInterface
  private interface RetryerLookup {
    Retryer<Object> forMethod(Method method);
  }

  private static final class RetryingInvocationHandler implements InvocationHandler {
    private final Object target;
    private final RetryerLookup lookup;

    private RetryingInvocationHandler(Object target, RetryerLookup lookup) {
      this.target = target;
      this.lookup = lookup;
    }

    @Override
    public Object invoke(Object proxy, Method method, Object[] args) throws Throwable {
      if (method.getDeclaringClass() == Object.class) {
        return invokeTarget(method, args);
      }
      final Retryer<Object> retryer = lookup.forMethod(method);
      if (retryer == null) {
        return invokeTarget(method, args);
      }
      try {
        return retryer.call(() -> invokeTarget(method, args));
      } catch (InterruptedException e) {
        // the backoff sleep cleared the flag
        Thread.currentThread().interrupt();
        throw e;
      }
    }

    private Object invokeTarget(Method method, Object[] args) throws Exception {
      try {
        return method.invoke(target, args);
      } catch (InvocationTargetException e) {
        final Throwable cause = e.getCause();
        if (cause instanceof Exception) {
          throw (Exception) cause;
        }
        if (cause instanceof Error) {
          throw (Error) cause;
        }
        throw e;
      }
    }
  }
}
