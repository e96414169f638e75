package com.retrrry.common;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.google.common.base.Stopwatch;
import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class ThreadSleeperTest {

  @AfterEach
  void clearInterrupt() {
    Thread.interrupted();
  }

  @Test
  void testZeroDurationReturnsImmediately() {
    assertThatCode(() -> Sleeper.threadSleeper().sleep(Duration.ZERO)).doesNotThrowAnyException();
  }

  @Test
  void testSleepsAtLeastTheRequestedDuration() throws InterruptedException {
    final Stopwatch stopwatch = Stopwatch.createStarted();
    Sleeper.threadSleeper().sleep(Duration.ofMillis(20));
    assertThat(stopwatch.elapsed(TimeUnit.MILLISECONDS)).isGreaterThanOrEqualTo(20);
  }

  @Test
  void testInterruptedThreadAbortsSleep() {
    Thread.currentThread().interrupt();
    assertThatThrownBy(() -> Sleeper.threadSleeper().sleep(Duration.ofSeconds(10)))
        .isInstanceOf(InterruptedException.class);
  }

  @Test
  void testUnboundedDurationIsInterruptible() {
    Thread.currentThread().interrupt();
    assertThatThrownBy(() -> Sleeper.threadSleeper().sleep(ChronoUnit.FOREVER.getDuration()))
        .isInstanceOf(InterruptedException.class);
  }

  @Test
  void testPendingInterruptSurfacesOnZeroSleep() {
    Thread.currentThread().interrupt();
    assertThatThrownBy(() -> Sleeper.threadSleeper().sleep(Duration.ZERO))
        .isInstanceOf(InterruptedException.class);
  }
}
