package com.retrrry;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import org.junit.jupiter.api.Test;

class StopStrategiesTest {

  @Test
  void testNeverStop() {
    final StopStrategy stop = StopStrategies.neverStop();
    assertThat(stop.shouldStop(3, Duration.ofMillis(6546))).isFalse();
    assertThat(stop.shouldStop(Integer.MAX_VALUE, Duration.ofDays(365))).isFalse();
  }

  @Test
  void testStopAfterAttempt() {
    final StopStrategy stop = StopStrategies.stopAfterAttempt(3);
    assertThat(stop.shouldStop(2, Duration.ofMillis(6546))).isFalse();
    assertThat(stop.shouldStop(3, Duration.ofMillis(6546))).isTrue();
    assertThat(stop.shouldStop(4, Duration.ofMillis(6546))).isTrue();
  }

  @Test
  void testStopAfterAttemptBoundaryHoldsForAnyLimit() {
    for (int n = 1; n <= 50; n++) {
      final StopStrategy stop = StopStrategies.stopAfterAttempt(n);
      assertThat(stop.shouldStop(n, Duration.ZERO)).as("n=%s", n).isTrue();
      assertThat(stop.shouldStop(n - 1, Duration.ZERO)).as("n-1 for n=%s", n).isFalse();
    }
  }

  @Test
  void testSingleAttemptStopsImmediately() {
    assertThat(StopStrategies.stopAfterAttempt(1).shouldStop(1, Duration.ZERO)).isTrue();
  }

  @Test
  void testStopAfterAttemptRejectsNonPositiveLimit() {
    assertThatThrownBy(() -> StopStrategies.stopAfterAttempt(0))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> StopStrategies.stopAfterAttempt(-3))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void testStopAfterDelay() {
    final StopStrategy stop = StopStrategies.stopAfterDelay(Duration.ofMillis(1000));
    assertThat(stop.shouldStop(2, Duration.ofMillis(999))).isFalse();
    assertThat(stop.shouldStop(2, Duration.ofMillis(1000))).isTrue();
    assertThat(stop.shouldStop(2, Duration.ofMillis(1001))).isTrue();
  }

  @Test
  void testStopAfterDelayRejectsNegativeDelay() {
    assertThatThrownBy(() -> StopStrategies.stopAfterDelay(Duration.ofMillis(-1)))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void testAnyOfStopsWhenEitherFires() {
    final StopStrategy stop =
        StopStrategies.anyOf(
            StopStrategies.stopAfterAttempt(5),
            StopStrategies.stopAfterDelay(Duration.ofSeconds(1)));
    assertThat(stop.shouldStop(1, Duration.ofMillis(10))).isFalse();
    assertThat(stop.shouldStop(5, Duration.ofMillis(10))).isTrue();
    assertThat(stop.shouldStop(1, Duration.ofSeconds(2))).isTrue();
  }

  @Test
  void testAnyOfNothingNeverStops() {
    assertThat(StopStrategies.anyOf().shouldStop(100, Duration.ofDays(1))).isFalse();
  }

  @Test
  void testCustomStopStrategy() {
    final StopStrategy stop = (attempt, delay) -> attempt == delay.toMillis();
    assertThat(stop.shouldStop(1, Duration.ofMillis(3))).isFalse();
    assertThat(stop.shouldStop(100, Duration.ofMillis(99))).isFalse();
    assertThat(stop.shouldStop(101, Duration.ofMillis(101))).isTrue();
  }
}
