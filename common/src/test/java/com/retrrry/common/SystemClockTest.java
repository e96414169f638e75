package com.retrrry.common;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import org.junit.jupiter.api.Test;

class SystemClockTest {

  @Test
  void testReadingsNeverGoBackwards() {
    final Clock clock = Clock.system();
    final long first = clock.nanoTime();
    final long second = clock.nanoTime();
    assertThat(second).isGreaterThanOrEqualTo(first);
  }

  @Test
  void testElapsedSinceIsNonNegative() {
    final Clock clock = Clock.system();
    final long start = clock.nanoTime();
    assertThat(clock.elapsedSince(start)).isGreaterThanOrEqualTo(Duration.ZERO);
  }
}
