package com.retrrry;

import com.retrrry.common.Clock;
import java.time.Duration;

public class FakeClock implements Clock {
  private long currentNanos;

  public void advance(Duration duration) {
    currentNanos += duration.toNanos();
  }

  @Override
  public long nanoTime() {
    return currentNanos;
  }
}
