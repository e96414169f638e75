package com.retrrry;

import com.retrrry.common.Sleeper;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/** Records requested sleeps and moves a {@link FakeClock} forward instead of blocking. */
public class RecordingSleeper implements Sleeper {
  private final FakeClock clock;
  public final List<Duration> sleeps = new ArrayList<>();

  public RecordingSleeper(FakeClock clock) {
    this.clock = clock;
  }

  @Override
  public void sleep(Duration duration) {
    sleeps.add(duration);
    clock.advance(duration);
  }
}
