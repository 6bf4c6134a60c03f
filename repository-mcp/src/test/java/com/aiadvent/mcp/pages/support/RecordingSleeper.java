package com.aiadvent.mcp.pages.support;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/** Sleeper that advances a {@link MutableClock} instead of blocking and remembers every wait. */
public class RecordingSleeper implements Sleeper {

  private final MutableClock clock;
  private final List<Duration> sleeps = new ArrayList<>();
  private Runnable onSleep = () -> {};

  public RecordingSleeper(MutableClock clock) {
    this.clock = clock;
  }

  /** Runs {@code action} after each simulated wait, e.g. to cancel a token mid-operation. */
  public RecordingSleeper onSleep(Runnable action) {
    this.onSleep = action;
    return this;
  }

  @Override
  public synchronized void sleep(Duration duration, CancellationToken cancellation) {
    cancellation.throwIfCancelled("wait");
    sleeps.add(duration);
    clock.advance(duration);
    onSleep.run();
    cancellation.throwIfCancelled("wait");
  }

  public synchronized List<Duration> sleeps() {
    return List.copyOf(sleeps);
  }

  public synchronized Duration total() {
    return sleeps.stream().reduce(Duration.ZERO, Duration::plus);
  }
}
