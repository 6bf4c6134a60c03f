package com.aiadvent.mcp.pages.support;

import java.time.Duration;

/**
 * Cooperative, cancellable waiting used for throttle waits, retry backoff and deployment polling.
 *
 * <p>Implementations check the token before waiting and raise {@link OperationCancelledException}
 * when it is (or becomes) cancelled.
 */
@FunctionalInterface
public interface Sleeper {

  void sleep(Duration duration, CancellationToken cancellation);

  /** Blocks the calling thread; cancellation wakes it up immediately. */
  static Sleeper threadSleeper() {
    return (duration, cancellation) -> {
      cancellation.throwIfCancelled("wait");
      if (duration == null || duration.isZero() || duration.isNegative()) {
        return;
      }
      try {
        if (cancellation.await(duration)) {
          throw new OperationCancelledException("wait");
        }
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
        throw new OperationCancelledException("wait");
      }
    };
  }
}
