package com.aiadvent.mcp.pages.support;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Caller-owned cancellation signal shared by every wait inside one logical operation.
 *
 * <p>Cancelling wakes up any {@link Sleeper} currently waiting on the token, so long backoffs and
 * deployment polls end promptly instead of running out their full delay.
 */
public final class CancellationToken {

  private static final CancellationToken NONE = new CancellationToken();

  private final CountDownLatch latch = new CountDownLatch(1);

  public static CancellationToken create() {
    return new CancellationToken();
  }

  /** Token that is never cancelled by anyone. */
  public static CancellationToken none() {
    return NONE;
  }

  public void cancel() {
    if (this == NONE) {
      return;
    }
    latch.countDown();
  }

  public boolean isCancelled() {
    return latch.getCount() == 0;
  }

  public void throwIfCancelled(String operation) {
    if (isCancelled()) {
      throw new OperationCancelledException(operation);
    }
  }

  /**
   * Blocks for up to {@code timeout}; returns {@code true} when the token was cancelled before the
   * timeout elapsed.
   */
  boolean await(Duration timeout) throws InterruptedException {
    if (timeout.isZero() || timeout.isNegative()) {
      return isCancelled();
    }
    return latch.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
  }
}
