package com.aiadvent.mcp.pages.retry;

import java.time.Duration;

/** Delay before the next counted attempt of a transient failure. */
@FunctionalInterface
public interface Backoff {

  /**
   * @param attempt one-based number of the attempt that just failed
   */
  Duration delay(FailureClass failureClass, int attempt);
}
