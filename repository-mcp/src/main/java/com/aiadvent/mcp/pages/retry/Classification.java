package com.aiadvent.mcp.pages.retry;

import java.time.Duration;
import java.time.Instant;
import org.springframework.lang.Nullable;

/**
 * Result of classifying one failure.
 *
 * @param resetAt moment the primary rate limit resets, if the server reported it
 * @param retryAfter server-mandated wait for secondary limits, if reported
 */
public record Classification(
    FailureClass failureClass,
    @Nullable Integer status,
    @Nullable Instant resetAt,
    @Nullable Duration retryAfter) {

  public static Classification of(FailureClass failureClass) {
    return new Classification(failureClass, null, null, null);
  }

  public static Classification of(FailureClass failureClass, @Nullable Integer status) {
    return new Classification(failureClass, status, null, null);
  }
}
