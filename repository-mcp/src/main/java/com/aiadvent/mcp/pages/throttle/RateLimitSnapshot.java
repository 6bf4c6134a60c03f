package com.aiadvent.mcp.pages.throttle;

import java.time.Instant;

/**
 * Server-reported request budget as read from the last response.
 *
 * @param limit total requests allowed in the current server window, {@code -1} if unknown
 * @param remaining requests left in the current server window, {@code -1} if unknown
 * @param resetAt moment the server window resets, {@code null} if unknown
 */
public record RateLimitSnapshot(int limit, int remaining, Instant resetAt) {

  public static RateLimitSnapshot unknown() {
    return new RateLimitSnapshot(-1, -1, null);
  }

  public boolean isKnown() {
    return remaining >= 0;
  }

  public boolean isExhausted() {
    return remaining == 0;
  }
}
