package com.aiadvent.mcp.pages.throttle;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Last known server-side request budget. Updated after every response and consumed on every
 * admission by {@link RequestThrottle}.
 */
public class RateLimitState {

  private static final Logger log = LoggerFactory.getLogger(RateLimitState.class);

  private final Clock clock;

  private int limit = -1;
  private int remaining = -1;
  private Instant resetAt;

  public RateLimitState(Clock clock) {
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  public synchronized void update(RateLimitSnapshot snapshot) {
    if (snapshot == null || !snapshot.isKnown()) {
      return;
    }
    if (resetAt != null
        && snapshot.resetAt() != null
        && snapshot.resetAt().isBefore(resetAt)
        && remaining >= 0
        && snapshot.remaining() > remaining) {
      // late response from the previous window
      log.debug("Ignoring stale rate limit snapshot remaining={} resetAt={}", snapshot.remaining(), snapshot.resetAt());
      return;
    }
    this.limit = snapshot.limit();
    this.remaining = Math.max(0, snapshot.remaining());
    this.resetAt = snapshot.resetAt();
  }

  /** Marks the server window as exhausted until {@code reset}. */
  public synchronized void markExhausted(Instant reset) {
    this.remaining = 0;
    if (reset != null) {
      this.resetAt = reset;
    }
  }

  public synchronized RateLimitSnapshot snapshot() {
    replenishIfReset(clock.instant());
    return new RateLimitSnapshot(limit, remaining, resetAt);
  }

  /**
   * Time left until the server budget allows another request, zero when it does already.
   * Requests beyond {@code reserve} remaining calls are held back as well.
   */
  synchronized Duration requiredWait(Instant now, int reserve) {
    replenishIfReset(now);
    if (remaining < 0 || remaining > reserve || resetAt == null) {
      return Duration.ZERO;
    }
    Duration wait = Duration.between(now, resetAt);
    return wait.isNegative() ? Duration.ZERO : wait;
  }

  /** Accounts for one admitted request ahead of the server response. */
  synchronized void consume() {
    if (remaining > 0) {
      remaining--;
    }
  }

  private void replenishIfReset(Instant now) {
    if (resetAt != null && !now.isBefore(resetAt) && remaining >= 0) {
      remaining = limit >= 0 ? limit : -1;
      resetAt = null;
    }
  }
}
