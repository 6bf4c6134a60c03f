package com.aiadvent.mcp.pages.throttle;

import java.time.Duration;

/**
 * Local request ceilings. The hourly default stays below the 5000 requests per hour GitHub grants
 * an authenticated token so other tools sharing the token keep some headroom.
 */
public record ThrottleSettings(
    Duration minInterval, int maxPerMinute, int maxPerHour, Duration safetyMargin, int serverReserve) {

  public static final Duration DEFAULT_MIN_INTERVAL = Duration.ofMillis(100);
  public static final int DEFAULT_MAX_PER_MINUTE = 60;
  public static final int DEFAULT_MAX_PER_HOUR = 1000;
  public static final Duration DEFAULT_SAFETY_MARGIN = Duration.ofMillis(100);

  public ThrottleSettings {
    minInterval = minInterval == null || minInterval.isNegative() ? DEFAULT_MIN_INTERVAL : minInterval;
    safetyMargin = safetyMargin == null || safetyMargin.isNegative() ? DEFAULT_SAFETY_MARGIN : safetyMargin;
    if (maxPerMinute <= 0) {
      throw new IllegalArgumentException("maxPerMinute must be positive");
    }
    if (maxPerHour <= 0) {
      throw new IllegalArgumentException("maxPerHour must be positive");
    }
    if (serverReserve < 0) {
      throw new IllegalArgumentException("serverReserve must not be negative");
    }
  }

  public static ThrottleSettings defaults() {
    return new ThrottleSettings(
        DEFAULT_MIN_INTERVAL, DEFAULT_MAX_PER_MINUTE, DEFAULT_MAX_PER_HOUR, DEFAULT_SAFETY_MARGIN, 0);
  }
}
