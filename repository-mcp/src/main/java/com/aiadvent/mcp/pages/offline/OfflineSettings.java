package com.aiadvent.mcp.pages.offline;

import java.time.Duration;

/**
 * @param failureThreshold consecutive qualifying failures before reads switch to cached data
 * @param probeInterval minimum time between two reachability probes
 */
public record OfflineSettings(int failureThreshold, Duration probeInterval) {

  public static final Duration DEFAULT_PROBE_INTERVAL = Duration.ofSeconds(60);

  public OfflineSettings {
    if (failureThreshold < 1) {
      throw new IllegalArgumentException("failureThreshold must be at least 1");
    }
    probeInterval =
        probeInterval == null || probeInterval.isNegative() ? DEFAULT_PROBE_INTERVAL : probeInterval;
  }

  public static OfflineSettings defaults() {
    return new OfflineSettings(1, DEFAULT_PROBE_INTERVAL);
  }
}
