package com.aiadvent.mcp.pages.offline;

import com.aiadvent.mcp.pages.retry.FailureClass;
import com.aiadvent.mcp.pages.support.RepositoryEvent;
import com.aiadvent.mcp.pages.support.RepositoryEventListener;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.Nullable;

/**
 * Tracks whether the remote is reachable. Failures that point at an unreachable or overloaded
 * remote push the controller offline; a successful probe or live call brings it back. Every
 * transition is announced exactly once.
 */
public class OfflineController {

  private static final Logger log = LoggerFactory.getLogger(OfflineController.class);

  private final Clock clock;
  private final RepositoryEventListener eventListener;
  private final Counter offlineCounter;
  private final Counter onlineCounter;
  private final Counter probeCounter;

  private volatile OfflineSettings settings;
  private ConnectivityMode mode = ConnectivityMode.ONLINE;
  private int failureStreak;
  private Instant lastProbeAt;
  private Instant offlineSince;
  private String lastFailure;

  public OfflineController(
      OfflineSettings settings,
      Clock clock,
      RepositoryEventListener eventListener,
      @Nullable MeterRegistry meterRegistry) {
    this.settings = Objects.requireNonNull(settings, "settings");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.eventListener = Objects.requireNonNull(eventListener, "eventListener");
    MeterRegistry registry = meterRegistry;
    if (registry == null) {
      registry = new SimpleMeterRegistry();
    }
    this.offlineCounter = registry.counter("repository_offline_entered_total");
    this.onlineCounter = registry.counter("repository_offline_exited_total");
    this.probeCounter = registry.counter("repository_offline_probe_total");
  }

  public synchronized ConnectivityMode mode() {
    return mode;
  }

  public boolean isOffline() {
    return mode() == ConnectivityMode.OFFLINE;
  }

  /**
   * Registers a failed live call.
   *
   * @return whether the failure counted towards going offline
   */
  public boolean recordFailure(FailureClass failureClass, String reason) {
    if (failureClass == null || !failureClass.degradesConnectivity()) {
      return false;
    }
    RepositoryEvent event = null;
    synchronized (this) {
      failureStreak++;
      lastFailure = reason;
      if (mode == ConnectivityMode.ONLINE && failureStreak >= settings.failureThreshold()) {
        Instant now = clock.instant();
        mode = ConnectivityMode.OFFLINE;
        offlineSince = now;
        // first probe is due one interval after going offline
        lastProbeAt = now;
        event = transition(ConnectivityMode.OFFLINE, now, failureClass, reason);
      }
    }
    publish(event);
    return true;
  }

  /** Registers a successful live call. */
  public void recordSuccess() {
    RepositoryEvent event = null;
    synchronized (this) {
      failureStreak = 0;
      if (mode == ConnectivityMode.OFFLINE) {
        event = goOnline("live request succeeded");
      }
    }
    publish(event);
  }

  /**
   * Runs {@code probe} if the controller is offline and the probe interval has elapsed since the
   * last probe.
   *
   * @return the mode after the call
   */
  public ConnectivityMode probeIfDue(ConnectivityProbe probe) {
    Objects.requireNonNull(probe, "probe");
    synchronized (this) {
      if (mode == ConnectivityMode.ONLINE) {
        return mode;
      }
      Instant now = clock.instant();
      if (lastProbeAt != null && Duration.between(lastProbeAt, now).compareTo(settings.probeInterval()) < 0) {
        return mode;
      }
      lastProbeAt = now;
    }
    probeCounter.increment();
    try {
      probe.check();
    } catch (RuntimeException ex) {
      log.debug("repository.offline probe failed: {}", ex.getMessage());
      synchronized (this) {
        lastFailure = ex.getMessage();
        return mode;
      }
    }
    RepositoryEvent event = null;
    ConnectivityMode result;
    synchronized (this) {
      failureStreak = 0;
      if (mode == ConnectivityMode.OFFLINE) {
        event = goOnline("reachability probe succeeded");
      }
      result = mode;
    }
    publish(event);
    return result;
  }

  public void reconfigure(OfflineSettings newSettings) {
    this.settings = Objects.requireNonNull(newSettings, "newSettings");
  }

  public OfflineSettings settings() {
    return settings;
  }

  public synchronized Status status() {
    return new Status(mode, failureStreak, offlineSince, lastProbeAt, lastFailure);
  }

  private RepositoryEvent goOnline(String reason) {
    Instant now = clock.instant();
    Duration offlineFor = offlineSince != null ? Duration.between(offlineSince, now) : Duration.ZERO;
    mode = ConnectivityMode.ONLINE;
    offlineSince = null;
    lastFailure = null;
    Map<String, Object> details = new LinkedHashMap<>();
    details.put("reason", reason);
    details.put("offlineSeconds", offlineFor.toSeconds());
    onlineCounter.increment();
    log.info("repository.offline exited reason={} offlineFor={}s", reason, offlineFor.toSeconds());
    return new RepositoryEvent(
        RepositoryEvent.Type.EXITED_OFFLINE, "Connection to the repository restored", now, details);
  }

  private RepositoryEvent transition(
      ConnectivityMode target, Instant now, FailureClass failureClass, String reason) {
    Map<String, Object> details = new LinkedHashMap<>();
    details.put("failureClass", failureClass.name());
    if (reason != null) {
      details.put("reason", reason);
    }
    details.put("failureStreak", failureStreak);
    offlineCounter.increment();
    log.warn(
        "repository.offline entered mode={} class={} streak={} reason={}",
        target,
        failureClass,
        failureStreak,
        reason);
    return new RepositoryEvent(
        RepositoryEvent.Type.ENTERED_OFFLINE,
        "Repository unreachable, serving cached data",
        now,
        details);
  }

  private void publish(@Nullable RepositoryEvent event) {
    if (event != null) {
      eventListener.onEvent(event);
    }
  }

  public record Status(
      ConnectivityMode mode,
      int failureStreak,
      @Nullable Instant offlineSince,
      @Nullable Instant lastProbeAt,
      @Nullable String lastFailure) {}
}
