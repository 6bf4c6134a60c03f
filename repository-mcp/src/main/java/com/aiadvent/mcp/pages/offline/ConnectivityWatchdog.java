package com.aiadvent.mcp.pages.offline;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.beans.factory.InitializingBean;

/** Probes the remote in the background while the client is offline. */
public class ConnectivityWatchdog implements InitializingBean, DisposableBean {

  private static final Logger log = LoggerFactory.getLogger(ConnectivityWatchdog.class);

  private final OfflineController offlineController;
  private final ConnectivityProbe probe;
  private final Duration checkInterval;
  private final ScheduledExecutorService probeExecutor;

  public ConnectivityWatchdog(
      OfflineController offlineController, ConnectivityProbe probe, Duration checkInterval) {
    this.offlineController = Objects.requireNonNull(offlineController, "offlineController");
    this.probe = Objects.requireNonNull(probe, "probe");
    this.checkInterval =
        checkInterval == null || checkInterval.isNegative() || checkInterval.isZero()
            ? OfflineSettings.DEFAULT_PROBE_INTERVAL
            : checkInterval;
    this.probeExecutor =
        Executors.newSingleThreadScheduledExecutor(
            r -> {
              Thread thread = new Thread(r, "repository-connectivity-probe");
              thread.setDaemon(true);
              return thread;
            });
  }

  @Override
  public void afterPropertiesSet() {
    probeExecutor.scheduleWithFixedDelay(
        () -> {
          try {
            runOnce();
          } catch (Exception ex) {
            log.warn("Scheduled connectivity probe failed: {}", ex.getMessage(), ex);
          }
        },
        checkInterval.toMillis(),
        checkInterval.toMillis(),
        TimeUnit.MILLISECONDS);
  }

  @Override
  public void destroy() {
    probeExecutor.shutdownNow();
  }

  /** Probes once if offline and a probe is due; returns the resulting mode. */
  public ConnectivityMode runOnce() {
    if (!offlineController.isOffline()) {
      return ConnectivityMode.ONLINE;
    }
    return offlineController.probeIfDue(probe);
  }
}
