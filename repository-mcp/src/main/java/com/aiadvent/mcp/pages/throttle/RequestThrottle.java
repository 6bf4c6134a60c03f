package com.aiadvent.mcp.pages.throttle;

import com.aiadvent.mcp.pages.retry.FailureClass;
import com.aiadvent.mcp.pages.retry.RepositoryOperationException;
import com.aiadvent.mcp.pages.support.CancellationToken;
import com.aiadvent.mcp.pages.support.Sleeper;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.Nullable;

/**
 * Admits outgoing requests so that neither the local ceilings nor the server-reported budget are
 * exceeded. Callers are delayed; they are only rejected when the server budget resets later than
 * they are prepared to wait.
 *
 * <p>Checking and recording happen under one lock; waiting happens outside of it, after which the
 * check is repeated because another caller may have taken the freed slot.
 */
public class RequestThrottle {

  private static final Logger log = LoggerFactory.getLogger(RequestThrottle.class);

  static final Duration MINUTE_WINDOW = Duration.ofSeconds(60);
  static final Duration HOUR_WINDOW = Duration.ofSeconds(3600);
  static final Duration RESET_BUFFER = Duration.ofSeconds(1);

  private final Object lock = new Object();
  private final Deque<Instant> ledger = new ArrayDeque<>();
  private final RateLimitState rateLimitState;
  private final Clock clock;
  private final Sleeper sleeper;
  private final Counter admittedCounter;
  private final Counter waitCounter;
  private final Counter rejectedCounter;
  private final Timer waitTimer;

  private volatile ThrottleSettings settings;
  private Instant lastAdmittedAt;

  public RequestThrottle(
      ThrottleSettings settings,
      RateLimitState rateLimitState,
      Clock clock,
      Sleeper sleeper,
      @Nullable MeterRegistry meterRegistry) {
    this.settings = Objects.requireNonNull(settings, "settings");
    this.rateLimitState = Objects.requireNonNull(rateLimitState, "rateLimitState");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    MeterRegistry registry = meterRegistry;
    if (registry == null) {
      registry = new SimpleMeterRegistry();
    }
    this.admittedCounter = registry.counter("repository_throttle_admitted_total");
    this.waitCounter = registry.counter("repository_throttle_wait_total");
    this.rejectedCounter = registry.counter("repository_throttle_rejected_total");
    this.waitTimer = registry.timer("repository_throttle_wait_duration");
  }

  /**
   * Blocks until one more request may be sent and records it in the ledger, waiting out a server
   * reset however far away it is.
   */
  public void admit(CancellationToken cancellation) {
    admit(cancellation, null);
  }

  /**
   * Blocks until one more request may be sent and records it in the ledger.
   *
   * @param maxServerWait longest wait for an exhausted server budget to reset; {@code null} means
   *     unbounded
   * @throws RepositoryOperationException classified {@link FailureClass#RATE_LIMITED} when the
   *     server budget resets later than {@code maxServerWait}
   * @throws com.aiadvent.mcp.pages.support.OperationCancelledException when {@code cancellation}
   *     fires while waiting
   */
  public void admit(CancellationToken cancellation, @Nullable Duration maxServerWait) {
    CancellationToken token = cancellation != null ? cancellation : CancellationToken.none();
    while (true) {
      token.throwIfCancelled("throttle.admit");
      Duration wait;
      synchronized (lock) {
        Instant now = clock.instant();
        Duration serverWait = serverWait(now);
        if (maxServerWait != null && serverWait.compareTo(maxServerWait) > 0) {
          rejectedCounter.increment();
          log.warn(
              "repository.throttle rejected serverWait={}s maxServerWait={}s",
              serverWait.toSeconds(),
              maxServerWait.toSeconds());
          throw RepositoryOperationException.of(
              "throttle.admit",
              FailureClass.RATE_LIMITED,
              "Server rate limit resets in "
                  + serverWait.toSeconds()
                  + "s, longer than the allowed wait of "
                  + maxServerWait.toSeconds()
                  + "s");
        }
        wait = longest(localWait(now), serverWait);
        if (wait.isZero()) {
          record(now);
          return;
        }
      }
      waitCounter.increment();
      log.debug("repository.throttle wait={}ms", wait.toMillis());
      Instant startedAt = clock.instant();
      sleeper.sleep(wait, token);
      waitTimer.record(Duration.between(startedAt, clock.instant()));
    }
  }

  public void reconfigure(ThrottleSettings newSettings) {
    ThrottleSettings next = Objects.requireNonNull(newSettings, "newSettings");
    synchronized (lock) {
      this.settings = next;
    }
    log.info(
        "repository.throttle reconfigured minInterval={}ms perMinute={} perHour={}",
        next.minInterval().toMillis(),
        next.maxPerMinute(),
        next.maxPerHour());
  }

  public ThrottleSnapshot snapshot() {
    synchronized (lock) {
      Instant now = clock.instant();
      prune(now);
      return new ThrottleSnapshot(
          settings, countSince(now.minus(MINUTE_WINDOW)), ledger.size(), rateLimitState.snapshot());
    }
  }

  public ThrottleSettings settings() {
    return settings;
  }

  private Duration localWait(Instant now) {
    prune(now);
    ThrottleSettings current = settings;
    Duration wait = Duration.ZERO;

    if (lastAdmittedAt != null) {
      wait = longest(wait, Duration.between(now, lastAdmittedAt.plus(current.minInterval())));
    }

    List<Instant> lastMinute = entriesSince(now.minus(MINUTE_WINDOW));
    if (lastMinute.size() >= current.maxPerMinute()) {
      Instant blocking = lastMinute.get(lastMinute.size() - current.maxPerMinute());
      wait =
          longest(
              wait,
              Duration.between(now, blocking.plus(MINUTE_WINDOW)).plus(current.safetyMargin()));
    }

    if (ledger.size() >= current.maxPerHour()) {
      Instant blocking = entryAt(ledger.size() - current.maxPerHour());
      wait =
          longest(
              wait, Duration.between(now, blocking.plus(HOUR_WINDOW)).plus(current.safetyMargin()));
    }
    return wait;
  }

  private Duration serverWait(Instant now) {
    Duration serverWait = rateLimitState.requiredWait(now, settings.serverReserve());
    return serverWait.isZero() ? Duration.ZERO : serverWait.plus(RESET_BUFFER);
  }

  private void record(Instant now) {
    ledger.addLast(now);
    lastAdmittedAt = now;
    rateLimitState.consume();
    admittedCounter.increment();
  }

  /** Admission instants still inside the hourly window, oldest first. */
  List<Instant> recentAdmissions() {
    synchronized (lock) {
      return List.copyOf(ledger);
    }
  }

  private void prune(Instant now) {
    Instant cutoff = now.minus(HOUR_WINDOW);
    while (!ledger.isEmpty() && !ledger.peekFirst().isAfter(cutoff)) {
      ledger.pollFirst();
    }
  }

  private List<Instant> entriesSince(Instant cutoff) {
    List<Instant> result = new ArrayList<>();
    for (Instant entry : ledger) {
      if (entry.isAfter(cutoff)) {
        result.add(entry);
      }
    }
    return result;
  }

  private int countSince(Instant cutoff) {
    return entriesSince(cutoff).size();
  }

  private Instant entryAt(int index) {
    int position = 0;
    for (Instant entry : ledger) {
      if (position++ == index) {
        return entry;
      }
    }
    throw new IllegalStateException("Ledger index out of range: " + index);
  }

  private static Duration longest(Duration current, Duration candidate) {
    if (candidate.isNegative()) {
      return current;
    }
    return candidate.compareTo(current) > 0 ? candidate : current;
  }

  public record ThrottleSnapshot(
      ThrottleSettings settings,
      int requestsLastMinute,
      int requestsLastHour,
      RateLimitSnapshot serverBudget) {}
}
