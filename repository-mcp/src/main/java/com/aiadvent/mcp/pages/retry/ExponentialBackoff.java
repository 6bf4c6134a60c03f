package com.aiadvent.mcp.pages.retry;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * {@code base * multiplier^(attempt - 1) + jitter}, capped. Server errors use the smallest
 * multiplier since they usually clear quickly; rate limits the largest.
 */
public class ExponentialBackoff implements Backoff {

  public static final Duration DEFAULT_BASE = Duration.ofSeconds(1);
  public static final Duration DEFAULT_MAX_JITTER = Duration.ofSeconds(1);
  public static final Duration DEFAULT_CAP = Duration.ofSeconds(30);

  private static final Map<FailureClass, Double> DEFAULT_MULTIPLIERS = defaultMultipliers();

  private final Duration base;
  private final Duration maxJitter;
  private final Duration cap;
  private final Map<FailureClass, Double> multipliers;
  private final DoubleSupplier jitterSource;

  public ExponentialBackoff() {
    this(DEFAULT_BASE, DEFAULT_MAX_JITTER, DEFAULT_CAP, () -> ThreadLocalRandom.current().nextDouble());
  }

  public ExponentialBackoff(
      Duration base, Duration maxJitter, Duration cap, DoubleSupplier jitterSource) {
    this(base, maxJitter, cap, DEFAULT_MULTIPLIERS, jitterSource);
  }

  public ExponentialBackoff(
      Duration base,
      Duration maxJitter,
      Duration cap,
      Map<FailureClass, Double> multipliers,
      DoubleSupplier jitterSource) {
    this.base = Objects.requireNonNull(base, "base");
    this.maxJitter = Objects.requireNonNull(maxJitter, "maxJitter");
    this.cap = Objects.requireNonNull(cap, "cap");
    this.multipliers = Map.copyOf(Objects.requireNonNull(multipliers, "multipliers"));
    this.jitterSource = Objects.requireNonNull(jitterSource, "jitterSource");
  }

  @Override
  public Duration delay(FailureClass failureClass, int attempt) {
    double multiplier = multipliers.getOrDefault(failureClass, 2.0);
    double exponential = base.toMillis() * Math.pow(multiplier, Math.max(0, attempt - 1));
    double jitter = maxJitter.toMillis() * Math.max(0.0, Math.min(jitterSource.getAsDouble(), 0.999));
    long millis = (long) Math.min((double) cap.toMillis(), exponential + jitter);
    return Duration.ofMillis(millis);
  }

  public double multiplierFor(FailureClass failureClass) {
    return multipliers.getOrDefault(failureClass, 2.0);
  }

  private static Map<FailureClass, Double> defaultMultipliers() {
    Map<FailureClass, Double> map = new EnumMap<>(FailureClass.class);
    map.put(FailureClass.SERVER, 1.5);
    map.put(FailureClass.NETWORK, 2.0);
    map.put(FailureClass.RATE_LIMITED, 3.0);
    map.put(FailureClass.SECONDARY_RATE_LIMITED, 3.0);
    return map;
  }
}
