package com.aiadvent.mcp.pages.retry;

import java.time.Duration;
import java.util.Objects;

/**
 * Immutable description of how a failing call is retried.
 *
 * @param maxAttempts counted attempts before giving up, including the first one
 * @param patience longest server-mandated wait that is waited out; longer ones are surfaced
 * @param maxUncountedWaits how many rate limit waits one call may go through
 */
public record RetryPolicy(
    int maxAttempts,
    FailureClassifier classifier,
    Backoff backoff,
    Duration patience,
    int maxUncountedWaits) {

  public static final int DEFAULT_MAX_ATTEMPTS = 3;
  public static final Duration DEFAULT_PATIENCE = Duration.ofMinutes(15);
  public static final int DEFAULT_MAX_UNCOUNTED_WAITS = 10;

  public RetryPolicy {
    if (maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be at least 1");
    }
    Objects.requireNonNull(classifier, "classifier");
    Objects.requireNonNull(backoff, "backoff");
    patience = patience == null || patience.isNegative() ? DEFAULT_PATIENCE : patience;
    if (maxUncountedWaits < 0) {
      throw new IllegalArgumentException("maxUncountedWaits must not be negative");
    }
  }

  public static RetryPolicy defaults(FailureClassifier classifier) {
    return new RetryPolicy(
        DEFAULT_MAX_ATTEMPTS,
        classifier,
        new ExponentialBackoff(),
        DEFAULT_PATIENCE,
        DEFAULT_MAX_UNCOUNTED_WAITS);
  }

  public RetryPolicy withMaxAttempts(int attempts) {
    return new RetryPolicy(attempts, classifier, backoff, patience, maxUncountedWaits);
  }

  public RetryPolicy withBackoff(Backoff newBackoff) {
    return new RetryPolicy(maxAttempts, classifier, newBackoff, patience, maxUncountedWaits);
  }

  public RetryPolicy withPatience(Duration newPatience) {
    return new RetryPolicy(maxAttempts, classifier, backoff, newPatience, maxUncountedWaits);
  }
}
