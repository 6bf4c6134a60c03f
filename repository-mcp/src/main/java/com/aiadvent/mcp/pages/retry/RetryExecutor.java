package com.aiadvent.mcp.pages.retry;

import com.aiadvent.mcp.pages.support.CancellationToken;
import com.aiadvent.mcp.pages.support.OperationCancelledException;
import com.aiadvent.mcp.pages.support.Sleeper;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.Nullable;
import org.springframework.util.StringUtils;

/** Runs a call under a {@link RetryPolicy}. */
public class RetryExecutor {

  private static final Logger log = LoggerFactory.getLogger(RetryExecutor.class);

  static final Duration RESET_BUFFER = Duration.ofSeconds(1);

  private final Clock clock;
  private final Sleeper sleeper;
  private final Counter retryCounter;
  private final Counter rateLimitWaitCounter;
  private final Counter exhaustedCounter;

  public RetryExecutor(Clock clock, Sleeper sleeper, @Nullable MeterRegistry meterRegistry) {
    this.clock = Objects.requireNonNull(clock, "clock");
    this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    MeterRegistry registry = meterRegistry;
    if (registry == null) {
      registry = new SimpleMeterRegistry();
    }
    this.retryCounter = registry.counter("repository_retry_attempt_total");
    this.rateLimitWaitCounter = registry.counter("repository_retry_rate_limit_wait_total");
    this.exhaustedCounter = registry.counter("repository_retry_exhausted_total");
  }

  /**
   * Invokes {@code call} until it succeeds, fails terminally or the policy runs out.
   *
   * @throws RepositoryOperationException on terminal or exhausted failure
   * @throws OperationCancelledException when {@code cancellation} fires
   */
  public <T> T execute(
      String operation, RetryPolicy policy, CancellationToken cancellation, Supplier<T> call) {
    Objects.requireNonNull(policy, "policy");
    Objects.requireNonNull(call, "call");
    CancellationToken token = cancellation != null ? cancellation : CancellationToken.none();
    List<OperationAttempt> history = new ArrayList<>();
    int counted = 0;
    int uncounted = 0;

    while (true) {
      token.throwIfCancelled(operation);
      try {
        return call.get();
      } catch (OperationCancelledException | RepositoryOperationException ex) {
        throw ex;
      } catch (RuntimeException ex) {
        Classification classification = policy.classifier().classify(ex);
        FailureClass failureClass = classification.failureClass();
        int attemptNumber = history.size() + 1;

        Duration mandatedWait = mandatedWait(classification);
        if (mandatedWait != null) {
          if (mandatedWait.compareTo(policy.patience()) > 0) {
            history.add(new OperationAttempt(attemptNumber, failureClass, mandatedWait, false));
            throw fail(
                operation,
                classification,
                Math.max(counted, 1),
                history,
                "rate limit wait of %ds exceeds the allowed %ds"
                    .formatted(mandatedWait.toSeconds(), policy.patience().toSeconds()),
                ex);
          }
          if (uncounted >= policy.maxUncountedWaits()) {
            history.add(new OperationAttempt(attemptNumber, failureClass, mandatedWait, false));
            throw fail(
                operation,
                classification,
                Math.max(counted, 1),
                history,
                "rate limit persisted after %d waits".formatted(uncounted),
                ex);
          }
          uncounted++;
          history.add(new OperationAttempt(attemptNumber, failureClass, mandatedWait, false));
          rateLimitWaitCounter.increment();
          log.warn(
              "repository.retry rate_limited operation={} class={} wait={}ms",
              operation,
              failureClass,
              mandatedWait.toMillis());
          sleeper.sleep(mandatedWait, token);
          continue;
        }

        counted++;
        if (!isTransient(failureClass)) {
          history.add(new OperationAttempt(attemptNumber, failureClass, Duration.ZERO, true));
          throw fail(operation, classification, counted, history, describe(ex), ex);
        }
        if (counted >= policy.maxAttempts()) {
          history.add(new OperationAttempt(attemptNumber, failureClass, Duration.ZERO, true));
          exhaustedCounter.increment();
          throw fail(
              operation,
              classification,
              counted,
              history,
              "gave up after %d attempts: %s".formatted(counted, describe(ex)),
              ex);
        }
        Duration delay = policy.backoff().delay(failureClass, counted);
        history.add(new OperationAttempt(attemptNumber, failureClass, delay, true));
        retryCounter.increment();
        log.warn(
            "repository.retry operation={} class={} attempt={}/{} delay={}ms reason={}",
            operation,
            failureClass,
            counted,
            policy.maxAttempts(),
            delay.toMillis(),
            describe(ex));
        sleeper.sleep(delay, token);
      }
    }
  }

  @Nullable
  private Duration mandatedWait(Classification classification) {
    if (classification.failureClass() == FailureClass.RATE_LIMITED
        && classification.resetAt() != null) {
      Duration untilReset = Duration.between(clock.instant(), classification.resetAt());
      if (untilReset.isNegative()) {
        untilReset = Duration.ZERO;
      }
      return untilReset.plus(RESET_BUFFER);
    }
    if (classification.failureClass() == FailureClass.SECONDARY_RATE_LIMITED
        && classification.retryAfter() != null) {
      return classification.retryAfter().isNegative() ? Duration.ZERO : classification.retryAfter();
    }
    return null;
  }

  private static boolean isTransient(FailureClass failureClass) {
    return switch (failureClass) {
      case SERVER, NETWORK, RATE_LIMITED, SECONDARY_RATE_LIMITED -> true;
      default -> false;
    };
  }

  private RepositoryOperationException fail(
      String operation,
      Classification classification,
      int attempts,
      List<OperationAttempt> history,
      String reason,
      RuntimeException cause) {
    log.warn(
        "repository.retry failed operation={} class={} status={} attempts={} reason={}",
        operation,
        classification.failureClass(),
        classification.status(),
        attempts,
        reason);
    return new RepositoryOperationException(
        operation,
        classification.failureClass(),
        classification.status(),
        attempts,
        history,
        "%s failed (%s): %s".formatted(operation, classification.failureClass(), reason),
        cause);
  }

  private static String describe(Throwable ex) {
    String message = ex.getMessage();
    return StringUtils.hasText(message) ? message : ex.getClass().getSimpleName();
  }
}
