package com.aiadvent.mcp.pages.retry;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.aiadvent.mcp.pages.client.RepositoryApiException;
import com.aiadvent.mcp.pages.client.RepositoryFailureClassifier;
import com.aiadvent.mcp.pages.support.CancellationToken;
import com.aiadvent.mcp.pages.support.MutableClock;
import com.aiadvent.mcp.pages.support.OperationCancelledException;
import com.aiadvent.mcp.pages.support.RecordingSleeper;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class RetryExecutorTest {

  private MutableClock clock;
  private RecordingSleeper sleeper;
  private RetryExecutor executor;
  private RetryPolicy policy;

  @BeforeEach
  void setUp() {
    clock = MutableClock.startingAt("2024-05-01T10:00:00Z");
    sleeper = new RecordingSleeper(clock);
    executor = new RetryExecutor(clock, sleeper, null);
    ExponentialBackoff backoff =
        new ExponentialBackoff(Duration.ofSeconds(1), Duration.ofSeconds(1), Duration.ofSeconds(30), () -> 0.0);
    policy = RetryPolicy.defaults(new RepositoryFailureClassifier()).withBackoff(backoff);
  }

  @Test
  void primaryRateLimitWaitsForResetWithoutConsumingAttempt() {
    AtomicInteger calls = new AtomicInteger();
    RetryPolicy singleAttempt = policy.withMaxAttempts(1);

    String result =
        executor.execute(
            "read_file",
            singleAttempt,
            CancellationToken.none(),
            () -> {
              if (calls.incrementAndGet() == 1) {
                throw new RepositoryApiException(
                    403, "API rate limit exceeded", 0, clock.instant().plusSeconds(2), null, null);
              }
              return "ok";
            });

    assertThat(result).isEqualTo("ok");
    assertThat(calls).hasValue(2);
    assertThat(sleeper.total()).isGreaterThanOrEqualTo(Duration.ofSeconds(2));
    assertThat(sleeper.sleeps()).containsExactly(Duration.ofSeconds(3));
  }

  @Test
  void transientFailuresBackOffUntilAttemptsRunOut() {
    AtomicInteger calls = new AtomicInteger();

    assertThatThrownBy(
            () ->
                executor.execute(
                    "put_file",
                    policy,
                    CancellationToken.none(),
                    () -> {
                      calls.incrementAndGet();
                      throw new RepositoryApiException(502, "Bad gateway");
                    }))
        .isInstanceOfSatisfying(
            RepositoryOperationException.class,
            ex -> {
              assertThat(ex.failureClass()).isEqualTo(FailureClass.SERVER);
              assertThat(ex.attempts()).isEqualTo(3);
              assertThat(ex.status()).isEqualTo(502);
              assertThat(ex.history()).hasSize(3).allMatch(OperationAttempt::counted);
              assertThat(ex.getMessage()).startsWith("put_file failed (SERVER)");
            });

    assertThat(calls).hasValue(3);
    assertThat(sleeper.sleeps()).containsExactly(Duration.ofMillis(1000), Duration.ofMillis(1500));
  }

  @Test
  void authorizationFailureIsNotRetried() {
    AtomicInteger calls = new AtomicInteger();

    assertThatThrownBy(
            () ->
                executor.execute(
                    "get_file",
                    policy,
                    CancellationToken.none(),
                    () -> {
                      calls.incrementAndGet();
                      throw new RepositoryApiException(401, "Bad credentials");
                    }))
        .isInstanceOfSatisfying(
            RepositoryOperationException.class,
            ex -> {
              assertThat(ex.failureClass()).isEqualTo(FailureClass.AUTHORIZATION);
              assertThat(ex.attempts()).isEqualTo(1);
            });

    assertThat(calls).hasValue(1);
    assertThat(sleeper.sleeps()).isEmpty();
  }

  @Test
  void conflictFailsImmediately() {
    assertThatThrownBy(
            () ->
                executor.execute(
                    "put_file",
                    policy,
                    CancellationToken.none(),
                    () -> {
                      throw new RepositoryApiException(409, "sha mismatch");
                    }))
        .isInstanceOfSatisfying(
            RepositoryOperationException.class,
            ex -> assertThat(ex.failureClass()).isEqualTo(FailureClass.CONFLICT));
    assertThat(sleeper.sleeps()).isEmpty();
  }

  @Test
  void rateLimitBeyondPatienceFailsWithoutWaiting() {
    assertThatThrownBy(
            () ->
                executor.execute(
                    "get_file",
                    policy,
                    CancellationToken.none(),
                    () -> {
                      throw new RepositoryApiException(
                          403, "API rate limit exceeded", 0, clock.instant().plus(Duration.ofMinutes(20)), null, null);
                    }))
        .isInstanceOfSatisfying(
            RepositoryOperationException.class,
            ex -> {
              assertThat(ex.failureClass()).isEqualTo(FailureClass.RATE_LIMITED);
              assertThat(ex.getMessage()).contains("exceeds the allowed");
            });
    assertThat(sleeper.sleeps()).isEmpty();
  }

  @Test
  void secondaryLimitHonoursRetryAfter() {
    AtomicInteger calls = new AtomicInteger();

    Integer result =
        executor.execute(
            "create_tree",
            policy,
            CancellationToken.none(),
            () -> {
              if (calls.incrementAndGet() == 1) {
                throw new RepositoryApiException(
                    403, "You have exceeded a secondary rate limit", null, null, Duration.ofSeconds(30), null);
              }
              return 42;
            });

    assertThat(result).isEqualTo(42);
    assertThat(sleeper.sleeps()).containsExactly(Duration.ofSeconds(30));
  }

  @Test
  void repeatedRateLimitsStopAfterUncountedWaitBudget() {
    RetryPolicy policyWithTwoWaits =
        new RetryPolicy(3, new RepositoryFailureClassifier(), policy.backoff(), Duration.ofMinutes(15), 2);

    assertThatThrownBy(
            () ->
                executor.execute(
                    "get_file",
                    policyWithTwoWaits,
                    CancellationToken.none(),
                    () -> {
                      throw new RepositoryApiException(
                          429, "rate limit", 0, clock.instant().plusSeconds(1), null, null);
                    }))
        .isInstanceOfSatisfying(
            RepositoryOperationException.class,
            ex -> assertThat(ex.getMessage()).contains("persisted after 2 waits"));
    assertThat(sleeper.sleeps()).hasSize(2);
  }

  @Test
  void cancellationDuringBackoffEndsOperation() {
    CancellationToken token = CancellationToken.create();
    sleeper.onSleep(token::cancel);

    assertThatThrownBy(
            () ->
                executor.execute(
                    "get_file",
                    policy,
                    token,
                    () -> {
                      throw RepositoryApiException.network("connection reset", null);
                    }))
        .isInstanceOf(OperationCancelledException.class);
    assertThat(sleeper.sleeps()).hasSize(1);
  }
}
