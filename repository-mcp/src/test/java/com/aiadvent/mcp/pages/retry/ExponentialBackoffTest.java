package com.aiadvent.mcp.pages.retry;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import org.junit.jupiter.api.Test;

class ExponentialBackoffTest {

  private static final Duration BASE = Duration.ofSeconds(1);
  private static final Duration JITTER = Duration.ofSeconds(1);
  private static final Duration CAP = Duration.ofSeconds(30);

  @Test
  void growsPerFailureClassMultiplier() {
    ExponentialBackoff backoff = new ExponentialBackoff(BASE, JITTER, CAP, () -> 0.0);

    assertThat(backoff.delay(FailureClass.SERVER, 1)).isEqualTo(Duration.ofMillis(1000));
    assertThat(backoff.delay(FailureClass.SERVER, 2)).isEqualTo(Duration.ofMillis(1500));
    assertThat(backoff.delay(FailureClass.NETWORK, 3)).isEqualTo(Duration.ofMillis(4000));
    assertThat(backoff.delay(FailureClass.RATE_LIMITED, 2)).isEqualTo(Duration.ofMillis(3000));
    assertThat(backoff.delay(FailureClass.UNCLASSIFIED, 2)).isEqualTo(Duration.ofMillis(2000));
  }

  @Test
  void neverExceedsCap() {
    ExponentialBackoff backoff = new ExponentialBackoff(BASE, JITTER, CAP, () -> 0.99);

    assertThat(backoff.delay(FailureClass.SECONDARY_RATE_LIMITED, 6)).isEqualTo(CAP);
  }

  @Test
  void jitterStaysBelowOneSecond() {
    ExponentialBackoff backoff = new ExponentialBackoff(BASE, JITTER, CAP, () -> 1.0);

    assertThat(backoff.delay(FailureClass.SERVER, 1)).isEqualTo(Duration.ofMillis(1999));
  }
}
