package com.aiadvent.mcp.pages.client;

import static org.assertj.core.api.Assertions.assertThat;

import com.aiadvent.mcp.pages.retry.Classification;
import com.aiadvent.mcp.pages.retry.FailureClass;
import java.io.UncheckedIOException;
import java.net.SocketTimeoutException;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class RepositoryFailureClassifierTest {

  private final RepositoryFailureClassifier classifier = new RepositoryFailureClassifier();

  @ParameterizedTest
  @CsvSource({
    "401, AUTHORIZATION",
    "400, VALIDATION",
    "422, VALIDATION",
    "404, NOT_FOUND",
    "409, CONFLICT",
    "408, NETWORK",
    "500, SERVER",
    "503, SERVER",
    "418, UNCLASSIFIED"
  })
  void mapsStatusCodes(int status, FailureClass expected) {
    Classification classification = classifier.classify(new RepositoryApiException(status, "failed"));

    assertThat(classification.failureClass()).isEqualTo(expected);
    assertThat(classification.status()).isEqualTo(status);
  }

  @Test
  void forbiddenWithExhaustedBudgetIsPrimaryRateLimit() {
    Instant reset = Instant.parse("2024-05-01T10:00:02Z");

    Classification classification =
        classifier.classify(new RepositoryApiException(403, "Forbidden", 0, reset, null, null));

    assertThat(classification.failureClass()).isEqualTo(FailureClass.RATE_LIMITED);
    assertThat(classification.resetAt()).isEqualTo(reset);
  }

  @Test
  void forbiddenWithRetryAfterIsSecondaryRateLimit() {
    Classification classification =
        classifier.classify(
            new RepositoryApiException(403, "Forbidden", 12, null, Duration.ofSeconds(60), null));

    assertThat(classification.failureClass()).isEqualTo(FailureClass.SECONDARY_RATE_LIMITED);
    assertThat(classification.retryAfter()).isEqualTo(Duration.ofSeconds(60));
  }

  @Test
  void forbiddenMentioningAbuseIsSecondaryRateLimit() {
    Classification classification =
        classifier.classify(new RepositoryApiException(403, "abuse detection mechanism triggered"));

    assertThat(classification.failureClass()).isEqualTo(FailureClass.SECONDARY_RATE_LIMITED);
  }

  @Test
  void plainForbiddenIsPermissionProblem() {
    Classification classification =
        classifier.classify(new RepositoryApiException(403, "Resource not accessible by integration"));

    assertThat(classification.failureClass()).isEqualTo(FailureClass.AUTHORIZATION);
  }

  @Test
  void tooManyRequestsWithoutDetailsIsRateLimited() {
    assertThat(classifier.classify(new RepositoryApiException(429, "Too Many Requests")).failureClass())
        .isEqualTo(FailureClass.RATE_LIMITED);
  }

  @Test
  void missingResponseAndIoFailuresAreNetwork() {
    assertThat(classifier.classify(RepositoryApiException.network("connect timed out", null)).failureClass())
        .isEqualTo(FailureClass.NETWORK);
    assertThat(
            classifier
                .classify(new UncheckedIOException(new SocketTimeoutException("Read timed out")))
                .failureClass())
        .isEqualTo(FailureClass.NETWORK);
    assertThat(
            classifier
                .classify(new IllegalStateException("wrapped", new SocketTimeoutException("late")))
                .failureClass())
        .isEqualTo(FailureClass.NETWORK);
  }

  @Test
  void credentialProblemsAreAuthorization() {
    assertThat(classifier.classify(new CredentialException("token missing")).failureClass())
        .isEqualTo(FailureClass.AUTHORIZATION);
  }

  @Test
  void unknownExceptionsAreUnclassified() {
    assertThat(classifier.classify(new IllegalStateException("boom")).failureClass())
        .isEqualTo(FailureClass.UNCLASSIFIED);
  }
}
