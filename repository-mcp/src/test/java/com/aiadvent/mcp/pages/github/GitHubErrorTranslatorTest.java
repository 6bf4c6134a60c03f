package com.aiadvent.mcp.pages.github;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.aiadvent.mcp.pages.client.RepositoryApiException;
import com.aiadvent.mcp.pages.throttle.RateLimitSnapshot;
import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.kohsuke.github.GHFileNotFoundException;
import org.kohsuke.github.HttpException;

class GitHubErrorTranslatorTest {

  @Test
  void failureWithoutResponseIsNetworkError() {
    RepositoryApiException ex =
        GitHubErrorTranslator.translate("read_file", new IOException("Connection reset"));

    assertThat(ex.status()).isZero();
    assertThat(ex.hasResponse()).isFalse();
    assertThat(ex.getMessage()).isEqualTo("read_file failed: Connection reset");
  }

  @Test
  void exhaustedBudgetCarriesRateLimitHeaders() {
    HttpException failure =
        httpException(
            403,
            "Forbidden",
            "{\"message\":\"API rate limit exceeded for user ID 1.\"}",
            Map.of(
                "X-RateLimit-Limit", List.of("5000"),
                "X-RateLimit-Remaining", List.of("0"),
                "X-RateLimit-Reset", List.of("1714557600")));

    RepositoryApiException ex = GitHubErrorTranslator.translate("write_file", failure);

    assertThat(ex.status()).isEqualTo(403);
    assertThat(ex.rateLimitRemaining()).isZero();
    assertThat(ex.rateLimitReset()).isEqualTo(Instant.ofEpochSecond(1714557600L));
    assertThat(ex.retryAfter()).isNull();
    assertThat(ex.getMessage())
        .isEqualTo("write_file failed (status 403 Forbidden - API rate limit exceeded for user ID 1.)");
  }

  @Test
  void retryAfterHeaderIsReadCaseInsensitively() {
    HttpException failure =
        httpException(
            403,
            "Forbidden",
            "{\"message\":\"You have exceeded a secondary rate limit.\"}",
            Map.of("retry-after", List.of("45")));

    RepositoryApiException ex = GitHubErrorTranslator.translate("create_tree", failure);

    assertThat(ex.retryAfter()).isEqualTo(Duration.ofSeconds(45));
    assertThat(ex.rateLimitRemaining()).isNull();
  }

  @Test
  void missingFileMapsToNotFound() {
    RepositoryApiException ex =
        GitHubErrorTranslator.translate("read_file", new GHFileNotFoundException("{\"message\":\"Not Found\"}"));

    assertThat(ex.status()).isEqualTo(404);
    assertThat(ex.getMessage()).contains("Not Found");
  }

  @Test
  void rateLimitSnapshotIsUnknownWithoutHeaders() {
    assertThat(GitHubErrorTranslator.rateLimitFrom(new IOException("timeout")).remaining()).isNegative();
  }

  @Test
  void rateLimitSnapshotFromHeaders() {
    HttpException failure =
        httpException(
            429,
            "Too Many Requests",
            null,
            Map.of(
                "X-RateLimit-Limit", List.of("60"),
                "X-RateLimit-Remaining", List.of("0"),
                "X-RateLimit-Reset", List.of("1714557600")));

    RateLimitSnapshot snapshot = GitHubErrorTranslator.rateLimitFrom(failure);

    assertThat(snapshot.limit()).isEqualTo(60);
    assertThat(snapshot.remaining()).isZero();
    assertThat(snapshot.resetAt()).isEqualTo(Instant.ofEpochSecond(1714557600L));
  }

  @Test
  void validationErrorsAreFlattened() {
    String body =
        "{\"message\":\"Validation Failed\",\"errors\":["
            + "{\"resource\":\"Content\",\"field\":\"sha\",\"code\":\"missing_field\"},"
            + "\"branch is protected\"]}";

    assertThat(GitHubErrorTranslator.extractErrorBody(body))
        .isEqualTo("Validation Failed; sha: missing_field; branch is protected");
  }

  @Test
  void nonJsonBodiesAreKeptVerbatim() {
    assertThat(GitHubErrorTranslator.extractErrorBody("  Bad gateway ")).isEqualTo("Bad gateway");
    assertThat(GitHubErrorTranslator.extractErrorBody("{broken")).isEqualTo("{broken");
    assertThat(GitHubErrorTranslator.extractErrorBody(" ")).isNull();
  }

  @Test
  void longDetailsAreTruncated() {
    HttpException failure = httpException(500, "Server Error", "x".repeat(2000), Map.of());

    RepositoryApiException ex = GitHubErrorTranslator.translate("commit", failure);

    assertThat(ex.getMessage()).endsWith("...)");
    assertThat(ex.getMessage().length())
        .isLessThanOrEqualTo("commit failed (".length() + GitHubErrorTranslator.MAX_API_ERROR_DETAIL + 4);
  }

  private static HttpException httpException(
      int status, String responseMessage, String body, Map<String, List<String>> headers) {
    HttpException failure = mock(HttpException.class);
    when(failure.getResponseCode()).thenReturn(status);
    when(failure.getResponseMessage()).thenReturn(responseMessage);
    when(failure.getMessage()).thenReturn(body);
    when(failure.getResponseHeaderFields()).thenReturn(headers);
    return failure;
  }
}
