package com.aiadvent.mcp.pages.client;

import com.aiadvent.mcp.pages.retry.Classification;
import com.aiadvent.mcp.pages.retry.FailureClass;
import com.aiadvent.mcp.pages.retry.FailureClassifier;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Locale;
import java.util.concurrent.TimeoutException;

/**
 * Maps failures of {@link RepositoryApi} calls onto {@link FailureClass}. A 403 only counts as a
 * rate limit when the response says so; otherwise it is a permission problem.
 */
public class RepositoryFailureClassifier implements FailureClassifier {

  @Override
  public Classification classify(Throwable failure) {
    if (failure instanceof CredentialException) {
      return Classification.of(FailureClass.AUTHORIZATION);
    }
    if (failure instanceof RepositoryApiException api) {
      return classifyApi(api);
    }
    if (isNetworkFailure(failure)) {
      return Classification.of(FailureClass.NETWORK);
    }
    return Classification.of(FailureClass.UNCLASSIFIED);
  }

  private Classification classifyApi(RepositoryApiException api) {
    int status = api.status();
    if (!api.hasResponse()) {
      return Classification.of(FailureClass.NETWORK);
    }
    if (status == 403 || status == 429) {
      if (isSecondaryLimit(api)) {
        return new Classification(
            FailureClass.SECONDARY_RATE_LIMITED, status, null, api.retryAfter());
      }
      if (isPrimaryLimit(api)) {
        return new Classification(FailureClass.RATE_LIMITED, status, api.rateLimitReset(), null);
      }
      if (status == 429) {
        return Classification.of(FailureClass.RATE_LIMITED, status);
      }
      return Classification.of(FailureClass.AUTHORIZATION, status);
    }
    if (status == 401) {
      return Classification.of(FailureClass.AUTHORIZATION, status);
    }
    if (status == 400 || status == 422) {
      return Classification.of(FailureClass.VALIDATION, status);
    }
    if (status == 404) {
      return Classification.of(FailureClass.NOT_FOUND, status);
    }
    if (status == 409) {
      return Classification.of(FailureClass.CONFLICT, status);
    }
    if (status == 408) {
      return Classification.of(FailureClass.NETWORK, status);
    }
    if (status >= 500) {
      return Classification.of(FailureClass.SERVER, status);
    }
    return Classification.of(FailureClass.UNCLASSIFIED, status);
  }

  private static boolean isSecondaryLimit(RepositoryApiException api) {
    if (api.retryAfter() != null) {
      return true;
    }
    String message = lower(api.getMessage());
    return message.contains("secondary rate limit") || message.contains("abuse");
  }

  private static boolean isPrimaryLimit(RepositoryApiException api) {
    Integer remaining = api.rateLimitRemaining();
    if (remaining != null && remaining == 0) {
      return true;
    }
    return lower(api.getMessage()).contains("rate limit");
  }

  private static boolean isNetworkFailure(Throwable failure) {
    Throwable current = failure;
    while (current != null) {
      if (current instanceof IOException
          || current instanceof UncheckedIOException
          || current instanceof TimeoutException) {
        return true;
      }
      current = current.getCause();
    }
    return false;
  }

  private static String lower(String value) {
    return value == null ? "" : value.toLowerCase(Locale.ROOT);
  }
}
