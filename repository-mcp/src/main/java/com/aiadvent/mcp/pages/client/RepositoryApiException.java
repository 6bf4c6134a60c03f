package com.aiadvent.mcp.pages.client;

import java.time.Duration;
import java.time.Instant;
import org.springframework.lang.Nullable;

/**
 * Failure of a single remote call, carrying what the response said about it.
 *
 * <p>A status of {@code 0} means no HTTP response was received at all.
 */
public class RepositoryApiException extends RuntimeException {

  private final int status;
  private final Instant rateLimitReset;
  private final Integer rateLimitRemaining;
  private final Duration retryAfter;

  public RepositoryApiException(
      int status,
      String message,
      @Nullable Integer rateLimitRemaining,
      @Nullable Instant rateLimitReset,
      @Nullable Duration retryAfter,
      @Nullable Throwable cause) {
    super(message, cause);
    this.status = status;
    this.rateLimitRemaining = rateLimitRemaining;
    this.rateLimitReset = rateLimitReset;
    this.retryAfter = retryAfter;
  }

  public RepositoryApiException(int status, String message) {
    this(status, message, null, null, null, null);
  }

  public static RepositoryApiException network(String message, Throwable cause) {
    return new RepositoryApiException(0, message, null, null, null, cause);
  }

  public int status() {
    return status;
  }

  public boolean hasResponse() {
    return status > 0;
  }

  @Nullable
  public Integer rateLimitRemaining() {
    return rateLimitRemaining;
  }

  @Nullable
  public Instant rateLimitReset() {
    return rateLimitReset;
  }

  @Nullable
  public Duration retryAfter() {
    return retryAfter;
  }
}
