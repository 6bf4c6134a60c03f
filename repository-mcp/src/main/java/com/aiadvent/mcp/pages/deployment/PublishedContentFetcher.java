package com.aiadvent.mcp.pages.deployment;

import java.time.Duration;
import org.springframework.lang.Nullable;

/** Fetches the public, published version of a page, bypassing caches. */
@FunctionalInterface
public interface PublishedContentFetcher {

  /** Never throws for HTTP or network failures; they are reported in the result. */
  FetchResult fetch(String url);

  /**
   * @param status HTTP status, {@code 0} when no response arrived
   */
  record FetchResult(int status, @Nullable String body, Duration responseTime, @Nullable String error) {

    public boolean isSuccessful() {
      return status >= 200 && status < 300;
    }
  }
}
