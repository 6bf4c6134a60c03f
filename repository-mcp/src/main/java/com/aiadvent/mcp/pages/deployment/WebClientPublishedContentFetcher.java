package com.aiadvent.mcp.pages.deployment;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.web.reactive.function.client.WebClient;

/** Fetches published pages with caching disabled and a cache-busting query parameter. */
public class WebClientPublishedContentFetcher implements PublishedContentFetcher {

  private static final Logger log = LoggerFactory.getLogger(WebClientPublishedContentFetcher.class);

  private final WebClient webClient;
  private final Clock clock;
  private final Duration timeout;

  public WebClientPublishedContentFetcher(WebClient webClient, Clock clock, Duration timeout) {
    this.webClient = Objects.requireNonNull(webClient, "webClient");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.timeout = timeout != null ? timeout : Duration.ofSeconds(30);
  }

  @Override
  public FetchResult fetch(String url) {
    Instant startedAt = clock.instant();
    String target = url + (url.contains("?") ? "&" : "?") + "t=" + startedAt.toEpochMilli();
    try {
      FetchResult result =
          webClient
              .get()
              .uri(URI.create(target))
              .header(HttpHeaders.CACHE_CONTROL, "no-cache, no-store, must-revalidate")
              .header(HttpHeaders.PRAGMA, "no-cache")
              .exchangeToMono(
                  response ->
                      response
                          .bodyToMono(String.class)
                          .defaultIfEmpty("")
                          .map(
                              body ->
                                  new FetchResult(
                                      response.statusCode().value(),
                                      body,
                                      Duration.between(startedAt, clock.instant()),
                                      null)))
              .block(timeout);
      if (result == null) {
        return new FetchResult(0, null, Duration.between(startedAt, clock.instant()), "empty response");
      }
      log.debug("repository.published_fetch url={} status={} time={}ms", url, result.status(), result.responseTime().toMillis());
      return result;
    } catch (RuntimeException ex) {
      log.warn("repository.published_fetch failure url={} reason={}", url, ex.getMessage());
      return new FetchResult(0, null, Duration.between(startedAt, clock.instant()), ex.getMessage());
    }
  }
}
