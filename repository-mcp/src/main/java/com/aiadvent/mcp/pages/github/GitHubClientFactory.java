package com.aiadvent.mcp.pages.github;

import java.io.IOException;
import java.util.concurrent.atomic.AtomicReference;
import org.kohsuke.github.AbuseLimitHandler;
import org.kohsuke.github.GitHub;
import org.kohsuke.github.GitHubBuilder;
import org.kohsuke.github.RateLimitHandler;
import org.springframework.lang.Nullable;
import org.springframework.util.StringUtils;

/**
 * Builds authenticated {@link GitHub} clients. Rate limit and abuse handlers fail fast so that
 * waiting is left to the request throttle and retry policy.
 */
public class GitHubClientFactory {

  private final String endpoint;
  private final AtomicReference<CachedClient> lastClient = new AtomicReference<>();

  public GitHubClientFactory(@Nullable String endpoint) {
    this.endpoint = StringUtils.hasText(endpoint) ? endpoint.trim() : null;
  }

  /**
   * Returns the client for {@code token}, building a new one when the token changed. Building may
   * resolve the authenticated user, so {@code beforeBuild} runs first to admit that request.
   */
  public GitHub clientFor(String token, Runnable beforeBuild) throws IOException {
    if (!StringUtils.hasText(token)) {
      throw new IllegalArgumentException("token must not be blank");
    }
    String trimmed = token.trim();
    CachedClient cached = lastClient.get();
    if (cached != null && cached.token().equals(trimmed)) {
      return cached.client();
    }
    beforeBuild.run();
    GitHub client = configure(new GitHubBuilder()).withOAuthToken(trimmed).build();
    lastClient.set(new CachedClient(trimmed, client));
    return client;
  }

  private GitHubBuilder configure(GitHubBuilder builder) {
    builder.withRateLimitHandler(RateLimitHandler.FAIL);
    builder.withAbuseLimitHandler(AbuseLimitHandler.FAIL);
    if (endpoint != null) {
      builder.withEndpoint(endpoint);
    }
    return builder;
  }

  private record CachedClient(String token, GitHub client) {}
}
