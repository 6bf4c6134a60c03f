package com.aiadvent.mcp.pages.config;

import com.aiadvent.mcp.pages.cache.LocalCache;
import com.aiadvent.mcp.pages.client.CredentialProvider;
import com.aiadvent.mcp.pages.client.FileContent;
import com.aiadvent.mcp.pages.client.RepositoryApi;
import com.aiadvent.mcp.pages.client.RepositoryClient;
import com.aiadvent.mcp.pages.client.RepositoryClient.CacheKey;
import com.aiadvent.mcp.pages.client.RepositoryFailureClassifier;
import com.aiadvent.mcp.pages.client.RepositoryRef;
import com.aiadvent.mcp.pages.client.StaticTokenCredentialProvider;
import com.aiadvent.mcp.pages.conflict.ConflictAnalyzer;
import com.aiadvent.mcp.pages.deployment.DeploymentMonitor;
import com.aiadvent.mcp.pages.deployment.DeploymentMonitor.MonitorOptions;
import com.aiadvent.mcp.pages.deployment.PublishedContentFetcher;
import com.aiadvent.mcp.pages.deployment.WebClientPublishedContentFetcher;
import com.aiadvent.mcp.pages.github.GitHubClientFactory;
import com.aiadvent.mcp.pages.github.GitHubRepositoryApi;
import com.aiadvent.mcp.pages.offline.ConnectivityWatchdog;
import com.aiadvent.mcp.pages.offline.FallbackProvider;
import com.aiadvent.mcp.pages.offline.OfflineController;
import com.aiadvent.mcp.pages.offline.OfflineSettings;
import com.aiadvent.mcp.pages.retry.ExponentialBackoff;
import com.aiadvent.mcp.pages.retry.RetryExecutor;
import com.aiadvent.mcp.pages.retry.RetryPolicy;
import com.aiadvent.mcp.pages.support.LoggingRepositoryEventListener;
import com.aiadvent.mcp.pages.support.RecentEventLog;
import com.aiadvent.mcp.pages.support.RepositoryEventListener;
import com.aiadvent.mcp.pages.support.Sleeper;
import com.aiadvent.mcp.pages.throttle.RateLimitState;
import com.aiadvent.mcp.pages.throttle.RequestThrottle;
import com.aiadvent.mcp.pages.throttle.ThrottleSettings;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.ThreadLocalRandom;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.http.HttpHeaders;
import org.springframework.lang.Nullable;
import org.springframework.web.reactive.function.client.WebClient;

@Configuration
public class RepositoryClientConfiguration {

  @Bean
  Clock repositoryClock() {
    return Clock.systemUTC();
  }

  @Bean
  Sleeper repositorySleeper() {
    return Sleeper.threadSleeper();
  }

  @Bean
  RecentEventLog recentEventLog() {
    return new RecentEventLog();
  }

  @Bean
  @Primary
  RepositoryEventListener repositoryEventListener(RecentEventLog recentEventLog) {
    return RepositoryEventListener.composite(
        List.of(new LoggingRepositoryEventListener(), recentEventLog));
  }

  @Bean
  RateLimitState rateLimitState(Clock clock) {
    return new RateLimitState(clock);
  }

  @Bean
  RequestThrottle requestThrottle(
      RepositoryClientProperties properties,
      RateLimitState rateLimitState,
      Clock clock,
      Sleeper sleeper,
      @Nullable MeterRegistry meterRegistry) {
    RepositoryClientProperties.Throttle throttle = properties.getThrottle();
    ThrottleSettings settings =
        new ThrottleSettings(
            throttle.getMinInterval(),
            throttle.getMaxPerMinute(),
            throttle.getMaxPerHour(),
            throttle.getSafetyMargin(),
            throttle.getServerReserve());
    return new RequestThrottle(settings, rateLimitState, clock, sleeper, meterRegistry);
  }

  @Bean
  RetryExecutor retryExecutor(Clock clock, Sleeper sleeper, @Nullable MeterRegistry meterRegistry) {
    return new RetryExecutor(clock, sleeper, meterRegistry);
  }

  @Bean
  RetryPolicy repositoryRetryPolicy(RepositoryClientProperties properties) {
    RepositoryClientProperties.Retry retry = properties.getRetry();
    ExponentialBackoff backoff =
        new ExponentialBackoff(
            retry.getBaseDelay(),
            retry.getMaxJitter(),
            retry.getMaxDelay(),
            () -> ThreadLocalRandom.current().nextDouble());
    return new RetryPolicy(
        retry.getMaxAttempts(),
        new RepositoryFailureClassifier(),
        backoff,
        retry.getPatience(),
        retry.getMaxUncountedWaits());
  }

  @Bean
  LocalCache<CacheKey, FileContent> repositoryFileCache(
      RepositoryClientProperties properties, Clock clock, @Nullable MeterRegistry meterRegistry) {
    return new LocalCache<>(
        properties.getCache().getTtl(),
        properties.getCache().getCapacity(),
        FileContent::copy,
        clock,
        meterRegistry);
  }

  @Bean
  OfflineController offlineController(
      RepositoryClientProperties properties,
      Clock clock,
      RepositoryEventListener eventListener,
      @Nullable MeterRegistry meterRegistry) {
    RepositoryClientProperties.Offline offline = properties.getOffline();
    return new OfflineController(
        new OfflineSettings(offline.getFailureThreshold(), offline.getProbeInterval()),
        clock,
        eventListener,
        meterRegistry);
  }

  @Bean
  GitHubClientFactory gitHubClientFactory(RepositoryClientProperties properties) {
    return new GitHubClientFactory(properties.getBaseUrl());
  }

  @Bean
  RepositoryApi repositoryApi(GitHubClientFactory clientFactory, RateLimitState rateLimitState) {
    return new GitHubRepositoryApi(clientFactory, rateLimitState);
  }

  @Bean
  CredentialProvider repositoryCredentialProvider(RepositoryClientProperties properties) {
    return new StaticTokenCredentialProvider(properties.getToken());
  }

  @Bean(destroyMethod = "close")
  RepositoryClient repositoryClient(
      RepositoryClientProperties properties,
      RepositoryApi api,
      CredentialProvider credentials,
      RequestThrottle throttle,
      RetryExecutor retryExecutor,
      RetryPolicy retryPolicy,
      LocalCache<CacheKey, FileContent> cache,
      OfflineController offlineController,
      Sleeper sleeper,
      Clock clock,
      @Nullable MeterRegistry meterRegistry) {
    RepositoryClientProperties.Write write = properties.getWrite();
    RepositoryClient.Settings settings =
        new RepositoryClient.Settings(
            write.getConflictAttempts(),
            write.getConflictDelay(),
            write.getReadBatchSize(),
            write.getReadBatchPause(),
            properties.getPublishedUrl());
    return new RepositoryClient(
        new RepositoryRef(properties.getOwner(), properties.getName(), properties.getBranch()),
        api,
        credentials,
        throttle,
        retryExecutor,
        retryPolicy,
        cache,
        offlineController,
        FallbackProvider.of(properties.getOffline().getFallbacks()),
        sleeper,
        clock,
        settings,
        meterRegistry);
  }

  @Bean
  @ConditionalOnProperty(
      prefix = "repository.client.offline",
      name = "watchdog-enabled",
      havingValue = "true",
      matchIfMissing = true)
  ConnectivityWatchdog connectivityWatchdog(
      RepositoryClientProperties properties,
      OfflineController offlineController,
      RepositoryClient repositoryClient) {
    return new ConnectivityWatchdog(
        offlineController, repositoryClient::pingRemote, properties.getOffline().getProbeInterval());
  }

  @Bean
  WebClient publishedSiteWebClient(RepositoryClientProperties properties) {
    RepositoryClientProperties.Deployment deployment = properties.getDeployment();
    return WebClient.builder()
        .defaultHeader(HttpHeaders.ACCEPT, "text/html,*/*")
        .defaultHeader(HttpHeaders.USER_AGENT, deployment.getUserAgent())
        .clientConnector(
            new ReactorClientHttpConnectorBuilder()
                .connectTimeout(deployment.getConnectTimeout())
                .readTimeout(deployment.getFetchTimeout())
                .followRedirects(true)
                .build())
        .build();
  }

  @Bean
  PublishedContentFetcher publishedContentFetcher(
      WebClient publishedSiteWebClient, Clock clock, RepositoryClientProperties properties) {
    return new WebClientPublishedContentFetcher(
        publishedSiteWebClient, clock, properties.getDeployment().getFetchTimeout());
  }

  @Bean
  ConflictAnalyzer conflictAnalyzer(
      RepositoryClient repositoryClient, Clock clock, RepositoryEventListener eventListener) {
    return new ConflictAnalyzer(repositoryClient, clock, eventListener);
  }

  @Bean
  DeploymentMonitor deploymentMonitor(
      RepositoryClient repositoryClient,
      PublishedContentFetcher contentFetcher,
      Sleeper sleeper,
      Clock clock,
      RepositoryEventListener eventListener,
      RepositoryClientProperties properties,
      @Nullable MeterRegistry meterRegistry) {
    RepositoryClientProperties.Deployment deployment = properties.getDeployment();
    return new DeploymentMonitor(
        repositoryClient,
        contentFetcher,
        sleeper,
        clock,
        eventListener,
        new MonitorOptions(deployment.getPollInterval(), deployment.getTimeout()),
        meterRegistry);
  }
}
