package com.aiadvent.mcp.pages.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "repository.client")
public class RepositoryClientProperties {

  @NotBlank private String owner;

  @NotBlank private String name;

  @NotBlank private String branch = "main";

  private String token;
  private String baseUrl = "https://api.github.com";
  private String publishedUrl;

  @Valid private Throttle throttle = new Throttle();
  @Valid private Retry retry = new Retry();
  @Valid private Cache cache = new Cache();
  @Valid private Offline offline = new Offline();
  @Valid private Write write = new Write();
  @Valid private Deployment deployment = new Deployment();

  public String getOwner() {
    return owner;
  }

  public void setOwner(String owner) {
    this.owner = owner;
  }

  public String getName() {
    return name;
  }

  public void setName(String name) {
    this.name = name;
  }

  public String getBranch() {
    return branch;
  }

  public void setBranch(String branch) {
    this.branch = branch;
  }

  public String getToken() {
    return token;
  }

  public void setToken(String token) {
    this.token = token;
  }

  public String getBaseUrl() {
    return baseUrl;
  }

  public void setBaseUrl(String baseUrl) {
    this.baseUrl = baseUrl;
  }

  public String getPublishedUrl() {
    return publishedUrl;
  }

  public void setPublishedUrl(String publishedUrl) {
    this.publishedUrl = publishedUrl;
  }

  public Throttle getThrottle() {
    return throttle;
  }

  public void setThrottle(Throttle throttle) {
    this.throttle = throttle;
  }

  public Retry getRetry() {
    return retry;
  }

  public void setRetry(Retry retry) {
    this.retry = retry;
  }

  public Cache getCache() {
    return cache;
  }

  public void setCache(Cache cache) {
    this.cache = cache;
  }

  public Offline getOffline() {
    return offline;
  }

  public void setOffline(Offline offline) {
    this.offline = offline;
  }

  public Write getWrite() {
    return write;
  }

  public void setWrite(Write write) {
    this.write = write;
  }

  public Deployment getDeployment() {
    return deployment;
  }

  public void setDeployment(Deployment deployment) {
    this.deployment = deployment;
  }

  public static class Throttle {

    @NotNull private Duration minInterval = Duration.ofMillis(100);

    @Min(1)
    private int maxPerMinute = 60;

    @Min(1)
    private int maxPerHour = 1000;

    @NotNull private Duration safetyMargin = Duration.ofMillis(100);

    @Min(0)
    private int serverReserve = 0;

    public Duration getMinInterval() {
      return minInterval;
    }

    public void setMinInterval(Duration minInterval) {
      this.minInterval = minInterval;
    }

    public int getMaxPerMinute() {
      return maxPerMinute;
    }

    public void setMaxPerMinute(int maxPerMinute) {
      this.maxPerMinute = maxPerMinute;
    }

    public int getMaxPerHour() {
      return maxPerHour;
    }

    public void setMaxPerHour(int maxPerHour) {
      this.maxPerHour = maxPerHour;
    }

    public Duration getSafetyMargin() {
      return safetyMargin;
    }

    public void setSafetyMargin(Duration safetyMargin) {
      this.safetyMargin = safetyMargin;
    }

    public int getServerReserve() {
      return serverReserve;
    }

    public void setServerReserve(int serverReserve) {
      this.serverReserve = serverReserve;
    }
  }

  public static class Retry {

    @Min(1)
    @Max(10)
    private int maxAttempts = 3;

    @NotNull private Duration baseDelay = Duration.ofSeconds(1);
    @NotNull private Duration maxJitter = Duration.ofSeconds(1);
    @NotNull private Duration maxDelay = Duration.ofSeconds(30);
    @NotNull private Duration patience = Duration.ofMinutes(15);

    @Min(0)
    private int maxUncountedWaits = 10;

    public int getMaxAttempts() {
      return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
      this.maxAttempts = maxAttempts;
    }

    public Duration getBaseDelay() {
      return baseDelay;
    }

    public void setBaseDelay(Duration baseDelay) {
      this.baseDelay = baseDelay;
    }

    public Duration getMaxJitter() {
      return maxJitter;
    }

    public void setMaxJitter(Duration maxJitter) {
      this.maxJitter = maxJitter;
    }

    public Duration getMaxDelay() {
      return maxDelay;
    }

    public void setMaxDelay(Duration maxDelay) {
      this.maxDelay = maxDelay;
    }

    public Duration getPatience() {
      return patience;
    }

    public void setPatience(Duration patience) {
      this.patience = patience;
    }

    public int getMaxUncountedWaits() {
      return maxUncountedWaits;
    }

    public void setMaxUncountedWaits(int maxUncountedWaits) {
      this.maxUncountedWaits = maxUncountedWaits;
    }
  }

  public static class Cache {

    @NotNull private Duration ttl = Duration.ofMinutes(5);

    @Min(1)
    private int capacity = 50;

    public Duration getTtl() {
      return ttl;
    }

    public void setTtl(Duration ttl) {
      this.ttl = ttl;
    }

    public int getCapacity() {
      return capacity;
    }

    public void setCapacity(int capacity) {
      this.capacity = capacity;
    }
  }

  public static class Offline {

    @Min(1)
    private int failureThreshold = 1;

    @NotNull private Duration probeInterval = Duration.ofSeconds(60);

    private boolean watchdogEnabled = true;

    /** Content served for a path when the remote is unreachable and nothing is cached. */
    private Map<String, String> fallbacks = new LinkedHashMap<>();

    public int getFailureThreshold() {
      return failureThreshold;
    }

    public void setFailureThreshold(int failureThreshold) {
      this.failureThreshold = failureThreshold;
    }

    public Duration getProbeInterval() {
      return probeInterval;
    }

    public void setProbeInterval(Duration probeInterval) {
      this.probeInterval = probeInterval;
    }

    public boolean isWatchdogEnabled() {
      return watchdogEnabled;
    }

    public void setWatchdogEnabled(boolean watchdogEnabled) {
      this.watchdogEnabled = watchdogEnabled;
    }

    public Map<String, String> getFallbacks() {
      return fallbacks;
    }

    public void setFallbacks(Map<String, String> fallbacks) {
      this.fallbacks = fallbacks;
    }
  }

  public static class Write {

    @Min(1)
    private int conflictAttempts = 3;

    @NotNull private Duration conflictDelay = Duration.ofSeconds(1);

    @Min(1)
    private int readBatchSize = 5;

    @NotNull private Duration readBatchPause = Duration.ofMillis(100);

    public int getConflictAttempts() {
      return conflictAttempts;
    }

    public void setConflictAttempts(int conflictAttempts) {
      this.conflictAttempts = conflictAttempts;
    }

    public Duration getConflictDelay() {
      return conflictDelay;
    }

    public void setConflictDelay(Duration conflictDelay) {
      this.conflictDelay = conflictDelay;
    }

    public int getReadBatchSize() {
      return readBatchSize;
    }

    public void setReadBatchSize(int readBatchSize) {
      this.readBatchSize = readBatchSize;
    }

    public Duration getReadBatchPause() {
      return readBatchPause;
    }

    public void setReadBatchPause(Duration readBatchPause) {
      this.readBatchPause = readBatchPause;
    }
  }

  public static class Deployment {

    @NotNull private Duration pollInterval = Duration.ofSeconds(10);
    @NotNull private Duration timeout = Duration.ofMinutes(5);
    @NotNull private Duration fetchTimeout = Duration.ofSeconds(15);
    @NotNull private Duration connectTimeout = Duration.ofSeconds(10);
    private String userAgent = "AI Advent Pages MCP/0.1";

    public Duration getPollInterval() {
      return pollInterval;
    }

    public void setPollInterval(Duration pollInterval) {
      this.pollInterval = pollInterval;
    }

    public Duration getTimeout() {
      return timeout;
    }

    public void setTimeout(Duration timeout) {
      this.timeout = timeout;
    }

    public Duration getFetchTimeout() {
      return fetchTimeout;
    }

    public void setFetchTimeout(Duration fetchTimeout) {
      this.fetchTimeout = fetchTimeout;
    }

    public Duration getConnectTimeout() {
      return connectTimeout;
    }

    public void setConnectTimeout(Duration connectTimeout) {
      this.connectTimeout = connectTimeout;
    }

    public String getUserAgent() {
      return userAgent;
    }

    public void setUserAgent(String userAgent) {
      this.userAgent = userAgent;
    }
  }
}
