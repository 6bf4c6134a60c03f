package com.aiadvent.mcp.pages.deployment;

import com.aiadvent.mcp.pages.client.RepositoryApi.DeploymentState;
import com.aiadvent.mcp.pages.client.RepositoryApi.RemoteDeployment;
import com.aiadvent.mcp.pages.client.RepositoryClient;
import com.aiadvent.mcp.pages.retry.RepositoryOperationException;
import com.aiadvent.mcp.pages.support.CancellationToken;
import com.aiadvent.mcp.pages.support.OperationCancelledException;
import com.aiadvent.mcp.pages.support.ProgressListener;
import com.aiadvent.mcp.pages.support.RepositoryEvent;
import com.aiadvent.mcp.pages.support.RepositoryEventListener;
import com.aiadvent.mcp.pages.support.Sleeper;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.Nullable;
import org.springframework.util.StringUtils;

/**
 * Waits for the site publish triggered by a commit and checks that the published pages show the
 * new content. Polling is the only completion signal.
 */
public class DeploymentMonitor {

  private static final Logger log = LoggerFactory.getLogger(DeploymentMonitor.class);

  static final int COMMIT_PREFIX_LENGTH = 7;

  private final RepositoryClient client;
  private final PublishedContentFetcher contentFetcher;
  private final Sleeper sleeper;
  private final Clock clock;
  private final RepositoryEventListener eventListener;
  private final MonitorOptions defaults;
  private final MeterRegistry meterRegistry;
  private final Timer monitorTimer;

  public DeploymentMonitor(
      RepositoryClient client,
      PublishedContentFetcher contentFetcher,
      Sleeper sleeper,
      Clock clock,
      RepositoryEventListener eventListener,
      MonitorOptions defaults,
      @Nullable MeterRegistry meterRegistry) {
    this.client = Objects.requireNonNull(client, "client");
    this.contentFetcher = Objects.requireNonNull(contentFetcher, "contentFetcher");
    this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.eventListener = Objects.requireNonNull(eventListener, "eventListener");
    this.defaults = Objects.requireNonNull(defaults, "defaults");
    MeterRegistry registry = meterRegistry;
    if (registry == null) {
      registry = new SimpleMeterRegistry();
    }
    this.meterRegistry = registry;
    this.monitorTimer = registry.timer("repository_deployment_monitor_duration");
  }

  public MonitorOptions defaults() {
    return defaults;
  }

  /**
   * Polls the latest deployment until one built from {@code commitSha} finishes, the timeout
   * passes, the poll fails or {@code cancellation} fires.
   */
  public MonitorOutcome monitor(
      String commitSha,
      @Nullable MonitorOptions options,
      @Nullable ProgressListener progress,
      @Nullable CancellationToken cancellation) {
    if (!StringUtils.hasText(commitSha)) {
      throw new IllegalArgumentException("commitSha must not be blank");
    }
    MonitorOptions effective = options != null ? options : defaults;
    ProgressListener listener = ProgressListener.orNone(progress);
    CancellationToken token = cancellation != null ? cancellation : CancellationToken.none();
    String prefix = commitPrefix(commitSha);
    Instant startedAt = clock.instant();
    DeploymentRecord last = null;
    int polls = 0;

    listener.onProgress(0, "Waiting for deployment of " + prefix);
    while (true) {
      if (token.isCancelled()) {
        return finish(Result.CANCELLED, last, startedAt, polls, "Deployment monitoring cancelled", listener);
      }
      Duration elapsed = Duration.between(startedAt, clock.instant());
      if (elapsed.compareTo(effective.timeout()) >= 0) {
        return finish(
            Result.TIMEOUT,
            last,
            startedAt,
            polls,
            "Deployment of %s not finished after %ds".formatted(prefix, effective.timeout().toSeconds()),
            listener);
      }

      polls++;
      Optional<RemoteDeployment> latest;
      try {
        latest = client.latestDeployment(token);
      } catch (OperationCancelledException ex) {
        return finish(Result.CANCELLED, last, startedAt, polls, "Deployment monitoring cancelled", listener);
      } catch (RepositoryOperationException ex) {
        return finish(
            Result.FAILED, last, startedAt, polls, "Deployment status unavailable: " + ex.getMessage(), listener);
      }

      if (latest.isPresent() && latest.get().sha() != null && latest.get().sha().startsWith(prefix)) {
        last = toRecord(latest.get());
        if (last.status() == DeploymentRecord.Status.COMPLETED) {
          return finish(Result.COMPLETED, last, startedAt, polls, "Deployment of %s completed".formatted(prefix), listener);
        }
        if (last.status() == DeploymentRecord.Status.FAILED) {
          return finish(Result.FAILED, last, startedAt, polls, "Deployment of %s failed".formatted(prefix), listener);
        }
      }

      elapsed = Duration.between(startedAt, clock.instant());
      Duration remaining = effective.timeout().minus(elapsed);
      int percentage =
          (int) Math.min(95, elapsed.toMillis() * 100 / Math.max(1, effective.timeout().toMillis()));
      listener.onProgress(
          percentage,
          last == null
              ? "Waiting for deployment of %s to start".formatted(prefix)
              : "Deployment of %s in progress".formatted(prefix));
      log.debug("repository.deployment poll={} commit={} elapsed={}s", polls, prefix, elapsed.toSeconds());
      if (remaining.isNegative() || remaining.isZero()) {
        continue;
      }
      Duration wait = remaining.compareTo(effective.pollInterval()) < 0 ? remaining : effective.pollInterval();
      try {
        sleeper.sleep(wait, token);
      } catch (OperationCancelledException ex) {
        return finish(Result.CANCELLED, last, startedAt, polls, "Deployment monitoring cancelled", listener);
      }
    }
  }

  /**
   * Fetches the published page at {@code path} and checks that every marker appears in it. Pages
   * that are reachable but do not show the markers yet are reported, not failed.
   */
  public VerificationResult verify(@Nullable List<String> expectedMarkers, @Nullable String path) {
    String baseUrl = client.publishedUrl();
    if (!StringUtils.hasText(baseUrl)) {
      return new VerificationResult(
          VerificationStatus.NO_PUBLISHED_URL, null, 0, Duration.ZERO, List.of(), "No published URL known");
    }
    String url = resolve(baseUrl, path);
    PublishedContentFetcher.FetchResult fetched = contentFetcher.fetch(url);
    if (!fetched.isSuccessful()) {
      String reason =
          fetched.status() > 0 ? "HTTP " + fetched.status() : Objects.toString(fetched.error(), "no response");
      return new VerificationResult(
          VerificationStatus.UNREACHABLE,
          url,
          fetched.status(),
          fetched.responseTime(),
          List.of(),
          "Published site not reachable: " + reason);
    }
    List<String> missing = new ArrayList<>();
    String body = fetched.body() != null ? fetched.body() : "";
    if (expectedMarkers != null) {
      for (String marker : expectedMarkers) {
        if (StringUtils.hasText(marker) && !body.contains(marker)) {
          missing.add(marker);
        }
      }
    }
    if (!missing.isEmpty()) {
      return new VerificationResult(
          VerificationStatus.CONTENT_NOT_VISIBLE,
          url,
          fetched.status(),
          fetched.responseTime(),
          missing,
          "Site is up but %d expected marker(s) are not visible yet".formatted(missing.size()));
    }
    return new VerificationResult(
        VerificationStatus.VERIFIED,
        url,
        fetched.status(),
        fetched.responseTime(),
        List.of(),
        "Published content verified");
  }

  /** Monitors the publish of {@code commitSha}, then verifies the published content. */
  public WorkflowResult completeDeploymentWorkflow(
      String commitSha,
      @Nullable List<String> expectedMarkers,
      @Nullable String path,
      @Nullable ProgressListener progress,
      @Nullable CancellationToken cancellation) {
    ProgressListener listener = ProgressListener.orNone(progress);
    listener.onProgress(5, "Starting deployment tracking");
    MonitorOutcome outcome = monitor(commitSha, null, listener.scaled(10, 80), cancellation);
    if (outcome.result() != Result.COMPLETED) {
      listener.onProgress(100, outcome.message());
      return new WorkflowResult(false, outcome, null, outcome.message());
    }
    listener.onProgress(85, "Verifying published content");
    VerificationResult verification = verify(expectedMarkers, path);
    listener.onProgress(95, verification.message());
    boolean success = verification.status() == VerificationStatus.VERIFIED
        || verification.status() == VerificationStatus.CONTENT_NOT_VISIBLE;
    listener.onProgress(100, success ? "Deployment finished" : "Deployment finished, site not reachable");
    return new WorkflowResult(success, outcome, verification, verification.message());
  }

  private MonitorOutcome finish(
      Result result,
      @Nullable DeploymentRecord deployment,
      Instant startedAt,
      int polls,
      String message,
      ProgressListener listener) {
    Duration elapsed = Duration.between(startedAt, clock.instant());
    monitorTimer.record(elapsed);
    meterRegistry.counter("repository_deployment_monitor_total", "result", result.name()).increment();
    listener.onProgress(100, message);
    if (result == Result.COMPLETED) {
      log.info("repository.deployment finished result={} elapsed={}s polls={}", result, elapsed.toSeconds(), polls);
    } else {
      log.warn("repository.deployment finished result={} elapsed={}s polls={} reason={}", result, elapsed.toSeconds(), polls, message);
    }
    Map<String, Object> details = new LinkedHashMap<>();
    details.put("result", result.name());
    details.put("elapsedSeconds", elapsed.toSeconds());
    details.put("polls", polls);
    if (deployment != null) {
      details.put("deploymentId", deployment.id());
      details.put("sourceCommit", deployment.sourceCommit());
    }
    eventListener.onEvent(
        new RepositoryEvent(RepositoryEvent.Type.DEPLOYMENT_FINISHED, message, clock.instant(), details));
    return new MonitorOutcome(result, deployment, elapsed, polls, message);
  }

  private DeploymentRecord toRecord(RemoteDeployment deployment) {
    DeploymentRecord.Status status =
        deployment.state() == DeploymentState.SUCCESS
            ? DeploymentRecord.Status.COMPLETED
            : deployment.state() == DeploymentState.FAILURE
                ? DeploymentRecord.Status.FAILED
                : DeploymentRecord.Status.PENDING;
    return new DeploymentRecord(
        deployment.id(),
        deployment.sha(),
        status,
        client.publishedUrl(),
        deployment.createdAt(),
        deployment.updatedAt());
  }

  static String commitPrefix(String commitSha) {
    String trimmed = commitSha.trim();
    return trimmed.length() > COMMIT_PREFIX_LENGTH ? trimmed.substring(0, COMMIT_PREFIX_LENGTH) : trimmed;
  }

  private static String resolve(String baseUrl, @Nullable String path) {
    if (!StringUtils.hasText(path)) {
      return baseUrl;
    }
    String base = baseUrl.endsWith("/") ? baseUrl : baseUrl + "/";
    String relative = path.trim();
    while (relative.startsWith("/")) {
      relative = relative.substring(1);
    }
    return base + relative;
  }

  /**
   * @param pollInterval delay between two status polls
   * @param timeout wall-clock budget for the whole monitoring
   */
  public record MonitorOptions(Duration pollInterval, Duration timeout) {

    public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofSeconds(10);
    public static final Duration DEFAULT_TIMEOUT = Duration.ofMinutes(5);

    public MonitorOptions {
      pollInterval =
          pollInterval == null || pollInterval.isNegative() || pollInterval.isZero()
              ? DEFAULT_POLL_INTERVAL
              : pollInterval;
      timeout = timeout == null || timeout.isNegative() || timeout.isZero() ? DEFAULT_TIMEOUT : timeout;
    }

    public static MonitorOptions defaults() {
      return new MonitorOptions(DEFAULT_POLL_INTERVAL, DEFAULT_TIMEOUT);
    }
  }

  public enum Result {
    COMPLETED,
    TIMEOUT,
    CANCELLED,
    FAILED
  }

  public record MonitorOutcome(
      Result result,
      @Nullable DeploymentRecord deployment,
      Duration elapsed,
      int polls,
      String message) {}

  public enum VerificationStatus {
    VERIFIED,
    CONTENT_NOT_VISIBLE,
    UNREACHABLE,
    NO_PUBLISHED_URL
  }

  public record VerificationResult(
      VerificationStatus status,
      @Nullable String url,
      int httpStatus,
      Duration responseTime,
      List<String> missingMarkers,
      String message) {

    public VerificationResult {
      missingMarkers = List.copyOf(missingMarkers);
    }
  }

  public record WorkflowResult(
      boolean success,
      MonitorOutcome monitor,
      @Nullable VerificationResult verification,
      String message) {}
}
