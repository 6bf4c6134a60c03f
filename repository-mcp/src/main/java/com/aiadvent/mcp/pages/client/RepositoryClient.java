package com.aiadvent.mcp.pages.client;

import com.aiadvent.mcp.pages.cache.LocalCache;
import com.aiadvent.mcp.pages.client.RepositoryApi.BranchComparison;
import com.aiadvent.mcp.pages.client.RepositoryApi.CommitSummary;
import com.aiadvent.mcp.pages.client.RepositoryApi.FileWrite;
import com.aiadvent.mcp.pages.client.RepositoryApi.PeerChange;
import com.aiadvent.mcp.pages.client.RepositoryApi.PutResult;
import com.aiadvent.mcp.pages.client.RepositoryApi.RemoteDeployment;
import com.aiadvent.mcp.pages.client.RepositoryApi.RemoteFile;
import com.aiadvent.mcp.pages.client.RepositoryApi.RepositoryMetadata;
import com.aiadvent.mcp.pages.client.RepositoryApi.TreeEntry;
import com.aiadvent.mcp.pages.offline.ConnectivityMode;
import com.aiadvent.mcp.pages.offline.FallbackProvider;
import com.aiadvent.mcp.pages.offline.OfflineController;
import com.aiadvent.mcp.pages.retry.FailureClass;
import com.aiadvent.mcp.pages.retry.RepositoryOperationException;
import com.aiadvent.mcp.pages.retry.RetryExecutor;
import com.aiadvent.mcp.pages.retry.RetryPolicy;
import com.aiadvent.mcp.pages.support.CancellationToken;
import com.aiadvent.mcp.pages.support.OperationCancelledException;
import com.aiadvent.mcp.pages.support.ProgressListener;
import com.aiadvent.mcp.pages.support.Sleeper;
import com.aiadvent.mcp.pages.throttle.RateLimitSnapshot;
import com.aiadvent.mcp.pages.throttle.RequestThrottle;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.Nullable;
import org.springframework.util.StringUtils;

/**
 * Entry point for everything that talks to the remote repository. Every remote call goes through
 * the {@link RequestThrottle} and the {@link RetryExecutor}; reads additionally consult the
 * {@link OfflineController} and the {@link LocalCache}.
 *
 * <p>This is the last layer that turns failures into user-facing messages: writes and commits
 * return outcomes instead of throwing.
 */
public class RepositoryClient implements AutoCloseable {

  private static final Logger log = LoggerFactory.getLogger(RepositoryClient.class);

  private static final int SHORT_SHA_LENGTH = 7;
  private static final int MAX_RECENT_COMMITS = 100;

  private final RepositoryApi api;
  private final CredentialProvider credentials;
  private final RequestThrottle throttle;
  private final RetryExecutor retryExecutor;
  private final RetryPolicy retryPolicy;
  private final LocalCache<CacheKey, FileContent> cache;
  private final OfflineController offline;
  private final FallbackProvider fallbackProvider;
  private final Sleeper sleeper;
  private final Clock clock;
  private final Settings settings;
  private final ExecutorService readExecutor;
  private final AtomicReference<RepositoryRef> repository;
  private final AtomicReference<AccessCheck> grantedAccess = new AtomicReference<>();
  private final MeterRegistry meterRegistry;

  private final Timer writeTimer;
  private final Counter writeSuccessCounter;
  private final Counter writeFailureCounter;
  private final Counter commitSuccessCounter;
  private final Counter commitFailureCounter;
  private final Counter degradedReadCounter;

  /**
   * The client starts its own fixed pool of {@code settings.readBatchSize()} daemon threads for
   * batch reads and owns it. Spring closes the bean on shutdown; callers that construct the client
   * themselves must call {@link #close()}.
   */
  public RepositoryClient(
      RepositoryRef repository,
      RepositoryApi api,
      CredentialProvider credentials,
      RequestThrottle throttle,
      RetryExecutor retryExecutor,
      RetryPolicy retryPolicy,
      LocalCache<CacheKey, FileContent> cache,
      OfflineController offline,
      FallbackProvider fallbackProvider,
      Sleeper sleeper,
      Clock clock,
      Settings settings,
      @Nullable MeterRegistry meterRegistry) {
    this.repository = new AtomicReference<>(Objects.requireNonNull(repository, "repository"));
    this.api = Objects.requireNonNull(api, "api");
    this.credentials = Objects.requireNonNull(credentials, "credentials");
    this.throttle = Objects.requireNonNull(throttle, "throttle");
    this.retryExecutor = Objects.requireNonNull(retryExecutor, "retryExecutor");
    this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
    this.cache = Objects.requireNonNull(cache, "cache");
    this.offline = Objects.requireNonNull(offline, "offline");
    this.fallbackProvider = Objects.requireNonNull(fallbackProvider, "fallbackProvider");
    this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.settings = Objects.requireNonNull(settings, "settings");
    this.readExecutor =
        Executors.newFixedThreadPool(
            settings.readBatchSize(),
            r -> {
              Thread thread = new Thread(r, "repository-batch-read");
              thread.setDaemon(true);
              return thread;
            });
    MeterRegistry registry = meterRegistry;
    if (registry == null) {
      registry = new SimpleMeterRegistry();
    }
    this.meterRegistry = registry;
    this.writeTimer = registry.timer("repository_write_duration");
    this.writeSuccessCounter = registry.counter("repository_write_success_total");
    this.writeFailureCounter = registry.counter("repository_write_failure_total");
    this.commitSuccessCounter = registry.counter("repository_commit_success_total");
    this.commitFailureCounter = registry.counter("repository_commit_failure_total");
    this.degradedReadCounter = registry.counter("repository_read_degraded_total");
  }

  public RepositoryRef repository() {
    return repository.get();
  }

  /** Points the client at another repository or branch; cached access grants are dropped. */
  public void reconfigure(RepositoryRef newRepository) {
    RepositoryRef next = Objects.requireNonNull(newRepository, "newRepository");
    RepositoryRef previous = repository.getAndSet(next);
    grantedAccess.set(null);
    log.info("repository.client reconfigured from={} to={}@{}", previous.fullName(), next.fullName(), next.branch());
  }

  // reads

  public FileContent readFile(String path, @Nullable String ref) {
    return readFile(path, ref, true, CancellationToken.none());
  }

  public FileContent readFile(String path, @Nullable String ref, boolean useCache) {
    return readFile(path, ref, useCache, CancellationToken.none());
  }

  /**
   * Reads a file. A missing path yields {@code content == null}. While offline, or when the live
   * read fails for connectivity reasons, cached data or the configured fallback is returned,
   * tagged accordingly.
   */
  public FileContent readFile(
      String path, @Nullable String ref, boolean useCache, CancellationToken cancellation) {
    CancellationToken token = cancellation != null ? cancellation : CancellationToken.none();
    token.throwIfCancelled("read_file");
    String normalizedPath = normalizePath(path);
    RepositoryRef repo = repository.get();
    String resolvedRef = StringUtils.hasText(ref) ? ref.trim() : repo.branch();
    CacheKey key = new CacheKey(repo.fullName(), normalizedPath, resolvedRef);

    if (offline.isOffline()) {
      offline.probeIfDue(this::pingRemote);
      if (offline.isOffline()) {
        return degraded(key, "repository is offline");
      }
    }
    if (useCache) {
      Optional<FileContent> cached = cache.get(key);
      if (cached.isPresent()) {
        return cached.get().withSource(DataSource.CACHE);
      }
    }
    try {
      FileContent live = fetchLive(repo, normalizedPath, resolvedRef, token);
      if (live.exists()) {
        cache.put(key, live);
      } else {
        cache.invalidate(key);
      }
      return live;
    } catch (RepositoryOperationException ex) {
      if (ex.failureClass().degradesConnectivity()) {
        return degraded(key, ex.getMessage());
      }
      throw ex;
    }
  }

  public boolean fileExists(String path, @Nullable String ref) {
    return fileExists(path, ref, CancellationToken.none());
  }

  public boolean fileExists(String path, @Nullable String ref, CancellationToken cancellation) {
    FileContent content = readFile(path, ref, true, cancellation);
    return content.exists() && content.source() != DataSource.FALLBACK;
  }

  /**
   * Reads several files in batches of concurrent requests with a short pause between batches.
   * Failures are reported per path.
   */
  public BatchReadResult readFiles(List<String> paths, @Nullable String ref, CancellationToken cancellation) {
    Objects.requireNonNull(paths, "paths");
    CancellationToken token = cancellation != null ? cancellation : CancellationToken.none();
    List<String> unique = new ArrayList<>(new LinkedHashSet<>(paths));
    Map<String, FileContent> files = new LinkedHashMap<>();
    Map<String, String> errors = new LinkedHashMap<>();
    int batchSize = settings.readBatchSize();
    for (int start = 0; start < unique.size(); start += batchSize) {
      token.throwIfCancelled("read_files");
      List<String> batch = unique.subList(start, Math.min(unique.size(), start + batchSize));
      List<CompletableFuture<FileContent>> futures = new ArrayList<>();
      for (String path : batch) {
        futures.add(
            CompletableFuture.supplyAsync(() -> readFile(path, ref, true, token), readExecutor));
      }
      for (int i = 0; i < batch.size(); i++) {
        String path = batch.get(i);
        try {
          files.put(path, futures.get(i).join());
        } catch (CompletionException ex) {
          Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
          log.warn("repository.read_files failed path={} reason={}", path, cause.getMessage());
          errors.put(path, describeFailure(cause));
        }
      }
      if (start + batchSize < unique.size()) {
        sleeper.sleep(settings.readBatchPause(), token);
      }
    }
    token.throwIfCancelled("read_files");
    return new BatchReadResult(files, errors);
  }

  // writes

  public WriteOutcome writeFile(
      String path, String content, String message, boolean isBinary, ProgressListener progress) {
    return writeFile(path, decodeContent(content, isBinary), message, progress);
  }

  /**
   * Creates or updates one file on the working branch. The current version tag is looked up
   * first; a concurrent change between lookup and write surfaces as a conflict outcome.
   */
  public WriteOutcome writeFile(
      String path, byte[] content, String message, ProgressListener progress) {
    return writeOnce(path, content, message, ProgressListener.orNone(progress), CancellationToken.none(), 1);
  }

  public WriteOutcome writeFileWithRetry(
      String path, String content, String message, boolean isBinary, ProgressListener progress) {
    return writeFileWithRetry(
        path, decodeContent(content, isBinary), message, progress, CancellationToken.none());
  }

  /** Like {@link #writeFile} but retries version conflicts, waiting one second longer each time. */
  public WriteOutcome writeFileWithRetry(
      String path,
      byte[] content,
      String message,
      ProgressListener progress,
      CancellationToken cancellation) {
    CancellationToken token = cancellation != null ? cancellation : CancellationToken.none();
    ProgressListener listener = ProgressListener.orNone(progress);
    int maxAttempts = settings.writeConflictAttempts();
    WriteOutcome outcome = null;
    for (int attempt = 1; attempt <= maxAttempts; attempt++) {
      outcome = writeOnce(path, content, message, listener, token, attempt);
      if (outcome.success() || outcome.failureClass() != FailureClass.CONFLICT) {
        return outcome;
      }
      if (attempt < maxAttempts) {
        Duration delay = settings.writeConflictDelay().multipliedBy(attempt);
        log.warn(
            "repository.write_file conflict path={} attempt={}/{} retryIn={}ms",
            path,
            attempt,
            maxAttempts,
            delay.toMillis());
        sleeper.sleep(delay, token);
      }
    }
    return outcome;
  }

  /**
   * Commits several files atomically: branch tip, base tree, new tree, commit, then the branch
   * ref is moved. A failure before the last step leaves the branch untouched.
   */
  public CommitOutcome commitFiles(
      List<CommitFile> files, String message, ProgressListener progress, CancellationToken cancellation) {
    if (files == null || files.isEmpty()) {
      throw new IllegalArgumentException("files must not be empty");
    }
    if (!StringUtils.hasText(message)) {
      throw new IllegalArgumentException("message must not be blank");
    }
    CancellationToken token = cancellation != null ? cancellation : CancellationToken.none();
    ProgressListener listener = ProgressListener.orNone(progress);
    RepositoryRef repo = repository.get();
    String branch = repo.branch();
    List<TreeEntry> entries =
        files.stream().map(file -> new TreeEntry(normalizePath(file.path()), file.content())).toList();

    String stage = "access";
    String tip = null;
    try {
      ensureWriteAccess(token);
      stage = "branch_tip";
      listener.onProgress(10, "Resolving tip of " + branch);
      tip = live("commit.branch_tip", token, context -> api.getBranchTip(context, repo, branch));

      stage = "base_tree";
      listener.onProgress(25, "Reading base tree");
      String parentTip = tip;
      String baseTree =
          live("commit.base_tree", token, context -> api.getCommitTree(context, repo, parentTip));

      stage = "tree";
      listener.onProgress(45, "Creating tree with %d file(s)".formatted(entries.size()));
      String tree =
          live("commit.create_tree", token, context -> api.createTree(context, repo, baseTree, entries));

      stage = "commit";
      listener.onProgress(65, "Creating commit");
      String commit =
          live(
              "commit.create_commit",
              token,
              context -> api.createCommit(context, repo, message, tree, List.of(parentTip)));

      stage = "update_ref";
      listener.onProgress(85, "Updating " + branch);
      live(
          "commit.update_ref",
          token,
          context -> {
            api.updateBranch(context, repo, branch, commit, false);
            return null;
          });

      for (TreeEntry entry : entries) {
        cache.put(
            new CacheKey(repo.fullName(), entry.path(), branch),
            new FileContent(entry.path(), branch, entry.content(), null, DataSource.LIVE));
      }
      listener.onProgress(100, "Committed %d file(s)".formatted(entries.size()));
      commitSuccessCounter.increment();
      log.info(
          "repository.commit_files success repo={} branch={} commit={} files={}",
          repo.fullName(),
          branch,
          commit,
          entries.size());
      return CommitOutcome.success(commit, tree, tip, entries.size());
    } catch (RepositoryOperationException ex) {
      commitFailureCounter.increment();
      log.warn(
          "repository.commit_files failure repo={} branch={} stage={} class={} reason={}",
          repo.fullName(),
          branch,
          stage,
          ex.failureClass(),
          ex.getMessage());
      return CommitOutcome.failure(stage, tip, ex.failureClass(), userMessage(ex));
    }
  }

  // access

  /**
   * Checks that the token can write to the repository. A positive result is remembered until
   * {@link #reconfigure} is called.
   */
  public AccessCheck checkAccess() {
    return checkAccess(CancellationToken.none());
  }

  public AccessCheck checkAccess(CancellationToken cancellation) {
    RepositoryRef repo = repository.get();
    try {
      String login = live("check_access.login", cancellation, api::currentLogin);
      RepositoryMetadata metadata =
          live("check_access.repository", cancellation, context -> api.getRepository(context, repo));
      Set<String> scopes = new LinkedHashSet<>();
      if (metadata.admin()) {
        scopes.add("admin");
      }
      if (metadata.push()) {
        scopes.add("push");
      }
      if (metadata.pull()) {
        scopes.add("pull");
      }
      boolean ok = metadata.push() || metadata.admin();
      String message =
          ok
              ? "Write access to %s confirmed for %s".formatted(repo.fullName(), login)
              : "%s has no write access to %s".formatted(login, repo.fullName());
      AccessCheck result = new AccessCheck(ok, login, scopes, message, ok ? null : FailureClass.AUTHORIZATION);
      if (ok) {
        grantedAccess.set(result);
      }
      log.info("repository.check_access repo={} login={} ok={} scopes={}", repo.fullName(), login, ok, scopes);
      return result;
    } catch (RepositoryOperationException ex) {
      log.warn("repository.check_access failure repo={} class={} reason={}", repo.fullName(), ex.failureClass(), ex.getMessage());
      return new AccessCheck(false, null, Set.of(), userMessage(ex), ex.failureClass());
    }
  }

  private void ensureWriteAccess(CancellationToken cancellation) {
    if (grantedAccess.get() != null) {
      return;
    }
    AccessCheck access = checkAccess(cancellation);
    if (!access.ok()) {
      FailureClass failureClass =
          access.failureClass() != null ? access.failureClass() : FailureClass.AUTHORIZATION;
      throw RepositoryOperationException.of("write_access", failureClass, access.message());
    }
  }

  // metadata

  public RepositoryInfo getRepositoryInfo() {
    return getRepositoryInfo(CancellationToken.none());
  }

  public RepositoryInfo getRepositoryInfo(CancellationToken cancellation) {
    RepositoryRef repo = repository.get();
    RepositoryMetadata metadata =
        live("repository_info", cancellation, context -> api.getRepository(context, repo));
    return new RepositoryInfo(
        metadata.fullName(),
        metadata.defaultBranch(),
        repo.branch(),
        metadata.privateRepository(),
        metadata.description(),
        metadata.htmlUrl(),
        metadata.hasPages(),
        publishedUrl(),
        metadata.admin(),
        metadata.push(),
        metadata.pull(),
        metadata.updatedAt());
  }

  public List<CommitSummary> listRecentCommits(int count) {
    return listRecentCommits(count, CancellationToken.none());
  }

  public List<CommitSummary> listRecentCommits(int count, CancellationToken cancellation) {
    int limit = Math.max(1, Math.min(MAX_RECENT_COMMITS, count));
    RepositoryRef repo = repository.get();
    List<CommitSummary> commits =
        live(
            "recent_commits",
            cancellation,
            context -> api.recentCommits(context, repo, repo.branch(), limit));
    return commits.stream()
        .map(
            commit ->
                new CommitSummary(
                    shortSha(commit.sha()), commit.message(), commit.author(), commit.date(), commit.url()))
        .toList();
  }

  /** Refreshes the server budget when reachable; otherwise reports the last known state. */
  public RateLimitStatus rateLimitStatus() {
    return rateLimitStatus(true);
  }

  public RateLimitStatus rateLimitStatus(boolean refresh) {
    if (!refresh) {
      return new RateLimitStatus(false, throttle.snapshot());
    }
    boolean refreshed = false;
    try {
      pingRemote();
      refreshed = true;
    } catch (RepositoryApiException | RepositoryOperationException | CredentialException ex) {
      log.warn("repository.rate_limit refresh failed: {}", ex.getMessage());
    }
    return new RateLimitStatus(refreshed, throttle.snapshot());
  }

  public ConnectionTest testConnection() {
    return testConnection(CancellationToken.none());
  }

  public ConnectionTest testConnection(CancellationToken cancellation) {
    Instant startedAt = clock.instant();
    try {
      RateLimitSnapshot budget = live("test_connection", cancellation, api::rateLimit);
      AccessCheck access = checkAccess(cancellation);
      Duration responseTime = Duration.between(startedAt, clock.instant());
      return new ConnectionTest(
          access.ok(), access.login(), responseTime.toMillis(), budget.remaining(), access.message());
    } catch (RepositoryOperationException ex) {
      Duration responseTime = Duration.between(startedAt, clock.instant());
      return new ConnectionTest(false, null, responseTime.toMillis(), -1, userMessage(ex));
    }
  }

  // branch primitives

  public String branchTip(String branch) {
    return branchTip(branch, CancellationToken.none());
  }

  public String branchTip(String branch, CancellationToken cancellation) {
    RepositoryRef repo = repository.get();
    return live("branch_tip", cancellation, context -> api.getBranchTip(context, repo, branch));
  }

  public String defaultBranch() {
    return defaultBranch(CancellationToken.none());
  }

  public String defaultBranch(CancellationToken cancellation) {
    RepositoryRef repo = repository.get();
    return live("default_branch", cancellation, context -> api.getRepository(context, repo))
        .defaultBranch();
  }

  public BranchComparison compareBranches(String base, String head) {
    return compareBranches(base, head, CancellationToken.none());
  }

  public BranchComparison compareBranches(String base, String head, CancellationToken cancellation) {
    RepositoryRef repo = repository.get();
    return live("compare", cancellation, context -> api.compare(context, repo, base, head));
  }

  public List<PeerChange> listOpenPeerChanges(String baseBranch) {
    return listOpenPeerChanges(baseBranch, CancellationToken.none());
  }

  public List<PeerChange> listOpenPeerChanges(String baseBranch, CancellationToken cancellation) {
    RepositoryRef repo = repository.get();
    return live(
        "open_pull_requests",
        cancellation,
        context -> api.listOpenPullRequests(context, repo, baseBranch));
  }

  public void createBranch(String branch, String commitSha) {
    createBranch(branch, commitSha, CancellationToken.none());
  }

  public void createBranch(String branch, String commitSha, CancellationToken cancellation) {
    RepositoryRef repo = repository.get();
    ensureWriteAccess(cancellation);
    live(
        "create_branch",
        cancellation,
        context -> {
          api.createBranch(context, repo, branch, commitSha);
          return null;
        });
    log.info("repository.create_branch success repo={} branch={} sha={}", repo.fullName(), branch, shortSha(commitSha));
  }

  public void fastForwardBranch(String branch, String commitSha) {
    fastForwardBranch(branch, commitSha, CancellationToken.none());
  }

  /** Moves {@code branch} to {@code commitSha}; rejected by the remote unless it is a fast-forward. */
  public void fastForwardBranch(String branch, String commitSha, CancellationToken cancellation) {
    RepositoryRef repo = repository.get();
    ensureWriteAccess(cancellation);
    live(
        "fast_forward",
        cancellation,
        context -> {
          api.updateBranch(context, repo, branch, commitSha, false);
          return null;
        });
    log.info("repository.fast_forward success repo={} branch={} sha={}", repo.fullName(), branch, shortSha(commitSha));
  }

  // deployment primitives

  public Optional<RemoteDeployment> latestDeployment(CancellationToken cancellation) {
    RepositoryRef repo = repository.get();
    return live("latest_deployment", cancellation, context -> api.latestDeployment(context, repo));
  }

  /** Public address of the published site. */
  public String publishedUrl() {
    if (StringUtils.hasText(settings.publishedUrl())) {
      return settings.publishedUrl().trim();
    }
    RepositoryRef repo = repository.get();
    String host = repo.owner().toLowerCase(Locale.ROOT) + ".github.io";
    if (repo.name().equalsIgnoreCase(host)) {
      return "https://" + host + "/";
    }
    return "https://" + host + "/" + repo.name() + "/";
  }

  // connectivity

  public ConnectivityMode connectivityMode() {
    return offline.mode();
  }

  public OfflineController.Status connectivityStatus() {
    return offline.status();
  }

  /** Probes the remote if offline and a probe is due. */
  public ConnectivityMode probeConnectivity() {
    return offline.probeIfDue(this::pingRemote);
  }

  /**
   * Single throttled rate limit request without retries; used as reachability probe. Never waits
   * for the server budget: while it is exhausted the probe fails with {@link
   * FailureClass#RATE_LIMITED}.
   */
  public void pingRemote() {
    api.rateLimit(
        new RequestContext(
            credential(), () -> throttle.admit(CancellationToken.none(), Duration.ZERO)));
  }

  @Override
  public void close() {
    readExecutor.shutdownNow();
  }

  // internals

  private WriteOutcome writeOnce(
      String path,
      byte[] content,
      String message,
      ProgressListener listener,
      CancellationToken token,
      int attempt) {
    if (content == null) {
      throw new IllegalArgumentException("content must not be null");
    }
    if (!StringUtils.hasText(message)) {
      throw new IllegalArgumentException("message must not be blank");
    }
    String normalizedPath = normalizePath(path);
    RepositoryRef repo = repository.get();
    String branch = repo.branch();
    Timer.Sample sample = Timer.start(meterRegistry);
    try {
      ensureWriteAccess(token);
      listener.onProgress(10, "Reading current version of " + normalizedPath);
      String currentSha =
          live(
                  "write_file.lookup",
                  token,
                  context -> api.getFile(context, repo, normalizedPath, branch))
              .map(RemoteFile::sha)
              .orElse(null);

      listener.onProgress(40, (currentSha == null ? "Creating " : "Updating ") + normalizedPath);
      PutResult result =
          live(
              "write_file",
              token,
              context ->
                  api.putFile(
                      context, repo, new FileWrite(normalizedPath, content, message, branch, currentSha)));

      cache.put(
          new CacheKey(repo.fullName(), normalizedPath, branch),
          new FileContent(normalizedPath, branch, content, result.contentSha(), DataSource.LIVE));
      listener.onProgress(100, "Saved " + normalizedPath);
      writeSuccessCounter.increment();
      log.info(
          "repository.write_file success repo={} branch={} path={} commit={} attempt={}",
          repo.fullName(),
          branch,
          normalizedPath,
          result.commitSha(),
          attempt);
      return WriteOutcome.success(normalizedPath, result.contentSha(), result.commitSha(), attempt);
    } catch (RepositoryOperationException ex) {
      writeFailureCounter.increment();
      log.warn(
          "repository.write_file failure repo={} path={} class={} attempt={} reason={}",
          repo.fullName(),
          normalizedPath,
          ex.failureClass(),
          attempt,
          ex.getMessage());
      return WriteOutcome.failure(normalizedPath, ex.failureClass(), userMessage(ex), attempt);
    } finally {
      sample.stop(writeTimer);
    }
  }

  private FileContent fetchLive(
      RepositoryRef repo, String path, String ref, CancellationToken cancellation) {
    return live("read_file", cancellation, context -> api.getFile(context, repo, path, ref))
        .map(file -> new FileContent(path, ref, file.content(), file.sha(), DataSource.LIVE))
        .orElseGet(() -> FileContent.missing(path, ref));
  }

  private FileContent degraded(CacheKey key, String reason) {
    degradedReadCounter.increment();
    Optional<FileContent> cached = cache.get(key);
    if (cached.isPresent()) {
      log.warn("repository.read_file degraded source=cache path={} reason={}", key.path(), reason);
      return cached.get().withSource(DataSource.CACHE);
    }
    byte[] fallback = fallbackProvider.fallbackFor(key.path()).orElse(new byte[0]);
    log.warn("repository.read_file degraded source=fallback path={} reason={}", key.path(), reason);
    return new FileContent(key.path(), key.ref(), fallback, null, DataSource.FALLBACK);
  }

  /**
   * Throttled, retried remote call. Every HTTP request is admitted by the throttle, which rejects
   * server resets further away than the retry patience. The final outcome feeds the offline
   * controller.
   */
  private <T> T live(
      String operation, CancellationToken cancellation, Function<RequestContext, T> request) {
    CancellationToken token = cancellation != null ? cancellation : CancellationToken.none();
    try {
      T result =
          retryExecutor.execute(
              operation,
              retryPolicy,
              token,
              () ->
                  request.apply(
                      new RequestContext(
                          credential(), () -> throttle.admit(token, retryPolicy.patience()))));
      offline.recordSuccess();
      return result;
    } catch (RepositoryOperationException ex) {
      offline.recordFailure(ex.failureClass(), ex.getMessage());
      throw ex;
    }
  }

  private String credential() {
    if (credentials.needsRefresh()) {
      credentials.refresh();
    }
    return credentials.currentToken();
  }

  private static byte[] decodeContent(String content, boolean isBinary) {
    if (content == null) {
      throw new IllegalArgumentException("content must not be null");
    }
    if (!isBinary) {
      return content.getBytes(StandardCharsets.UTF_8);
    }
    try {
      return Base64.getMimeDecoder().decode(content);
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("Binary content must be base64 encoded", ex);
    }
  }

  static String normalizePath(String path) {
    if (!StringUtils.hasText(path)) {
      throw new IllegalArgumentException("path must not be blank");
    }
    String normalized = path.trim().replace('\\', '/');
    while (normalized.startsWith("/")) {
      normalized = normalized.substring(1);
    }
    if (normalized.isEmpty()) {
      throw new IllegalArgumentException("path must not point at the repository root");
    }
    for (String segment : normalized.split("/")) {
      if ("..".equals(segment)) {
        throw new IllegalArgumentException("path must not contain '..': " + path);
      }
    }
    return normalized;
  }

  static String shortSha(String sha) {
    if (sha == null) {
      return null;
    }
    return sha.length() > SHORT_SHA_LENGTH ? sha.substring(0, SHORT_SHA_LENGTH) : sha;
  }

  private static String describeFailure(Throwable failure) {
    if (failure instanceof RepositoryOperationException ex) {
      return userMessage(ex);
    }
    if (failure instanceof OperationCancelledException) {
      return "cancelled";
    }
    return StringUtils.hasText(failure.getMessage()) ? failure.getMessage() : failure.getClass().getSimpleName();
  }

  static String userMessage(RepositoryOperationException ex) {
    String detail = ex.getCause() != null && StringUtils.hasText(ex.getCause().getMessage())
        ? ex.getCause().getMessage()
        : ex.getMessage();
    return switch (ex.failureClass()) {
      case AUTHORIZATION -> "Access denied: " + detail;
      case VALIDATION -> "Request rejected by the repository: " + detail;
      case CONFLICT -> "The file was changed by someone else; reload it and try again";
      case NOT_FOUND -> "Repository, branch or file not found: " + detail;
      case RATE_LIMITED, SECONDARY_RATE_LIMITED -> "Rate limit exceeded, try again later: " + detail;
      case SERVER, NETWORK -> "Repository is unreachable: " + detail;
      case UNCLASSIFIED -> "Repository operation failed: " + detail;
    };
  }

  // types

  public record CacheKey(String repository, String path, String ref) {}

  public record CommitFile(String path, byte[] content) {

    public CommitFile {
      Objects.requireNonNull(content, "content");
    }

    public static CommitFile text(String path, String content) {
      return new CommitFile(path, content.getBytes(StandardCharsets.UTF_8));
    }
  }

  /**
   * @param writeConflictAttempts attempts of {@link #writeFileWithRetry} on version conflicts
   * @param writeConflictDelay delay after the first conflict, grows linearly
   * @param publishedUrl public site address, derived from the repository name when blank
   */
  public record Settings(
      int writeConflictAttempts,
      Duration writeConflictDelay,
      int readBatchSize,
      Duration readBatchPause,
      @Nullable String publishedUrl) {

    public Settings {
      if (writeConflictAttempts < 1) {
        throw new IllegalArgumentException("writeConflictAttempts must be at least 1");
      }
      if (readBatchSize < 1) {
        throw new IllegalArgumentException("readBatchSize must be at least 1");
      }
      writeConflictDelay = writeConflictDelay == null ? Duration.ofSeconds(1) : writeConflictDelay;
      readBatchPause = readBatchPause == null ? Duration.ofMillis(100) : readBatchPause;
    }

    public static Settings defaults() {
      return new Settings(3, Duration.ofSeconds(1), 5, Duration.ofMillis(100), null);
    }
  }

  public record WriteOutcome(
      boolean success,
      String path,
      @Nullable String versionTag,
      @Nullable String commitSha,
      @Nullable FailureClass failureClass,
      String message,
      int attempts) {

    static WriteOutcome success(String path, String versionTag, String commitSha, int attempts) {
      return new WriteOutcome(
          true, path, versionTag, commitSha, null, "Saved " + path, attempts);
    }

    static WriteOutcome failure(String path, FailureClass failureClass, String message, int attempts) {
      return new WriteOutcome(false, path, null, null, failureClass, message, attempts);
    }
  }

  public record CommitOutcome(
      boolean success,
      @Nullable String commitSha,
      @Nullable String treeSha,
      @Nullable String parentSha,
      int fileCount,
      @Nullable String failedStage,
      @Nullable FailureClass failureClass,
      String message) {

    static CommitOutcome success(String commitSha, String treeSha, String parentSha, int fileCount) {
      return new CommitOutcome(
          true,
          commitSha,
          treeSha,
          parentSha,
          fileCount,
          null,
          null,
          "Committed %d file(s) as %s".formatted(fileCount, shortSha(commitSha)));
    }

    static CommitOutcome failure(
        String stage, @Nullable String parentSha, FailureClass failureClass, String message) {
      return new CommitOutcome(false, null, null, parentSha, 0, stage, failureClass, message);
    }
  }

  public record AccessCheck(
      boolean ok,
      @Nullable String login,
      Set<String> grantedScopes,
      String message,
      @Nullable FailureClass failureClass) {

    public AccessCheck {
      grantedScopes = grantedScopes == null ? Set.of() : Set.copyOf(grantedScopes);
    }
  }

  public record BatchReadResult(Map<String, FileContent> files, Map<String, String> errors) {

    public BatchReadResult {
      files = Collections.unmodifiableMap(new LinkedHashMap<>(files));
      errors = Collections.unmodifiableMap(new LinkedHashMap<>(errors));
    }
  }

  public record RepositoryInfo(
      String fullName,
      String defaultBranch,
      String workingBranch,
      boolean privateRepository,
      @Nullable String description,
      @Nullable String htmlUrl,
      boolean hasPages,
      String pagesUrl,
      boolean admin,
      boolean push,
      boolean pull,
      @Nullable Instant updatedAt) {}

  public record RateLimitStatus(boolean refreshed, RequestThrottle.ThrottleSnapshot throttle) {}

  public record ConnectionTest(
      boolean success,
      @Nullable String login,
      long responseTimeMs,
      int rateLimitRemaining,
      String message) {}
}
