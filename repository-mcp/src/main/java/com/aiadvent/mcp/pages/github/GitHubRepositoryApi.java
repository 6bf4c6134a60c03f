package com.aiadvent.mcp.pages.github;

import com.aiadvent.mcp.pages.client.RepositoryApi;
import com.aiadvent.mcp.pages.client.RepositoryApiException;
import com.aiadvent.mcp.pages.client.RepositoryRef;
import com.aiadvent.mcp.pages.client.RequestContext;
import com.aiadvent.mcp.pages.throttle.RateLimitSnapshot;
import com.aiadvent.mcp.pages.throttle.RateLimitState;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.io.IOException;
import java.io.InputStream;
import java.net.URL;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Date;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import org.kohsuke.github.GHCommit;
import org.kohsuke.github.GHCommitBuilder;
import org.kohsuke.github.GHCompare;
import org.kohsuke.github.GHContent;
import org.kohsuke.github.GHContentUpdateResponse;
import org.kohsuke.github.GHDeployment;
import org.kohsuke.github.GHDeploymentStatus;
import org.kohsuke.github.GHFileNotFoundException;
import org.kohsuke.github.GHIssueState;
import org.kohsuke.github.GHPullRequest;
import org.kohsuke.github.GHRateLimit;
import org.kohsuke.github.GHRef;
import org.kohsuke.github.GHRepository;
import org.kohsuke.github.GHTreeBuilder;
import org.kohsuke.github.GHUser;
import org.kohsuke.github.GitHub;
import org.kohsuke.github.GitUser;
import org.kohsuke.github.PagedIterator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.Nullable;

/**
 * {@link RepositoryApi} backed by the kohsuke GitHub client. After every call the rate limit
 * reported by GitHub is copied into the shared {@link RateLimitState}.
 *
 * <p>Every HTTP request kohsuke sends on our behalf is preceded by {@link
 * RequestContext#beforeRequest()}. Repository handles are kept per client so that an operation
 * costs a single request once the handle is known.
 */
public class GitHubRepositoryApi implements RepositoryApi {

  private static final Logger log = LoggerFactory.getLogger(GitHubRepositoryApi.class);

  static final String PAGES_ENVIRONMENT = "github-pages";
  static final int PAGE_SIZE = 100;

  // kohsuke reports this placeholder limit until GitHub has answered once
  private static final int UNKNOWN_LIMIT = 1_000_000;

  private final GitHubClientFactory clientFactory;
  private final RateLimitState rateLimitState;
  private final Cache<HandleKey, GHRepository> handles =
      Caffeine.newBuilder().maximumSize(64).expireAfterWrite(Duration.ofMinutes(30)).build();

  public GitHubRepositoryApi(GitHubClientFactory clientFactory, RateLimitState rateLimitState) {
    this.clientFactory = Objects.requireNonNull(clientFactory, "clientFactory");
    this.rateLimitState = Objects.requireNonNull(rateLimitState, "rateLimitState");
  }

  @Override
  public Optional<RemoteFile> getFile(
      RequestContext context, RepositoryRef repository, String path, String ref) {
    return execute(
        context,
        "Read %s@%s:%s".formatted(repository.fullName(), ref, path),
        github -> {
          GHRepository repo = handle(github, context, repository);
          try {
            context.beforeRequest();
            GHContent content = repo.getFileContent(path, ref);
            return Optional.of(
                new RemoteFile(content.getPath(), readContent(content), content.getSha(), content.getSize()));
          } catch (GHFileNotFoundException ex) {
            log.debug("github.read_file missing repo={} ref={} path={}", repository.fullName(), ref, path);
            return Optional.empty();
          }
        });
  }

  @Override
  public PutResult putFile(RequestContext context, RepositoryRef repository, FileWrite write) {
    return execute(
        context,
        "Write %s@%s:%s".formatted(repository.fullName(), write.branch(), write.path()),
        github -> {
          GHRepository repo = handle(github, context, repository);
          var builder =
              repo.createContent()
                  .content(write.content())
                  .path(write.path())
                  .branch(write.branch())
                  .message(write.message());
          if (write.expectedSha() != null) {
            builder.sha(write.expectedSha());
          }
          context.beforeRequest();
          GHContentUpdateResponse response = builder.commit();
          String contentSha = response.getContent() != null ? response.getContent().getSha() : null;
          String commitSha = response.getCommit() != null ? response.getCommit().getSHA1() : null;
          log.debug(
              "github.write_file success repo={} path={} commit={}",
              repository.fullName(),
              write.path(),
              commitSha);
          return new PutResult(contentSha, commitSha);
        });
  }

  @Override
  public String getBranchTip(RequestContext context, RepositoryRef repository, String branch) {
    return execute(
        context,
        "Resolve branch %s of %s".formatted(branch, repository.fullName()),
        github -> {
          GHRepository repo = handle(github, context, repository);
          context.beforeRequest();
          return repo.getRef("heads/" + branch).getObject().getSha();
        });
  }

  @Override
  public String getCommitTree(RequestContext context, RepositoryRef repository, String commitSha) {
    return execute(
        context,
        "Read tree of commit %s in %s".formatted(commitSha, repository.fullName()),
        github -> {
          GHRepository repo = handle(github, context, repository);
          context.beforeRequest();
          return repo.getCommit(commitSha).getCommitShortInfo().getTreeSHA1();
        });
  }

  @Override
  public String createTree(
      RequestContext context, RepositoryRef repository, String baseTreeSha, List<TreeEntry> entries) {
    return execute(
        context,
        "Create tree in %s".formatted(repository.fullName()),
        github -> {
          GHTreeBuilder builder = handle(github, context, repository).createTree().baseTree(baseTreeSha);
          for (TreeEntry entry : entries) {
            builder.add(entry.path(), entry.content(), false);
          }
          context.beforeRequest();
          return builder.create().getSha();
        });
  }

  @Override
  public String createCommit(
      RequestContext context,
      RepositoryRef repository,
      String message,
      String treeSha,
      List<String> parents) {
    return execute(
        context,
        "Create commit in %s".formatted(repository.fullName()),
        github -> {
          GHCommitBuilder builder =
              handle(github, context, repository).createCommit().message(message).tree(treeSha);
          for (String parent : parents) {
            builder.parent(parent);
          }
          context.beforeRequest();
          return builder.create().getSHA1();
        });
  }

  @Override
  public void updateBranch(
      RequestContext context, RepositoryRef repository, String branch, String commitSha, boolean force) {
    execute(
        context,
        "Update branch %s of %s".formatted(branch, repository.fullName()),
        github -> {
          GHRepository repo = handle(github, context, repository);
          context.beforeRequest();
          GHRef ref = repo.getRef("heads/" + branch);
          context.beforeRequest();
          ref.updateTo(commitSha, force);
          log.debug("github.update_ref success repo={} branch={} sha={}", repository.fullName(), branch, commitSha);
          return null;
        });
  }

  @Override
  public void createBranch(
      RequestContext context, RepositoryRef repository, String branch, String commitSha) {
    execute(
        context,
        "Create branch %s in %s".formatted(branch, repository.fullName()),
        github -> {
          GHRepository repo = handle(github, context, repository);
          context.beforeRequest();
          return repo.createRef("refs/heads/" + branch, commitSha);
        });
  }

  @Override
  public BranchComparison compare(
      RequestContext context, RepositoryRef repository, String base, String head) {
    return execute(
        context,
        "Compare %s...%s in %s".formatted(base, head, repository.fullName()),
        github -> {
          GHRepository repo = handle(github, context, repository);
          context.beforeRequest();
          GHCompare compare = repo.getCompare(base, head);
          String status =
              compare.getStatus() != null ? compare.getStatus().name().toLowerCase(Locale.ROOT) : "unknown";
          return new BranchComparison(
              status, compare.getAheadBy(), compare.getBehindBy(), compare.getTotalCommits());
        });
  }

  @Override
  public List<PeerChange> listOpenPullRequests(
      RequestContext context, RepositoryRef repository, String baseBranch) {
    return execute(
        context,
        "List open pull requests of %s".formatted(repository.fullName()),
        github -> {
          GHRepository repo = handle(github, context, repository);
          context.beforeRequest();
          PagedIterator<GHPullRequest> pages =
              repo.queryPullRequests()
                  .state(GHIssueState.OPEN)
                  .base(baseBranch)
                  .list()
                  .withPageSize(PAGE_SIZE)
                  .iterator();
          List<PeerChange> changes = new ArrayList<>();
          if (pages.hasNext()) {
            for (GHPullRequest pr : pages.nextPage()) {
              changes.add(toPeerChange(pr));
            }
          }
          return List.copyOf(changes);
        });
  }

  /** Always asks GitHub, refreshing the cached handle on the way. */
  @Override
  public RepositoryMetadata getRepository(RequestContext context, RepositoryRef repository) {
    return execute(
        context,
        "Read repository %s".formatted(repository.fullName()),
        github -> {
          context.beforeRequest();
          GHRepository repo = github.getRepository(repository.fullName());
          handles.put(new HandleKey(github, repository.fullName()), repo);
          return new RepositoryMetadata(
              repo.getFullName(),
              repo.getDefaultBranch(),
              repo.isPrivate(),
              repo.getDescription(),
              safeUrl(repo.getHtmlUrl()),
              repo.hasPages(),
              repo.hasAdminAccess(),
              repo.hasPushAccess(),
              repo.hasPullAccess(),
              safeInstant(repo::getUpdatedAt));
        });
  }

  @Override
  public String currentLogin(RequestContext context) {
    return execute(
        context,
        "Resolve authenticated user",
        github -> {
          context.beforeRequest();
          return github.getMyself().getLogin();
        });
  }

  @Override
  public Optional<RemoteDeployment> latestDeployment(
      RequestContext context, RepositoryRef repository) {
    return execute(
        context,
        "Read latest deployment of %s".formatted(repository.fullName()),
        github -> {
          GHRepository repo = handle(github, context, repository);
          context.beforeRequest();
          Iterator<GHDeployment> deployments =
              repo.listDeployments(null, null, null, PAGES_ENVIRONMENT).withPageSize(1).iterator();
          if (!deployments.hasNext()) {
            return Optional.empty();
          }
          GHDeployment deployment = deployments.next();
          context.beforeRequest();
          DeploymentState state = latestState(deployment);
          return Optional.of(
              new RemoteDeployment(
                  deployment.getId(),
                  deployment.getSha(),
                  state,
                  deployment.getEnvironment(),
                  safeInstant(deployment::getCreatedAt),
                  safeInstant(deployment::getUpdatedAt)));
        });
  }

  @Override
  public List<CommitSummary> recentCommits(
      RequestContext context, RepositoryRef repository, String branch, int count) {
    return execute(
        context,
        "List commits of %s@%s".formatted(repository.fullName(), branch),
        github -> {
          GHRepository repo = handle(github, context, repository);
          int pageSize = Math.max(1, Math.min(count, PAGE_SIZE));
          context.beforeRequest();
          PagedIterator<GHCommit> pages =
              repo.queryCommits().from(branch).pageSize(pageSize).list().iterator();
          List<CommitSummary> commits = new ArrayList<>();
          if (pages.hasNext()) {
            for (GHCommit commit : pages.nextPage()) {
              if (commits.size() >= count) {
                break;
              }
              GHCommit.ShortInfo info = commit.getCommitShortInfo();
              GitUser author = info.getAuthor();
              commits.add(
                  new CommitSummary(
                      commit.getSHA1(),
                      info.getMessage(),
                      author != null ? author.getName() : null,
                      author != null && author.getDate() != null ? author.getDate().toInstant() : null,
                      safeUrl(commit.getHtmlUrl())));
            }
          }
          return List.copyOf(commits);
        });
  }

  @Override
  public RateLimitSnapshot rateLimit(RequestContext context) {
    return execute(
        context,
        "Read rate limit",
        github -> {
          context.beforeRequest();
          GHRateLimit.Record core = github.getRateLimit().getCore();
          return new RateLimitSnapshot(
              core.getLimit(), core.getRemaining(), Instant.ofEpochSecond(core.getResetEpochSeconds()));
        });
  }

  private <T> T execute(RequestContext context, String action, GitHubCall<T> call) {
    GitHub github;
    try {
      github = clientFactory.clientFor(context.token(), context::beforeRequest);
    } catch (IOException ex) {
      throw GitHubErrorTranslator.translate("Connect to GitHub", ex);
    }
    try {
      T result = call.apply(github);
      recordRateLimit(github);
      return result;
    } catch (IOException ex) {
      rateLimitState.update(GitHubErrorTranslator.rateLimitFrom(ex));
      RepositoryApiException translated = GitHubErrorTranslator.translate(action, ex);
      log.debug("github.call failure action={} status={} reason={}", action, translated.status(), translated.getMessage());
      throw translated;
    }
  }

  private GHRepository handle(GitHub github, RequestContext context, RepositoryRef repository)
      throws IOException {
    HandleKey key = new HandleKey(github, repository.fullName());
    GHRepository cached = handles.getIfPresent(key);
    if (cached != null) {
      return cached;
    }
    context.beforeRequest();
    GHRepository repo = github.getRepository(repository.fullName());
    handles.put(key, repo);
    log.debug("github.repository_handle loaded repo={}", repository.fullName());
    return repo;
  }

  private void recordRateLimit(GitHub github) {
    GHRateLimit last = github.lastRateLimit();
    if (last == null) {
      return;
    }
    GHRateLimit.Record core = last.getCore();
    if (core == null || core.getLimit() >= UNKNOWN_LIMIT) {
      return;
    }
    rateLimitState.update(
        new RateLimitSnapshot(
            core.getLimit(), core.getRemaining(), Instant.ofEpochSecond(core.getResetEpochSeconds())));
  }

  private PeerChange toPeerChange(GHPullRequest pr) throws IOException {
    GHUser user = pr.getUser();
    return new PeerChange(
        pr.getNumber(),
        pr.getTitle(),
        user != null ? user.getLogin() : null,
        pr.getHead() != null ? pr.getHead().getRef() : null,
        safeUrl(pr.getHtmlUrl()),
        safeInstant(pr::getUpdatedAt));
  }

  private DeploymentState latestState(GHDeployment deployment) throws IOException {
    Iterator<GHDeploymentStatus> statuses = deployment.listStatuses().withPageSize(1).iterator();
    if (!statuses.hasNext()) {
      return DeploymentState.PENDING;
    }
    GHDeploymentStatus status = statuses.next();
    String state = status.getState() != null ? status.getState().name() : "";
    return switch (state) {
      case "SUCCESS" -> DeploymentState.SUCCESS;
      case "ERROR", "FAILURE" -> DeploymentState.FAILURE;
      case "IN_PROGRESS", "QUEUED" -> DeploymentState.IN_PROGRESS;
      case "INACTIVE" -> DeploymentState.INACTIVE;
      default -> DeploymentState.PENDING;
    };
  }

  private static byte[] readContent(GHContent content) throws IOException {
    try (InputStream stream = content.read()) {
      return stream.readAllBytes();
    }
  }

  @Nullable
  private static Instant safeInstant(IOSupplier<Date> supplier) {
    try {
      Date date = supplier.get();
      return date != null ? date.toInstant() : null;
    } catch (IOException ex) {
      log.debug("Unable to read timestamp: {}", ex.getMessage());
      return null;
    }
  }

  @Nullable
  private static String safeUrl(@Nullable URL url) {
    return url != null ? url.toString() : null;
  }

  private record HandleKey(GitHub github, String fullName) {}

  @FunctionalInterface
  interface GitHubCall<T> {
    T apply(GitHub github) throws IOException;
  }

  @FunctionalInterface
  interface IOSupplier<T> {
    T get() throws IOException;
  }
}
