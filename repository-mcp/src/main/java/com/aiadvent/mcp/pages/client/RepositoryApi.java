package com.aiadvent.mcp.pages.client;

import com.aiadvent.mcp.pages.throttle.RateLimitSnapshot;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.springframework.lang.Nullable;

/**
 * Remote repository HTTP API. Every method performs one logical operation and reports failures as
 * {@link RepositoryApiException}. Each HTTP request an operation sends is admitted through
 * {@link RequestContext#beforeRequest()} first; retries and caching happen above.
 */
public interface RepositoryApi {

  /** Returns empty when the path does not exist at {@code ref}. */
  Optional<RemoteFile> getFile(RequestContext context, RepositoryRef repository, String path, String ref);

  PutResult putFile(RequestContext context, RepositoryRef repository, FileWrite write);

  String getBranchTip(RequestContext context, RepositoryRef repository, String branch);

  String getCommitTree(RequestContext context, RepositoryRef repository, String commitSha);

  String createTree(
      RequestContext context, RepositoryRef repository, String baseTreeSha, List<TreeEntry> entries);

  String createCommit(
      RequestContext context, RepositoryRef repository, String message, String treeSha, List<String> parents);

  void updateBranch(
      RequestContext context, RepositoryRef repository, String branch, String commitSha, boolean force);

  void createBranch(RequestContext context, RepositoryRef repository, String branch, String commitSha);

  BranchComparison compare(RequestContext context, RepositoryRef repository, String base, String head);

  /** First page of open pull requests against {@code baseBranch}, at most 100. */
  List<PeerChange> listOpenPullRequests(RequestContext context, RepositoryRef repository, String baseBranch);

  RepositoryMetadata getRepository(RequestContext context, RepositoryRef repository);

  String currentLogin(RequestContext context);

  Optional<RemoteDeployment> latestDeployment(RequestContext context, RepositoryRef repository);

  List<CommitSummary> recentCommits(
      RequestContext context, RepositoryRef repository, String branch, int count);

  RateLimitSnapshot rateLimit(RequestContext context);

  record RemoteFile(String path, byte[] content, String sha, long size) {}

  /**
   * @param expectedSha blob sha of the version being replaced, {@code null} when creating
   */
  record FileWrite(
      String path, byte[] content, String message, String branch, @Nullable String expectedSha) {}

  record PutResult(String contentSha, String commitSha) {}

  record TreeEntry(String path, byte[] content) {}

  record BranchComparison(String status, int aheadBy, int behindBy, int totalCommits) {}

  record PeerChange(
      int number,
      String title,
      @Nullable String author,
      @Nullable String headBranch,
      @Nullable String url,
      @Nullable Instant updatedAt) {}

  record RepositoryMetadata(
      String fullName,
      String defaultBranch,
      boolean privateRepository,
      @Nullable String description,
      @Nullable String htmlUrl,
      boolean hasPages,
      boolean admin,
      boolean push,
      boolean pull,
      @Nullable Instant updatedAt) {}

  record RemoteDeployment(
      long id,
      String sha,
      DeploymentState state,
      @Nullable String environment,
      @Nullable Instant createdAt,
      @Nullable Instant updatedAt) {}

  enum DeploymentState {
    PENDING,
    IN_PROGRESS,
    SUCCESS,
    FAILURE,
    INACTIVE
  }

  record CommitSummary(
      String sha,
      String message,
      @Nullable String author,
      @Nullable Instant date,
      @Nullable String url) {}
}
