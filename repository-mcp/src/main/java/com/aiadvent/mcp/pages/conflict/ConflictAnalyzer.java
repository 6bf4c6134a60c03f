package com.aiadvent.mcp.pages.conflict;

import com.aiadvent.mcp.pages.client.RepositoryApi.BranchComparison;
import com.aiadvent.mcp.pages.client.RepositoryApi.PeerChange;
import com.aiadvent.mcp.pages.client.RepositoryClient;
import com.aiadvent.mcp.pages.conflict.Conflict.Kind;
import com.aiadvent.mcp.pages.conflict.Conflict.Severity;
import com.aiadvent.mcp.pages.conflict.Resolution.Action;
import com.aiadvent.mcp.pages.conflict.Resolution.Risk;
import com.aiadvent.mcp.pages.retry.RepositoryOperationException;
import com.aiadvent.mcp.pages.support.RepositoryEvent;
import com.aiadvent.mcp.pages.support.RepositoryEventListener;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.Nullable;
import org.springframework.util.StringUtils;

/**
 * Compares the working branch with the repository's default branch and suggests how to bring
 * them back together. Only the simplest case, a branch that is strictly behind, is ever resolved
 * automatically, and only after a backup branch has been created.
 */
public class ConflictAnalyzer {

  private static final Logger log = LoggerFactory.getLogger(ConflictAnalyzer.class);

  private static final DateTimeFormatter BACKUP_TIMESTAMP =
      DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH-mm-ss-SSS'Z'").withZone(ZoneOffset.UTC);

  private final RepositoryClient client;
  private final Clock clock;
  private final RepositoryEventListener eventListener;

  public ConflictAnalyzer(
      RepositoryClient client, Clock clock, RepositoryEventListener eventListener) {
    this.client = Objects.requireNonNull(client, "client");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.eventListener = Objects.requireNonNull(eventListener, "eventListener");
  }

  /**
   * Inspects {@code branch} (the client's working branch when blank). Failures are reported in
   * the returned report rather than thrown.
   */
  public ConflictReport detectConflicts(@Nullable String branch) {
    String target = StringUtils.hasText(branch) ? branch.trim() : client.repository().branch();
    String base = null;
    try {
      base = client.defaultBranch();
      List<Conflict> conflicts = new ArrayList<>();
      boolean hasConflicts;
      if (!target.equals(base)) {
        BranchComparison comparison = client.compareBranches(base, target);
        int ahead = comparison.aheadBy();
        int behind = comparison.behindBy();
        if (behind > 0 && ahead == 0) {
          conflicts.add(
              new Conflict(
                  Kind.BEHIND,
                  Severity.WARNING,
                  "Branch %s is %d commit(s) behind %s".formatted(target, behind, base),
                  ahead,
                  behind,
                  List.of()));
        } else if (behind > 0 && ahead > 0) {
          conflicts.add(
              new Conflict(
                  Kind.DIVERGED,
                  Severity.ERROR,
                  "Branch %s has diverged from %s (%d ahead, %d behind)"
                      .formatted(target, base, ahead, behind),
                  ahead,
                  behind,
                  List.of()));
        }
        hasConflicts = !conflicts.isEmpty();
      } else {
        List<PeerChange> openChanges = client.listOpenPeerChanges(target);
        if (!openChanges.isEmpty()) {
          conflicts.add(
              new Conflict(
                  Kind.OPEN_PEER_CHANGES,
                  Severity.INFO,
                  "%d open pull request(s) target %s and may conflict"
                      .formatted(openChanges.size(), target),
                  0,
                  0,
                  openChanges));
        }
        hasConflicts = conflicts.stream().anyMatch(c -> c.severity() == Severity.ERROR);
      }

      String message =
          conflicts.isEmpty()
              ? "No conflicts detected"
              : "%d potential conflict(s) detected".formatted(conflicts.size());
      ConflictReport report =
          new ConflictReport(
              target, base, hasConflicts, conflicts, resolutionsFor(conflicts), message, null, clock.instant());
      if (!conflicts.isEmpty()) {
        publishDetected(report);
      }
      log.info(
          "repository.detect_conflicts branch={} base={} conflicts={} blocking={}",
          target,
          base,
          conflicts.size(),
          hasConflicts);
      return report;
    } catch (RepositoryOperationException ex) {
      log.warn("repository.detect_conflicts failure branch={} class={} reason={}", target, ex.failureClass(), ex.getMessage());
      return new ConflictReport(
          target,
          base,
          false,
          List.of(),
          List.of(),
          "Conflict detection failed: " + ex.getMessage(),
          ex.getMessage(),
          clock.instant());
    }
  }

  /** Suggestions for each conflict, in the order the conflicts are given. */
  public List<Resolution> resolutionsFor(List<Conflict> conflicts) {
    List<Resolution> resolutions = new ArrayList<>();
    for (Conflict conflict : conflicts) {
      resolutions.addAll(resolutionsFor(conflict.kind()));
    }
    return List.copyOf(resolutions);
  }

  private static List<Resolution> resolutionsFor(Kind kind) {
    return switch (kind) {
      case BEHIND ->
          List.of(
              new Resolution(
                  kind,
                  Action.MERGE,
                  Risk.LOW,
                  "Update branch",
                  "Bring in the latest changes from the base branch",
                  List.of(
                      "Back up local changes",
                      "Merge the base branch",
                      "Resolve conflicts if any",
                      "Test the result")));
      case DIVERGED ->
          List.of(
              new Resolution(
                  kind,
                  Action.REBASE,
                  Risk.MEDIUM,
                  "Rebase branch",
                  "Replay the branch commits on top of the base branch",
                  List.of(
                      "Create a backup of the current branch",
                      "Rebase onto the base branch",
                      "Resolve conflicts manually",
                      "Force-push with care")),
              new Resolution(
                  kind,
                  Action.NEW_BRANCH,
                  Risk.LOW,
                  "Create a new branch",
                  "Move the changes to a fresh branch",
                  List.of(
                      "Create a new branch from the base branch",
                      "Apply the changes to the new branch",
                      "Open a pull request",
                      "Review and merge")));
      case OPEN_PEER_CHANGES ->
          List.of(
              new Resolution(
                  kind,
                  Action.COORDINATE,
                  Risk.LOW,
                  "Coordinate with open pull requests",
                  "Line up the change with pull requests already in flight",
                  List.of(
                      "Review the open pull requests",
                      "Talk to their authors",
                      "Wait for them to merge or agree on an order",
                      "Commit once coordinated")));
      default -> List.of(manualResolution(kind));
    };
  }

  static Resolution manualResolution(Kind kind) {
    return new Resolution(
        kind,
        Action.MANUAL,
        Risk.MEDIUM,
        "Resolve manually",
        "Resolve the conflict by hand",
        List.of(
            "Analyse the conflict in detail",
            "Back up the changes",
            "Resolve the conflict by hand",
            "Test the resolution"));
  }

  /**
   * Creates a backup branch at the current tip of the working branch, then resolves what can be
   * resolved safely. A branch strictly behind its base is fast-forwarded when {@code autoMerge}
   * is set; everything else is left for a person.
   */
  public AutoResolutionResult attemptAutoResolution(List<Conflict> conflicts, AutoResolutionOptions options) {
    Objects.requireNonNull(conflicts, "conflicts");
    AutoResolutionOptions effective = options != null ? options : AutoResolutionOptions.defaults();
    String target =
        StringUtils.hasText(effective.branch()) ? effective.branch().trim() : client.repository().branch();

    BackupResult backup = createBackupBranch(target, null);
    if (!backup.success()) {
      log.warn("repository.auto_resolve backup failed branch={} reason={}", target, backup.message());
    }

    List<ConflictOutcome> outcomes = new ArrayList<>();
    for (Conflict conflict : conflicts) {
      outcomes.add(resolve(conflict, target, effective));
    }
    boolean success =
        outcomes.stream()
            .allMatch(o -> o.status() == OutcomeStatus.MERGED || o.status() == OutcomeStatus.NOTIFIED);
    long resolved = outcomes.stream().filter(o -> o.status() == OutcomeStatus.MERGED).count();
    String message =
        "%d conflict(s) resolved, %d need attention".formatted(
            resolved,
            outcomes.stream()
                .filter(o -> o.status() == OutcomeStatus.MANUAL_REQUIRED || o.status() == OutcomeStatus.FAILED)
                .count());
    log.info("repository.auto_resolve branch={} success={} outcomes={}", target, success, outcomes.size());
    return new AutoResolutionResult(success, backup, outcomes, message);
  }

  private ConflictOutcome resolve(Conflict conflict, String target, AutoResolutionOptions options) {
    if (conflict.kind() == Kind.BEHIND) {
      if (!options.autoMerge()) {
        return new ConflictOutcome(conflict, OutcomeStatus.MANUAL_REQUIRED, "Automatic merge is not enabled");
      }
      try {
        String base = client.defaultBranch();
        String baseTip = client.branchTip(base);
        client.fastForwardBranch(target, baseTip);
        return new ConflictOutcome(
            conflict, OutcomeStatus.MERGED, "Fast-forwarded %s to %s".formatted(target, base));
      } catch (RepositoryOperationException ex) {
        log.warn("repository.auto_resolve merge failed branch={} reason={}", target, ex.getMessage());
        return new ConflictOutcome(conflict, OutcomeStatus.FAILED, ex.getMessage());
      }
    }
    if (conflict.kind() == Kind.OPEN_PEER_CHANGES) {
      return new ConflictOutcome(
          conflict, OutcomeStatus.NOTIFIED, "Open pull requests reported, coordinate before committing");
    }
    return new ConflictOutcome(
        conflict, OutcomeStatus.MANUAL_REQUIRED, "This conflict cannot be resolved automatically");
  }

  /**
   * Creates {@code name}, or {@code backup-<branch>-<timestamp>} when blank, at the tip of
   * {@code branch}. Never throws on remote failures.
   */
  public BackupResult createBackupBranch(@Nullable String branch, @Nullable String name) {
    String source = StringUtils.hasText(branch) ? branch.trim() : client.repository().branch();
    String backupName =
        StringUtils.hasText(name)
            ? name.trim()
            : "backup-%s-%s".formatted(source, BACKUP_TIMESTAMP.format(clock.instant()));
    try {
      String tip = client.branchTip(source);
      client.createBranch(backupName, tip);
      return new BackupResult(true, backupName, tip, "Backup branch created: " + backupName);
    } catch (RepositoryOperationException ex) {
      return new BackupResult(false, null, null, "Backup failed: " + ex.getMessage());
    }
  }

  public ConflictNotification notificationFor(List<Conflict> conflicts) {
    if (conflicts == null || conflicts.isEmpty()) {
      return new ConflictNotification(
          NotificationLevel.SUCCESS, "No conflicts", "No conflicts detected in the repository", List.of());
    }
    boolean hasErrors = conflicts.stream().anyMatch(c -> c.severity() == Severity.ERROR);
    boolean hasWarnings = conflicts.stream().anyMatch(c -> c.severity() == Severity.WARNING);
    NotificationLevel level =
        hasErrors ? NotificationLevel.ERROR : hasWarnings ? NotificationLevel.WARNING : NotificationLevel.INFO;
    String title = hasErrors ? "Critical conflicts" : hasWarnings ? "Attention needed" : "Information";
    String message = conflicts.stream().map(Conflict::message).collect(Collectors.joining("; "));
    List<NotificationAction> actions =
        List.of(
            new NotificationAction("Show details", "show_details", false, true),
            new NotificationAction(
                "Resolve automatically",
                "auto_resolve",
                true,
                conflicts.stream().anyMatch(c -> c.kind() == Kind.BEHIND)),
            new NotificationAction("Resolve manually", "manual_resolve", false, true));
    return new ConflictNotification(level, title, message, actions);
  }

  private void publishDetected(ConflictReport report) {
    Map<String, Object> details = new LinkedHashMap<>();
    details.put("branch", report.branch());
    details.put("baseBranch", report.baseBranch());
    details.put(
        "kinds", report.conflicts().stream().map(c -> c.kind().name()).collect(Collectors.toList()));
    details.put("blocking", report.hasConflicts());
    eventListener.onEvent(
        new RepositoryEvent(RepositoryEvent.Type.CONFLICT_DETECTED, report.message(), report.checkedAt(), details));
  }

  public record ConflictReport(
      String branch,
      @Nullable String baseBranch,
      boolean hasConflicts,
      List<Conflict> conflicts,
      List<Resolution> resolutions,
      String message,
      @Nullable String error,
      Instant checkedAt) {

    public ConflictReport {
      conflicts = List.copyOf(conflicts);
      resolutions = List.copyOf(resolutions);
    }
  }

  /**
   * @param branch branch to resolve, the client's working branch when blank
   */
  public record AutoResolutionOptions(boolean autoMerge, @Nullable String branch) {

    public static AutoResolutionOptions defaults() {
      return new AutoResolutionOptions(false, null);
    }
  }

  public enum OutcomeStatus {
    MERGED,
    NOTIFIED,
    MANUAL_REQUIRED,
    FAILED
  }

  public record ConflictOutcome(Conflict conflict, OutcomeStatus status, String message) {}

  public record AutoResolutionResult(
      boolean success, BackupResult backup, List<ConflictOutcome> outcomes, String message) {

    public AutoResolutionResult {
      outcomes = List.copyOf(outcomes);
    }
  }

  public record BackupResult(
      boolean success, @Nullable String branchName, @Nullable String sha, String message) {}

  public enum NotificationLevel {
    SUCCESS,
    INFO,
    WARNING,
    ERROR
  }

  public record NotificationAction(String label, String action, boolean primary, boolean enabled) {}

  public record ConflictNotification(
      NotificationLevel level, String title, String message, List<NotificationAction> actions) {

    public ConflictNotification {
      actions = List.copyOf(actions);
    }
  }
}
