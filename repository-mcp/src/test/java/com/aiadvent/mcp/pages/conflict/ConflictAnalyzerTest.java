package com.aiadvent.mcp.pages.conflict;

import static org.assertj.core.api.Assertions.assertThat;

import com.aiadvent.mcp.pages.client.FakeRepositoryApi;
import com.aiadvent.mcp.pages.client.RepositoryApi.PeerChange;
import com.aiadvent.mcp.pages.client.RepositoryApiException;
import com.aiadvent.mcp.pages.client.RepositoryClient;
import com.aiadvent.mcp.pages.client.RepositoryClientFixture;
import com.aiadvent.mcp.pages.conflict.Conflict.Kind;
import com.aiadvent.mcp.pages.conflict.Conflict.Severity;
import com.aiadvent.mcp.pages.conflict.ConflictAnalyzer.AutoResolutionOptions;
import com.aiadvent.mcp.pages.conflict.ConflictAnalyzer.AutoResolutionResult;
import com.aiadvent.mcp.pages.conflict.ConflictAnalyzer.BackupResult;
import com.aiadvent.mcp.pages.conflict.ConflictAnalyzer.ConflictNotification;
import com.aiadvent.mcp.pages.conflict.ConflictAnalyzer.ConflictOutcome;
import com.aiadvent.mcp.pages.conflict.ConflictAnalyzer.ConflictReport;
import com.aiadvent.mcp.pages.conflict.ConflictAnalyzer.NotificationAction;
import com.aiadvent.mcp.pages.conflict.ConflictAnalyzer.NotificationLevel;
import com.aiadvent.mcp.pages.conflict.ConflictAnalyzer.OutcomeStatus;
import com.aiadvent.mcp.pages.support.RepositoryEvent;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ConflictAnalyzerTest {

  private RepositoryClientFixture fixture;
  private FakeRepositoryApi api;
  private RepositoryClient client;
  private List<RepositoryEvent> events;
  private ConflictAnalyzer analyzer;

  @BeforeEach
  void setUp() {
    fixture = new RepositoryClientFixture();
    api = fixture.api;
    client = fixture.build();
    events = new ArrayList<>();
    analyzer = new ConflictAnalyzer(client, fixture.clock, events::add);
  }

  @AfterEach
  void tearDown() {
    client.close();
  }

  @Test
  void branchStrictlyBehindBaseIsReportedAsWarning() {
    api.seedBranch("feature", "main");
    api.seedCommit("main", "one", Map.of("a.html", "1"));
    api.seedCommit("main", "two", Map.of("a.html", "2"));
    api.seedCommit("main", "three", Map.of("a.html", "3"));

    ConflictReport report = analyzer.detectConflicts("feature");

    assertThat(report.baseBranch()).isEqualTo("main");
    assertThat(report.hasConflicts()).isTrue();
    assertThat(report.error()).isNull();
    assertThat(report.conflicts()).singleElement().satisfies(conflict -> {
      assertThat(conflict.kind()).isEqualTo(Kind.BEHIND);
      assertThat(conflict.severity()).isEqualTo(Severity.WARNING);
      assertThat(conflict.behindBy()).isEqualTo(3);
      assertThat(conflict.aheadBy()).isZero();
    });
    assertThat(report.resolutions()).extracting(Resolution::action).containsExactly(Resolution.Action.MERGE);
    assertThat(events).extracting(RepositoryEvent::type).containsExactly(RepositoryEvent.Type.CONFLICT_DETECTED);
  }

  @Test
  void divergedBranchIsAnErrorWithTwoSuggestions() {
    api.seedBranch("feature", "main");
    api.seedCommit("feature", "local work", Map.of("b.html", "b"));
    api.seedCommit("main", "upstream one", Map.of("a.html", "1"));
    api.seedCommit("main", "upstream two", Map.of("a.html", "2"));

    ConflictReport report = analyzer.detectConflicts("feature");

    assertThat(report.conflicts()).singleElement().satisfies(conflict -> {
      assertThat(conflict.kind()).isEqualTo(Kind.DIVERGED);
      assertThat(conflict.severity()).isEqualTo(Severity.ERROR);
      assertThat(conflict.aheadBy()).isEqualTo(1);
      assertThat(conflict.behindBy()).isEqualTo(2);
    });
    assertThat(report.resolutions())
        .extracting(Resolution::action)
        .containsExactly(Resolution.Action.REBASE, Resolution.Action.NEW_BRANCH);
  }

  @Test
  void branchOnlyAheadHasNoConflicts() {
    api.seedBranch("feature", "main");
    api.seedCommit("feature", "local work", Map.of("b.html", "b"));

    ConflictReport report = analyzer.detectConflicts("feature");

    assertThat(report.hasConflicts()).isFalse();
    assertThat(report.conflicts()).isEmpty();
    assertThat(report.message()).isEqualTo("No conflicts detected");
    assertThat(events).isEmpty();
  }

  @Test
  void openPullRequestsOnBaseBranchAreInformational() {
    api.addOpenPullRequest(
        new PeerChange(42, "Redesign header", "alice", "redesign", "https://github.com/acme/site/pull/42", null));

    ConflictReport report = analyzer.detectConflicts(null);

    assertThat(report.branch()).isEqualTo("main");
    assertThat(report.hasConflicts()).isFalse();
    assertThat(report.conflicts()).singleElement().satisfies(conflict -> {
      assertThat(conflict.kind()).isEqualTo(Kind.OPEN_PEER_CHANGES);
      assertThat(conflict.severity()).isEqualTo(Severity.INFO);
      assertThat(conflict.peerChanges()).extracting(PeerChange::number).containsExactly(42);
    });
    assertThat(api.calls("compare")).isZero();
  }

  @Test
  void remoteFailureIsReportedNotThrown() {
    api.failAlways("getRepository", () -> new RepositoryApiException(401, "Bad credentials"));

    ConflictReport report = analyzer.detectConflicts("feature");

    assertThat(report.error()).contains("Bad credentials");
    assertThat(report.conflicts()).isEmpty();
    assertThat(report.hasConflicts()).isFalse();
    assertThat(report.message()).startsWith("Conflict detection failed");
  }

  @Test
  void autoResolutionFastForwardsBehindBranchAfterBackup() {
    api.seedBranch("feature", "main");
    String featureTip = api.tip("feature").orElseThrow();
    api.seedCommit("main", "one", Map.of("a.html", "1"));
    ConflictReport report = analyzer.detectConflicts("feature");

    AutoResolutionResult result =
        analyzer.attemptAutoResolution(report.conflicts(), new AutoResolutionOptions(true, "feature"));

    assertThat(result.success()).isTrue();
    assertThat(result.backup().success()).isTrue();
    assertThat(result.backup().branchName()).startsWith("backup-feature-2024-05-01T10-");
    assertThat(api.tip(result.backup().branchName())).contains(featureTip);
    assertThat(result.outcomes()).extracting(ConflictOutcome::status).containsExactly(OutcomeStatus.MERGED);
    assertThat(api.tip("feature")).isEqualTo(api.tip("main"));
  }

  @Test
  void behindBranchIsLeftAloneWithoutAutoMerge() {
    api.seedBranch("feature", "main");
    String featureTip = api.tip("feature").orElseThrow();
    api.seedCommit("main", "one", Map.of("a.html", "1"));
    ConflictReport report = analyzer.detectConflicts("feature");

    AutoResolutionResult result =
        analyzer.attemptAutoResolution(report.conflicts(), new AutoResolutionOptions(false, "feature"));

    assertThat(result.success()).isFalse();
    assertThat(result.outcomes()).extracting(ConflictOutcome::status).containsExactly(OutcomeStatus.MANUAL_REQUIRED);
    assertThat(api.tip("feature")).contains(featureTip);
  }

  @Test
  void divergedBranchIsNeverRewrittenAutomatically() {
    api.seedBranch("feature", "main");
    String featureTip = api.seedCommit("feature", "local", Map.of("b.html", "b"));
    api.seedCommit("main", "upstream", Map.of("a.html", "1"));
    ConflictReport report = analyzer.detectConflicts("feature");

    AutoResolutionResult result =
        analyzer.attemptAutoResolution(report.conflicts(), new AutoResolutionOptions(true, "feature"));

    assertThat(result.success()).isFalse();
    assertThat(result.outcomes()).extracting(ConflictOutcome::status).containsExactly(OutcomeStatus.MANUAL_REQUIRED);
    assertThat(api.tip("feature")).contains(featureTip);
    assertThat(api.calls("updateBranch")).isZero();
  }

  @Test
  void backupWithExplicitNameAndExistingBranchFailsGracefully() {
    BackupResult first = analyzer.createBackupBranch("main", "backup-release");
    BackupResult second = analyzer.createBackupBranch("main", "backup-release");

    assertThat(first.success()).isTrue();
    assertThat(first.sha()).isEqualTo(api.tip("main").orElseThrow());
    assertThat(second.success()).isFalse();
    assertThat(second.message()).startsWith("Backup failed");
  }

  @Test
  void notificationLevelFollowsWorstSeverity() {
    Conflict behind = new Conflict(Kind.BEHIND, Severity.WARNING, "behind by 2", 0, 2, List.of());
    Conflict diverged = new Conflict(Kind.DIVERGED, Severity.ERROR, "diverged", 1, 1, List.of());

    ConflictNotification none = analyzer.notificationFor(List.of());
    ConflictNotification warning = analyzer.notificationFor(List.of(behind));
    ConflictNotification error = analyzer.notificationFor(List.of(behind, diverged));

    assertThat(none.level()).isEqualTo(NotificationLevel.SUCCESS);
    assertThat(none.actions()).isEmpty();
    assertThat(warning.level()).isEqualTo(NotificationLevel.WARNING);
    assertThat(warning.actions())
        .filteredOn(NotificationAction::primary)
        .singleElement()
        .satisfies(action -> assertThat(action.enabled()).isTrue());
    assertThat(error.level()).isEqualTo(NotificationLevel.ERROR);
    assertThat(error.message()).isEqualTo("behind by 2; diverged");
  }

  @Test
  void autoResolveActionIsDisabledWhenNothingCanBeMerged() {
    Conflict diverged = new Conflict(Kind.DIVERGED, Severity.ERROR, "diverged", 1, 1, List.of());

    ConflictNotification notification = analyzer.notificationFor(List.of(diverged));

    assertThat(notification.actions())
        .filteredOn(action -> action.action().equals("auto_resolve"))
        .singleElement()
        .satisfies(action -> assertThat(action.enabled()).isFalse());
  }

  @Test
  void reportCarriesCheckTime() {
    ConflictReport report = analyzer.detectConflicts("main");

    assertThat(report.checkedAt()).isAfterOrEqualTo(Instant.parse("2024-05-01T10:00:00Z"));
  }
}
