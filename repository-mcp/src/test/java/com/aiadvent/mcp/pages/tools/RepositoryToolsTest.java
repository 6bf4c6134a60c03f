package com.aiadvent.mcp.pages.tools;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.aiadvent.mcp.pages.client.DataSource;
import com.aiadvent.mcp.pages.client.FakeRepositoryApi;
import com.aiadvent.mcp.pages.client.RepositoryApi.DeploymentState;
import com.aiadvent.mcp.pages.client.RepositoryApi.RemoteDeployment;
import com.aiadvent.mcp.pages.client.RepositoryApiException;
import com.aiadvent.mcp.pages.client.RepositoryClient;
import com.aiadvent.mcp.pages.client.RepositoryClientFixture;
import com.aiadvent.mcp.pages.conflict.ConflictAnalyzer;
import com.aiadvent.mcp.pages.conflict.ConflictAnalyzer.AutoResolutionResult;
import com.aiadvent.mcp.pages.deployment.DeploymentMonitor;
import com.aiadvent.mcp.pages.deployment.DeploymentMonitor.MonitorOptions;
import com.aiadvent.mcp.pages.deployment.DeploymentMonitor.Result;
import com.aiadvent.mcp.pages.deployment.PublishedContentFetcher.FetchResult;
import com.aiadvent.mcp.pages.offline.ConnectivityMode;
import com.aiadvent.mcp.pages.retry.FailureClass;
import com.aiadvent.mcp.pages.support.RecentEventLog;
import com.aiadvent.mcp.pages.tools.RepositoryTools.CommitFileInput;
import com.aiadvent.mcp.pages.tools.RepositoryTools.CommitFilesRequest;
import com.aiadvent.mcp.pages.tools.RepositoryTools.CommitFilesResponse;
import com.aiadvent.mcp.pages.tools.RepositoryTools.DetectConflictsRequest;
import com.aiadvent.mcp.pages.tools.RepositoryTools.DetectConflictsResponse;
import com.aiadvent.mcp.pages.tools.RepositoryTools.MonitorDeploymentRequest;
import com.aiadvent.mcp.pages.tools.RepositoryTools.MonitorDeploymentResponse;
import com.aiadvent.mcp.pages.tools.RepositoryTools.ReadFileRequest;
import com.aiadvent.mcp.pages.tools.RepositoryTools.ReadFileResponse;
import com.aiadvent.mcp.pages.tools.RepositoryTools.ReadFilesRequest;
import com.aiadvent.mcp.pages.tools.RepositoryTools.RecentCommitsRequest;
import com.aiadvent.mcp.pages.tools.RepositoryTools.ResolveConflictsRequest;
import com.aiadvent.mcp.pages.tools.RepositoryTools.StatusRequest;
import com.aiadvent.mcp.pages.tools.RepositoryTools.StatusResponse;
import com.aiadvent.mcp.pages.tools.RepositoryTools.WriteFileRequest;
import com.aiadvent.mcp.pages.tools.RepositoryTools.WriteFileResponse;
import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.assertj.core.api.InstanceOfAssertFactories;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class RepositoryToolsTest {

  private RepositoryClientFixture fixture;
  private FakeRepositoryApi api;
  private RepositoryClient client;
  private RecentEventLog eventLog;
  private RepositoryTools tools;

  @BeforeEach
  void setUp() {
    fixture = new RepositoryClientFixture();
    api = fixture.api;
    client = fixture.build();
    eventLog = new RecentEventLog();
    ConflictAnalyzer analyzer = new ConflictAnalyzer(client, fixture.clock, eventLog);
    DeploymentMonitor monitor =
        new DeploymentMonitor(
            client,
            url -> new FetchResult(200, "<h1>Hello</h1>", Duration.ofMillis(5), null),
            fixture.sleeper,
            fixture.clock,
            eventLog,
            MonitorOptions.defaults(),
            fixture.meterRegistry);
    tools = new RepositoryTools(client, analyzer, monitor, eventLog);
  }

  @AfterEach
  void tearDown() {
    client.close();
  }

  @Test
  void writeThenReadThroughTools() {
    WriteFileResponse write =
        tools.writeFile(new WriteFileRequest("index.html", "<h1>Hello</h1>", "Add index", false, null));
    ReadFileResponse read = tools.readFile(new ReadFileRequest("index.html", null, false, false));

    assertThat(write.outcome().success()).isTrue();
    assertThat(write.progress()).last().isEqualTo("100% Saved index.html");
    assertThat(read.exists()).isTrue();
    assertThat(read.content()).isEqualTo("<h1>Hello</h1>");
    assertThat(read.encoding()).isEqualTo("utf-8");
    assertThat(read.source()).isEqualTo(DataSource.LIVE);
  }

  @Test
  void binaryReadIsBase64Encoded() {
    tools.writeFile(new WriteFileRequest("logo.bin", "AAEC", "Add logo", true, false));

    ReadFileResponse read = tools.readFile(new ReadFileRequest("logo.bin", null, true, true));

    assertThat(read.content()).isEqualTo("AAEC");
    assertThat(read.encoding()).isEqualTo("base64");
    assertThat(read.size()).isEqualTo(3);
  }

  @Test
  void conflictWithoutRetryIsReportedOnce() {
    api.failNext("putFile", () -> new RepositoryApiException(409, "sha mismatch"));

    WriteFileResponse write =
        tools.writeFile(new WriteFileRequest("index.html", "x", "Add index", false, false));

    assertThat(write.outcome().success()).isFalse();
    assertThat(write.outcome().failureClass()).isEqualTo(FailureClass.CONFLICT);
    assertThat(api.calls("putFile")).isEqualTo(1);
  }

  @Test
  void commitFilesDecodesBinaryEntries() {
    CommitFilesResponse response =
        tools.commitFiles(
            new CommitFilesRequest(
                "Publish",
                List.of(
                    new CommitFileInput("index.html", "<h1>Home</h1>", null),
                    new CommitFileInput("img/dot.bin", "AAEC", true))));

    assertThat(response.outcome().success()).isTrue();
    assertThat(response.outcome().fileCount()).isEqualTo(2);
    assertThat(response.progress()).hasSize(6);
    assertThat(api.fileText("main", "index.html")).contains("<h1>Home</h1>");
  }

  @Test
  void invalidInputIsRejectedBeforeAnyRemoteCall() {
    assertThatThrownBy(() -> tools.readFile(new ReadFileRequest(" ", null, null, null)))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> tools.writeFile(new WriteFileRequest("a.html", null, "msg", null, null)))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> tools.writeFile(new WriteFileRequest("a.html", "x", " ", null, null)))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(
            () ->
                tools.commitFiles(
                    new CommitFilesRequest("Publish", List.of(new CommitFileInput("a.bin", "@@@", true)))))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("base64");
    assertThatThrownBy(() -> tools.commitFiles(new CommitFilesRequest("Publish", List.of())))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(
            () -> tools.readFiles(new ReadFilesRequest(Collections.nCopies(51, "a.html"), null)))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> tools.monitorDeployment(new MonitorDeploymentRequest("abc", null, null)))
        .isInstanceOf(IllegalArgumentException.class);
    assertThat(api.calls("getFile")).isZero();
    assertThat(api.calls("putFile")).isZero();
    assertThat(api.calls("createTree")).isZero();
  }

  @Test
  void recentCommitsDefaultToTen() {
    for (int i = 0; i < 12; i++) {
      api.seedCommit("main", "change " + i, Map.of("a.html", "v" + i));
    }

    assertThat(tools.recentCommits(new RecentCommitsRequest(null)).commits()).hasSize(10);
    assertThat(tools.recentCommits(new RecentCommitsRequest(3)).commits()).hasSize(3);
  }

  @Test
  void detectConflictsIncludesNotification() {
    api.seedBranch("feature", "main");
    api.seedCommit("main", "upstream", Map.of("a.html", "1"));

    DetectConflictsResponse response = tools.detectConflicts(new DetectConflictsRequest("feature"));

    assertThat(response.report().hasConflicts()).isTrue();
    assertThat(response.notification().title()).isEqualTo("Attention needed");
  }

  @Test
  void resolveConflictsFastForwardsWhenAllowed() {
    api.seedBranch("feature", "main");
    api.seedCommit("main", "upstream", Map.of("a.html", "1"));

    AutoResolutionResult result = tools.resolveConflicts(new ResolveConflictsRequest("feature", true));

    assertThat(result.success()).isTrue();
    assertThat(api.tip("feature")).isEqualTo(api.tip("main"));
  }

  @Test
  void resolveConflictsRefusesWhenCheckFails() {
    api.failAlways("getRepository", () -> new RepositoryApiException(401, "Bad credentials"));

    assertThatThrownBy(() -> tools.resolveConflicts(new ResolveConflictsRequest("feature", true)))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("Conflict check failed");
    assertThat(api.calls("createBranch")).isZero();
  }

  @Test
  void monitorDeploymentUsesRequestedTimings() {
    api.enqueueDeployment(
        Optional.of(new RemoteDeployment(1L, "abc1234ffff", DeploymentState.PENDING, "github-pages", null, null)));

    MonitorDeploymentResponse response =
        tools.monitorDeployment(new MonitorDeploymentRequest("abc1234", 5, 15));

    assertThat(response.outcome().result()).isEqualTo(Result.TIMEOUT);
    assertThat(response.outcome().polls()).isEqualTo(3);
    assertThat(response.progress()).last(InstanceOfAssertFactories.STRING).startsWith("100%");
  }

  @Test
  void statusReportsConnectivityThrottleAndEvents() {
    api.seedBranch("feature", "main");
    api.seedCommit("main", "upstream", Map.of("a.html", "1"));
    tools.detectConflicts(new DetectConflictsRequest("feature"));

    StatusResponse status = tools.status(new StatusRequest(false));

    assertThat(status.repository()).isEqualTo("acme/site");
    assertThat(status.branch()).isEqualTo("main");
    assertThat(status.connectivity().mode()).isEqualTo(ConnectivityMode.ONLINE);
    assertThat(status.throttle().requestsLastMinute()).isPositive();
    assertThat(status.recentEvents()).first().satisfies(event -> assertThat(event.type()).isEqualTo("CONFLICT_DETECTED"));
    assertThat(api.calls("rateLimit")).isZero();
  }

  @Test
  void statusCanRefreshRateLimit() {
    tools.status(new StatusRequest(true));

    assertThat(api.calls("rateLimit")).isEqualTo(1);
  }
}
