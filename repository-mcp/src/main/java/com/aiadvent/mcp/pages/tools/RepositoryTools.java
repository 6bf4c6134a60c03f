package com.aiadvent.mcp.pages.tools;

import com.aiadvent.mcp.pages.client.DataSource;
import com.aiadvent.mcp.pages.client.FileContent;
import com.aiadvent.mcp.pages.client.RepositoryApi.CommitSummary;
import com.aiadvent.mcp.pages.client.RepositoryClient;
import com.aiadvent.mcp.pages.client.RepositoryClient.AccessCheck;
import com.aiadvent.mcp.pages.client.RepositoryClient.BatchReadResult;
import com.aiadvent.mcp.pages.client.RepositoryClient.CommitFile;
import com.aiadvent.mcp.pages.client.RepositoryClient.CommitOutcome;
import com.aiadvent.mcp.pages.client.RepositoryClient.ConnectionTest;
import com.aiadvent.mcp.pages.client.RepositoryClient.RepositoryInfo;
import com.aiadvent.mcp.pages.client.RepositoryClient.WriteOutcome;
import com.aiadvent.mcp.pages.conflict.ConflictAnalyzer;
import com.aiadvent.mcp.pages.conflict.ConflictAnalyzer.AutoResolutionOptions;
import com.aiadvent.mcp.pages.conflict.ConflictAnalyzer.AutoResolutionResult;
import com.aiadvent.mcp.pages.conflict.ConflictAnalyzer.BackupResult;
import com.aiadvent.mcp.pages.conflict.ConflictAnalyzer.ConflictNotification;
import com.aiadvent.mcp.pages.conflict.ConflictAnalyzer.ConflictReport;
import com.aiadvent.mcp.pages.deployment.DeploymentMonitor;
import com.aiadvent.mcp.pages.deployment.DeploymentMonitor.MonitorOptions;
import com.aiadvent.mcp.pages.deployment.DeploymentMonitor.MonitorOutcome;
import com.aiadvent.mcp.pages.deployment.DeploymentMonitor.VerificationResult;
import com.aiadvent.mcp.pages.deployment.DeploymentMonitor.WorkflowResult;
import com.aiadvent.mcp.pages.offline.OfflineController;
import com.aiadvent.mcp.pages.support.CancellationToken;
import com.aiadvent.mcp.pages.support.ProgressListener;
import com.aiadvent.mcp.pages.support.RecentEventLog;
import com.aiadvent.mcp.pages.support.RepositoryEvent;
import com.aiadvent.mcp.pages.throttle.RequestThrottle.ThrottleSnapshot;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

@Component
class RepositoryTools {

  private static final int MAX_BATCH_PATHS = 50;
  private static final int MAX_COMMIT_FILES = 100;

  private final RepositoryClient client;
  private final ConflictAnalyzer conflictAnalyzer;
  private final DeploymentMonitor deploymentMonitor;
  private final RecentEventLog recentEvents;

  RepositoryTools(
      RepositoryClient client,
      ConflictAnalyzer conflictAnalyzer,
      DeploymentMonitor deploymentMonitor,
      RecentEventLog recentEvents) {
    this.client = Objects.requireNonNull(client, "client");
    this.conflictAnalyzer = Objects.requireNonNull(conflictAnalyzer, "conflictAnalyzer");
    this.deploymentMonitor = Objects.requireNonNull(deploymentMonitor, "deploymentMonitor");
    this.recentEvents = Objects.requireNonNull(recentEvents, "recentEvents");
  }

  @Tool(
      name = "repository.read_file",
      description =
          "Читает файл из рабочего репозитория сайта. Тело запроса: "
              + "{\"path\": \"index.html\", \"ref\": \"main\", \"useCache\": true, \"binary\": false}. "
              + "path обязателен и задаётся относительно корня. ref опционален (по умолчанию рабочая ветка). "
              + "useCache=false принудительно идёт в API. binary=true возвращает содержимое в base64. "
              + "source в ответе: LIVE, CACHE или FALLBACK (offline-режим); exists=false означает отсутствие файла.")
  ReadFileResponse readFile(ReadFileRequest request) {
    String path = requirePath(request == null ? null : request.path());
    boolean useCache = request.useCache() == null || request.useCache();
    FileContent content = client.readFile(path, request.ref(), useCache);
    return toReadFileResponse(content, Boolean.TRUE.equals(request.binary()));
  }

  @Tool(
      name = "repository.read_files",
      description =
          "Пакетное чтение нескольких файлов. Тело запроса: {\"paths\": [\"index.html\", \"css/site.css\"], "
              + "\"ref\": \"main\"}. Не более 50 путей; запросы уходят пачками с паузой между ними. "
              + "Ошибки отдельных файлов возвращаются в errors и не прерывают остальные чтения.")
  ReadFilesResponse readFiles(ReadFilesRequest request) {
    if (request == null || request.paths() == null || request.paths().isEmpty()) {
      throw new IllegalArgumentException("paths must not be empty");
    }
    if (request.paths().size() > MAX_BATCH_PATHS) {
      throw new IllegalArgumentException("paths must contain at most " + MAX_BATCH_PATHS + " entries");
    }
    BatchReadResult result =
        client.readFiles(request.paths(), request.ref(), CancellationToken.none());
    List<ReadFileResponse> files =
        result.files().values().stream().map(file -> toReadFileResponse(file, false)).toList();
    return new ReadFilesResponse(files, result.errors());
  }

  @Tool(
      name = "repository.write_file",
      description =
          "Создаёт или обновляет один файл в рабочей ветке. Тело запроса: "
              + "{\"path\": \"index.html\", \"content\": \"<html>...\", \"message\": \"Update index\", "
              + "\"binary\": false, \"retryOnConflict\": true}. "
              + "Перед записью проверяются права на push. binary=true означает, что content передан в base64. "
              + "retryOnConflict=true повторяет запись при конфликте версий (до 3 попыток). "
              + "Ответ содержит success, versionTag и commitSha; при ошибке failureClass и message.")
  WriteFileResponse writeFile(WriteFileRequest request) {
    String path = requirePath(request == null ? null : request.path());
    if (request.content() == null) {
      throw new IllegalArgumentException("content must be provided");
    }
    String message = requireMessage(request.message());
    boolean binary = Boolean.TRUE.equals(request.binary());
    ProgressCollector progress = new ProgressCollector();
    WriteOutcome outcome =
        Boolean.FALSE.equals(request.retryOnConflict())
            ? client.writeFile(path, request.content(), message, binary, progress)
            : client.writeFileWithRetry(path, request.content(), message, binary, progress);
    return new WriteFileResponse(outcome, progress.steps());
  }

  @Tool(
      name = "repository.commit_files",
      description =
          "Атомарно коммитит несколько файлов одним коммитом. Тело запроса: "
              + "{\"message\": \"Publish site\", \"files\": [{\"path\": \"index.html\", \"content\": \"...\", "
              + "\"binary\": false}]}. Последовательность: проверка доступа, вершина ветки, базовое дерево, "
              + "новое дерево, коммит, перенос ветки. Ошибка до последнего шага не меняет ветку; "
              + "failedStage в ответе указывает шаг, на котором всё остановилось.")
  CommitFilesResponse commitFiles(CommitFilesRequest request) {
    if (request == null || request.files() == null || request.files().isEmpty()) {
      throw new IllegalArgumentException("files must not be empty");
    }
    if (request.files().size() > MAX_COMMIT_FILES) {
      throw new IllegalArgumentException("files must contain at most " + MAX_COMMIT_FILES + " entries");
    }
    String message = requireMessage(request.message());
    List<CommitFile> files = new ArrayList<>(request.files().size());
    for (CommitFileInput file : request.files()) {
      if (file == null) {
        throw new IllegalArgumentException("files must not contain null entries");
      }
      String path = requirePath(file.path());
      if (file.content() == null) {
        throw new IllegalArgumentException("content must be provided for " + path);
      }
      byte[] bytes =
          Boolean.TRUE.equals(file.binary())
              ? decodeBase64(file.content(), path)
              : file.content().getBytes(StandardCharsets.UTF_8);
      files.add(new CommitFile(path, bytes));
    }
    ProgressCollector progress = new ProgressCollector();
    CommitOutcome outcome = client.commitFiles(files, message, progress, CancellationToken.none());
    return new CommitFilesResponse(outcome, progress.steps());
  }

  @Tool(
      name = "repository.check_access",
      description =
          "Проверяет токен и права на рабочий репозиторий. Запрос пустой: {}. "
              + "ok=true только при наличии push-доступа; grantedScopes перечисляет admin/push/pull.")
  AccessCheck checkAccess() {
    return client.checkAccess();
  }

  @Tool(
      name = "repository.info",
      description =
          "Возвращает метаданные рабочего репозитория: default branch, рабочую ветку, видимость, "
              + "наличие Pages, адрес опубликованного сайта и права текущего токена. Запрос пустой: {}.")
  RepositoryInfo repositoryInfo() {
    return client.getRepositoryInfo();
  }

  @Tool(
      name = "repository.recent_commits",
      description =
          "Список последних коммитов рабочей ветки. Тело запроса: {\"count\": 10}. "
              + "count ограничен диапазоном 1-100, по умолчанию 10. sha в ответе сокращён до 7 символов.")
  RecentCommitsResponse recentCommits(RecentCommitsRequest request) {
    int count = request == null || request.count() == null ? 10 : request.count();
    List<CommitSummary> commits = client.listRecentCommits(count);
    return new RecentCommitsResponse(client.repository().fullName(), client.repository().branch(), commits);
  }

  @Tool(
      name = "repository.detect_conflicts",
      description =
          "Сравнивает ветку с базовой и ищет конфликты. Тело запроса: {\"branch\": \"feature-x\"}. "
              + "branch опционален (по умолчанию рабочая ветка). Типы конфликтов: BEHIND (ветка отстала), "
              + "DIVERGED (разошлась с базовой), OPEN_PEER_CHANGES (открытые PR в базовую ветку). "
              + "Ответ содержит варианты решения и уведомление для пользователя.")
  DetectConflictsResponse detectConflicts(DetectConflictsRequest request) {
    ConflictReport report = conflictAnalyzer.detectConflicts(request == null ? null : request.branch());
    ConflictNotification notification = conflictAnalyzer.notificationFor(report.conflicts());
    return new DetectConflictsResponse(report, notification);
  }

  @Tool(
      name = "repository.resolve_conflicts",
      description =
          "Пытается автоматически разрешить конфликты ветки. Тело запроса: "
              + "{\"branch\": \"feature-x\", \"autoMerge\": true}. Перед любыми действиями создаётся "
              + "резервная ветка backup-<branch>-<время>. autoMerge=true переносит отставшую ветку на "
              + "вершину базовой (fast-forward); разошедшиеся ветки всегда требуют ручного решения.")
  AutoResolutionResult resolveConflicts(ResolveConflictsRequest request) {
    String branch = request == null ? null : request.branch();
    boolean autoMerge = request != null && Boolean.TRUE.equals(request.autoMerge());
    ConflictReport report = conflictAnalyzer.detectConflicts(branch);
    if (report.error() != null) {
      throw new IllegalStateException("Conflict check failed: " + report.error());
    }
    return conflictAnalyzer.attemptAutoResolution(
        report.conflicts(), new AutoResolutionOptions(autoMerge, report.branch()));
  }

  @Tool(
      name = "repository.create_backup",
      description =
          "Создаёт резервную ветку от вершины указанной ветки. Тело запроса: "
              + "{\"branch\": \"main\", \"name\": \"backup-before-publish\"}. "
              + "Оба поля опциональны: по умолчанию рабочая ветка и имя backup-<branch>-<время UTC>.")
  BackupResult createBackup(CreateBackupRequest request) {
    return conflictAnalyzer.createBackupBranch(
        request == null ? null : request.branch(), request == null ? null : request.name());
  }

  @Tool(
      name = "repository.monitor_deployment",
      description =
          "Отслеживает публикацию сайта для коммита до завершения. Тело запроса: "
              + "{\"commitSha\": \"abc1234\", \"pollIntervalSeconds\": 10, \"timeoutSeconds\": 300}. "
              + "commitSha обязателен (достаточно 7 символов). Интервал опроса по умолчанию 10 секунд, "
              + "таймаут 5 минут. result: COMPLETED, TIMEOUT, CANCELLED или FAILED.")
  MonitorDeploymentResponse monitorDeployment(MonitorDeploymentRequest request) {
    String commitSha = requireCommitSha(request == null ? null : request.commitSha());
    MonitorOptions defaults = deploymentMonitor.defaults();
    MonitorOptions options =
        new MonitorOptions(
            seconds(request.pollIntervalSeconds(), defaults.pollInterval()),
            seconds(request.timeoutSeconds(), defaults.timeout()));
    ProgressCollector progress = new ProgressCollector();
    MonitorOutcome outcome =
        deploymentMonitor.monitor(commitSha, options, progress, CancellationToken.none());
    return new MonitorDeploymentResponse(outcome, progress.steps());
  }

  @Tool(
      name = "repository.verify_deployment",
      description =
          "Проверяет, что опубликованный сайт отдаёт ожидаемое содержимое. Тело запроса: "
              + "{\"path\": \"index.html\", \"expectedMarkers\": [\"<title>My site</title>\"]}. "
              + "Запрос идёт в обход кэша. status: VERIFIED, CONTENT_NOT_VISIBLE (страница доступна, "
              + "но маркеры не найдены), UNREACHABLE или NO_PUBLISHED_URL.")
  VerificationResult verifyDeployment(VerifyDeploymentRequest request) {
    return deploymentMonitor.verify(
        request == null ? null : request.expectedMarkers(), request == null ? null : request.path());
  }

  @Tool(
      name = "repository.publish_and_verify",
      description =
          "Полный цикл после коммита: ожидание публикации и проверка сайта. Тело запроса: "
              + "{\"commitSha\": \"abc1234\", \"path\": \"index.html\", \"expectedMarkers\": [\"...\"]}. "
              + "success=true, если публикация завершена и страница доступна.")
  PublishWorkflowResponse publishAndVerify(PublishWorkflowRequest request) {
    String commitSha = requireCommitSha(request == null ? null : request.commitSha());
    ProgressCollector progress = new ProgressCollector();
    WorkflowResult result =
        deploymentMonitor.completeDeploymentWorkflow(
            commitSha, request.expectedMarkers(), request.path(), progress, CancellationToken.none());
    return new PublishWorkflowResponse(result, progress.steps());
  }

  @Tool(
      name = "repository.status",
      description =
          "Состояние клиента: режим связи (ONLINE/OFFLINE), серия ошибок, загрузка ограничителя "
              + "запросов, остаток лимита API и последние события. Тело запроса: {\"refreshRateLimit\": false}. "
              + "refreshRateLimit=true дополнительно запрашивает лимит у API.")
  StatusResponse status(StatusRequest request) {
    ThrottleSnapshot throttle =
        request != null && Boolean.TRUE.equals(request.refreshRateLimit())
            ? client.rateLimitStatus().throttle()
            : client.rateLimitStatus(false).throttle();
    OfflineController.Status connectivity = client.connectivityStatus();
    List<EventView> events =
        recentEvents.recent().stream().map(RepositoryTools::toEventView).toList();
    return new StatusResponse(
        client.repository().fullName(), client.repository().branch(), connectivity, throttle, events);
  }

  @Tool(
      name = "repository.test_connection",
      description =
          "Пробный запрос к API: проверяет токен и измеряет время ответа. Запрос пустой: {}. "
              + "В ответе login, responseTimeMs и rateLimitRemaining.")
  ConnectionTest testConnection() {
    return client.testConnection();
  }

  private ReadFileResponse toReadFileResponse(FileContent content, boolean binary) {
    String body = binary ? content.base64() : content.text();
    return new ReadFileResponse(
        content.path(),
        content.ref(),
        content.exists(),
        body,
        binary ? "base64" : "utf-8",
        content.versionTag(),
        content.source(),
        content.size());
  }

  private static EventView toEventView(RepositoryEvent event) {
    return new EventView(
        event.type().name(), event.message(), event.occurredAt().toString(), new LinkedHashMap<>(event.details()));
  }

  private static String requirePath(String path) {
    if (!StringUtils.hasText(path)) {
      throw new IllegalArgumentException("path must not be blank");
    }
    return path.trim();
  }

  private static String requireMessage(String message) {
    if (!StringUtils.hasText(message)) {
      throw new IllegalArgumentException("message must not be blank");
    }
    return message.trim();
  }

  private static String requireCommitSha(String commitSha) {
    if (!StringUtils.hasText(commitSha)) {
      throw new IllegalArgumentException("commitSha must not be blank");
    }
    String trimmed = commitSha.trim();
    if (trimmed.length() < 7) {
      throw new IllegalArgumentException("commitSha must contain at least 7 characters");
    }
    return trimmed;
  }

  private static byte[] decodeBase64(String content, String path) {
    try {
      return Base64.getDecoder().decode(content.trim());
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("content of " + path + " is not valid base64", ex);
    }
  }

  private static Duration seconds(Integer value, Duration fallback) {
    if (value == null || value <= 0) {
      return fallback;
    }
    return Duration.ofSeconds(value);
  }

  /** Gathers progress reports so they can be returned with the tool result. */
  private static final class ProgressCollector implements ProgressListener {

    private final List<String> steps = new ArrayList<>();

    @Override
    public synchronized void onProgress(int percentage, String message) {
      steps.add(percentage + "% " + message);
    }

    synchronized List<String> steps() {
      return List.copyOf(steps);
    }
  }

  record ReadFileRequest(String path, String ref, Boolean useCache, Boolean binary) {}

  record ReadFileResponse(
      String path,
      String ref,
      boolean exists,
      String content,
      String encoding,
      String versionTag,
      DataSource source,
      int size) {}

  record ReadFilesRequest(List<String> paths, String ref) {}

  record ReadFilesResponse(List<ReadFileResponse> files, Map<String, String> errors) {}

  record WriteFileRequest(
      String path, String content, String message, Boolean binary, Boolean retryOnConflict) {}

  record WriteFileResponse(WriteOutcome outcome, List<String> progress) {}

  record CommitFileInput(String path, String content, Boolean binary) {}

  record CommitFilesRequest(String message, List<CommitFileInput> files) {}

  record CommitFilesResponse(CommitOutcome outcome, List<String> progress) {}

  record RecentCommitsRequest(Integer count) {}

  record RecentCommitsResponse(String repository, String branch, List<CommitSummary> commits) {}

  record DetectConflictsRequest(String branch) {}

  record DetectConflictsResponse(ConflictReport report, ConflictNotification notification) {}

  record ResolveConflictsRequest(String branch, Boolean autoMerge) {}

  record CreateBackupRequest(String branch, String name) {}

  record MonitorDeploymentRequest(String commitSha, Integer pollIntervalSeconds, Integer timeoutSeconds) {}

  record MonitorDeploymentResponse(MonitorOutcome outcome, List<String> progress) {}

  record VerifyDeploymentRequest(String path, List<String> expectedMarkers) {}

  record PublishWorkflowRequest(String commitSha, String path, List<String> expectedMarkers) {}

  record PublishWorkflowResponse(WorkflowResult result, List<String> progress) {}

  record StatusRequest(Boolean refreshRateLimit) {}

  record EventView(String type, String message, String occurredAt, Map<String, Object> details) {}

  record StatusResponse(
      String repository,
      String branch,
      OfflineController.Status connectivity,
      ThrottleSnapshot throttle,
      List<EventView> recentEvents) {}
}
