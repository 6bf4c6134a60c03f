package com.aiadvent.mcp.pages.github;

import com.aiadvent.mcp.pages.client.RepositoryApiException;
import com.aiadvent.mcp.pages.throttle.RateLimitSnapshot;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.kohsuke.github.GHFileNotFoundException;
import org.kohsuke.github.HttpException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.Nullable;
import org.springframework.util.StringUtils;

/** Turns kohsuke client failures into {@link RepositoryApiException}s with readable details. */
final class GitHubErrorTranslator {

  private static final Logger log = LoggerFactory.getLogger(GitHubErrorTranslator.class);

  static final int MAX_API_ERROR_DETAIL = 500;

  static final String HEADER_LIMIT = "X-RateLimit-Limit";
  static final String HEADER_REMAINING = "X-RateLimit-Remaining";
  static final String HEADER_RESET = "X-RateLimit-Reset";
  static final String HEADER_RETRY_AFTER = "Retry-After";

  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

  private GitHubErrorTranslator() {}

  static RepositoryApiException translate(String action, IOException failure) {
    Map<String, List<String>> headers = responseHeaders(failure);
    int status = responseStatus(failure);
    if (status <= 0) {
      String reason = StringUtils.hasText(failure.getMessage()) ? failure.getMessage() : failure.getClass().getSimpleName();
      return RepositoryApiException.network(action + " failed: " + reason, failure);
    }
    String message = action + " failed";
    String detail = describeHttpError(failure, status);
    if (StringUtils.hasText(detail)) {
      message = message + " (" + detail + ")";
    }
    Integer remaining = intHeader(headers, HEADER_REMAINING);
    Long reset = longHeader(headers, HEADER_RESET);
    Long retryAfter = longHeader(headers, HEADER_RETRY_AFTER);
    return new RepositoryApiException(
        status,
        message,
        remaining,
        reset != null ? Instant.ofEpochSecond(reset) : null,
        retryAfter != null ? Duration.ofSeconds(Math.max(0, retryAfter)) : null,
        failure);
  }

  /** Rate limit details carried by a failed response, if any. */
  static RateLimitSnapshot rateLimitFrom(IOException failure) {
    Map<String, List<String>> headers = responseHeaders(failure);
    Integer remaining = intHeader(headers, HEADER_REMAINING);
    if (remaining == null) {
      return RateLimitSnapshot.unknown();
    }
    Integer limit = intHeader(headers, HEADER_LIMIT);
    Long reset = longHeader(headers, HEADER_RESET);
    return new RateLimitSnapshot(
        limit != null ? limit : -1, remaining, reset != null ? Instant.ofEpochSecond(reset) : null);
  }

  private static int responseStatus(Throwable failure) {
    HttpException httpException = findHttpException(failure);
    if (httpException != null) {
      return httpException.getResponseCode();
    }
    if (findCause(failure, GHFileNotFoundException.class) != null) {
      return 404;
    }
    return 0;
  }

  private static Map<String, List<String>> responseHeaders(Throwable failure) {
    HttpException httpException = findHttpException(failure);
    Map<String, List<String>> headers = null;
    if (httpException != null) {
      headers = httpException.getResponseHeaderFields();
    } else {
      GHFileNotFoundException notFound = findCause(failure, GHFileNotFoundException.class);
      if (notFound != null) {
        headers = notFound.getResponseHeaderFields();
      }
    }
    return headers != null ? headers : Map.of();
  }

  private static String describeHttpError(Throwable failure, int status) {
    StringBuilder detail = new StringBuilder("status ").append(status);
    HttpException httpException = findHttpException(failure);
    if (httpException != null && StringUtils.hasText(httpException.getResponseMessage())) {
      detail.append(" ").append(httpException.getResponseMessage());
    }
    String bodyDetail = extractErrorBody(failure.getMessage());
    if (StringUtils.hasText(bodyDetail)) {
      detail.append(" - ").append(bodyDetail);
    }
    String result = detail.toString();
    if (result.length() > MAX_API_ERROR_DETAIL) {
      return result.substring(0, MAX_API_ERROR_DETAIL) + "...";
    }
    return result;
  }

  @Nullable
  static String extractErrorBody(@Nullable String rawBody) {
    if (!StringUtils.hasText(rawBody)) {
      return null;
    }
    String trimmed = rawBody.trim();
    if (trimmed.startsWith("{")) {
      try {
        JsonNode node = OBJECT_MAPPER.readTree(trimmed);
        List<String> parts = new ArrayList<>();
        String message = node.path("message").asText(null);
        if (StringUtils.hasText(message)) {
          parts.add(message);
        }
        JsonNode errors = node.get("errors");
        if (errors != null && errors.isArray()) {
          for (JsonNode errorNode : errors) {
            String errorDetail = extractErrorDetail(errorNode);
            if (StringUtils.hasText(errorDetail)) {
              parts.add(errorDetail);
            }
          }
        }
        if (!parts.isEmpty()) {
          return String.join("; ", parts);
        }
      } catch (JsonProcessingException ex) {
        log.debug("Error body is not valid JSON, using it verbatim: {}", ex.getOriginalMessage());
      }
    }
    return trimmed;
  }

  @Nullable
  private static String extractErrorDetail(JsonNode errorNode) {
    if (errorNode == null || errorNode.isNull()) {
      return null;
    }
    if (errorNode.isTextual()) {
      return errorNode.asText();
    }
    String message = errorNode.path("message").asText(null);
    if (!StringUtils.hasText(message)) {
      message = errorNode.path("code").asText(null);
    }
    String field = errorNode.path("field").asText(null);
    if (StringUtils.hasText(field) && StringUtils.hasText(message)) {
      return field + ": " + message;
    }
    return StringUtils.hasText(message) ? message : field;
  }

  @Nullable
  private static HttpException findHttpException(Throwable throwable) {
    return findCause(throwable, HttpException.class);
  }

  @Nullable
  private static <T extends Throwable> T findCause(Throwable throwable, Class<T> type) {
    Throwable current = throwable;
    while (current != null) {
      if (type.isInstance(current)) {
        return type.cast(current);
      }
      current = current.getCause();
    }
    return null;
  }

  @Nullable
  private static Integer intHeader(Map<String, List<String>> headers, String name) {
    Long value = longHeader(headers, name);
    return value != null ? (int) Math.min(Integer.MAX_VALUE, value) : null;
  }

  @Nullable
  private static Long longHeader(Map<String, List<String>> headers, String name) {
    for (Map.Entry<String, List<String>> entry : headers.entrySet()) {
      if (entry.getKey() == null || !entry.getKey().equalsIgnoreCase(name)) {
        continue;
      }
      List<String> values = entry.getValue();
      if (values == null || values.isEmpty() || !StringUtils.hasText(values.get(0))) {
        return null;
      }
      try {
        return Long.parseLong(values.get(0).trim());
      } catch (NumberFormatException ex) {
        log.debug("Ignoring non-numeric {} header: {}", name, values.get(0));
        return null;
      }
    }
    return null;
  }
}
