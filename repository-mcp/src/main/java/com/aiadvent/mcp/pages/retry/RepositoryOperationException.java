package com.aiadvent.mcp.pages.retry;

import java.util.List;
import org.springframework.lang.Nullable;

/** A remote operation failed for good, after classification and any retries. */
public class RepositoryOperationException extends RuntimeException {

  private final String operation;
  private final FailureClass failureClass;
  private final Integer status;
  private final int attempts;
  private final List<OperationAttempt> history;

  public RepositoryOperationException(
      String operation,
      FailureClass failureClass,
      @Nullable Integer status,
      int attempts,
      List<OperationAttempt> history,
      String message,
      @Nullable Throwable cause) {
    super(message, cause);
    this.operation = operation;
    this.failureClass = failureClass;
    this.status = status;
    this.attempts = attempts;
    this.history = history == null ? List.of() : List.copyOf(history);
  }

  public static RepositoryOperationException of(
      String operation, FailureClass failureClass, String message) {
    return new RepositoryOperationException(
        operation, failureClass, null, 0, List.of(), message, null);
  }

  public String operation() {
    return operation;
  }

  public FailureClass failureClass() {
    return failureClass;
  }

  @Nullable
  public Integer status() {
    return status;
  }

  /** Counted attempts made before giving up. */
  public int attempts() {
    return attempts;
  }

  public List<OperationAttempt> history() {
    return history;
  }
}
