package com.aiadvent.mcp.pages.support;

public class OperationCancelledException extends RuntimeException {

  private final String operation;

  public OperationCancelledException(String operation) {
    super("Operation '%s' was cancelled".formatted(operation));
    this.operation = operation;
  }

  public String operation() {
    return operation;
  }
}
