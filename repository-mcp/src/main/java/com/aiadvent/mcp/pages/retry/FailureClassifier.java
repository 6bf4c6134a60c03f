package com.aiadvent.mcp.pages.retry;

@FunctionalInterface
public interface FailureClassifier {

  Classification classify(Throwable failure);
}
