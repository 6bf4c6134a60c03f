package com.aiadvent.mcp.pages.conflict;

import java.util.List;

/** Suggested way out of a {@link Conflict}, with the steps a person would follow. */
public record Resolution(
    Conflict.Kind conflictKind,
    Action action,
    Risk risk,
    String title,
    String description,
    List<String> steps) {

  public Resolution {
    steps = List.copyOf(steps);
  }

  public enum Action {
    MERGE,
    REBASE,
    NEW_BRANCH,
    COORDINATE,
    MANUAL
  }

  public enum Risk {
    LOW,
    MEDIUM,
    HIGH
  }
}
