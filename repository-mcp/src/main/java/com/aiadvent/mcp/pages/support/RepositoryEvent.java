package com.aiadvent.mcp.pages.support;

import java.time.Instant;
import java.util.Map;

/** Structured notification of a state transition inside the repository client. */
public record RepositoryEvent(Type type, String message, Instant occurredAt, Map<String, Object> details) {

  public RepositoryEvent {
    details = details == null ? Map.of() : Map.copyOf(details);
  }

  public enum Type {
    ENTERED_OFFLINE,
    EXITED_OFFLINE,
    CONFLICT_DETECTED,
    DEPLOYMENT_FINISHED
  }
}
