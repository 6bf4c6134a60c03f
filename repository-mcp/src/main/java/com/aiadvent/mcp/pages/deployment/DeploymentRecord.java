package com.aiadvent.mcp.pages.deployment;

import java.time.Instant;
import org.springframework.lang.Nullable;

/** A publish of the site as reported by the repository backend. */
public record DeploymentRecord(
    long id,
    String sourceCommit,
    Status status,
    @Nullable String publishedUrl,
    @Nullable Instant createdAt,
    @Nullable Instant updatedAt) {

  public enum Status {
    PENDING,
    COMPLETED,
    FAILED
  }
}
