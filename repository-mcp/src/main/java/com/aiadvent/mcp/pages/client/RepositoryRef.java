package com.aiadvent.mcp.pages.client;

import org.springframework.util.StringUtils;

/** Coordinates of the repository and working branch the client operates on. */
public record RepositoryRef(String owner, String name, String branch) {

  public static final String DEFAULT_BRANCH = "main";

  public RepositoryRef {
    if (!StringUtils.hasText(owner)) {
      throw new IllegalArgumentException("owner must not be blank");
    }
    if (!StringUtils.hasText(name)) {
      throw new IllegalArgumentException("name must not be blank");
    }
    owner = owner.trim();
    name = name.trim();
    branch = StringUtils.hasText(branch) ? branch.trim() : DEFAULT_BRANCH;
  }

  /** Parses {@code owner/name}, optionally followed by {@code @branch}. */
  public static RepositoryRef parse(String value) {
    if (!StringUtils.hasText(value)) {
      throw new IllegalArgumentException("repository must not be blank");
    }
    String trimmed = value.trim();
    String branch = null;
    int at = trimmed.indexOf('@');
    if (at >= 0) {
      branch = trimmed.substring(at + 1);
      trimmed = trimmed.substring(0, at);
    }
    int slash = trimmed.indexOf('/');
    if (slash <= 0 || slash == trimmed.length() - 1 || trimmed.indexOf('/', slash + 1) >= 0) {
      throw new IllegalArgumentException("repository must look like owner/name: " + value);
    }
    return new RepositoryRef(trimmed.substring(0, slash), trimmed.substring(slash + 1), branch);
  }

  public String fullName() {
    return owner + "/" + name;
  }

  public RepositoryRef withBranch(String newBranch) {
    return new RepositoryRef(owner, name, newBranch);
  }
}
