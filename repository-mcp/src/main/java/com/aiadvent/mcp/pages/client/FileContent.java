package com.aiadvent.mcp.pages.client;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Base64;
import org.springframework.lang.Nullable;

/**
 * File as read from the repository.
 *
 * @param content raw bytes, {@code null} when the path does not exist
 * @param versionTag blob sha of the version read, used for optimistic writes
 */
public record FileContent(
    String path,
    String ref,
    @Nullable byte[] content,
    @Nullable String versionTag,
    DataSource source) {

  public static FileContent missing(String path, String ref) {
    return new FileContent(path, ref, null, null, DataSource.LIVE);
  }

  public boolean exists() {
    return content != null;
  }

  @Nullable
  public String text() {
    return content != null ? new String(content, StandardCharsets.UTF_8) : null;
  }

  @Nullable
  public String base64() {
    return content != null ? Base64.getEncoder().encodeToString(content) : null;
  }

  public int size() {
    return content != null ? content.length : 0;
  }

  public FileContent withSource(DataSource newSource) {
    return new FileContent(path, ref, content, versionTag, newSource);
  }

  /** Deep copy; the byte array is never shared. */
  public FileContent copy() {
    return new FileContent(
        path, ref, content != null ? Arrays.copyOf(content, content.length) : null, versionTag, source);
  }
}
