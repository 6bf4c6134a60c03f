package com.aiadvent.mcp.pages.client;

import java.util.Objects;

/**
 * Credential of one remote operation together with the gate every HTTP request it sends has to
 * pass. {@link RepositoryApi} implementations call {@link #beforeRequest()} once per request.
 */
public record RequestContext(String token, Gate gate) {

  public RequestContext {
    Objects.requireNonNull(token, "token");
    Objects.requireNonNull(gate, "gate");
  }

  /** Blocks until one more HTTP request may be sent. */
  public void beforeRequest() {
    gate.admit();
  }

  @FunctionalInterface
  public interface Gate {
    void admit();
  }
}
