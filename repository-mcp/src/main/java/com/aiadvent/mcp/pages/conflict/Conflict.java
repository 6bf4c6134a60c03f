package com.aiadvent.mcp.pages.conflict;

import com.aiadvent.mcp.pages.client.RepositoryApi.PeerChange;
import java.util.List;

/** Divergence between the working branch and the base branch, or a risk of it. */
public record Conflict(
    Kind kind, Severity severity, String message, int aheadBy, int behindBy, List<PeerChange> peerChanges) {

  public Conflict {
    peerChanges = peerChanges == null ? List.of() : List.copyOf(peerChanges);
  }

  public enum Kind {
    BEHIND,
    DIVERGED,
    OPEN_PEER_CHANGES
  }

  public enum Severity {
    INFO,
    WARNING,
    ERROR
  }
}
