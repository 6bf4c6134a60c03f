package com.aiadvent.mcp.pages.retry;

/** Category a failed remote call falls into; drives retry and offline decisions. */
public enum FailureClass {
  AUTHORIZATION(false),
  VALIDATION(false),
  RATE_LIMITED(true),
  SECONDARY_RATE_LIMITED(true),
  SERVER(true),
  NETWORK(true),
  CONFLICT(false),
  NOT_FOUND(false),
  UNCLASSIFIED(false);

  private final boolean degradesConnectivity;

  FailureClass(boolean degradesConnectivity) {
    this.degradesConnectivity = degradesConnectivity;
  }

  /** Whether a persistent failure of this class means the remote is effectively unreachable. */
  public boolean degradesConnectivity() {
    return degradesConnectivity;
  }

  public boolean isTerminal() {
    return this == AUTHORIZATION || this == VALIDATION;
  }
}
