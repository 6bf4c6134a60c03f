package com.aiadvent.mcp.pages.offline;

/** Lightweight reachability check; returns normally when the remote answered. */
@FunctionalInterface
public interface ConnectivityProbe {

  void check();
}
