package com.aiadvent.mcp.pages.offline;

public enum ConnectivityMode {
  ONLINE,
  OFFLINE
}
