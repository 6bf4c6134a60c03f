package com.aiadvent.mcp.pages.client;

/** Where a read result came from. */
public enum DataSource {
  LIVE,
  CACHE,
  FALLBACK
}
