package com.aiadvent.mcp.pages.offline;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Optional;

/** Static content handed out for a path when it is neither reachable nor cached. */
@FunctionalInterface
public interface FallbackProvider {

  Optional<byte[]> fallbackFor(String path);

  static FallbackProvider empty() {
    return path -> Optional.empty();
  }

  static FallbackProvider of(Map<String, String> payloads) {
    Map<String, String> snapshot = payloads == null ? Map.of() : Map.copyOf(payloads);
    return path ->
        Optional.ofNullable(snapshot.get(path)).map(value -> value.getBytes(StandardCharsets.UTF_8));
  }
}
