package com.aiadvent.mcp.pages.support;

import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

@FunctionalInterface
public interface RepositoryEventListener {

  void onEvent(RepositoryEvent event);

  /** Fans an event out to every listener; a failing listener does not stop the others. */
  static RepositoryEventListener composite(List<? extends RepositoryEventListener> listeners) {
    List<RepositoryEventListener> snapshot = List.copyOf(listeners);
    Logger log = LoggerFactory.getLogger(RepositoryEventListener.class);
    return event -> {
      for (RepositoryEventListener listener : snapshot) {
        try {
          listener.onEvent(event);
        } catch (RuntimeException ex) {
          log.warn("Repository event listener failed for {}: {}", event.type(), ex.getMessage(), ex);
        }
      }
    };
  }
}
