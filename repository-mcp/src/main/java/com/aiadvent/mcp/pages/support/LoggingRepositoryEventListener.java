package com.aiadvent.mcp.pages.support;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class LoggingRepositoryEventListener implements RepositoryEventListener {

  private static final Logger log = LoggerFactory.getLogger(LoggingRepositoryEventListener.class);

  @Override
  public void onEvent(RepositoryEvent event) {
    switch (event.type()) {
      case ENTERED_OFFLINE, CONFLICT_DETECTED ->
          log.warn("repository.event type={} message={} details={}", event.type(), event.message(), event.details());
      default ->
          log.info("repository.event type={} message={} details={}", event.type(), event.message(), event.details());
    }
  }
}
