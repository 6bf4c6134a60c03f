package com.aiadvent.mcp.pages.support;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class RecentEventLogTest {

  @Test
  void keepsNewestEventsFirstWithinCapacity() {
    RecentEventLog log = new RecentEventLog(2);

    log.onEvent(event(RepositoryEvent.Type.ENTERED_OFFLINE));
    log.onEvent(event(RepositoryEvent.Type.EXITED_OFFLINE));
    log.onEvent(event(RepositoryEvent.Type.CONFLICT_DETECTED));

    assertThat(log.recent())
        .extracting(RepositoryEvent::type)
        .containsExactly(RepositoryEvent.Type.CONFLICT_DETECTED, RepositoryEvent.Type.EXITED_OFFLINE);
  }

  @Test
  void compositeKeepsDeliveringWhenOneListenerFails() {
    List<RepositoryEvent> delivered = new ArrayList<>();
    RepositoryEventListener failing =
        event -> {
          throw new IllegalStateException("listener down");
        };
    RepositoryEventListener composite = RepositoryEventListener.composite(List.of(failing, delivered::add));

    composite.onEvent(event(RepositoryEvent.Type.DEPLOYMENT_FINISHED));

    assertThat(delivered).hasSize(1);
  }

  private static RepositoryEvent event(RepositoryEvent.Type type) {
    return new RepositoryEvent(type, type.name(), Instant.parse("2024-05-01T10:00:00Z"), Map.of());
  }
}
