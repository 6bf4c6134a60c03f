package com.aiadvent.mcp.pages.support;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

/** Keeps the last few events in memory for status reporting. */
public class RecentEventLog implements RepositoryEventListener {

  public static final int DEFAULT_CAPACITY = 20;

  private final int capacity;
  private final Deque<RepositoryEvent> events = new ArrayDeque<>();

  public RecentEventLog() {
    this(DEFAULT_CAPACITY);
  }

  public RecentEventLog(int capacity) {
    if (capacity <= 0) {
      throw new IllegalArgumentException("capacity must be positive");
    }
    this.capacity = capacity;
  }

  @Override
  public synchronized void onEvent(RepositoryEvent event) {
    if (event == null) {
      return;
    }
    if (events.size() >= capacity) {
      events.removeFirst();
    }
    events.addLast(event);
  }

  /** Newest first. */
  public synchronized List<RepositoryEvent> recent() {
    List<RepositoryEvent> snapshot = new ArrayList<>(events);
    Collections.reverse(snapshot);
    return List.copyOf(snapshot);
  }
}
