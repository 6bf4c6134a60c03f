package com.aiadvent.mcp.pages.support;

/** Receives progress of long operations (commits, deployment monitoring). */
@FunctionalInterface
public interface ProgressListener {

  ProgressListener NONE = (percentage, message) -> {};

  void onProgress(int percentage, String message);

  static ProgressListener orNone(ProgressListener listener) {
    return listener != null ? listener : NONE;
  }

  /**
   * Maps the full 0-100 range of a nested step onto {@code [from, to]} of this listener.
   */
  default ProgressListener scaled(int from, int to) {
    ProgressListener target = this;
    return (percentage, message) -> {
      int bounded = Math.max(0, Math.min(100, percentage));
      target.onProgress(from + (int) Math.round((to - from) * bounded / 100.0), message);
    };
  }
}
