package com.aiadvent.mcp.pages.support;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class ProgressListenerTest {

  @Test
  void scaledListenerMapsNestedRange() {
    List<Integer> reported = new ArrayList<>();
    ProgressListener scaled = ((ProgressListener) (percentage, message) -> reported.add(percentage)).scaled(10, 80);

    scaled.onProgress(0, "start");
    scaled.onProgress(50, "half");
    scaled.onProgress(100, "done");
    scaled.onProgress(150, "overflow");

    assertThat(reported).containsExactly(10, 45, 80, 80);
  }

  @Test
  void orNoneNeverReturnsNull() {
    assertThat(ProgressListener.orNone(null)).isSameAs(ProgressListener.NONE);
  }
}
