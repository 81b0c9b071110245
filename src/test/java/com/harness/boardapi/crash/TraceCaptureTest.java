package com.harness.boardapi.crash;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TraceCaptureTest {

  @Test
  void currentTraceMatchesPrintStackTraceIncludingCauses() {
    IllegalStateException failure =
        new IllegalStateException("outer", new IllegalArgumentException("inner"));

    String trace = new TraceCapture(100_000).captureCurrent(failure);

    assertThat(trace)
        .startsWith("java.lang.IllegalStateException: outer")
        .contains("\tat com.harness.boardapi.crash.TraceCaptureTest.")
        .contains("Caused by: java.lang.IllegalArgumentException: inner");
  }

  @Test
  void allThreadsTraceAppendsOtherLiveThreads() throws Exception {
    Thread parked = new Thread(() -> {
      try {
        Thread.sleep(10_000);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    }, "parked-for-trace-test");
    parked.setDaemon(true);
    parked.start();
    try {
      String trace = new TraceCapture(1_000_000).captureAllThreads(new IllegalStateException("boom"));

      assertThat(trace)
          .startsWith("java.lang.IllegalStateException: boom")
          .contains("\"parked-for-trace-test\"");
    } finally {
      parked.interrupt();
      parked.join(1_000);
    }
  }

  @Test
  void outputIsBoundedByMaxChars() {
    String trace = new TraceCapture(64).captureAllThreads(new IllegalStateException("boom"));

    assertThat(trace).hasSize(64).startsWith("java.lang.IllegalStateException: boom");
  }
}
