package com.harness.boardapi.crash;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.Map;

/**
 * Renders the trace text attached to a failure report, bounded to
 * {@link ReportingSettings#maxTraceChars()}.
 */
public class TraceCapture {

  private final int maxChars;

  public TraceCapture(int maxChars) {
    this.maxChars = maxChars;
  }

  /**
   * The failure's own trace followed by a dump of every other live thread.
   */
  public String captureAllThreads(Throwable failure) {
    StringBuilder out = new StringBuilder(render(failure));
    Thread current = Thread.currentThread();
    for (Map.Entry<Thread, StackTraceElement[]> entry : Thread.getAllStackTraces().entrySet()) {
      if (out.length() >= maxChars) {
        break;
      }
      Thread thread = entry.getKey();
      if (thread == current) {
        continue;
      }
      out.append(System.lineSeparator());
      out.append('"').append(thread.getName()).append('"')
          .append(" #").append(thread.getId())
          .append(thread.isDaemon() ? " daemon" : "")
          .append(' ').append(thread.getState())
          .append(System.lineSeparator());
      for (StackTraceElement frame : entry.getValue()) {
        out.append("\tat ").append(frame).append(System.lineSeparator());
      }
    }
    return truncate(out.toString());
  }

  public String captureCurrent(Throwable failure) {
    return truncate(render(failure));
  }

  private static String render(Throwable failure) {
    StringWriter buffer = new StringWriter();
    try (PrintWriter writer = new PrintWriter(buffer)) {
      failure.printStackTrace(writer);
    }
    return buffer.toString();
  }

  private String truncate(String text) {
    return text.length() <= maxChars ? text : text.substring(0, maxChars);
  }
}
