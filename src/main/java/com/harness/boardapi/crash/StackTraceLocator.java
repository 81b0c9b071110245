package com.harness.boardapi.crash;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Picks the frame a failure should be attributed to: the first frame, in trace order, that
 * belongs to application code rather than to the crash-reporting classes or to the
 * JDK/servlet container/framework underneath.
 *
 * <p>Frames are taken from the throwable itself when available; {@link #locate(String)} applies
 * the same rules to trace text. The result is a diagnostic hint only.
 */
public class StackTraceLocator {

  private static final String SOURCE_EXTENSION = ".java";

  private static final List<String> INFRASTRUCTURE_CLASSES = List.of(
      CrashRecoveryFilter.class.getName(),
      CrashReporter.class.getName(),
      CrashReportDispatcher.class.getName(),
      TraceCapture.class.getName(),
      StartupFailureReporter.class.getName()
  );

  private static final List<String> PLATFORM_PREFIXES = List.of(
      "java.",
      "javax.",
      "jdk.",
      "sun.",
      "com.sun.",
      "jakarta.",
      "org.springframework.",
      "org.apache.catalina.",
      "org.apache.coyote.",
      "org.apache.tomcat.",
      "org.hibernate.",
      "com.zaxxer.hikari.",
      "org.postgresql.",
      "com.fasterxml.jackson.",
      "org.junit.",
      "org.mockito.",
      "net.bytebuddy."
  );

  private static final List<String> UNIT_START_PREFIXES = List.of(
      "\"",
      "Caused by:",
      "Suppressed:",
      "Exception in thread"
  );

  // at [loader//][module@version/]pkg.Class.method(File.java:42) [trailing annotation]
  private static final Pattern FRAME_LINE = Pattern.compile("^\\s*at\\s+(\\S+?)\\(([^()]*)\\)");

  public Optional<SourceLocation> locate(Throwable failure) {
    Set<Throwable> seen = Collections.newSetFromMap(new IdentityHashMap<>());
    for (Throwable current = failure; current != null && seen.add(current);
        current = current.getCause()) {
      for (StackTraceElement frame : current.getStackTrace()) {
        if (frame.getFileName() == null || frame.getLineNumber() <= 0) {
          continue;
        }
        if (isApplicationFrame(frame.getClassName(), frame.getFileName())) {
          return Optional.of(new SourceLocation(lastSegment(frame.getFileName()),
              frame.getLineNumber()));
        }
      }
    }
    return Optional.empty();
  }

  public Optional<SourceLocation> locate(String traceText) {
    if (traceText == null || traceText.isEmpty()) {
      return Optional.empty();
    }
    for (String line : traceText.split("\\R")) {
      if (startsUnit(line)) {
        continue;
      }
      Matcher matcher = FRAME_LINE.matcher(line);
      if (!matcher.find()) {
        continue;
      }
      String location = matcher.group(2);
      if (!location.contains(SOURCE_EXTENSION + ":")) {
        continue;
      }
      String className = classOf(matcher.group(1));
      int colon = location.lastIndexOf(':');
      String filePath = location.substring(0, colon).trim();
      if (!isApplicationFrame(className, filePath)) {
        continue;
      }
      Optional<Integer> lineNumber = parseLine(location.substring(colon + 1));
      if (lineNumber.isPresent()) {
        return Optional.of(new SourceLocation(lastSegment(filePath), lineNumber.get()));
      }
    }
    return Optional.empty();
  }

  boolean isApplicationFrame(String className, String filePath) {
    if (className == null || className.isEmpty()) {
      return false;
    }
    if (filePath == null || !filePath.endsWith(SOURCE_EXTENSION)) {
      return false;
    }
    for (String infra : INFRASTRUCTURE_CLASSES) {
      if (className.equals(infra) || className.startsWith(infra + "$")) {
        return false;
      }
    }
    for (String prefix : PLATFORM_PREFIXES) {
      if (className.startsWith(prefix)) {
        return false;
      }
    }
    return true;
  }

  private static boolean startsUnit(String line) {
    String trimmed = line.stripLeading();
    for (String prefix : UNIT_START_PREFIXES) {
      if (trimmed.startsWith(prefix)) {
        return true;
      }
    }
    return false;
  }

  /**
   * Drops class loader and module qualifiers, then the method name.
   */
  private static String classOf(String descriptor) {
    String qualified = descriptor.substring(descriptor.lastIndexOf('/') + 1);
    int lastDot = qualified.lastIndexOf('.');
    return lastDot > 0 ? qualified.substring(0, lastDot) : qualified;
  }

  private static Optional<Integer> parseLine(String text) {
    String digits = text.trim();
    int space = digits.indexOf(' ');
    if (space > 0) {
      digits = digits.substring(0, space);
    }
    try {
      int line = Integer.parseInt(digits);
      return line > 0 ? Optional.of(line) : Optional.empty();
    } catch (NumberFormatException e) {
      return Optional.empty();
    }
  }

  private static String lastSegment(String path) {
    int slash = Math.max(path.lastIndexOf('/'), path.lastIndexOf('\\'));
    return slash >= 0 ? path.substring(slash + 1) : path;
  }
}
