package com.harness.boardapi.crash;

import java.time.Instant;
import java.util.Optional;

/**
 * One recovered failure, built once and handed to the dispatcher as-is.
 * {@code tenantId}, {@code sourceFile} and {@code sourceLine} are null when unknown.
 */
public record FailureEvent(
    String tenantId,
    Instant timestamp,
    String sourceFile,
    Integer sourceLine,
    String rawMessage,
    String traceText,
    String requestPath,
    String requestMethod,
    String userAgent,
    FailureKind kind
) {

  public static final String STARTUP_PATH = "STARTUP";
  public static final String STARTUP_METHOD = "STARTUP";
  public static final String STARTUP_USER_AGENT = "STARTUP_ERROR";

  public static FailureEvent startup(
      String tenantId,
      Instant timestamp,
      Optional<SourceLocation> location,
      String rawMessage,
      String traceText) {
    return new FailureEvent(
        tenantId,
        timestamp,
        location.map(SourceLocation::file).orElse(null),
        location.map(SourceLocation::line).orElse(null),
        rawMessage,
        traceText,
        STARTUP_PATH,
        STARTUP_METHOD,
        STARTUP_USER_AGENT,
        FailureKind.ERROR
    );
  }
}
