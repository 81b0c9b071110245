package com.harness.boardapi.crash;

import java.time.Duration;
import java.util.Map;

/**
 * Immutable crash-reporting configuration, resolved once at startup.
 *
 * @param endpointUrl   telemetry endpoint; blank disables reporting
 * @param boardId       statically configured tenant/board id, may be blank
 * @param timeout       connect and read timeout of a single delivery attempt
 * @param maxTraceChars upper bound on the captured trace text
 */
public record ReportingSettings(
    String endpointUrl,
    String boardId,
    Duration timeout,
    int maxTraceChars
) {

  public static final String ENDPOINT_ENV = "RUNTIME_ERROR_ENDPOINT_URL";
  public static final String BOARD_ID_ENV = "BOARD_ID";
  public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(5);
  public static final int DEFAULT_MAX_TRACE_CHARS = 8192;

  public ReportingSettings {
    endpointUrl = endpointUrl == null ? "" : endpointUrl.trim();
    boardId = boardId == null ? "" : boardId.trim();
    timeout = timeout != null ? timeout : DEFAULT_TIMEOUT;
    if (maxTraceChars <= 0) {
      maxTraceChars = DEFAULT_MAX_TRACE_CHARS;
    }
  }

  /**
   * Used before the Spring context exists, e.g. when startup itself fails.
   */
  public static ReportingSettings fromEnvironment(Map<String, String> env) {
    return new ReportingSettings(
        env.get(ENDPOINT_ENV),
        env.get(BOARD_ID_ENV),
        DEFAULT_TIMEOUT,
        DEFAULT_MAX_TRACE_CHARS
    );
  }

  public boolean reportingEnabled() {
    return !endpointUrl.isEmpty();
  }

  public boolean hasBoardId() {
    return !boardId.isEmpty();
  }
}
