package com.harness.boardapi.crash;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;

/**
 * Serializes a {@link FailureEvent} into the JSON body posted to the reporting endpoint.
 * Unknown values are written as {@code null}, never dropped.
 */
public class CrashReportEncoder {

  private final ObjectMapper objectMapper;

  public CrashReportEncoder(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  public String encode(FailureEvent event) {
    try {
      return objectMapper.writeValueAsString(toPayload(event));
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to serialize crash report", e);
    }
  }

  CrashReportPayload toPayload(FailureEvent event) {
    return new CrashReportPayload(
        event.tenantId(),
        DateTimeFormatter.ISO_INSTANT.format(event.timestamp().truncatedTo(ChronoUnit.SECONDS)),
        event.sourceFile(),
        event.sourceLine(),
        event.traceText(),
        event.rawMessage(),
        event.kind().wireValue(),
        event.requestPath(),
        event.requestMethod(),
        event.userAgent()
    );
  }

  @JsonInclude(JsonInclude.Include.ALWAYS)
  @JsonPropertyOrder({
      "tenantId", "timestamp", "file", "line", "stackTrace", "message",
      "exceptionType", "requestPath", "requestMethod", "userAgent"
  })
  public record CrashReportPayload(
      String tenantId,
      String timestamp,
      String file,
      Integer line,
      String stackTrace,
      String message,
      String exceptionType,
      String requestPath,
      String requestMethod,
      String userAgent
  ) {}
}
