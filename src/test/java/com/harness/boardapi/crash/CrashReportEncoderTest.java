package com.harness.boardapi.crash;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CrashReportEncoderTest {

  private final ObjectMapper objectMapper = new ObjectMapper();
  private final CrashReportEncoder encoder = new CrashReportEncoder(objectMapper);

  @Test
  void encodesAllFieldsInOrder() throws Exception {
    FailureEvent event = new FailureEvent(
        "deadbeefdeadbeefdeadbeef",
        Instant.parse("2026-10-19T10:15:30.123Z"),
        "ProjectService.java",
        42,
        "division by zero",
        "trace",
        "/api/test/1",
        "GET",
        "curl/8.0",
        FailureKind.PANIC
    );

    JsonNode json = objectMapper.readTree(encoder.encode(event));

    List<String> names = new ArrayList<>();
    Iterator<String> it = json.fieldNames();
    it.forEachRemaining(names::add);
    assertThat(names).containsExactly(
        "tenantId", "timestamp", "file", "line", "stackTrace", "message",
        "exceptionType", "requestPath", "requestMethod", "userAgent");
    assertThat(json.get("tenantId").asText()).isEqualTo("deadbeefdeadbeefdeadbeef");
    assertThat(json.get("timestamp").asText()).isEqualTo("2026-10-19T10:15:30Z");
    assertThat(json.get("file").asText()).isEqualTo("ProjectService.java");
    assertThat(json.get("line").isInt()).isTrue();
    assertThat(json.get("line").asInt()).isEqualTo(42);
    assertThat(json.get("exceptionType").asText()).isEqualTo("panic");
    assertThat(json.get("requestMethod").asText()).isEqualTo("GET");
  }

  @Test
  void absentValuesAreNullTokens() {
    FailureEvent event = FailureEvent.startup(
        null,
        Instant.parse("2026-10-19T10:15:30Z"),
        Optional.empty(),
        "Port 8080 was already in use",
        "trace"
    );

    String payload = encoder.encode(event);

    assertThat(payload)
        .contains("\"tenantId\":null")
        .contains("\"file\":null")
        .contains("\"line\":null")
        .doesNotContain("\"tenantId\":\"\"")
        .contains("\"exceptionType\":\"error\"")
        .contains("\"requestPath\":\"STARTUP\"")
        .contains("\"requestMethod\":\"STARTUP\"")
        .contains("\"userAgent\":\"STARTUP_ERROR\"");
  }

  @Test
  void escapesFreeTextWithoutDoubleEscaping() {
    FailureEvent event = eventWith("say \"hi\"\\n", "a\\b\n\tc\r\n");

    String payload = encoder.encode(event);

    assertThat(payload)
        .contains("\"message\":\"say \\\"hi\\\"\\\\n\"")
        .contains("\"stackTrace\":\"a\\\\b\\n\\tc\\r\\n\"");
  }

  @Test
  void decodingRestoresMessageAndTraceExactly() throws Exception {
    String message = "bad \"input\" at C:\\temp\\x\n\tsecond line\r";
    String trace = "java.lang.IllegalStateException: " + message + "\n\tat a.B.c(B.java:1)\n\u0001";

    JsonNode json = objectMapper.readTree(encoder.encode(eventWith(message, trace)));

    assertThat(json.get("message").asText()).isEqualTo(message);
    assertThat(json.get("stackTrace").asText()).isEqualTo(trace);
  }

  private static FailureEvent eventWith(String message, String trace) {
    return new FailureEvent(
        null,
        Instant.parse("2026-10-19T10:15:30Z"),
        null,
        null,
        message,
        trace,
        "/",
        "GET",
        "",
        FailureKind.PANIC
    );
  }
}
