package com.harness.boardapi.crash;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.harness.boardapi.model.ProjectDto;
import com.harness.boardapi.service.ProjectService;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.test.web.servlet.MockMvc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(properties = {
    "crash-reporting.endpoint-url=" + CrashRecoveryIntegrationTest.ENDPOINT,
    "crash-reporting.board-id="
})
@AutoConfigureMockMvc
class CrashRecoveryIntegrationTest {

  static final String ENDPOINT = "http://telemetry.example.com/api/runtime-errors";

  @Autowired
  private MockMvc mockMvc;

  @Autowired
  private ObjectMapper objectMapper;

  @MockBean
  private ProjectService projectService;

  @MockBean
  private CrashReportDispatcher dispatcher;

  @Test
  void handlerFailureIsReportedAndAnswered500() throws Exception {
    given(projectService.getProject(3)).willThrow(new IllegalStateException("division by zero"));

    mockMvc.perform(get("/api/test/3")
            .header("X-Board-Id", "deadbeefdeadbeefdeadbeef")
            .header("User-Agent", "integration-test"))
        .andExpect(status().isInternalServerError())
        .andExpect(header().string("Access-Control-Allow-Origin", "*"))
        .andExpect(jsonPath("$.error").value("An error occurred while processing your request"))
        .andExpect(jsonPath("$.message").value("division by zero"));

    ArgumentCaptor<String> payload = ArgumentCaptor.forClass(String.class);
    verify(dispatcher).dispatch(eq(ENDPOINT), payload.capture());
    JsonNode report = objectMapper.readTree(payload.getValue());
    assertThat(report.get("tenantId").asText()).isEqualTo("deadbeefdeadbeefdeadbeef");
    assertThat(report.get("file").asText()).isEqualTo("ProjectController.java");
    assertThat(report.get("line").asInt()).isPositive();
    assertThat(report.get("message").asText()).isEqualTo("division by zero");
    assertThat(report.get("exceptionType").asText()).isEqualTo("panic");
    assertThat(report.get("requestPath").asText()).isEqualTo("/api/test/3");
    assertThat(report.get("requestMethod").asText()).isEqualTo("GET");
    assertThat(report.get("userAgent").asText()).isEqualTo("integration-test");
  }

  @Test
  void deliberateErrorsAreNotReported() throws Exception {
    given(projectService.getProject(4)).willReturn(new ProjectDto(4, "alpha"));
    given(projectService.listProjects())
        .willThrow(new DataAccessResourceFailureException("connection refused"));

    mockMvc.perform(get("/api/test/not-a-number"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.message").value("Invalid ID"));
    mockMvc.perform(get("/api/test/4"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.Name").value("alpha"));
    mockMvc.perform(get("/api/test"))
        .andExpect(status().isInternalServerError())
        .andExpect(jsonPath("$.error").value("Internal Server Error"))
        .andExpect(jsonPath("$.message").value("Database error: connection refused"));

    verify(dispatcher, never()).dispatch(anyString(), anyString());
    verify(dispatcher, never()).deliver(anyString(), anyString());
  }
}
