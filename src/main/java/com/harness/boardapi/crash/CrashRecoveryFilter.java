package com.harness.boardapi.crash;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.harness.boardapi.model.ErrorResponse;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Outermost filter. Anything thrown further down the chain is reported through
 * {@link CrashReporter} and answered with a 500 JSON body instead of reaching the container.
 */
public class CrashRecoveryFilter extends OncePerRequestFilter {

  private static final Logger log = LoggerFactory.getLogger(CrashRecoveryFilter.class);

  private final CrashReporter crashReporter;
  private final ObjectMapper objectMapper;

  public CrashRecoveryFilter(CrashReporter crashReporter, ObjectMapper objectMapper) {
    this.crashReporter = crashReporter;
    this.objectMapper = objectMapper;
  }

  @Override
  protected void doFilterInternal(HttpServletRequest request,
                                  HttpServletResponse response,
                                  FilterChain filterChain) throws ServletException, IOException {
    try {
      filterChain.doFilter(request, response);
    } catch (RuntimeException | Error | ServletException | IOException e) {
      recover(request, response, e);
    }
  }

  private void recover(HttpServletRequest request, HttpServletResponse response, Throwable failure)
      throws IOException {
    Throwable cause = CrashReporter.unwrap(failure);
    try {
      crashReporter.reportRequestFailure(request, failure);
    } catch (RuntimeException e) {
      log.error("Crash reporting failed. method={}, path={}",
          request.getMethod(), request.getRequestURI(), e);
    }

    if (response.isCommitted()) {
      log.warn("Response already committed, cannot send error body. method={}, path={}",
          request.getMethod(), request.getRequestURI());
      return;
    }

    response.resetBuffer();
    response.setStatus(HttpServletResponse.SC_INTERNAL_SERVER_ERROR);
    response.setContentType(MediaType.APPLICATION_JSON_VALUE);
    response.setCharacterEncoding("UTF-8");
    objectMapper.writeValue(response.getOutputStream(),
        ErrorResponse.unexpected(CrashReporter.messageOf(cause)));
  }
}
