package com.harness.boardapi.web;

import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import static org.assertj.core.api.Assertions.assertThat;

class CorsHeaderFilterTest {

  private final CorsHeaderFilter filter = new CorsHeaderFilter();

  @Test
  void addsHeadersAndContinuesChain() throws Exception {
    AtomicBoolean reached = new AtomicBoolean(false);
    MockHttpServletResponse response = new MockHttpServletResponse();

    filter.doFilter(new MockHttpServletRequest("GET", "/api/test"), response,
        (req, res) -> reached.set(true));

    assertThat(reached).isTrue();
    assertThat(response.getHeader("Access-Control-Allow-Origin")).isEqualTo("*");
    assertThat(response.getHeader("Access-Control-Allow-Methods"))
        .isEqualTo("GET, POST, PUT, DELETE, OPTIONS");
    assertThat(response.getHeader("Access-Control-Allow-Headers")).isEqualTo("Content-Type");
  }

  @Test
  void preflightIsAnsweredWithoutReachingHandlers() throws Exception {
    AtomicBoolean reached = new AtomicBoolean(false);
    MockHttpServletResponse response = new MockHttpServletResponse();

    filter.doFilter(new MockHttpServletRequest("OPTIONS", "/api/test"), response,
        (req, res) -> reached.set(true));

    assertThat(reached).isFalse();
    assertThat(response.getStatus()).isEqualTo(200);
    assertThat(response.getHeader("Access-Control-Allow-Origin")).isEqualTo("*");
  }
}
