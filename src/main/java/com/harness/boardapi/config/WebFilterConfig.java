package com.harness.boardapi.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.harness.boardapi.crash.CrashRecoveryFilter;
import com.harness.boardapi.crash.CrashReporter;
import com.harness.boardapi.web.CorsHeaderFilter;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.Ordered;

/**
 * Crash recovery wraps everything, CORS headers come next.
 */
@Configuration
public class WebFilterConfig {

  @Bean
  public FilterRegistrationBean<CrashRecoveryFilter> crashRecoveryFilter(
      CrashReporter crashReporter, ObjectMapper objectMapper) {
    FilterRegistrationBean<CrashRecoveryFilter> registration =
        new FilterRegistrationBean<>(new CrashRecoveryFilter(crashReporter, objectMapper));
    registration.setOrder(Ordered.HIGHEST_PRECEDENCE);
    registration.addUrlPatterns("/*");
    return registration;
  }

  @Bean
  public FilterRegistrationBean<CorsHeaderFilter> corsHeaderFilter() {
    FilterRegistrationBean<CorsHeaderFilter> registration =
        new FilterRegistrationBean<>(new CorsHeaderFilter());
    registration.setOrder(Ordered.HIGHEST_PRECEDENCE + 1);
    registration.addUrlPatterns("/*");
    return registration;
  }
}
