package com.harness.boardapi.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.harness.boardapi.crash.CrashReportDispatcher;
import com.harness.boardapi.crash.CrashReportEncoder;
import com.harness.boardapi.crash.CrashReporter;
import com.harness.boardapi.crash.ReportingSettings;
import com.harness.boardapi.crash.StackTraceLocator;
import com.harness.boardapi.crash.TenantResolver;
import com.harness.boardapi.crash.TraceCapture;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ThreadPoolExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class CrashReportingConfig {

  private static final Logger log = LoggerFactory.getLogger(CrashReportingConfig.class);

  @Bean
  public ReportingSettings reportingSettings(
      @Value("${crash-reporting.endpoint-url:}") String endpointUrl,
      @Value("${crash-reporting.board-id:}") String boardId,
      @Value("${crash-reporting.timeout-ms:5000}") long timeoutMs,
      @Value("${crash-reporting.max-trace-chars:8192}") int maxTraceChars) {
    ReportingSettings settings = new ReportingSettings(
        endpointUrl, boardId, Duration.ofMillis(timeoutMs), maxTraceChars);
    if (settings.reportingEnabled()) {
      log.info("Crash reporting enabled. endpoint={}, timeoutMs={}", settings.endpointUrl(), timeoutMs);
    } else {
      log.info("Crash reporting disabled, {} is not set", ReportingSettings.ENDPOINT_ENV);
    }
    return settings;
  }

  // Reports are dropped once the queue is full.
  @Bean(name = "crashReportExecutor")
  public ThreadPoolTaskExecutor crashReportExecutor(
      @Value("${crash-reporting.executor.core-size:2}") int coreSize,
      @Value("${crash-reporting.executor.max-size:4}") int maxSize,
      @Value("${crash-reporting.executor.queue-capacity:100}") int queueCapacity) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(coreSize);
    executor.setMaxPoolSize(maxSize);
    executor.setQueueCapacity(queueCapacity);
    executor.setThreadNamePrefix("crash-report-");
    executor.setDaemon(true);
    executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
    executor.setWaitForTasksToCompleteOnShutdown(false);
    return executor;
  }

  @Bean
  public TenantResolver tenantResolver(ReportingSettings settings) {
    return new TenantResolver(settings);
  }

  @Bean
  public StackTraceLocator stackTraceLocator() {
    return new StackTraceLocator();
  }

  @Bean
  public TraceCapture traceCapture(ReportingSettings settings) {
    return new TraceCapture(settings.maxTraceChars());
  }

  @Bean
  public CrashReportEncoder crashReportEncoder(ObjectMapper objectMapper) {
    return new CrashReportEncoder(objectMapper);
  }

  @Bean
  public CrashReportDispatcher crashReportDispatcher(
      ReportingSettings settings,
      @Qualifier("crashReportExecutor") ThreadPoolTaskExecutor crashReportExecutor) {
    return new CrashReportDispatcher(
        CrashReportDispatcher.restTemplate(settings.timeout()),
        crashReportExecutor,
        settings.timeout());
  }

  @Bean
  public CrashReporter crashReporter(ReportingSettings settings,
                                     TenantResolver tenantResolver,
                                     StackTraceLocator stackTraceLocator,
                                     TraceCapture traceCapture,
                                     CrashReportEncoder crashReportEncoder,
                                     CrashReportDispatcher crashReportDispatcher) {
    return new CrashReporter(
        settings,
        tenantResolver,
        stackTraceLocator,
        traceCapture,
        crashReportEncoder,
        crashReportDispatcher,
        Clock.systemUTC()
    );
  }
}
