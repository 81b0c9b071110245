package com.harness.boardapi.crash;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import java.util.Map;
import org.springframework.core.task.SyncTaskExecutor;

/**
 * Reports a failed application start. Runs without a Spring context, so it wires its own
 * collaborators from the process environment.
 */
public class StartupFailureReporter {

  private final CrashReporter crashReporter;

  public StartupFailureReporter(CrashReporter crashReporter) {
    this.crashReporter = crashReporter;
  }

  public static StartupFailureReporter fromEnvironment(Map<String, String> env) {
    ReportingSettings settings = ReportingSettings.fromEnvironment(env);
    CrashReportDispatcher dispatcher = new CrashReportDispatcher(
        CrashReportDispatcher.restTemplate(settings.timeout()),
        new SyncTaskExecutor(),
        settings.timeout());
    return new StartupFailureReporter(new CrashReporter(
        settings,
        new TenantResolver(settings),
        new StackTraceLocator(),
        new TraceCapture(settings.maxTraceChars()),
        new CrashReportEncoder(new ObjectMapper()),
        dispatcher,
        Clock.systemUTC()
    ));
  }

  public FailureEvent report(Throwable failure) {
    return crashReporter.reportStartupFailure(failure);
  }
}
