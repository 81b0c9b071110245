package com.harness.boardapi.crash;

import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns a caught failure into a {@link FailureEvent} and ships it to the reporting endpoint
 * when one is configured.
 */
public class CrashReporter {

  private static final Logger log = LoggerFactory.getLogger(CrashReporter.class);

  private final ReportingSettings settings;
  private final TenantResolver tenantResolver;
  private final StackTraceLocator locator;
  private final TraceCapture traceCapture;
  private final CrashReportEncoder encoder;
  private final CrashReportDispatcher dispatcher;
  private final Clock clock;

  public CrashReporter(ReportingSettings settings,
                       TenantResolver tenantResolver,
                       StackTraceLocator locator,
                       TraceCapture traceCapture,
                       CrashReportEncoder encoder,
                       CrashReportDispatcher dispatcher,
                       Clock clock) {
    this.settings = settings;
    this.tenantResolver = tenantResolver;
    this.locator = locator;
    this.traceCapture = traceCapture;
    this.encoder = encoder;
    this.dispatcher = dispatcher;
    this.clock = clock;
  }

  /**
   * Reports a failure that escaped request handling. Delivery runs in the background.
   */
  public FailureEvent reportRequestFailure(HttpServletRequest request, Throwable failure) {
    Throwable cause = unwrap(failure);
    String traceText = traceCapture.captureAllThreads(cause);
    String tenantId = tenantResolver.resolve(request).orElse(null);
    Optional<SourceLocation> location = locator.locate(cause);

    FailureEvent event = new FailureEvent(
        tenantId,
        Instant.now(clock),
        location.map(SourceLocation::file).orElse(null),
        location.map(SourceLocation::line).orElse(null),
        messageOf(cause),
        traceText,
        request.getRequestURI(),
        request.getMethod(),
        nullToEmpty(request.getHeader("User-Agent")),
        FailureKind.PANIC
    );

    log.error("Recovered from request failure. method={}, path={}, boardId={}, file={}, line={}",
        event.requestMethod(), event.requestPath(), tenantId != null ? tenantId : "NULL",
        event.sourceFile(), event.sourceLine(), cause);

    if (settings.reportingEnabled()) {
      dispatcher.dispatch(settings.endpointUrl(), encoder.encode(event));
    } else {
      log.info("{} is not set, skipping crash report", ReportingSettings.ENDPOINT_ENV);
    }
    return event;
  }

  /**
   * Reports a failure to start the application. Delivery happens on the calling thread,
   * bounded by the dispatcher's timeout, since the process is about to exit.
   */
  public FailureEvent reportStartupFailure(Throwable failure) {
    String traceText = traceCapture.captureCurrent(failure);
    FailureEvent event = FailureEvent.startup(
        settings.hasBoardId() ? settings.boardId() : null,
        Instant.now(clock),
        locator.locate(failure),
        messageOf(failure),
        traceText
    );

    log.error("Application failed to start. file={}, line={}",
        event.sourceFile(), event.sourceLine(), failure);

    if (settings.reportingEnabled()) {
      dispatcher.deliver(settings.endpointUrl(), encoder.encode(event));
    }
    return event;
  }

  /**
   * The servlet container wraps handler failures; report what the handler actually threw.
   */
  static Throwable unwrap(Throwable failure) {
    Throwable current = failure;
    while (current instanceof ServletException && current.getCause() != null
        && current.getCause() != current) {
      current = current.getCause();
    }
    return current;
  }

  static String messageOf(Throwable failure) {
    String message = failure.getMessage();
    return message != null ? message : failure.toString();
  }

  private static String nullToEmpty(String value) {
    return value != null ? value : "";
  }
}
