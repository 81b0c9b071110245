package com.harness.boardapi.crash;

import java.net.URI;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.SimpleAsyncTaskExecutor;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;

/**
 * Posts crash reports to the telemetry endpoint. One attempt per report, no retry; every
 * failure is logged here and never reaches the caller.
 */
public class CrashReportDispatcher {

  private static final Logger log = LoggerFactory.getLogger(CrashReportDispatcher.class);

  private final RestTemplate restTemplate;
  private final Executor executor;
  private final Duration attemptTimeout;
  private final AsyncTaskExecutor attemptExecutor;

  public CrashReportDispatcher(RestTemplate restTemplate, Executor executor) {
    this(restTemplate, executor, ReportingSettings.DEFAULT_TIMEOUT);
  }

  /**
   * @param restTemplate   shared client
   * @param executor       runs {@link #dispatch} deliveries off the caller's thread
   * @param attemptTimeout deadline for one whole attempt, connect to last byte of the reply
   */
  public CrashReportDispatcher(RestTemplate restTemplate, Executor executor, Duration attemptTimeout) {
    this.restTemplate = restTemplate;
    this.executor = executor;
    this.attemptTimeout = attemptTimeout;
    SimpleAsyncTaskExecutor attempts = new SimpleAsyncTaskExecutor("crash-report-attempt-");
    attempts.setDaemon(true);
    this.attemptExecutor = attempts;
  }

  /**
   * Client with the given connect and response timeout. Blocking calls on it give up when the
   * calling thread is interrupted.
   */
  public static RestTemplate restTemplate(Duration timeout) {
    HttpClient httpClient = HttpClient.newBuilder()
        .version(HttpClient.Version.HTTP_1_1)
        .connectTimeout(timeout)
        .build();
    JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(httpClient);
    requestFactory.setReadTimeout(timeout);
    return new RestTemplate(requestFactory);
  }

  /**
   * Hands the delivery to the executor and returns immediately.
   */
  public void dispatch(String endpointUrl, String payload) {
    try {
      executor.execute(() -> {
        try {
          deliver(endpointUrl, payload);
        } catch (RuntimeException e) {
          log.warn("Unexpected error while sending crash report. endpoint={}", endpointUrl, e);
        }
      });
    } catch (RejectedExecutionException e) {
      log.warn("Crash report dropped, dispatch executor rejected it. endpoint={}", endpointUrl, e);
    }
  }

  /**
   * Sends the report and waits at most the attempt timeout for the answer.
   *
   * @return true only when the endpoint answered 200 in time
   */
  public boolean deliver(String endpointUrl, String payload) {
    if (endpointUrl == null || endpointUrl.isBlank()) {
      log.warn("Failed to create crash report request, no endpoint given");
      return false;
    }
    URI uri;
    try {
      uri = URI.create(endpointUrl.trim());
    } catch (IllegalArgumentException e) {
      log.warn("Failed to create crash report request. endpoint={}", endpointUrl, e);
      return false;
    }
    if (!uri.isAbsolute()) {
      log.warn("Failed to create crash report request, endpoint is not absolute. endpoint={}",
          endpointUrl);
      return false;
    }

    HttpHeaders headers = new HttpHeaders();
    headers.setContentType(MediaType.APPLICATION_JSON);
    HttpEntity<String> request = new HttpEntity<>(payload, headers);

    Future<ResponseEntity<String>> attempt;
    try {
      attempt = attemptExecutor.submit(
          () -> restTemplate.exchange(uri, HttpMethod.POST, request, String.class));
    } catch (RejectedExecutionException e) {
      log.warn("Failed to start crash report request. endpoint={}", endpointUrl, e);
      return false;
    }

    try {
      ResponseEntity<String> response = attempt.get(attemptTimeout.toMillis(), TimeUnit.MILLISECONDS);
      int status = response.getStatusCode().value();
      if (status == 200) {
        log.info("Crash report accepted. endpoint={}, status={}", endpointUrl, status);
        return true;
      }
      log.warn("Crash report endpoint returned non-success. endpoint={}, status={}, body={}",
          endpointUrl, status, response.getBody());
      return false;
    } catch (TimeoutException e) {
      attempt.cancel(true);
      log.warn("Crash report timed out. endpoint={}, timeoutMs={}", endpointUrl, attemptTimeout.toMillis());
      return false;
    } catch (InterruptedException e) {
      attempt.cancel(true);
      Thread.currentThread().interrupt();
      log.warn("Interrupted while sending crash report. endpoint={}", endpointUrl);
      return false;
    } catch (ExecutionException e) {
      return logFailure(endpointUrl, e.getCause());
    }
  }

  private static boolean logFailure(String endpointUrl, Throwable failure) {
    if (failure instanceof RestClientResponseException) {
      RestClientResponseException responseError = (RestClientResponseException) failure;
      log.warn("Crash report endpoint returned non-success. endpoint={}, status={}, body={}",
          endpointUrl, responseError.getStatusCode().value(), responseError.getResponseBodyAsString());
    } else if (failure instanceof RestClientException) {
      log.warn("Failed to send crash report. endpoint={}", endpointUrl, failure);
    } else {
      log.warn("Unexpected error while sending crash report. endpoint={}", endpointUrl, failure);
    }
    return false;
  }
}
