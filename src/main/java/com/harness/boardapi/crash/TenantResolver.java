package com.harness.boardapi.crash;

import jakarta.servlet.http.HttpServletRequest;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Optional;
import org.springframework.web.util.UriComponentsBuilder;
import org.springframework.web.util.UriUtils;

/**
 * Works out which board a failing request belongs to. Sources are checked in order:
 * {@code boardId} query parameter, {@code X-Board-Id} header, the configured board id,
 * the request host and finally the configured reporting endpoint URL.
 */
public class TenantResolver {

  public static final String QUERY_PARAM = "boardId";
  public static final String HEADER = "X-Board-Id";

  static final String HOST_MARKER = "webapi";
  static final int BOARD_ID_LENGTH = 24;

  private final ReportingSettings settings;

  public TenantResolver(ReportingSettings settings) {
    this.settings = settings;
  }

  public Optional<String> resolve(HttpServletRequest request) {
    String fromQuery = queryParameter(request.getQueryString(), QUERY_PARAM);
    if (hasText(fromQuery)) {
      return Optional.of(fromQuery);
    }

    String fromHeader = request.getHeader(HEADER);
    if (hasText(fromHeader)) {
      return Optional.of(fromHeader);
    }

    if (settings.hasBoardId()) {
      return Optional.of(settings.boardId());
    }

    Optional<String> fromHost = extractMarkedId(hostOf(request));
    if (fromHost.isPresent()) {
      return fromHost;
    }

    return extractMarkedId(settings.endpointUrl());
  }

  /**
   * Finds the first {@code webapi} marker (any case) and returns the 24 characters after it,
   * provided they are all hex digits.
   */
  static Optional<String> extractMarkedId(String text) {
    if (!hasText(text)) {
      return Optional.empty();
    }
    int idx = text.toLowerCase(Locale.ROOT).indexOf(HOST_MARKER);
    if (idx < 0) {
      return Optional.empty();
    }
    int start = idx + HOST_MARKER.length();
    if (text.length() - start < BOARD_ID_LENGTH) {
      return Optional.empty();
    }
    String candidate = text.substring(start, start + BOARD_ID_LENGTH);
    return isHex(candidate) ? Optional.of(candidate) : Optional.empty();
  }

  /**
   * Reads a parameter from the raw query string only. Form bodies are never touched.
   */
  static String queryParameter(String queryString, String name) {
    if (!hasText(queryString)) {
      return null;
    }
    String raw = UriComponentsBuilder.newInstance()
        .query(queryString)
        .build()
        .getQueryParams()
        .getFirst(name);
    return raw != null ? UriUtils.decode(raw, StandardCharsets.UTF_8) : null;
  }

  private static String hostOf(HttpServletRequest request) {
    String host = request.getHeader("Host");
    return hasText(host) ? host : request.getServerName();
  }

  private static boolean isHex(String s) {
    for (int i = 0; i < s.length(); i++) {
      char c = s.charAt(i);
      boolean hex = (c >= '0' && c <= '9') || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
      if (!hex) {
        return false;
      }
    }
    return true;
  }

  private static boolean hasText(String value) {
    return value != null && !value.isBlank();
  }
}
