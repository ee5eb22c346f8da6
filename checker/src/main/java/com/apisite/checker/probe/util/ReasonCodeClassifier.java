package com.apisite.checker.probe.util;

import java.util.Locale;

public final class ReasonCodeClassifier {
  public static final String TIMEOUT = "TIMEOUT";
  public static final String DNS_FAILURE = "DNS_FAILURE";
  public static final String TLS_FAILURE = "TLS_FAILURE";
  public static final String CONNECTION_FAILED = "CONNECTION_FAILED";
  public static final String INVALID_URL = "INVALID_URL";
  public static final String HTTP_401_403 = "HTTP_401_403";
  public static final String HTTP_404 = "HTTP_404";
  public static final String HTTP_429_RATE_LIMIT = "HTTP_429_RATE_LIMIT";
  public static final String HTTP_5XX = "HTTP_5XX";
  public static final String HTTP_OTHER = "HTTP_OTHER";
  public static final String NOT_JSON = "NOT_JSON";
  public static final String SCHEMA_REJECTED = "SCHEMA_REJECTED";
  public static final String TASK_FAILED = "TASK_FAILED";
  public static final String UNKNOWN = "UNKNOWN";

  private ReasonCodeClassifier() {}

  public static String fromHttpStatus(Integer status) {
    if (status == null || status <= 0) {
      return UNKNOWN;
    }
    if (status == 401 || status == 403) {
      return HTTP_401_403;
    }
    if (status == 404) {
      return HTTP_404;
    }
    if (status == 408) {
      return TIMEOUT;
    }
    if (status == 429) {
      return HTTP_429_RATE_LIMIT;
    }
    if (status >= 500 && status < 600) {
      return HTTP_5XX;
    }
    return HTTP_OTHER;
  }

  public static String fromErrorCode(String errorCode, String errorMessage) {
    if (errorCode == null || errorCode.isBlank()) {
      return UNKNOWN;
    }
    String code = errorCode.toLowerCase(Locale.ROOT);
    if (code.contains("timeout")) {
      return TIMEOUT;
    }
    if (code.equals("invalid_url")) {
      return INVALID_URL;
    }
    if (code.equals("tls_error")) {
      return TLS_FAILURE;
    }
    if (code.contains("io_error")) {
      String lower = errorMessage == null ? "" : errorMessage.toLowerCase(Locale.ROOT);
      if (lower.contains("unknownhost")
          || lower.contains("unresolved")
          || lower.contains("name or service not known")
          || lower.contains("no such host")) {
        return DNS_FAILURE;
      }
      if (lower.contains("ssl") || lower.contains("handshake") || lower.contains("certificate")) {
        return TLS_FAILURE;
      }
      return CONNECTION_FAILED;
    }
    return UNKNOWN;
  }
}
