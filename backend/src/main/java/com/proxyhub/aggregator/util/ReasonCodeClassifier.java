package com.proxyhub.aggregator.util;

import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.net.http.HttpTimeoutException;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.TimeoutException;
import javax.net.ssl.SSLException;

public final class ReasonCodeClassifier {
  public static final String INVALID_URL = "INVALID_URL";
  public static final String TIMEOUT = "TIMEOUT";
  public static final String DNS_FAILURE = "DNS_FAILURE";
  public static final String TLS_FAILURE = "TLS_FAILURE";
  public static final String CONNECTION_REFUSED = "CONNECTION_REFUSED";
  public static final String NETWORK_UNREACHABLE = "NETWORK_UNREACHABLE";
  public static final String HTTP_401_403 = "HTTP_401_403";
  public static final String HTTP_404 = "HTTP_404";
  public static final String HTTP_429_RATE_LIMIT = "HTTP_429_RATE_LIMIT";
  public static final String HTTP_4XX = "HTTP_4XX";
  public static final String HTTP_5XX = "HTTP_5XX";
  public static final String PARSING_FAILED = "PARSING_FAILED";
  public static final String ENGINE_UNAVAILABLE = "ENGINE_UNAVAILABLE";
  public static final String INTERRUPTED = "INTERRUPTED";
  public static final String UNKNOWN = "UNKNOWN";

  private static final Set<String> KNOWN = Set.of(
      INVALID_URL, TIMEOUT, DNS_FAILURE, TLS_FAILURE, CONNECTION_REFUSED, NETWORK_UNREACHABLE,
      HTTP_401_403, HTTP_404, HTTP_429_RATE_LIMIT, HTTP_4XX, HTTP_5XX, PARSING_FAILED,
      ENGINE_UNAVAILABLE, INTERRUPTED, UNKNOWN);

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
    if (status >= 400 && status < 500) {
      return HTTP_4XX;
    }
    if (status >= 500 && status < 600) {
      return HTTP_5XX;
    }
    return UNKNOWN;
  }

  public static String fromErrorCode(String errorCode, String errorMessage) {
    if (errorCode == null || errorCode.isBlank()) {
      return UNKNOWN;
    }
    String code = errorCode.toLowerCase(Locale.ROOT);
    if (code.contains("timeout")) {
      return TIMEOUT;
    }
    if (code.contains("invalid_url")) {
      return INVALID_URL;
    }
    if (code.contains("interrupted")) {
      return INTERRUPTED;
    }
    if (code.contains("io_error")) {
      return fromMessage(errorMessage);
    }
    return UNKNOWN;
  }

  public static String fromException(Throwable error) {
    Throwable current = error;
    while (current != null) {
      if (current instanceof HttpTimeoutException
          || current instanceof SocketTimeoutException
          || current instanceof TimeoutException) {
        return TIMEOUT;
      }
      if (current instanceof UnknownHostException) {
        return DNS_FAILURE;
      }
      if (current instanceof SSLException) {
        return TLS_FAILURE;
      }
      if (current instanceof ConnectException) {
        return CONNECTION_REFUSED;
      }
      if (current instanceof NoRouteToHostException) {
        return NETWORK_UNREACHABLE;
      }
      if (current instanceof InterruptedException) {
        return INTERRUPTED;
      }
      if (current.getCause() == current) {
        break;
      }
      current = current.getCause();
    }
    return error == null ? UNKNOWN : fromMessage(error.getMessage());
  }

  /**
   * Maps a free-form error string reported by a prober onto one of the codes above.
   */
  public static String normalize(String errorType) {
    if (errorType == null || errorType.isBlank()) {
      return UNKNOWN;
    }
    String upper = errorType.trim().toUpperCase(Locale.ROOT);
    if (KNOWN.contains(upper)) {
      return upper;
    }
    return fromMessage(errorType);
  }

  static String fromMessage(String message) {
    String lower = message == null ? "" : message.toLowerCase(Locale.ROOT);
    if (lower.contains("timed out") || lower.contains("timeout")) {
      return TIMEOUT;
    }
    if (lower.contains("unknownhost")
        || lower.contains("unknown host")
        || lower.contains("name or service not known")
        || lower.contains("no such host")
        || lower.contains("dns")) {
      return DNS_FAILURE;
    }
    if (lower.contains("ssl") || lower.contains("tls") || lower.contains("handshake")) {
      return TLS_FAILURE;
    }
    if (lower.contains("refused")) {
      return CONNECTION_REFUSED;
    }
    if (lower.contains("unreachable") || lower.contains("no route")) {
      return NETWORK_UNREACHABLE;
    }
    return UNKNOWN;
  }
}
