package com.gentoro.aistack.exception;

import java.util.Map;

/**
 * A provider adapter failed to serve a valid request: deadline exceeded ({@link
 * StackErrorCode#TIMEOUT}), non-success upstream answer ({@link StackErrorCode#UPSTREAM_ERROR}) or
 * transport failure ({@link StackErrorCode#TRANSPORT_ERROR}).
 */
public class AdapterException extends StackException {
  public static final String STATUS_CODE = "status_code";
  public static final String BODY = "body";

  public AdapterException(StackErrorCode code, String message) {
    super(code, message);
  }

  public AdapterException(StackErrorCode code, String message, Throwable cause) {
    super(code, message, cause);
  }

  public AdapterException(StackErrorCode code, String message, Map<String, ?> context) {
    super(code, message, context);
  }

  public AdapterException(
      StackErrorCode code, String message, Map<String, ?> context, Throwable cause) {
    super(code, message, context, cause);
  }

  /** Upstream failure carrying the HTTP status and the opaque response body. */
  public static AdapterException upstream(int statusCode, String body) {
    return new AdapterException(
        StackErrorCode.UPSTREAM_ERROR,
        "Upstream provider answered with status " + statusCode,
        Map.of(STATUS_CODE, statusCode, BODY, body == null ? "" : body));
  }

  public Integer statusCode() {
    Object v = getContext().get(STATUS_CODE);
    return v instanceof Number n ? n.intValue() : null;
  }

  public String body() {
    Object v = getContext().get(BODY);
    return v == null ? null : v.toString();
  }
}
