package com.gentoro.aistack.exception;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Map;

/** Lightweight DTO to expose structured error information to logs or HTTP responses. */
public final class ErrorDetails {
  public final String type;
  public final String message;
  public final StackErrorCode code;
  public final StackErrorCode.Origin origin;
  public final Map<String, Object> context;
  public final String timestamp;

  @JsonCreator
  public ErrorDetails(
      @JsonProperty("type") String type,
      @JsonProperty("message") String message,
      @JsonProperty("code") StackErrorCode code,
      @JsonProperty("origin") StackErrorCode.Origin origin,
      @JsonProperty("context") Map<String, Object> context,
      @JsonProperty("timestamp") String timestamp) {
    this.type = type;
    this.message = message;
    this.code = code;
    this.origin = origin;
    this.context = context;
    this.timestamp = timestamp;
  }
}
