package com.gentoro.aistack.apis.telemetry;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Map;

/**
 * Telemetry event. {@code type} decides which fields are meaningful: logs use {@code message} and
 * {@code severity}, metrics {@code name}, {@code value} and {@code unit}, span events {@code name}
 * and, for span end, {@code status}.
 */
public record TelemetryEvent(
    @JsonProperty("type") Type type,
    @JsonProperty("trace_id") String traceId,
    @JsonProperty("span_id") String spanId,
    @JsonProperty("parent_span_id") String parentSpanId,
    @JsonProperty("timestamp") long timestamp,
    @JsonProperty("name") String name,
    @JsonProperty("message") String message,
    @JsonProperty("severity") Severity severity,
    @JsonProperty("value") Double value,
    @JsonProperty("unit") String unit,
    @JsonProperty("status") SpanStatus status,
    @JsonProperty("attributes") Map<String, Object> attributes) {

  public enum Type {
    @JsonProperty("unstructured_log")
    UNSTRUCTURED_LOG,
    @JsonProperty("metric")
    METRIC,
    @JsonProperty("span_start")
    SPAN_START,
    @JsonProperty("span_end")
    SPAN_END
  }

  public enum Severity {
    @JsonProperty("verbose")
    VERBOSE,
    @JsonProperty("debug")
    DEBUG,
    @JsonProperty("info")
    INFO,
    @JsonProperty("warn")
    WARN,
    @JsonProperty("error")
    ERROR,
    @JsonProperty("critical")
    CRITICAL
  }

  public enum SpanStatus {
    @JsonProperty("ok")
    OK,
    @JsonProperty("error")
    ERROR
  }

  public static TelemetryEvent log(
      String traceId, String spanId, Severity severity, String message) {
    return new TelemetryEvent(
        Type.UNSTRUCTURED_LOG,
        traceId,
        spanId,
        null,
        System.currentTimeMillis(),
        null,
        message,
        severity,
        null,
        null,
        null,
        null);
  }

  public static TelemetryEvent spanStart(
      String traceId, String spanId, String parentSpanId, String name, long timestamp) {
    return new TelemetryEvent(
        Type.SPAN_START, traceId, spanId, parentSpanId, timestamp, name, null, null, null, null,
        null, null);
  }

  public static TelemetryEvent spanEnd(
      String traceId, String spanId, SpanStatus status, long timestamp) {
    return new TelemetryEvent(
        Type.SPAN_END, traceId, spanId, null, timestamp, null, null, null, null, null, status,
        null);
  }
}
