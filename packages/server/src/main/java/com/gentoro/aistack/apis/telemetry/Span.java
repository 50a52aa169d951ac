package com.gentoro.aistack.apis.telemetry;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Map;

/** A span as reconstructed from its start and end events; {@code end_time} is 0 while open. */
public record Span(
    @JsonProperty("span_id") String spanId,
    @JsonProperty("parent_span_id") String parentSpanId,
    @JsonProperty("name") String name,
    @JsonProperty("start_time") long startTime,
    @JsonProperty("end_time") long endTime,
    @JsonProperty("status") TelemetryEvent.SpanStatus status,
    @JsonProperty("attributes") Map<String, Object> attributes) {}
