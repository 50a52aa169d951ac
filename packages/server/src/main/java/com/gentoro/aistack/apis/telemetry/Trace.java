package com.gentoro.aistack.apis.telemetry;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

public record Trace(
    @JsonProperty("trace_id") String traceId,
    @JsonProperty("root_span_id") String rootSpanId,
    @JsonProperty("start_time") long startTime,
    @JsonProperty("end_time") long endTime,
    @JsonProperty("spans") List<Span> spans) {}
