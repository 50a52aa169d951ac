package com.gentoro.aistack.apis.telemetry;

import com.fasterxml.jackson.annotation.JsonProperty;

public record TraceRef(@JsonProperty("trace_id") String traceId) {}
