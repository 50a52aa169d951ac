package com.gentoro.aistack.apis.telemetry;

import com.fasterxml.jackson.annotation.JsonProperty;

public record LogEventRequest(@JsonProperty("event") TelemetryEvent event) {}
