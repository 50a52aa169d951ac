package com.gentoro.aistack.apis.inference;

import com.fasterxml.jackson.annotation.JsonProperty;

public record CompletionResponse(
    @JsonProperty("content") String content,
    @JsonProperty("stop_reason") StopReason stopReason) {}
