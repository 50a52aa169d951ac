package com.gentoro.aistack.apis.inference;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ChatCompletionResponse(
    @JsonProperty("completion_message") Message completionMessage,
    @JsonProperty("stop_reason") StopReason stopReason) {}
