package com.gentoro.aistack.apis.inference;

import com.fasterxml.jackson.annotation.JsonProperty;

public record CompletionRequest(
    @JsonProperty("model") String model,
    @JsonProperty("content") String content,
    @JsonProperty("sampling_params") SamplingParams samplingParams) {}
