package com.gentoro.aistack.apis.inference;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Optional sampling knobs; {@code null} leaves the provider default in place. */
public record SamplingParams(
    @JsonProperty("temperature") Double temperature,
    @JsonProperty("top_p") Double topP,
    @JsonProperty("max_tokens") Integer maxTokens,
    @JsonProperty("repetition_penalty") Double repetitionPenalty) {}
