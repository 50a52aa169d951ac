package com.gentoro.aistack.apis.inference;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

public record EmbeddingsRequest(
    @JsonProperty("model") String model, @JsonProperty("contents") List<String> contents) {}
