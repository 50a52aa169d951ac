package com.gentoro.aistack.apis.inference;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

public record ChatCompletionRequest(
    @JsonProperty("model") String model,
    @JsonProperty("messages") List<Message> messages,
    @JsonProperty("sampling_params") SamplingParams samplingParams) {

  public ChatCompletionRequest(String model, List<Message> messages) {
    this(model, messages, null);
  }
}
