package com.gentoro.aistack.apis.agents;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.gentoro.aistack.apis.inference.SamplingParams;
import java.util.List;

/**
 * Agent definition. Shields are shield ids; {@code memory_bank_ids} turns on retrieval before
 * every inference step.
 */
public record AgentConfig(
    @JsonProperty("model") String model,
    @JsonProperty("instructions") String instructions,
    @JsonProperty("input_shields") List<String> inputShields,
    @JsonProperty("output_shields") List<String> outputShields,
    @JsonProperty("memory_bank_ids") List<String> memoryBankIds,
    @JsonProperty("max_chunks") Integer maxChunks,
    @JsonProperty("sampling_params") SamplingParams samplingParams) {

  public List<String> inputShieldsOrEmpty() {
    return inputShields == null ? List.of() : inputShields;
  }

  public List<String> outputShieldsOrEmpty() {
    return outputShields == null ? List.of() : outputShields;
  }

  public List<String> memoryBankIdsOrEmpty() {
    return memoryBankIds == null ? List.of() : memoryBankIds;
  }
}
