package com.gentoro.aistack.apis.agents;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.gentoro.aistack.apis.inference.Message;
import com.gentoro.aistack.apis.safety.RunShieldResponse;
import java.util.List;

/** One step of a turn. Only the field matching {@link #stepType()} is populated. */
public record TurnStep(
    @JsonProperty("step_type") StepType stepType,
    @JsonProperty("shield_id") String shieldId,
    @JsonProperty("violation") RunShieldResponse violation,
    @JsonProperty("memory_bank_ids") List<String> memoryBankIds,
    @JsonProperty("inserted_context") String insertedContext,
    @JsonProperty("model_response") Message modelResponse,
    @JsonProperty("started_at") long startedAt,
    @JsonProperty("completed_at") long completedAt) {

  public enum StepType {
    @JsonProperty("shield_call")
    SHIELD_CALL,
    @JsonProperty("memory_retrieval")
    MEMORY_RETRIEVAL,
    @JsonProperty("inference")
    INFERENCE
  }
}
