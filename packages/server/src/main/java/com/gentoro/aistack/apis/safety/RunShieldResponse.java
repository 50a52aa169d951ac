package com.gentoro.aistack.apis.safety;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Map;

/** Shield verdict. Produced per call and never persisted. */
public record RunShieldResponse(
    @JsonProperty("violation_level") ViolationLevel violationLevel,
    @JsonProperty("user_message") String userMessage,
    @JsonProperty("metadata") Map<String, Object> metadata) {

  public static RunShieldResponse none() {
    return new RunShieldResponse(ViolationLevel.NONE, null, Map.of());
  }

  @JsonIgnore
  public boolean isViolation() {
    return violationLevel != null && violationLevel != ViolationLevel.NONE;
  }
}
