package com.gentoro.aistack.apis.safety;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.gentoro.aistack.apis.inference.Message;
import java.util.List;
import java.util.Map;

public record RunShieldRequest(
    @JsonProperty("shield_type") String shieldType,
    @JsonProperty("messages") List<Message> messages,
    @JsonProperty("params") Map<String, Object> params) {

  public RunShieldRequest(String shieldType, List<Message> messages) {
    this(shieldType, messages, null);
  }
}
