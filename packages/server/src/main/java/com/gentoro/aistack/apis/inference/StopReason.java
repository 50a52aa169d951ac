package com.gentoro.aistack.apis.inference;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum StopReason {
  @JsonProperty("end_of_turn")
  END_OF_TURN,
  @JsonProperty("end_of_message")
  END_OF_MESSAGE,
  @JsonProperty("out_of_tokens")
  OUT_OF_TOKENS
}
