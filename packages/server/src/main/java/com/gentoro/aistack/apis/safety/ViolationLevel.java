package com.gentoro.aistack.apis.safety;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Totally ordered: {@code NONE < WARNING < ERROR}. */
public enum ViolationLevel {
  @JsonProperty("none")
  NONE,
  @JsonProperty("warning")
  WARNING,
  @JsonProperty("error")
  ERROR
}
