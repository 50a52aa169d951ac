package com.gentoro.aistack.apis.models;

import com.fasterxml.jackson.annotation.JsonProperty;

/** A model identifier and the inference provider that serves it. */
public record Model(
    @JsonProperty("identifier") String identifier,
    @JsonProperty("provider_id") String providerId) {}
