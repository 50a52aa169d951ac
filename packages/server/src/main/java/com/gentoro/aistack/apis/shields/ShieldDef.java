package com.gentoro.aistack.apis.shields;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ShieldDef(
    @JsonProperty("identifier") String identifier,
    @JsonProperty("provider_id") String providerId) {}
