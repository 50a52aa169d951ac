package com.gentoro.aistack.apis.agents;

import com.fasterxml.jackson.annotation.JsonProperty;

public record SessionRef(
    @JsonProperty("agent_id") String agentId, @JsonProperty("session_id") String sessionId) {}
