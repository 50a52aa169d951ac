package com.gentoro.aistack.apis.agents;

import com.fasterxml.jackson.annotation.JsonProperty;

public record CreateSessionRequest(
    @JsonProperty("agent_id") String agentId, @JsonProperty("session_name") String sessionName) {}
