package com.gentoro.aistack.apis.agents;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

public record Session(
    @JsonProperty("session_id") String sessionId,
    @JsonProperty("agent_id") String agentId,
    @JsonProperty("session_name") String sessionName,
    @JsonProperty("turns") List<Turn> turns,
    @JsonProperty("started_at") long startedAt) {}
