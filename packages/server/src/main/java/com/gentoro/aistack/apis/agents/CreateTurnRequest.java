package com.gentoro.aistack.apis.agents;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.gentoro.aistack.apis.inference.Message;
import java.util.List;

public record CreateTurnRequest(
    @JsonProperty("agent_id") String agentId,
    @JsonProperty("session_id") String sessionId,
    @JsonProperty("messages") List<Message> messages) {}
