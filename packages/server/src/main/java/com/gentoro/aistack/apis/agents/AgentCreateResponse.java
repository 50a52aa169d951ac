package com.gentoro.aistack.apis.agents;

import com.fasterxml.jackson.annotation.JsonProperty;

public record AgentCreateResponse(@JsonProperty("agent_id") String agentId) {}
