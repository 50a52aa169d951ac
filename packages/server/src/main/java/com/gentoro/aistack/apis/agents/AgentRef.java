package com.gentoro.aistack.apis.agents;

import com.fasterxml.jackson.annotation.JsonProperty;

public record AgentRef(@JsonProperty("agent_id") String agentId) {}
