package com.gentoro.aistack.apis.agents;

import com.fasterxml.jackson.annotation.JsonProperty;

public record CreateAgentRequest(@JsonProperty("agent_config") AgentConfig agentConfig) {}
