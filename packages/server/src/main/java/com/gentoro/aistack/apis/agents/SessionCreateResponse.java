package com.gentoro.aistack.apis.agents;

import com.fasterxml.jackson.annotation.JsonProperty;

public record SessionCreateResponse(@JsonProperty("session_id") String sessionId) {}
