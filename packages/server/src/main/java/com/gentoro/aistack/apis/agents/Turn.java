package com.gentoro.aistack.apis.agents;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.gentoro.aistack.apis.inference.Message;
import java.util.List;

public record Turn(
    @JsonProperty("turn_id") String turnId,
    @JsonProperty("session_id") String sessionId,
    @JsonProperty("input_messages") List<Message> inputMessages,
    @JsonProperty("steps") List<TurnStep> steps,
    @JsonProperty("output_message") Message outputMessage,
    @JsonProperty("started_at") long startedAt,
    @JsonProperty("completed_at") long completedAt) {}
