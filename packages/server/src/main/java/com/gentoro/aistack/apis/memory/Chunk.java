package com.gentoro.aistack.apis.memory;

import com.fasterxml.jackson.annotation.JsonProperty;

public record Chunk(
    @JsonProperty("document_id") String documentId,
    @JsonProperty("content") String content,
    @JsonProperty("token_count") int tokenCount) {}
