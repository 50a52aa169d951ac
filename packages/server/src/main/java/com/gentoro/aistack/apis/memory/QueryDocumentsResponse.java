package com.gentoro.aistack.apis.memory;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/** Parallel arrays of the same length, scores in non-increasing order. */
public record QueryDocumentsResponse(
    @JsonProperty("chunks") List<Chunk> chunks, @JsonProperty("scores") List<Double> scores) {}
