package com.gentoro.aistack.apis.inference;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/** One vector per requested content, in request order. */
public record EmbeddingsResponse(@JsonProperty("embeddings") List<float[]> embeddings) {}
