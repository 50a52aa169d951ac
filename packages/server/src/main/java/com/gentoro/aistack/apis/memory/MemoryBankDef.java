package com.gentoro.aistack.apis.memory;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Vector memory bank definition, also the registration payload. */
public record MemoryBankDef(
    @JsonProperty("identifier") String identifier,
    @JsonProperty("embedding_model") String embeddingModel,
    @JsonProperty("chunk_size_in_tokens") int chunkSizeInTokens,
    @JsonProperty("overlap_size_in_tokens") int overlapSizeInTokens,
    @JsonProperty("provider_id") String providerId) {

  public MemoryBankDef withProviderId(String providerId) {
    return new MemoryBankDef(
        identifier, embeddingModel, chunkSizeInTokens, overlapSizeInTokens, providerId);
  }
}
