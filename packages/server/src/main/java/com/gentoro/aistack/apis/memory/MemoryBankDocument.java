package com.gentoro.aistack.apis.memory;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Map;

/**
 * A document to index. Exactly one of {@code content} (inline text) or {@code uri} (http(s), data
 * or file reference) is set.
 */
public record MemoryBankDocument(
    @JsonProperty("document_id") String documentId,
    @JsonProperty("content") String content,
    @JsonProperty("uri") String uri,
    @JsonProperty("mime_type") String mimeType,
    @JsonProperty("metadata") Map<String, Object> metadata) {

  public static MemoryBankDocument text(String documentId, String content) {
    return new MemoryBankDocument(documentId, content, null, "text/plain", Map.of());
  }
}
