package com.gentoro.aistack.apis.memory;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Map;

/** Query payload; {@code params.max_chunks} bounds the number of chunks returned. */
public record QueryDocumentsRequest(
    @JsonProperty("bank_id") String bankId,
    @JsonProperty("query") List<String> query,
    @JsonProperty("params") Map<String, Object> params) {

  public static final String MAX_CHUNKS = "max_chunks";

  public QueryDocumentsRequest(String bankId, List<String> query) {
    this(bankId, query, null);
  }
}
