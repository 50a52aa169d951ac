package com.gentoro.aistack.apis.memory;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

public record InsertDocumentsRequest(
    @JsonProperty("bank_id") String bankId,
    @JsonProperty("documents") List<MemoryBankDocument> documents) {}
