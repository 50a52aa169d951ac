package com.gentoro.aistack.apis.memory;

import com.fasterxml.jackson.annotation.JsonProperty;

public record RegisterMemoryBankResponse(@JsonProperty("bank_id") String bankId) {}
