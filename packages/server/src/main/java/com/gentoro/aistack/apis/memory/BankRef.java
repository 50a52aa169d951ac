package com.gentoro.aistack.apis.memory;

import com.fasterxml.jackson.annotation.JsonProperty;

public record BankRef(@JsonProperty("bank_id") String bankId) {}
