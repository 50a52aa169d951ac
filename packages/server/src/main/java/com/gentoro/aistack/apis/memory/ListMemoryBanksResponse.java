package com.gentoro.aistack.apis.memory;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

public record ListMemoryBanksResponse(@JsonProperty("banks") List<MemoryBankDef> banks) {}
