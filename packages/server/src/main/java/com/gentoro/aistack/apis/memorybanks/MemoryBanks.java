package com.gentoro.aistack.apis.memorybanks;

import com.gentoro.aistack.apis.memory.BankRef;
import com.gentoro.aistack.apis.memory.ListMemoryBanksResponse;
import com.gentoro.aistack.apis.memory.MemoryBankDef;

/** Routing table of the banks registered across all memory providers. */
public interface MemoryBanks {
  String LIST = "list";
  String GET = "get";

  ListMemoryBanksResponse listMemoryBanks();

  MemoryBankDef getMemoryBank(BankRef ref);
}
