package com.gentoro.aistack.client;

import com.gentoro.aistack.apis.Empty;
import com.gentoro.aistack.apis.memory.BankRef;
import com.gentoro.aistack.apis.memory.InsertDocumentsRequest;
import com.gentoro.aistack.apis.memory.ListMemoryBanksResponse;
import com.gentoro.aistack.apis.memory.Memory;
import com.gentoro.aistack.apis.memory.MemoryBankDef;
import com.gentoro.aistack.apis.memory.QueryDocumentsRequest;
import com.gentoro.aistack.apis.memory.QueryDocumentsResponse;
import com.gentoro.aistack.apis.memory.RegisterMemoryBankResponse;
import com.gentoro.aistack.provider.Api;

public class MemoryClient extends TransportClient implements Memory {
  public MemoryClient(CapabilityTransport transport) {
    super(transport);
  }

  @Override
  public RegisterMemoryBankResponse registerMemoryBank(MemoryBankDef bank) {
    return transport.invoke(
        Api.MEMORY, REGISTER_MEMORY_BANK, bank, RegisterMemoryBankResponse.class);
  }

  @Override
  public void insertDocuments(InsertDocumentsRequest request) {
    transport.invoke(Api.MEMORY, INSERT, request, Empty.class);
  }

  @Override
  public QueryDocumentsResponse queryDocuments(QueryDocumentsRequest request) {
    return transport.invoke(Api.MEMORY, QUERY, request, QueryDocumentsResponse.class);
  }

  @Override
  public MemoryBankDef getMemoryBank(BankRef ref) {
    return transport.invoke(Api.MEMORY, GET_MEMORY_BANK, ref, MemoryBankDef.class);
  }

  @Override
  public ListMemoryBanksResponse listMemoryBanks() {
    return transport.invoke(
        Api.MEMORY, LIST_MEMORY_BANKS, Empty.INSTANCE, ListMemoryBanksResponse.class);
  }

  @Override
  public void dropMemoryBank(BankRef ref) {
    transport.invoke(Api.MEMORY, DROP_MEMORY_BANK, ref, Empty.class);
  }
}
