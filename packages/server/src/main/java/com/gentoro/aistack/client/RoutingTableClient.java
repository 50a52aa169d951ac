package com.gentoro.aistack.client;

import com.gentoro.aistack.apis.Empty;
import com.gentoro.aistack.apis.memory.BankRef;
import com.gentoro.aistack.apis.memory.ListMemoryBanksResponse;
import com.gentoro.aistack.apis.memory.MemoryBankDef;
import com.gentoro.aistack.apis.memorybanks.MemoryBanks;
import com.gentoro.aistack.apis.models.ListModelsResponse;
import com.gentoro.aistack.apis.models.Model;
import com.gentoro.aistack.apis.models.ModelRef;
import com.gentoro.aistack.apis.models.Models;
import com.gentoro.aistack.apis.shields.ListShieldsResponse;
import com.gentoro.aistack.apis.shields.ShieldDef;
import com.gentoro.aistack.apis.shields.ShieldRef;
import com.gentoro.aistack.apis.shields.Shields;
import com.gentoro.aistack.provider.Api;

/** Client for the three routing-table groups, which share the list/get operation pair. */
public class RoutingTableClient extends TransportClient implements Models, Shields, MemoryBanks {
  public RoutingTableClient(CapabilityTransport transport) {
    super(transport);
  }

  @Override
  public ListModelsResponse listModels() {
    return transport.invoke(Api.MODELS, Models.LIST, Empty.INSTANCE, ListModelsResponse.class);
  }

  @Override
  public Model getModel(ModelRef ref) {
    return transport.invoke(Api.MODELS, Models.GET, ref, Model.class);
  }

  @Override
  public ListShieldsResponse listShields() {
    return transport.invoke(Api.SHIELDS, Shields.LIST, Empty.INSTANCE, ListShieldsResponse.class);
  }

  @Override
  public ShieldDef getShield(ShieldRef ref) {
    return transport.invoke(Api.SHIELDS, Shields.GET, ref, ShieldDef.class);
  }

  @Override
  public ListMemoryBanksResponse listMemoryBanks() {
    return transport.invoke(
        Api.MEMORY_BANKS, MemoryBanks.LIST, Empty.INSTANCE, ListMemoryBanksResponse.class);
  }

  @Override
  public MemoryBankDef getMemoryBank(BankRef ref) {
    return transport.invoke(Api.MEMORY_BANKS, MemoryBanks.GET, ref, MemoryBankDef.class);
  }
}
