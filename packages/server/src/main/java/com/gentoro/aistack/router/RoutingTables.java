package com.gentoro.aistack.router;

import com.gentoro.aistack.apis.memory.BankRef;
import com.gentoro.aistack.apis.memory.ListMemoryBanksResponse;
import com.gentoro.aistack.apis.memory.Memory;
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
import com.gentoro.aistack.exception.NotFoundException;
import com.gentoro.aistack.exception.ValidationException;
import com.gentoro.aistack.provider.Api;
import com.gentoro.aistack.provider.ProviderRegistry;
import com.gentoro.aistack.provider.RegisteredProvider;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Routing-table groups. Models and shields come from the static resource ownership recorded in the
 * registry; memory banks are asked from every memory provider, since banks are created at runtime.
 */
final class RoutingTables implements Models, Shields, MemoryBanks {
  private final ProviderRegistry registry;
  private final Function<String, RegisteredProvider> bankOwner;

  RoutingTables(ProviderRegistry registry, Function<String, RegisteredProvider> bankOwner) {
    this.registry = registry;
    this.bankOwner = bankOwner;
  }

  @Override
  public ListModelsResponse listModels() {
    List<Model> models = new ArrayList<>();
    registry
        .resources(Api.INFERENCE)
        .forEach((id, provider) -> models.add(new Model(id, provider.providerId())));
    return new ListModelsResponse(models);
  }

  @Override
  public Model getModel(ModelRef ref) {
    String id = required(ref == null ? null : ref.identifier(), "identifier");
    return registry
        .ownerOf(Api.INFERENCE, id)
        .map(p -> new Model(id, p.providerId()))
        .orElseThrow(() -> new NotFoundException("Unknown model: " + id, Map.of("model", id)));
  }

  @Override
  public ListShieldsResponse listShields() {
    List<ShieldDef> shields = new ArrayList<>();
    registry
        .resources(Api.SAFETY)
        .forEach((id, provider) -> shields.add(new ShieldDef(id, provider.providerId())));
    return new ListShieldsResponse(shields);
  }

  @Override
  public ShieldDef getShield(ShieldRef ref) {
    String id = required(ref == null ? null : ref.identifier(), "identifier");
    return registry
        .ownerOf(Api.SAFETY, id)
        .map(p -> new ShieldDef(id, p.providerId()))
        .orElseThrow(() -> new NotFoundException("Unknown shield: " + id, Map.of("shield", id)));
  }

  @Override
  public ListMemoryBanksResponse listMemoryBanks() {
    List<MemoryBankDef> banks = new ArrayList<>();
    for (RegisteredProvider provider : registry.providers(Api.MEMORY)) {
      ListMemoryBanksResponse listed = provider.adapterAs(Memory.class).listMemoryBanks();
      if (listed != null && listed.banks() != null) {
        listed.banks().forEach(b -> banks.add(withOwner(b, provider)));
      }
    }
    return new ListMemoryBanksResponse(banks);
  }

  @Override
  public MemoryBankDef getMemoryBank(BankRef ref) {
    String id = required(ref == null ? null : ref.bankId(), "bank_id");
    RegisteredProvider provider = bankOwner.apply(id);
    return withOwner(provider.adapterAs(Memory.class).getMemoryBank(new BankRef(id)), provider);
  }

  /** Banks are reported under the id of the provider that serves them in this stack. */
  private static MemoryBankDef withOwner(MemoryBankDef bank, RegisteredProvider provider) {
    return bank.withProviderId(provider.providerId());
  }

  private static String required(String value, String field) {
    if (value == null || value.isBlank()) {
      throw new ValidationException(field + " is required");
    }
    return value;
  }
}
