package com.gentoro.aistack.provider;

import com.gentoro.aistack.apis.agents.Agents;
import com.gentoro.aistack.apis.inference.Inference;
import com.gentoro.aistack.apis.memory.Memory;
import com.gentoro.aistack.apis.memorybanks.MemoryBanks;
import com.gentoro.aistack.apis.models.Models;
import com.gentoro.aistack.apis.safety.Safety;
import com.gentoro.aistack.apis.shields.Shields;
import com.gentoro.aistack.apis.telemetry.Telemetry;
import java.util.Arrays;
import java.util.Optional;

/**
 * Capability groups a stack can expose. Routing-table groups ({@link #MODELS}, {@link #SHIELDS},
 * {@link #MEMORY_BANKS}) have no providers of their own: the router answers them from the
 * providers of their backing group.
 */
public enum Api {
  INFERENCE("inference", Inference.class, null),
  SAFETY("safety", Safety.class, null),
  MEMORY("memory", Memory.class, null),
  AGENTS("agents", Agents.class, null),
  TELEMETRY("telemetry", Telemetry.class, null),
  MODELS("models", Models.class, INFERENCE),
  SHIELDS("shields", Shields.class, SAFETY),
  MEMORY_BANKS("memory_banks", MemoryBanks.class, MEMORY);

  private final String wireName;
  private final Class<?> contract;
  private final Api backingApi;

  Api(String wireName, Class<?> contract, Api backingApi) {
    this.wireName = wireName;
    this.contract = contract;
    this.backingApi = backingApi;
  }

  /** Name used in manifests and in HTTP paths. */
  public String wireName() {
    return wireName;
  }

  public Class<?> contract() {
    return contract;
  }

  public boolean isRoutingTable() {
    return backingApi != null;
  }

  public Api backingApi() {
    return backingApi;
  }

  public static Optional<Api> fromWireName(String name) {
    if (name == null) return Optional.empty();
    String n = name.trim().toLowerCase();
    return Arrays.stream(values()).filter(a -> a.wireName.equals(n)).findFirst();
  }

  @Override
  public String toString() {
    return wireName;
  }
}
