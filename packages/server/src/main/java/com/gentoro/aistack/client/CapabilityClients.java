package com.gentoro.aistack.client;

import com.gentoro.aistack.apis.agents.Agents;
import com.gentoro.aistack.apis.inference.Inference;
import com.gentoro.aistack.apis.memory.Memory;
import com.gentoro.aistack.apis.memorybanks.MemoryBanks;
import com.gentoro.aistack.apis.models.Models;
import com.gentoro.aistack.apis.safety.Safety;
import com.gentoro.aistack.apis.shields.Shields;
import com.gentoro.aistack.apis.telemetry.Telemetry;
import com.gentoro.aistack.exception.ValidationException;
import com.gentoro.aistack.provider.Api;

/** Creates typed capability clients over a transport. */
public final class CapabilityClients {
  private CapabilityClients() {}

  public static <T> T create(Class<T> contract, CapabilityTransport transport) {
    Object client;
    if (contract == Inference.class) {
      client = new InferenceClient(transport);
    } else if (contract == Safety.class) {
      client = new SafetyClient(transport);
    } else if (contract == Memory.class) {
      client = new MemoryClient(transport);
    } else if (contract == Agents.class) {
      client = new AgentsClient(transport);
    } else if (contract == Telemetry.class) {
      client = new TelemetryClient(transport);
    } else if (contract == Models.class
        || contract == Shields.class
        || contract == MemoryBanks.class) {
      client = new RoutingTableClient(transport);
    } else {
      throw new ValidationException("No capability contract named " + contract.getName());
    }
    return contract.cast(client);
  }

  /** Client for the contract of a capability group. */
  public static Object forApi(Api api, CapabilityTransport transport) {
    return create(api.contract(), transport);
  }
}
