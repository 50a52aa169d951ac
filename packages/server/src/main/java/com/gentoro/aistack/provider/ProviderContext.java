package com.gentoro.aistack.provider;

import com.gentoro.aistack.apis.agents.Agents;
import com.gentoro.aistack.apis.inference.Inference;
import com.gentoro.aistack.apis.memory.Memory;
import com.gentoro.aistack.apis.safety.Safety;
import com.gentoro.aistack.client.CapabilityClients;
import com.gentoro.aistack.client.CapabilityTransport;
import com.gentoro.aistack.manifest.ProviderBinding;
import org.apache.commons.configuration2.ImmutableHierarchicalConfiguration;

/**
 * Everything a factory needs to build one adapter: the binding it was selected for and a transport
 * to reach the other capability groups of the same stack.
 */
public final class ProviderContext {
  private final Api api;
  private final ProviderBinding binding;
  private final CapabilityTransport stackTransport;

  public ProviderContext(Api api, ProviderBinding binding, CapabilityTransport stackTransport) {
    this.api = api;
    this.binding = binding;
    this.stackTransport = stackTransport;
  }

  public Api api() {
    return api;
  }

  public String providerId() {
    return binding.providerId();
  }

  public String providerType() {
    return binding.providerType();
  }

  public ProviderKind kind() {
    return binding.kind();
  }

  public ImmutableHierarchicalConfiguration config() {
    return binding.config();
  }

  /** Inference calls made through the stack router, routed like any other caller's. */
  public Inference inference() {
    return CapabilityClients.create(Inference.class, stackTransport);
  }

  public Safety safety() {
    return CapabilityClients.create(Safety.class, stackTransport);
  }

  public Memory memory() {
    return CapabilityClients.create(Memory.class, stackTransport);
  }

  public Agents agents() {
    return CapabilityClients.create(Agents.class, stackTransport);
  }
}
