package com.gentoro.aistack.provider;

import com.gentoro.aistack.manifest.ProviderBinding;
import java.util.List;

/** A bound adapter instance together with the manifest entry it was built from. */
public record RegisteredProvider(
    Api api, ProviderBinding binding, Object adapter, List<String> servedResources) {

  public String providerId() {
    return binding.providerId();
  }

  public String providerType() {
    return binding.providerType();
  }

  public ProviderKind kind() {
    return binding.kind();
  }

  public <T> T adapterAs(Class<T> contract) {
    return contract.cast(adapter);
  }
}
