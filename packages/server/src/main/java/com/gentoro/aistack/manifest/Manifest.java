package com.gentoro.aistack.manifest;

import com.gentoro.aistack.provider.Api;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** Parsed distribution manifest: which capability groups to expose and who serves them. */
public record Manifest(
    String version, String imageName, List<Api> apis, Map<Api, List<ProviderBinding>> providers) {

  public Manifest {
    apis = List.copyOf(apis);
    Map<Api, List<ProviderBinding>> copy = new EnumMap<>(Api.class);
    providers.forEach((api, list) -> copy.put(api, List.copyOf(list)));
    providers = Collections.unmodifiableMap(copy);
  }

  public List<ProviderBinding> bindings(Api api) {
    return providers.getOrDefault(api, List.of());
  }

  /** The binding flagged {@code active: true}, otherwise the first one listed. */
  public Optional<ProviderBinding> activeBinding(Api api) {
    List<ProviderBinding> list = bindings(api);
    return list.stream()
        .filter(ProviderBinding::active)
        .findFirst()
        .or(() -> list.stream().findFirst());
  }
}
