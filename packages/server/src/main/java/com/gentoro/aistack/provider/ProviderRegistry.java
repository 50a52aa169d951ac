package com.gentoro.aistack.provider;

import com.gentoro.aistack.exception.RoutingException;
import com.gentoro.aistack.exception.StackErrorCode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Bound providers of a stack. Built once by the manifest resolver and never modified afterwards,
 * so lookups need no locking.
 */
public final class ProviderRegistry implements AutoCloseable {
  private static final org.slf4j.Logger log =
      com.gentoro.aistack.logging.LoggingService.getLogger(ProviderRegistry.class);

  private final Set<Api> apis;
  private final Map<Api, List<RegisteredProvider>> providers;
  private final Map<Api, Map<String, RegisteredProvider>> byId;
  private final Map<Api, RegisteredProvider> active;
  private final Map<Api, Map<String, RegisteredProvider>> resourceOwners;

  ProviderRegistry(
      Set<Api> apis,
      Map<Api, List<RegisteredProvider>> providers,
      Map<Api, RegisteredProvider> active,
      Map<Api, Map<String, RegisteredProvider>> resourceOwners) {
    this.apis = Collections.unmodifiableSet(apis);
    Map<Api, List<RegisteredProvider>> p = new EnumMap<>(Api.class);
    Map<Api, Map<String, RegisteredProvider>> ids = new EnumMap<>(Api.class);
    providers.forEach(
        (api, list) -> {
          p.put(api, List.copyOf(list));
          Map<String, RegisteredProvider> m = new LinkedHashMap<>();
          list.forEach(rp -> m.put(rp.providerId(), rp));
          ids.put(api, Collections.unmodifiableMap(m));
        });
    this.providers = Collections.unmodifiableMap(p);
    this.byId = Collections.unmodifiableMap(ids);
    this.active = Collections.unmodifiableMap(new EnumMap<>(active));
    Map<Api, Map<String, RegisteredProvider>> owners = new EnumMap<>(Api.class);
    resourceOwners.forEach(
        (api, m) -> owners.put(api, Collections.unmodifiableMap(new LinkedHashMap<>(m))));
    this.resourceOwners = Collections.unmodifiableMap(owners);
  }

  /** Builder used by the resolver; keeps insertion order of providers and resources. */
  public static Builder builder() {
    return new Builder();
  }

  /** Capability groups declared by the manifest. */
  public Set<Api> apis() {
    return apis;
  }

  public boolean exposes(Api api) {
    return apis.contains(api);
  }

  public List<RegisteredProvider> providers(Api api) {
    return providers.getOrDefault(api, List.of());
  }

  public List<RegisteredProvider> allProviders() {
    List<RegisteredProvider> all = new ArrayList<>();
    providers.values().forEach(all::addAll);
    return all;
  }

  public Optional<RegisteredProvider> find(Api api, String providerId) {
    if (providerId == null) return Optional.empty();
    return Optional.ofNullable(byId.getOrDefault(api, Map.of()).get(providerId));
  }

  /** The provider serving calls that carry no routing key. */
  public RegisteredProvider active(Api api) {
    RegisteredProvider p = active.get(api);
    if (p == null) {
      throw new RoutingException(
          StackErrorCode.NO_ACTIVE_PROVIDER,
          "No provider is bound for api '" + api.wireName() + "'",
          Map.of("api", api.wireName()));
    }
    return p;
  }

  /** The provider that statically owns a model or shield id. */
  public Optional<RegisteredProvider> ownerOf(Api api, String resourceId) {
    if (resourceId == null) return Optional.empty();
    return Optional.ofNullable(resourceOwners.getOrDefault(api, Map.of()).get(resourceId));
  }

  /** Resource id to owning provider, in declaration order. */
  public Map<String, RegisteredProvider> resources(Api api) {
    return resourceOwners.getOrDefault(api, Map.of());
  }

  /** Closes every adapter that holds resources, last bound first. */
  @Override
  public void close() {
    List<RegisteredProvider> all = allProviders();
    Collections.reverse(all);
    closeAdapters(all);
  }

  public static void closeAdapters(List<RegisteredProvider> providers) {
    for (RegisteredProvider p : providers) {
      if (p.adapter() instanceof AutoCloseable closeable) {
        try {
          closeable.close();
        } catch (Exception e) {
          log.warn(
              "Failed to close provider '{}' of api '{}'", p.providerId(), p.api().wireName(), e);
        }
      }
    }
  }

  public static final class Builder {
    private final Set<Api> apis = new java.util.LinkedHashSet<>();
    private final Map<Api, List<RegisteredProvider>> providers = new EnumMap<>(Api.class);
    private final Map<Api, RegisteredProvider> active = new EnumMap<>(Api.class);
    private final Map<Api, Map<String, RegisteredProvider>> owners = new EnumMap<>(Api.class);

    private Builder() {}

    public Builder api(Api api) {
      apis.add(api);
      return this;
    }

    public Builder provider(RegisteredProvider provider, boolean isActive) {
      providers.computeIfAbsent(provider.api(), k -> new ArrayList<>()).add(provider);
      if (isActive) {
        active.put(provider.api(), provider);
      }
      return this;
    }

    /** Registers resource ownership; returns the previous owner, if another provider had it. */
    public Optional<RegisteredProvider> resource(
        Api api, String resourceId, RegisteredProvider owner) {
      return Optional.ofNullable(
          owners.computeIfAbsent(api, k -> new LinkedHashMap<>()).putIfAbsent(resourceId, owner));
    }

    /** Providers added so far, in insertion order. */
    public List<RegisteredProvider> built() {
      List<RegisteredProvider> all = new ArrayList<>();
      providers.values().forEach(all::addAll);
      return all;
    }

    public ProviderRegistry build() {
      return new ProviderRegistry(apis, providers, active, owners);
    }
  }
}
