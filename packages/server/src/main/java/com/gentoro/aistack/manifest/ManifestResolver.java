package com.gentoro.aistack.manifest;

import com.gentoro.aistack.client.CapabilityTransport;
import com.gentoro.aistack.exception.ConfigException;
import com.gentoro.aistack.exception.ExceptionUtil;
import com.gentoro.aistack.exception.StackErrorCode;
import com.gentoro.aistack.provider.Api;
import com.gentoro.aistack.provider.ProviderAdapterFactory;
import com.gentoro.aistack.provider.ProviderContext;
import com.gentoro.aistack.provider.ProviderRegistry;
import com.gentoro.aistack.provider.RegisteredProvider;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.ServiceLoader;

/**
 * Turns a {@link Manifest} into a {@link ProviderRegistry}.
 *
 * <p>Every check runs before the first adapter is built. Building is all-or-nothing: when an
 * adapter fails to build, the ones built before it are closed and no registry is returned.
 */
public final class ManifestResolver {
  private static final org.slf4j.Logger log =
      com.gentoro.aistack.logging.LoggingService.getLogger(ManifestResolver.class);

  private final List<ProviderAdapterFactory> factories;

  public ManifestResolver(List<ProviderAdapterFactory> factories) {
    this.factories = List.copyOf(factories);
  }

  /** Resolver over the factories registered through {@link ServiceLoader}. */
  public static ManifestResolver withInstalledFactories() {
    List<ProviderAdapterFactory> found = new ArrayList<>();
    for (ProviderAdapterFactory f : ServiceLoader.load(ProviderAdapterFactory.class)) {
      log.debug("Discovered provider factory {} for {}", f.providerType(), f.apis());
      found.add(f);
    }
    return new ManifestResolver(found);
  }

  public List<ProviderAdapterFactory> factories() {
    return factories;
  }

  /**
   * @param stackTransport transport adapters use to reach other capability groups of this stack
   * @throws ConfigException with {@code MISSING_CAPABILITY} or {@code UNKNOWN_PROVIDER_KIND} when
   *     the manifest cannot be served
   */
  public ProviderRegistry resolve(Manifest manifest, CapabilityTransport stackTransport) {
    Map<ProviderBinding, ProviderAdapterFactory> plan = validate(manifest);

    ProviderRegistry.Builder builder = ProviderRegistry.builder();
    manifest.apis().forEach(builder::api);
    try {
      for (Map.Entry<Api, List<ProviderBinding>> e : manifest.providers().entrySet()) {
        Api api = e.getKey();
        ProviderBinding active = manifest.activeBinding(api).orElse(null);
        for (ProviderBinding binding : e.getValue()) {
          RegisteredProvider provider = build(api, binding, plan.get(binding), stackTransport);
          builder.provider(provider, binding == active);
          for (String resource : provider.servedResources()) {
            Optional<RegisteredProvider> previous = builder.resource(api, resource, provider);
            if (previous.isPresent()) {
              throw new ConfigException(
                  StackErrorCode.CONFIGURATION_ERROR,
                  "'%s' is served by both '%s' and '%s'"
                      .formatted(resource, previous.get().providerId(), provider.providerId()),
                  Map.of("api", api.wireName(), "resource", resource));
            }
          }
        }
      }
    } catch (RuntimeException ex) {
      List<RegisteredProvider> built = builder.built();
      Collections.reverse(built);
      log.warn("Stack assembly failed, closing {} provider(s) built so far", built.size());
      ProviderRegistry.closeAdapters(built);
      throw ExceptionUtil.rethrowIfUnchecked(
          ex, t -> new ConfigException("Failed to assemble stack: " + t.getMessage(), t));
    }
    ProviderRegistry registry = builder.build();
    log.info(
        "Stack '{}' assembled with {} provider(s) for apis {}",
        manifest.imageName(),
        registry.allProviders().size(),
        registry.apis());
    return registry;
  }

  private Map<ProviderBinding, ProviderAdapterFactory> validate(Manifest manifest) {
    for (Api api : manifest.apis()) {
      Api needed = api.isRoutingTable() ? api.backingApi() : api;
      if (manifest.bindings(needed).isEmpty()) {
        throw new ConfigException(
            StackErrorCode.MISSING_CAPABILITY,
            api == needed
                ? "No provider is bound for api '%s'".formatted(api.wireName())
                : "'%s' needs a provider bound for '%s'"
                    .formatted(api.wireName(), needed.wireName()),
            Map.of("api", api.wireName()));
      }
    }

    Map<ProviderBinding, ProviderAdapterFactory> plan = new IdentityHashMap<>();
    manifest
        .providers()
        .forEach(
            (api, bindings) -> {
              for (ProviderBinding binding : bindings) {
                ProviderAdapterFactory factory = factoryFor(api, binding);
                for (Api dependency : factory.dependencies(api, binding.config())) {
                  if (manifest.bindings(dependency).isEmpty()) {
                    throw new ConfigException(
                        StackErrorCode.MISSING_CAPABILITY,
                        "Provider '%s' of api '%s' depends on '%s', which has no provider"
                            .formatted(
                                binding.providerId(), api.wireName(), dependency.wireName()),
                        Map.of(
                            "api", api.wireName(),
                            "provider_id", binding.providerId(),
                            "dependency", dependency.wireName()));
                  }
                }
                plan.put(binding, factory);
              }
            });
    return plan;
  }

  private ProviderAdapterFactory factoryFor(Api api, ProviderBinding binding) {
    return factories.stream()
        .filter(f -> f.matches(api, binding.providerType()))
        .findFirst()
        .orElseThrow(
            () ->
                new ConfigException(
                    StackErrorCode.UNKNOWN_PROVIDER_KIND,
                    "No provider implementation of type '%s' for api '%s'"
                        .formatted(binding.providerType(), api.wireName()),
                    Map.of(
                        "api", api.wireName(),
                        "provider_id", binding.providerId(),
                        "provider_type", binding.providerType())));
  }

  private RegisteredProvider build(
      Api api,
      ProviderBinding binding,
      ProviderAdapterFactory factory,
      CapabilityTransport stackTransport) {
    log.debug(
        "Building provider '{}' ({}, {}) for api '{}'",
        binding.providerId(),
        binding.providerType(),
        binding.kind(),
        api.wireName());
    Object adapter = factory.create(api, new ProviderContext(api, binding, stackTransport));
    if (!api.contract().isInstance(adapter)) {
      throw new ConfigException(
          StackErrorCode.CONFIGURATION_ERROR,
          "Provider type '%s' did not produce a %s adapter"
              .formatted(binding.providerType(), api.contract().getSimpleName()),
          Map.of("api", api.wireName(), "provider_id", binding.providerId()));
    }
    List<String> resources = factory.servedResources(api, binding.config());
    return new RegisteredProvider(api, binding, adapter, List.copyOf(resources));
  }
}
