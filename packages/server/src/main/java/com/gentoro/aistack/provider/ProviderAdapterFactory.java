package com.gentoro.aistack.provider;

import java.util.List;
import java.util.Set;
import org.apache.commons.configuration2.ImmutableHierarchicalConfiguration;

/**
 * Service Provider Interface (SPI) for pluggable provider adapters.
 *
 * <p>Implementations are discovered via {@link java.util.ServiceLoader}. A factory is selected for
 * a manifest binding when it serves the binding's api and its {@link #providerType()} (or one of
 * its {@link #aliases()}) equals the binding's {@code provider_type}.
 *
 * <p>To register a factory, add its fully qualified class name to the service resource: {@code
 * META-INF/services/com.gentoro.aistack.provider.ProviderAdapterFactory}.
 */
public interface ProviderAdapterFactory {

  /** Stable provider type, e.g. {@code remote::ollama} or {@code meta-reference}. */
  String providerType();

  default Set<String> aliases() {
    return Set.of();
  }

  /** Capability groups this factory can build adapters for. */
  Set<Api> apis();

  /** Other capability groups the adapter calls at runtime; they must be bound in the manifest. */
  default Set<Api> dependencies(Api api, ImmutableHierarchicalConfiguration config) {
    return Set.of();
  }

  /**
   * Identifiers of resources (models, shields) the adapter serves. They are known from the binding
   * config alone, so the registry can route by them without contacting the provider.
   */
  default List<String> servedResources(Api api, ImmutableHierarchicalConfiguration config) {
    return List.of();
  }

  /**
   * Builds the adapter. The returned object implements {@code api.contract()}. Remote adapters
   * must not contact their backend here.
   *
   * @throws com.gentoro.aistack.exception.ConfigException when the binding config is invalid.
   */
  Object create(Api api, ProviderContext context);

  default boolean matches(Api api, String type) {
    return apis().contains(api) && (providerType().equals(type) || aliases().contains(type));
  }
}
