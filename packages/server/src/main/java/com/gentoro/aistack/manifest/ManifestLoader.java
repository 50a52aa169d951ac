package com.gentoro.aistack.manifest;

import com.gentoro.aistack.ConfigurationProvider;
import com.gentoro.aistack.exception.ConfigException;
import com.gentoro.aistack.exception.StackErrorCode;
import com.gentoro.aistack.provider.Api;
import com.gentoro.aistack.provider.ProviderKind;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.apache.commons.configuration2.BaseHierarchicalConfiguration;
import org.apache.commons.configuration2.HierarchicalConfiguration;
import org.apache.commons.configuration2.ImmutableHierarchicalConfiguration;
import org.apache.commons.configuration2.tree.ImmutableNode;

/**
 * Reads manifests in the {@code run.yaml} layout:
 *
 * <pre>
 * version: '2'
 * image_name: local
 * apis: [inference, memory, memory_banks]
 * providers:
 *   inference:
 *   - provider_id: ollama
 *     provider_type: remote::ollama
 *     config:
 *       url: ${env:OLLAMA_URL}
 * </pre>
 *
 * Only structure is checked here; whether the bindings can actually be served is decided by {@link
 * ManifestResolver}.
 */
public final class ManifestLoader {
  private static final org.slf4j.Logger log =
      com.gentoro.aistack.logging.LoggingService.getLogger(ManifestLoader.class);

  private ManifestLoader() {}

  public static Manifest load(String location) {
    log.info("Loading stack manifest from {}", location);
    return parse(ConfigurationProvider.loadYaml(location));
  }

  public static Manifest parseYaml(String yaml) {
    return parse(ConfigurationProvider.parseYaml(yaml));
  }

  public static Manifest parse(HierarchicalConfiguration<ImmutableNode> yaml) {
    String version = yaml.getString("version", "2");
    String imageName = yaml.getString("image_name", "local");

    Set<Api> providerApis = new LinkedHashSet<>();
    for (Iterator<String> it = yaml.getKeys("providers"); it.hasNext(); ) {
      String[] parts = it.next().split("\\.");
      if (parts.length < 2) {
        continue;
      }
      providerApis.add(api(parts[1], "providers"));
    }

    List<Api> apis = new ArrayList<>();
    List<String> declared = yaml.getList(String.class, "apis", List.of());
    if (declared.isEmpty()) {
      apis.addAll(providerApis);
    } else {
      for (String name : declared) {
        Api api = api(name, "apis");
        if (!apis.contains(api)) {
          apis.add(api);
        }
      }
    }

    Map<Api, List<ProviderBinding>> providers = new EnumMap<>(Api.class);
    for (Api api : providerApis) {
      if (!apis.contains(api)) {
        throw new ConfigException(
            StackErrorCode.CONFIGURATION_ERROR,
            "Providers are configured for api '%s' which is not listed under apis"
                .formatted(api.wireName()),
            Map.of("api", api.wireName()));
      }
      if (api.isRoutingTable()) {
        throw new ConfigException(
            StackErrorCode.CONFIGURATION_ERROR,
            "'%s' is served from the %s providers and takes no providers of its own"
                .formatted(api.wireName(), api.backingApi().wireName()),
            Map.of("api", api.wireName()));
      }
      providers.put(api, parseBindings(api, yaml));
    }
    return new Manifest(version, imageName, apis, providers);
  }

  private static List<ProviderBinding> parseBindings(
      Api api, HierarchicalConfiguration<ImmutableNode> yaml) {
    List<ProviderBinding> bindings = new ArrayList<>();
    Set<String> ids = new HashSet<>();
    int activeCount = 0;
    for (HierarchicalConfiguration<ImmutableNode> entry :
        yaml.configurationsAt("providers." + api.wireName())) {
      String providerId = required(entry, "provider_id", api);
      String providerType = required(entry, "provider_type", api);
      if (!ids.add(providerId)) {
        throw new ConfigException(
            StackErrorCode.CONFIGURATION_ERROR,
            "Duplicate provider_id '%s' for api '%s'".formatted(providerId, api.wireName()),
            Map.of("api", api.wireName(), "provider_id", providerId));
      }
      ProviderKind kind;
      try {
        kind = ProviderKind.fromProviderType(providerType);
      } catch (ConfigException e) {
        throw e.annotate("api", api.wireName()).annotate("provider_id", providerId);
      }
      boolean active = entry.getBoolean("active", false);
      if (active) {
        activeCount++;
      }
      bindings.add(new ProviderBinding(providerId, providerType, kind, active, config(entry)));
    }
    if (activeCount > 1) {
      throw new ConfigException(
          StackErrorCode.CONFIGURATION_ERROR,
          "More than one provider of api '%s' is flagged active".formatted(api.wireName()),
          Map.of("api", api.wireName()));
    }
    return bindings;
  }

  private static ImmutableHierarchicalConfiguration config(
      HierarchicalConfiguration<ImmutableNode> entry) {
    List<HierarchicalConfiguration<ImmutableNode>> sections = entry.configurationsAt("config");
    return sections.isEmpty() ? new BaseHierarchicalConfiguration() : sections.get(0);
  }

  private static String required(
      HierarchicalConfiguration<ImmutableNode> entry, String key, Api api) {
    String value = entry.getString(key);
    if (value == null || value.isBlank()) {
      throw new ConfigException(
          StackErrorCode.CONFIGURATION_ERROR,
          "Missing %s in a provider of api '%s'".formatted(key, api.wireName()),
          Map.of("api", api.wireName()));
    }
    return value.trim();
  }

  private static Api api(String name, String section) {
    return Api.fromWireName(name)
        .orElseThrow(
            () ->
                new ConfigException(
                    StackErrorCode.CONFIGURATION_ERROR,
                    "Unknown api '%s' in %s".formatted(name, section),
                    Map.of("api", String.valueOf(name))));
  }
}
