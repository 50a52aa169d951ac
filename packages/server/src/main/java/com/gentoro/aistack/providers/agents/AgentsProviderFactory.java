package com.gentoro.aistack.providers.agents;

import com.gentoro.aistack.exception.ConfigException;
import com.gentoro.aistack.exception.StackErrorCode;
import com.gentoro.aistack.provider.Api;
import com.gentoro.aistack.provider.ProviderAdapterFactory;
import com.gentoro.aistack.provider.ProviderContext;
import java.nio.file.Path;
import java.util.Map;
import java.util.Set;
import org.apache.commons.configuration2.ImmutableHierarchicalConfiguration;

/**
 * {@code meta-reference} agents provider.
 *
 * <pre>
 * persistence_store:
 *   type: file          # or inmemory (default)
 *   db_path: ~/.aistack/agents.json
 *   namespace: agents
 * </pre>
 */
public final class AgentsProviderFactory implements ProviderAdapterFactory {
  public static final String INMEMORY = "inmemory";
  public static final String FILE = "file";

  @Override
  public String providerType() {
    return "meta-reference";
  }

  @Override
  public Set<String> aliases() {
    return Set.of("inline::agents");
  }

  @Override
  public Set<Api> apis() {
    return Set.of(Api.AGENTS);
  }

  @Override
  public Set<Api> dependencies(Api api, ImmutableHierarchicalConfiguration config) {
    return Set.of(Api.INFERENCE);
  }

  @Override
  public Object create(Api api, ProviderContext context) {
    return new AgentsEngine(
        openStore(context.providerId(), context.config()),
        context.inference(),
        context.safety(),
        context.memory());
  }

  static KvStore openStore(String providerId, ImmutableHierarchicalConfiguration config) {
    String type = config.getString("persistence_store.type", INMEMORY);
    switch (type) {
      case INMEMORY:
        return new InMemoryKvStore();
      case FILE:
        String dbPath = config.getString("persistence_store.db_path");
        if (dbPath == null || dbPath.isBlank()) {
          throw new ConfigException(
              StackErrorCode.CONFIGURATION_ERROR,
              "persistence_store.db_path is required for a file store",
              Map.of("provider_id", providerId));
        }
        return new FileKvStore(
            expandHome(dbPath.trim()), config.getString("persistence_store.namespace", null));
      default:
        throw new ConfigException(
            StackErrorCode.CONFIGURATION_ERROR,
            "Unsupported persistence_store.type '" + type + "'",
            Map.of("provider_id", providerId, "type", type));
    }
  }

  private static Path expandHome(String path) {
    if (path.equals("~") || path.startsWith("~/")) {
      return Path.of(System.getProperty("user.home"), path.substring(1).replaceFirst("^/", ""));
    }
    return Path.of(path);
  }
}
