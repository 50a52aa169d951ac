package com.gentoro.aistack.providers.localembedding;

import com.gentoro.aistack.exception.ConfigException;
import com.gentoro.aistack.exception.StackErrorCode;
import com.gentoro.aistack.provider.Api;
import com.gentoro.aistack.provider.ProviderAdapterFactory;
import com.gentoro.aistack.provider.ProviderContext;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.apache.commons.configuration2.ImmutableHierarchicalConfiguration;

/**
 * {@code inline::local-embedding}. Config keys: {@code models} (embedding model identifiers this
 * provider answers for) and {@code dimension} (default 384).
 */
public final class LocalEmbeddingProviderFactory implements ProviderAdapterFactory {
  @Override
  public String providerType() {
    return "inline::local-embedding";
  }

  @Override
  public Set<Api> apis() {
    return Set.of(Api.INFERENCE);
  }

  @Override
  public List<String> servedResources(Api api, ImmutableHierarchicalConfiguration config) {
    return config.getList(String.class, "models", List.of());
  }

  @Override
  public Object create(Api api, ProviderContext context) {
    int dimension = context.config().getInt("dimension", HashingEmbedder.DEFAULT_DIMENSION);
    if (dimension <= 0) {
      throw new ConfigException(
          StackErrorCode.CONFIGURATION_ERROR,
          "dimension must be positive for provider '%s'".formatted(context.providerId()),
          Map.of("provider_id", context.providerId(), "dimension", dimension));
    }
    return new LocalEmbeddingInference(
        new HashingEmbedder(dimension),
        new LinkedHashSet<>(servedResources(api, context.config())));
  }
}
