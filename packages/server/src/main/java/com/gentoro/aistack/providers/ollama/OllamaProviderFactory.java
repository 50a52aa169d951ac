package com.gentoro.aistack.providers.ollama;

import com.gentoro.aistack.exception.ConfigException;
import com.gentoro.aistack.exception.StackErrorCode;
import com.gentoro.aistack.provider.Api;
import com.gentoro.aistack.provider.ProviderAdapterFactory;
import com.gentoro.aistack.provider.ProviderContext;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import okhttp3.HttpUrl;
import org.apache.commons.configuration2.ImmutableHierarchicalConfiguration;

/**
 * {@code remote::ollama}. Config keys: {@code url} (default {@code http://localhost:11434}), {@code
 * models} (stack model identifiers, each must be a supported Llama model), {@code
 * embedding_models} (Ollama tags served for embeddings as-is), {@code timeout_seconds} (default
 * 300).
 */
public final class OllamaProviderFactory implements ProviderAdapterFactory {
  public static final String DEFAULT_URL = "http://localhost:11434";

  @Override
  public String providerType() {
    return "remote::ollama";
  }

  @Override
  public Set<Api> apis() {
    return Set.of(Api.INFERENCE);
  }

  @Override
  public List<String> servedResources(Api api, ImmutableHierarchicalConfiguration config) {
    List<String> models = new ArrayList<>();
    for (String model : config.getList(String.class, "models", List.of())) {
      if (OllamaModels.ollamaTag(model).isEmpty()) {
        throw new ConfigException(
            StackErrorCode.CONFIGURATION_ERROR,
            "Model " + model + " is not supported by Ollama",
            Map.of("model", model, "supported", List.copyOf(OllamaModels.SUPPORTED.keySet())));
      }
      models.add(model);
    }
    models.addAll(config.getList(String.class, "embedding_models", List.of()));
    return models;
  }

  @Override
  public Object create(Api api, ProviderContext context) {
    ImmutableHierarchicalConfiguration config = context.config();
    String url = config.getString("url", DEFAULT_URL);
    HttpUrl baseUrl = HttpUrl.parse(url.trim());
    if (baseUrl == null) {
      throw new ConfigException(
          StackErrorCode.CONFIGURATION_ERROR,
          "Provider '%s' has an invalid url '%s'".formatted(context.providerId(), url),
          Map.of("provider_id", context.providerId()));
    }
    Duration timeout = Duration.ofSeconds(config.getLong("timeout_seconds", 300L));
    return new OllamaInferenceAdapter(
        baseUrl,
        timeout,
        new LinkedHashSet<>(config.getList(String.class, "embedding_models", List.of())));
  }
}
