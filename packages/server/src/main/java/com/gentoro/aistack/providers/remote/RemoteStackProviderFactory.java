package com.gentoro.aistack.providers.remote;

import com.gentoro.aistack.client.CapabilityClients;
import com.gentoro.aistack.exception.ConfigException;
import com.gentoro.aistack.exception.StackErrorCode;
import com.gentoro.aistack.provider.Api;
import com.gentoro.aistack.provider.ProviderAdapterFactory;
import com.gentoro.aistack.provider.ProviderContext;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import okhttp3.HttpUrl;
import org.apache.commons.configuration2.ImmutableHierarchicalConfiguration;

/**
 * {@code remote::stack}: proxies a capability group to another stack over HTTP.
 *
 * <p>Config keys: {@code url} (required), {@code timeout_seconds} (default 20), {@code
 * structured_errors} (default false), {@code models} and {@code shields} for the resources the
 * remote stack serves.
 */
public final class RemoteStackProviderFactory implements ProviderAdapterFactory {

  @Override
  public String providerType() {
    return "remote::stack";
  }

  @Override
  public Set<Api> apis() {
    return Set.of(Api.INFERENCE, Api.SAFETY, Api.MEMORY, Api.AGENTS, Api.TELEMETRY);
  }

  @Override
  public List<String> servedResources(Api api, ImmutableHierarchicalConfiguration config) {
    return switch (api) {
      case INFERENCE -> config.getList(String.class, "models", List.of());
      case SAFETY -> config.getList(String.class, "shields", List.of());
      default -> List.of();
    };
  }

  @Override
  public Object create(Api api, ProviderContext context) {
    ImmutableHierarchicalConfiguration config = context.config();
    String url = config.getString("url");
    HttpUrl baseUrl = url == null ? null : HttpUrl.parse(url.trim());
    if (baseUrl == null) {
      throw new ConfigException(
          StackErrorCode.CONFIGURATION_ERROR,
          "Provider '%s' needs a valid http(s) url, got '%s'".formatted(context.providerId(), url),
          Map.of("provider_id", context.providerId()));
    }
    double timeoutSeconds =
        config.getDouble("timeout_seconds", RemoteStackClient.DEFAULT_TIMEOUT.toSeconds());
    if (timeoutSeconds <= 0) {
      throw new ConfigException(
          StackErrorCode.CONFIGURATION_ERROR,
          "timeout_seconds must be positive for provider '%s'".formatted(context.providerId()),
          Map.of("provider_id", context.providerId(), "timeout_seconds", timeoutSeconds));
    }
    RemoteStackClient client =
        new RemoteStackClient(
            baseUrl,
            Duration.ofMillis((long) (timeoutSeconds * 1000)),
            config.getBoolean("structured_errors", false));
    return CapabilityClients.forApi(api, client);
  }
}
