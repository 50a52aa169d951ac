package com.gentoro.aistack.providers.telemetry;

import com.gentoro.aistack.exception.ConfigException;
import com.gentoro.aistack.exception.StackErrorCode;
import com.gentoro.aistack.provider.Api;
import com.gentoro.aistack.provider.ProviderAdapterFactory;
import com.gentoro.aistack.provider.ProviderContext;
import java.util.Map;
import java.util.Set;

/** {@code meta-reference} telemetry. Config key: {@code max_traces} (default 1000). */
public final class TelemetryProviderFactory implements ProviderAdapterFactory {
  @Override
  public String providerType() {
    return "meta-reference";
  }

  @Override
  public Set<String> aliases() {
    return Set.of("inline::telemetry");
  }

  @Override
  public Set<Api> apis() {
    return Set.of(Api.TELEMETRY);
  }

  @Override
  public Object create(Api api, ProviderContext context) {
    int maxTraces = context.config().getInt("max_traces", TelemetryService.DEFAULT_MAX_TRACES);
    if (maxTraces <= 0) {
      throw new ConfigException(
          StackErrorCode.CONFIGURATION_ERROR,
          "max_traces must be positive",
          Map.of("provider_id", context.providerId(), "max_traces", maxTraces));
    }
    return new TelemetryService(maxTraces);
  }
}
