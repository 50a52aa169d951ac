package com.gentoro.aistack.providers.safety;

import com.gentoro.aistack.provider.Api;
import com.gentoro.aistack.provider.ProviderAdapterFactory;
import com.gentoro.aistack.provider.ProviderContext;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.apache.commons.configuration2.ImmutableHierarchicalConfiguration;

/** {@code meta-reference} safety provider backed by {@link ShieldRunner}. */
public final class SafetyProviderFactory implements ProviderAdapterFactory {
  @Override
  public String providerType() {
    return "meta-reference";
  }

  @Override
  public Set<String> aliases() {
    return Set.of("inline::llama-guard", "inline::safety");
  }

  @Override
  public Set<Api> apis() {
    return Set.of(Api.SAFETY);
  }

  @Override
  public Set<Api> dependencies(Api api, ImmutableHierarchicalConfiguration config) {
    return ShieldConfig.parse(config).isEmpty() ? Set.of() : Set.of(Api.INFERENCE);
  }

  @Override
  public List<String> servedResources(Api api, ImmutableHierarchicalConfiguration config) {
    return ShieldConfig.parse(config).stream().map(ShieldConfig::shieldId).toList();
  }

  @Override
  public Object create(Api api, ProviderContext context) {
    Map<String, ShieldClassifier> shields = new LinkedHashMap<>();
    for (ShieldConfig shield : ShieldConfig.parse(context.config())) {
      shields.put(shield.shieldId(), shield.classifier(context.inference()));
    }
    return new ShieldRunner(shields);
  }
}
