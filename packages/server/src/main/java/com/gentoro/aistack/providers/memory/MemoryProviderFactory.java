package com.gentoro.aistack.providers.memory;

import com.gentoro.aistack.provider.Api;
import com.gentoro.aistack.provider.ProviderAdapterFactory;
import com.gentoro.aistack.provider.ProviderContext;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Set;
import org.apache.commons.configuration2.ImmutableHierarchicalConfiguration;

/**
 * {@code meta-reference} memory provider. Config keys: {@code max_chunks} (default result size),
 * {@code max_chunks_limit}, {@code embedding_batch_size}, {@code fetch_timeout_seconds}, {@code
 * allowed_file_roots} (directories {@code file:} document uris may read; none by default) and
 * {@code allowed_url_hosts} (hosts {@code http(s)} document uris may reach; any by default).
 */
public final class MemoryProviderFactory implements ProviderAdapterFactory {
  @Override
  public String providerType() {
    return "meta-reference";
  }

  @Override
  public Set<String> aliases() {
    return Set.of("inline::memory");
  }

  @Override
  public Set<Api> apis() {
    return Set.of(Api.MEMORY);
  }

  @Override
  public Set<Api> dependencies(Api api, ImmutableHierarchicalConfiguration config) {
    return Set.of(Api.INFERENCE);
  }

  @Override
  public Object create(Api api, ProviderContext context) {
    ImmutableHierarchicalConfiguration config = context.config();
    Duration fetchTimeout =
        Duration.ofMillis((long) (config.getDouble("fetch_timeout_seconds", 20.0) * 1000));
    return new MemoryBankEngine(
        context.providerId(),
        context.inference(),
        new DocumentContentLoader(
            fetchTimeout,
            config.getList(String.class, "allowed_file_roots", List.of()).stream()
                .filter(r -> !r.isBlank())
                .map(r -> Path.of(r.trim()))
                .toList(),
            Set.copyOf(config.getList(String.class, "allowed_url_hosts", List.of()))),
        config.getInt("max_chunks", MemoryBankEngine.DEFAULT_MAX_CHUNKS),
        config.getInt("max_chunks_limit", MemoryBankEngine.DEFAULT_MAX_CHUNKS_LIMIT),
        config.getInt("embedding_batch_size", MemoryBankEngine.DEFAULT_EMBEDDING_BATCH_SIZE));
  }
}
