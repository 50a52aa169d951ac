package com.gentoro.aistack.providers.agents;

import java.util.List;
import java.util.Optional;

/** String key/value persistence for agents and sessions. Values are JSON documents. */
public interface KvStore extends AutoCloseable {

  Optional<String> get(String key);

  void set(String key, String value);

  /** @return {@code true} when the key existed */
  boolean delete(String key);

  /** Keys starting with {@code prefix}, in lexicographic order. */
  List<String> keys(String prefix);

  @Override
  default void close() {}
}
