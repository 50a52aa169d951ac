package com.gentoro.aistack.providers.agents;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.gentoro.aistack.exception.IoException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Key/value store kept in memory and written through to a single JSON file.
 *
 * <p>On open the file is loaded when it exists and is a regular file; a missing file starts an
 * empty store. Every write replaces the file through a temporary sibling and an atomic move, so a
 * crash leaves either the old or the new content. A failed write leaves the in-memory view as it
 * was. Keys are stored under {@code namespace}.
 */
public class FileKvStore extends InMemoryKvStore {
  private static final org.slf4j.Logger log =
      com.gentoro.aistack.logging.LoggingService.getLogger(FileKvStore.class);

  private final Path file;
  private final String namespace;
  private final ObjectMapper objectMapper =
      new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

  public FileKvStore(Path file, String namespace) {
    this.file = Objects.requireNonNull(file, "file");
    this.namespace = namespace == null || namespace.isBlank() ? "" : namespace + "/";
    load();
  }

  public Path file() {
    return file;
  }

  private void load() {
    if (!Files.isRegularFile(file)) {
      log.debug("Key/value file not found, starting empty: {}", file);
      return;
    }
    log.debug("Loading key/value entries from {}", file);
    try (var in = Files.newBufferedReader(file)) {
      Map<String, String> stored =
          objectMapper.readValue(in, new TypeReference<TreeMap<String, String>>() {});
      if (stored == null) return;
      stored.forEach(
          (k, v) -> {
            if (k.startsWith(namespace)) {
              entries.put(k.substring(namespace.length()), v);
            }
          });
    } catch (IOException e) {
      throw new IoException("Failed to read key/value store " + file, e);
    }
  }

  @Override
  public synchronized void set(String key, String value) {
    Map<String, String> next = new TreeMap<>(entries);
    next.put(key, value);
    persist(next);
    super.set(key, value);
  }

  @Override
  public synchronized boolean delete(String key) {
    if (!entries.containsKey(key)) {
      return false;
    }
    Map<String, String> next = new TreeMap<>(entries);
    next.remove(key);
    persist(next);
    return super.delete(key);
  }

  /** Writes {@code snapshot} to disk; the in-memory entries change only once this returns. */
  private void persist(Map<String, String> snapshot) {
    Map<String, String> merged = new TreeMap<>();
    try {
      if (!namespace.isEmpty() && Files.isRegularFile(file)) {
        // Keep entries of other namespaces sharing the file.
        try (var in = Files.newBufferedReader(file)) {
          Map<String, String> stored =
              objectMapper.readValue(in, new TypeReference<TreeMap<String, String>>() {});
          if (stored != null) {
            stored.forEach(
                (k, v) -> {
                  if (!k.startsWith(namespace)) merged.put(k, v);
                });
          }
        }
      }
      snapshot.forEach((k, v) -> merged.put(namespace + k, v));

      Path parent = file.toAbsolutePath().getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
      try (var out = Files.newBufferedWriter(tmp)) {
        objectMapper.writeValue(out, merged);
      }
      Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    } catch (IOException e) {
      throw new IoException("Failed to write key/value store " + file, e);
    }
  }
}
