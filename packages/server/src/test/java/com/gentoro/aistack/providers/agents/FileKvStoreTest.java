package com.gentoro.aistack.providers.agents;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.aistack.ConfigurationProvider;
import com.gentoro.aistack.exception.ConfigException;
import com.gentoro.aistack.exception.IoException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileKvStoreTest {

  @Test
  @DisplayName("Entries survive reopening the store")
  void persists(@TempDir Path dir) {
    Path file = dir.resolve("store.json");
    FileKvStore store = new FileKvStore(file, "agents");
    store.set("agent:1", "{\"model\":\"m\"}");
    store.set("session:1:a", "{}");
    store.delete("session:1:a");

    FileKvStore reopened = new FileKvStore(file, "agents");
    assertEquals(Optional.of("{\"model\":\"m\"}"), reopened.get("agent:1"));
    assertEquals(Optional.empty(), reopened.get("session:1:a"));
    assertFalse(Files.exists(dir.resolve("store.json.tmp")));
  }

  @Test
  @DisplayName("Namespaces sharing a file do not see or clobber each other")
  void namespaces(@TempDir Path dir) {
    Path file = dir.resolve("shared.json");
    FileKvStore first = new FileKvStore(file, "one");
    first.set("k", "1");
    FileKvStore second = new FileKvStore(file, "two");
    second.set("k", "2");

    assertEquals(Optional.of("1"), new FileKvStore(file, "one").get("k"));
    assertEquals(Optional.of("2"), new FileKvStore(file, "two").get("k"));
  }

  @Test
  @DisplayName("keys lists the entries under a prefix in order")
  void keysByPrefix(@TempDir Path dir) {
    FileKvStore store = new FileKvStore(dir.resolve("s.json"), null);
    store.set("session:a:2", "x");
    store.set("session:a:1", "x");
    store.set("session:b:1", "x");
    store.set("agent:a", "x");

    assertEquals(List.of("session:a:1", "session:a:2"), store.keys("session:a:"));
  }

  @Test
  @DisplayName("A corrupt file fails to open with IO_ERROR")
  void corruptFile(@TempDir Path dir) throws Exception {
    Path file = dir.resolve("bad.json");
    Files.writeString(file, "[not a map");
    assertThrows(IoException.class, () -> new FileKvStore(file, "agents"));
  }

  @Test
  @DisplayName("A failed write leaves the store contents unchanged")
  void failedWrite(@TempDir Path dir) throws Exception {
    Path blocker = Files.writeString(dir.resolve("blocker"), "");
    FileKvStore store = new FileKvStore(blocker.resolve("store.json"), "agents");

    assertThrows(IoException.class, () -> store.set("agent:1", "{}"));
    assertEquals(Optional.empty(), store.get("agent:1"));
    assertTrue(store.keys("").isEmpty());
  }

  @Test
  @DisplayName("A failed delete keeps the entry")
  void failedDelete(@TempDir Path dir) throws Exception {
    Path sub = dir.resolve("sub");
    Path file = sub.resolve("store.json");
    FileKvStore store = new FileKvStore(file, "agents");
    store.set("agent:1", "{}");

    Files.delete(file);
    Files.delete(sub);
    Files.writeString(sub, "");

    assertThrows(IoException.class, () -> store.delete("agent:1"));
    assertEquals(Optional.of("{}"), store.get("agent:1"));
    assertFalse(store.delete("agent:2"));
  }

  @Test
  @DisplayName("The provider config selects the store type")
  void storeSelection(@TempDir Path dir) {
    assertInstanceOf(
        InMemoryKvStore.class,
        AgentsProviderFactory.openStore("agents", ConfigurationProvider.parseYaml("x: 1\n")));

    KvStore file =
        AgentsProviderFactory.openStore(
            "agents",
            ConfigurationProvider.parseYaml(
                "persistence_store:\n  type: file\n  db_path: "
                    + dir.resolve("a.json")
                    + "\n"));
    assertInstanceOf(FileKvStore.class, file);

    assertThrows(
        ConfigException.class,
        () ->
            AgentsProviderFactory.openStore(
                "agents", ConfigurationProvider.parseYaml("persistence_store:\n  type: file\n")));
    assertThrows(
        ConfigException.class,
        () ->
            AgentsProviderFactory.openStore(
                "agents", ConfigurationProvider.parseYaml("persistence_store:\n  type: redis\n")));
  }
}
