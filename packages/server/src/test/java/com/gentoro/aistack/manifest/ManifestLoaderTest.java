package com.gentoro.aistack.manifest;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.aistack.exception.ConfigException;
import com.gentoro.aistack.exception.StackErrorCode;
import com.gentoro.aistack.provider.Api;
import com.gentoro.aistack.provider.ProviderKind;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ManifestLoaderTest {

  @Test
  @DisplayName("Parses apis, bindings, kinds and provider config")
  void parsesManifest() {
    Manifest manifest =
        ManifestLoader.parseYaml(
            """
            version: '2'
            image_name: demo
            apis: [inference, memory, memory_banks]
            providers:
              inference:
              - provider_id: ollama
                provider_type: remote::ollama
                config:
                  url: http://localhost:11434
              - provider_id: local
                provider_type: inline::local-embedding
                active: true
              memory:
              - provider_id: mem
                provider_type: meta-reference
            """);

    assertEquals("2", manifest.version());
    assertEquals("demo", manifest.imageName());
    assertEquals(List.of(Api.INFERENCE, Api.MEMORY, Api.MEMORY_BANKS), manifest.apis());

    List<ProviderBinding> inference = manifest.bindings(Api.INFERENCE);
    assertEquals(2, inference.size());
    assertEquals(ProviderKind.REMOTE, inference.get(0).kind());
    assertEquals("http://localhost:11434", inference.get(0).config().getString("url"));
    assertEquals(ProviderKind.INLINE, inference.get(1).kind());
    assertTrue(inference.get(1).config().isEmpty());
    assertEquals("local", manifest.activeBinding(Api.INFERENCE).orElseThrow().providerId());

    assertEquals(ProviderKind.INLINE, manifest.bindings(Api.MEMORY).get(0).kind());
    assertEquals("mem", manifest.activeBinding(Api.MEMORY).orElseThrow().providerId());
  }

  @Test
  @DisplayName("Without an apis list the apis with providers are exposed")
  void apisFromProviders() {
    Manifest manifest =
        ManifestLoader.parseYaml(
            """
            providers:
              telemetry:
              - provider_id: t
                provider_type: meta-reference
            """);
    assertEquals(List.of(Api.TELEMETRY), manifest.apis());
    assertEquals("local", manifest.imageName());
  }

  @Test
  @DisplayName("Unknown apis and providers for undeclared apis are rejected")
  void unknownApis() {
    assertThrows(ConfigException.class, () -> ManifestLoader.parseYaml("apis: [vision]\n"));
    assertThrows(
        ConfigException.class,
        () ->
            ManifestLoader.parseYaml(
                """
                apis: [inference]
                providers:
                  safety:
                  - provider_id: s
                    provider_type: meta-reference
                """));
  }

  @Test
  @DisplayName("Routing-table apis cannot carry providers")
  void routingTableProviders() {
    assertThrows(
        ConfigException.class,
        () ->
            ManifestLoader.parseYaml(
                """
                apis: [models]
                providers:
                  models:
                  - provider_id: m
                    provider_type: meta-reference
                """));
  }

  @Test
  @DisplayName("A provider type without a known kind fails with UNKNOWN_PROVIDER_KIND")
  void unknownKind() {
    ConfigException ex =
        assertThrows(
            ConfigException.class,
            () ->
                ManifestLoader.parseYaml(
                    """
                    providers:
                      inference:
                      - provider_id: x
                        provider_type: cloud-thing
                    """));
    assertEquals(StackErrorCode.UNKNOWN_PROVIDER_KIND, ex.getCode());
    assertEquals("x", ex.getContext().get("provider_id"));
  }

  @Test
  @DisplayName("Duplicate provider ids, missing fields and several active flags are rejected")
  void invalidBindings() {
    assertThrows(
        ConfigException.class,
        () ->
            ManifestLoader.parseYaml(
                """
                providers:
                  inference:
                  - provider_id: a
                    provider_type: remote::ollama
                  - provider_id: a
                    provider_type: inline::local-embedding
                """));
    assertThrows(
        ConfigException.class,
        () ->
            ManifestLoader.parseYaml(
                """
                providers:
                  inference:
                  - provider_type: remote::ollama
                """));
    assertThrows(
        ConfigException.class,
        () ->
            ManifestLoader.parseYaml(
                """
                providers:
                  inference:
                  - provider_id: a
                    provider_type: remote::ollama
                    active: true
                  - provider_id: b
                    provider_type: remote::ollama
                    active: true
                """));
  }
}
