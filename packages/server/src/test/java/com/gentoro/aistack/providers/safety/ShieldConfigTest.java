package com.gentoro.aistack.providers.safety;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.aistack.ConfigurationProvider;
import com.gentoro.aistack.exception.ConfigException;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ShieldConfigTest {

  @Test
  @DisplayName("Named shields and the llama_guard_shield section are both registered")
  void bothForms() {
    List<ShieldConfig> shields =
        ShieldConfig.parse(
            ConfigurationProvider.parseYaml(
                """
                shields:
                  strict:
                    type: llama_guard
                    model: Llama-Guard-3-8B
                    excluded_categories: [S14, Elections]
                llama_guard_shield:
                  model: Llama-Guard-3-1B
                """));

    assertEquals(2, shields.size());
    ShieldConfig strict = shields.get(0);
    assertEquals("strict", strict.shieldId());
    assertEquals("Llama-Guard-3-8B", strict.model());
    assertEquals(Set.of(SafetyCategory.S14, SafetyCategory.S13), strict.excludedCategories());

    ShieldConfig legacy = shields.get(1);
    assertEquals(ShieldConfig.LLAMA_GUARD, legacy.shieldId());
    assertEquals("Llama-Guard-3-1B", legacy.model());
    assertTrue(legacy.excludedCategories().isEmpty());
  }

  @Test
  @DisplayName("No shields configured gives an empty list")
  void none() {
    assertTrue(ShieldConfig.parse(ConfigurationProvider.parseYaml("other: 1\n")).isEmpty());
  }

  @Test
  @DisplayName("Missing model, unknown type, unknown category and duplicates are config errors")
  void invalid() {
    assertThrows(
        ConfigException.class,
        () -> ShieldConfig.parse(ConfigurationProvider.parseYaml("llama_guard_shield:\n  x: 1\n")));
    assertThrows(
        ConfigException.class,
        () ->
            ShieldConfig.parse(
                ConfigurationProvider.parseYaml(
                    "shields:\n  a:\n    type: regex\n    model: m\n")));
    assertThrows(
        ConfigException.class,
        () ->
            ShieldConfig.parse(
                ConfigurationProvider.parseYaml(
                    "shields:\n  a:\n    model: m\n    excluded_categories: [S99]\n")));
    assertThrows(
        ConfigException.class,
        () ->
            ShieldConfig.parse(
                ConfigurationProvider.parseYaml(
                    "shields:\n  llama_guard:\n    model: m\nllama_guard_shield:\n  model: m\n")));
  }
}
