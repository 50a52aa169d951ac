package com.gentoro.aistack.providers.safety;

import com.gentoro.aistack.apis.inference.Inference;
import com.gentoro.aistack.exception.ConfigException;
import com.gentoro.aistack.exception.StackErrorCode;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.apache.commons.configuration2.ImmutableHierarchicalConfiguration;

/**
 * Shield definitions of a safety binding. Two forms are accepted and may be combined:
 *
 * <pre>
 * shields:
 *   guard:
 *     type: llama_guard
 *     model: Llama-Guard-3-1B
 *     excluded_categories: [S14]
 * llama_guard_shield:          # registered as "llama_guard"
 *   model: Llama-Guard-3-1B
 * </pre>
 */
public record ShieldConfig(
    String shieldId, String type, String model, Set<SafetyCategory> excludedCategories) {

  public static final String LLAMA_GUARD = "llama_guard";
  public static final String LLAMA_GUARD_SHIELD_KEY = "llama_guard_shield";

  public static List<ShieldConfig> parse(ImmutableHierarchicalConfiguration config) {
    Map<String, ShieldConfig> parsed = new LinkedHashMap<>();
    for (ImmutableHierarchicalConfiguration child :
        config.immutableChildConfigurationsAt("shields")) {
      String id = child.getRootElementName();
      add(parsed, of(id, child.getString("type", LLAMA_GUARD), child));
    }
    List<ImmutableHierarchicalConfiguration> legacy =
        config.immutableConfigurationsAt(LLAMA_GUARD_SHIELD_KEY);
    if (legacy.size() > 1) {
      throw new ConfigException("Only one " + LLAMA_GUARD_SHIELD_KEY + " section is allowed");
    }
    if (!legacy.isEmpty()) {
      add(parsed, of(LLAMA_GUARD, LLAMA_GUARD, legacy.get(0)));
    }
    return new ArrayList<>(parsed.values());
  }

  private static void add(Map<String, ShieldConfig> parsed, ShieldConfig shield) {
    if (parsed.putIfAbsent(shield.shieldId(), shield) != null) {
      throw new ConfigException(
          StackErrorCode.CONFIGURATION_ERROR,
          "Shield '" + shield.shieldId() + "' is configured twice",
          Map.of("shield_id", shield.shieldId()));
    }
  }

  private static ShieldConfig of(
      String id, String type, ImmutableHierarchicalConfiguration section) {
    if (!LLAMA_GUARD.equals(type)) {
      throw new ConfigException(
          StackErrorCode.CONFIGURATION_ERROR,
          "Unsupported shield type '" + type + "' for shield '" + id + "'",
          Map.of("shield_id", id, "type", String.valueOf(type)));
    }
    String model = section.getString("model");
    if (model == null || model.isBlank()) {
      throw new ConfigException(
          StackErrorCode.CONFIGURATION_ERROR,
          "Shield '" + id + "' requires a model",
          Map.of("shield_id", id));
    }
    Set<SafetyCategory> excluded = EnumSet.noneOf(SafetyCategory.class);
    for (String value : section.getList(String.class, "excluded_categories", List.of())) {
      if (value == null || value.isBlank()) continue;
      excluded.add(
          SafetyCategory.parse(value)
              .orElseThrow(
                  () ->
                      new ConfigException(
                          StackErrorCode.CONFIGURATION_ERROR,
                          "Unknown safety category '" + value + "' in shield '" + id + "'",
                          Map.of("shield_id", id, "category", value))));
    }
    return new ShieldConfig(id, type, model.trim(), excluded);
  }

  public ShieldClassifier classifier(Inference inference) {
    return new LlamaGuardClassifier(inference, model, excludedCategories);
  }
}
