package com.gentoro.aistack.utility;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import com.gentoro.aistack.exception.SerializationException;
import com.gentoro.aistack.exception.ValidationException;

public class JacksonUtility {
  private static final ObjectMapper YAML_MAPPER =
      new ObjectMapper(
              new YAMLFactory()
                  .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
                  .enable(YAMLGenerator.Feature.LITERAL_BLOCK_STYLE)
                  .disable(YAMLGenerator.Feature.SPLIT_LINES)
                  .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES))
          .setSerializationInclusion(JsonInclude.Include.NON_NULL);

  private static final ObjectMapper JSON_MAPPER =
      new ObjectMapper()
          // Ignore extra fields that aren't in the target type
          .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
          .configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false)
          .setSerializationInclusion(JsonInclude.Include.NON_NULL);

  public static ObjectMapper getYamlMapper() {
    return YAML_MAPPER;
  }

  public static ObjectMapper getJsonMapper() {
    return JSON_MAPPER;
  }

  public static String toJson(Object object) {
    try {
      return JSON_MAPPER.writeValueAsString(object);
    } catch (Exception e) {
      throw new SerializationException("Failed to serialize object to JSON", e);
    }
  }

  public static String toYaml(Object object) {
    try {
      return YAML_MAPPER.writeValueAsString(object);
    } catch (Exception e) {
      throw new SerializationException("Failed to serialize object to YAML", e);
    }
  }

  public static <T> T fromJson(String json, Class<T> type) {
    try {
      return JSON_MAPPER.readValue(json, type);
    } catch (Exception e) {
      throw new SerializationException("Failed to read " + type.getSimpleName() + " from JSON", e);
    }
  }

  public static JsonNode readTree(String json) {
    if (json == null || json.isBlank()) {
      return JSON_MAPPER.createObjectNode();
    }
    try {
      return JSON_MAPPER.readTree(json);
    } catch (Exception e) {
      throw new SerializationException("Malformed JSON payload", e);
    }
  }

  /** Bind an untyped payload (JsonNode, Map) to a request type. */
  public static <T> T bind(Object payload, Class<T> type) {
    try {
      if (payload instanceof JsonNode node) {
        return JSON_MAPPER.treeToValue(node, type);
      }
      return JSON_MAPPER.convertValue(payload, type);
    } catch (Exception e) {
      throw new ValidationException(
          "Payload does not match " + type.getSimpleName() + ": " + e.getMessage(), e);
    }
  }
}
