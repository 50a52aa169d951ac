package com.gentoro.aistack.prompt;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.aistack.apis.inference.Message;
import com.gentoro.aistack.exception.ExceptionUtil;
import com.gentoro.aistack.exception.NotFoundException;
import com.gentoro.aistack.exception.PromptException;
import com.gentoro.aistack.utility.JacksonUtility;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Loads prompt YAML files from the classpath, e.g. {@code prompts/llama_guard.yaml}:
 *
 * <pre>
 * sections:
 *   - id: classify
 *     role: user
 *     content: |-
 *       Task: ...
 * </pre>
 *
 * Parsed templates are cached per name.
 */
public class ClasspathPromptRepository {
  public static final String DEFAULT_BASE_PATH = "prompts";

  private static final ClasspathPromptRepository DEFAULT =
      new ClasspathPromptRepository(DEFAULT_BASE_PATH);

  private final String basePath;
  private final ClassLoader classLoader;
  private final Map<String, PromptTemplate> cache = new ConcurrentHashMap<>();

  public ClasspathPromptRepository(String basePath) {
    this(basePath, ClasspathPromptRepository.class.getClassLoader());
  }

  public ClasspathPromptRepository(String basePath, ClassLoader classLoader) {
    this.basePath = normalize(Objects.requireNonNull(basePath, "basePath"));
    this.classLoader = Objects.requireNonNull(classLoader, "classLoader");
  }

  /** Repository over the bundled {@code prompts/} directory. */
  public static ClasspathPromptRepository bundled() {
    return DEFAULT;
  }

  public PromptTemplate get(String name) {
    return cache.computeIfAbsent(name, this::load);
  }

  private PromptTemplate load(String name) {
    String resource = basePath + "/" + name + ".yaml";
    try (InputStream is = classLoader.getResourceAsStream(resource)) {
      if (is == null) {
        throw new NotFoundException("Prompt not found on classpath: " + resource);
      }
      JsonNode root =
          JacksonUtility.getYamlMapper()
              .readTree(new String(is.readAllBytes(), StandardCharsets.UTF_8));
      JsonNode arr = root == null ? null : root.get("sections");
      if (arr == null || !arr.isArray() || arr.isEmpty()) {
        throw new PromptException("Prompt YAML must contain a non-empty 'sections' array: " + name);
      }
      List<PromptTemplate.PromptSection> sections = new ArrayList<>();
      for (JsonNode n : arr) {
        String id = n.path("id").asText("");
        String content = n.path("content").asText("");
        if (id.isBlank() || content.isBlank()) {
          throw new PromptException("Every section of prompt '" + name + "' needs id and content");
        }
        sections.add(new PromptTemplate.PromptSection(id, role(name, n), content));
      }
      return new PebblePromptTemplate(name, sections);
    } catch (Exception e) {
      throw ExceptionUtil.rethrowIfUnchecked(
          e, (ex) -> new PromptException("Failed to read prompt file: " + resource, ex));
    }
  }

  private static Message.Role role(String name, JsonNode section) {
    String role = section.path("role").asText("user").toLowerCase(Locale.ROOT);
    return switch (role) {
      case "user" -> Message.Role.USER;
      case "assistant" -> Message.Role.ASSISTANT;
      case "system" -> Message.Role.SYSTEM;
      default -> throw new PromptException("Unknown role '" + role + "' in prompt: " + name);
    };
  }

  private static String normalize(String p) {
    String out = p.trim();
    if (out.startsWith("/")) out = out.substring(1);
    if (out.endsWith("/")) out = out.substring(0, out.length() - 1);
    return out;
  }
}
