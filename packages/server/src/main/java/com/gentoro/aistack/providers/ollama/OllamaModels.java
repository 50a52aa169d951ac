package com.gentoro.aistack.providers.ollama;

import com.gentoro.aistack.exception.ValidationException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/** Llama model identifiers this stack accepts and the Ollama tags that serve them. */
public final class OllamaModels {
  private OllamaModels() {}

  public static final Map<String, String> SUPPORTED;

  static {
    Map<String, String> m = new LinkedHashMap<>();
    m.put("Llama3.1-8B-Instruct", "llama3.1:8b-instruct-fp16");
    m.put("Llama3.1-70B-Instruct", "llama3.1:70b-instruct-fp16");
    m.put("Llama3.2-1B-Instruct", "llama3.2:1b-instruct-fp16");
    m.put("Llama3.2-3B-Instruct", "llama3.2:3b-instruct-fp16");
    m.put("Llama-Guard-3-8B", "llama-guard3:8b");
    m.put("Llama-Guard-3-1B", "llama-guard3:1b");
    m.put("Llama3.2-11B-Vision-Instruct", "x/llama3.2-vision:11b-instruct-fp16");
    SUPPORTED = Collections.unmodifiableMap(m);
  }

  public static Optional<String> ollamaTag(String identifier) {
    return Optional.ofNullable(identifier == null ? null : SUPPORTED.get(identifier));
  }

  public static String requireOllamaTag(String identifier) {
    return ollamaTag(identifier)
        .orElseThrow(
            () -> new ValidationException("Model " + identifier + " is not supported by Ollama"));
  }
}
