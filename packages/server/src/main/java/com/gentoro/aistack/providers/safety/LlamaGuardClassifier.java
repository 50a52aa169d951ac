package com.gentoro.aistack.providers.safety;

import com.gentoro.aistack.apis.inference.ChatCompletionRequest;
import com.gentoro.aistack.apis.inference.ChatCompletionResponse;
import com.gentoro.aistack.apis.inference.Inference;
import com.gentoro.aistack.apis.inference.Message;
import com.gentoro.aistack.apis.inference.SamplingParams;
import com.gentoro.aistack.apis.safety.ViolationLevel;
import com.gentoro.aistack.exception.AdapterException;
import com.gentoro.aistack.exception.StackErrorCode;
import com.gentoro.aistack.exception.ValidationException;
import com.gentoro.aistack.prompt.ClasspathPromptRepository;
import com.gentoro.aistack.prompt.PromptTemplate;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Asks a Llama Guard model, through the inference capability, whether the last message of a
 * conversation is safe. The model answers {@code safe}, or {@code unsafe} followed by a line of
 * violated category codes.
 */
public class LlamaGuardClassifier implements ShieldClassifier {
  private static final org.slf4j.Logger log =
      com.gentoro.aistack.logging.LoggingService.getLogger(LlamaGuardClassifier.class);

  public static final String CANNED_RESPONSE =
      "I can't answer that. Can I help with something else?";
  public static final String VIOLATION_TYPE = "violation_type";

  private static final Pattern UNSAFE = Pattern.compile("^unsafe\\s*\\n(.+)$", Pattern.DOTALL);

  static final String PROMPT = "llama_guard";

  private final Inference inference;
  private final String model;
  private final List<SafetyCategory> categories;
  private final PromptTemplate prompt;

  public LlamaGuardClassifier(Inference inference, String model, Set<SafetyCategory> excluded) {
    this.inference = inference;
    this.model = model;
    this.prompt = ClasspathPromptRepository.bundled().get(PROMPT);
    this.categories =
        SafetyCategory.forModel(model).stream().filter(c -> !excluded.contains(c)).toList();
  }

  public String model() {
    return model;
  }

  @Override
  public List<ShieldFinding> classify(List<Message> messages, Map<String, Object> params) {
    if (categories.isEmpty()) {
      return List.of();
    }
    List<Message> conversation =
        messages.stream()
            .filter(m -> m.role() == Message.Role.USER || m.role() == Message.Role.ASSISTANT)
            .toList();
    if (conversation.isEmpty()) {
      throw new ValidationException("Llama Guard needs at least one user or assistant message");
    }

    String rendered = buildPrompt(conversation);
    ChatCompletionResponse response =
        inference.chatCompletion(
            new ChatCompletionRequest(
                model, List.of(Message.user(rendered)), new SamplingParams(0.0, null, 20, null)));
    String verdict = response.completionMessage().content();
    log.debug("Llama Guard {} answered: {}", model, verdict);
    return parse(verdict);
  }

  String buildPrompt(List<Message> conversation) {
    List<Map<String, Object>> categoryVars =
        categories.stream()
            .map(c -> Map.<String, Object>of("code", c.code(), "title", c.title()))
            .toList();
    List<Map<String, Object>> turns =
        conversation.stream()
            .map(
                m ->
                    Map.<String, Object>of(
                        "role", speaker(m), "content", m.content() == null ? "" : m.content()))
            .toList();
    return prompt.renderText(
        Map.of(
            "agent_type", speaker(conversation.get(conversation.size() - 1)),
            "categories", categoryVars,
            "turns", turns));
  }

  private static String speaker(Message message) {
    return message.role() == Message.Role.USER ? "User" : "Agent";
  }

  List<ShieldFinding> parse(String verdict) {
    String text = verdict == null ? "" : verdict.trim();
    if (text.equals("safe")) {
      return List.of();
    }
    Matcher m = UNSAFE.matcher(text);
    if (!m.matches()) {
      throw new AdapterException(
          StackErrorCode.UPSTREAM_ERROR,
          "Unexpected Llama Guard answer: " + text,
          Map.of("model", model, AdapterException.BODY, text));
    }
    Set<String> violated = new LinkedHashSet<>();
    for (String code : m.group(1).trim().split(",")) {
      String c = code.trim();
      if (!c.isEmpty()) violated.add(c);
    }
    List<String> reported = new ArrayList<>();
    for (String code : violated) {
      boolean excluded =
          SafetyCategory.parse(code).map(cat -> !categories.contains(cat)).orElse(false);
      if (!excluded) reported.add(code);
    }
    if (reported.isEmpty()) {
      return List.of();
    }
    return List.of(
        new ShieldFinding(
            ViolationLevel.ERROR,
            CANNED_RESPONSE,
            Map.of(VIOLATION_TYPE, String.join(",", reported))));
  }
}
