package com.gentoro.aistack.prompt;

import com.gentoro.aistack.apis.inference.Message;
import java.util.List;
import java.util.Map;

/**
 * Immutable prompt definition made of one or more sections, each rendered into one conversation
 * message. All sections of a render share the same variables.
 */
public interface PromptTemplate {
  /** Identifier of this template (e.g., "llama_guard"). */
  String id();

  List<PromptSection> sections();

  /** One message per section, in definition order. */
  List<Message> renderMessages(Map<String, Object> vars);

  /** Section contents joined by blank lines. */
  String renderText(Map<String, Object> vars);

  record PromptSection(String id, Message.Role role, String content) {}
}
