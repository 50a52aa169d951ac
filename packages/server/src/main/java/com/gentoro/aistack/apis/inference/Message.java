package com.gentoro.aistack.apis.inference;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/** One conversation message. */
public record Message(@JsonProperty("role") Role role, @JsonProperty("content") String content) {

  public enum Role {
    @JsonProperty("system")
    SYSTEM,
    @JsonProperty("user")
    USER,
    @JsonProperty("assistant")
    ASSISTANT,
    @JsonProperty("tool")
    TOOL
  }

  public static Message user(String content) {
    return new Message(Role.USER, content);
  }

  public static Message assistant(String content) {
    return new Message(Role.ASSISTANT, content);
  }

  public static Message system(String content) {
    return new Message(Role.SYSTEM, content);
  }

  public static Message lastOf(List<Message> messages, Role role) {
    for (int i = messages.size() - 1; i >= 0; i--) {
      if (messages.get(i).role() == role) return messages.get(i);
    }
    return null;
  }
}
