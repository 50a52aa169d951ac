package com.gentoro.aistack.prompt;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.aistack.apis.inference.Message;
import com.gentoro.aistack.exception.NotFoundException;
import com.gentoro.aistack.exception.PromptException;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ClasspathPromptRepositoryTest {

  private final ClasspathPromptRepository repository =
      new ClasspathPromptRepository("/test-prompts/");

  @Test
  @DisplayName("Each section renders into a message with its role, user by default")
  void sectionsBecomeMessages() {
    List<Message> messages =
        repository
            .get("two_turns")
            .renderMessages(Map.of("topic", "tides", "question", "Why two a day?"));

    assertEquals(
        List.of(
            Message.system("You answer questions about tides."), Message.user("Why two a day?")),
        messages);
    assertSame(repository.get("two_turns"), repository.get("two_turns"));
  }

  @Test
  @DisplayName("Missing prompt files fail with NOT_FOUND")
  void missingPrompt() {
    assertThrows(NotFoundException.class, () -> repository.get("absent"));
  }

  @Test
  @DisplayName("Malformed prompt files fail with PROMPT_ERROR")
  void malformedPrompt() {
    assertThrows(PromptException.class, () -> repository.get("bad_role"));
    assertThrows(PromptException.class, () -> repository.get("no_sections"));
  }

  @Test
  @DisplayName("The bundled retrieval block lists chunks in order between its markers")
  void retrievedContext() {
    String text =
        ClasspathPromptRepository.bundled()
            .get("retrieved_context")
            .renderText(
                Map.of(
                    "chunks",
                    List.of(
                        Map.of("document_id", "a", "content", "first"),
                        Map.of("document_id", "b", "content", "x < y & z"))));

    assertEquals(
        "Here are the retrieved documents for relevant context:\n"
            + "=== START-RETRIEVED-CONTEXT ===\n"
            + "id:a; content:first\n"
            + "id:b; content:x < y & z\n"
            + "\n"
            + "=== END-RETRIEVED-CONTEXT ===",
        text);
  }
}
