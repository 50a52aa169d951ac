package com.gentoro.aistack.prompt;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.aistack.apis.inference.Message;
import com.gentoro.aistack.exception.PromptException;
import com.gentoro.aistack.exception.StackErrorCode;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class PebblePromptTemplateTest {

  private static PromptTemplate template(String content) {
    return new PebblePromptTemplate(
        "t", List.of(new PromptTemplate.PromptSection("s", Message.Role.USER, content)));
  }

  @Test
  @DisplayName("Undefined variables fail the render")
  void strictVariables() {
    PromptException ex =
        assertThrows(
            PromptException.class, () -> template("Hello {{ name }}").renderText(Map.of()));
    assertEquals(StackErrorCode.PROMPT_ERROR, ex.getCode());
  }

  @Test
  @DisplayName("Values are inserted verbatim, without HTML escaping")
  void noEscaping() {
    assertEquals(
        "say <b>\"hi\"</b> & 'bye'",
        template("say {{ text }}").renderText(Map.of("text", "<b>\"hi\"</b> & 'bye'")));
  }

  @Test
  @DisplayName("Loops drop the line break that follows a tag")
  void loops() {
    PromptTemplate t = template("{% for n in items %}\n{{ n }};\n{% endfor %}\ndone");
    assertEquals("1;\n2;\n3;\ndone", t.renderText(Map.of("items", List.of(1, 2, 3))));
  }

  @Test
  @DisplayName("Invalid template syntax fails when the template is built")
  void syntaxError() {
    assertThrows(PromptException.class, () -> template("{% for x in %}"));
  }

  @Test
  @DisplayName("Sections render in order and join with a blank line")
  void sections() {
    PromptTemplate t =
        new PebblePromptTemplate(
            "pair",
            List.of(
                new PromptTemplate.PromptSection("a", Message.Role.SYSTEM, "one {{ v }}"),
                new PromptTemplate.PromptSection("b", Message.Role.USER, "two {{ v }}")));

    assertEquals("one x\n\ntwo x", t.renderText(Map.of("v", "x")));
    assertEquals(Message.Role.SYSTEM, t.renderMessages(Map.of("v", "x")).get(0).role());
    assertEquals("pair", t.id());
    assertEquals(2, t.sections().size());
  }
}
