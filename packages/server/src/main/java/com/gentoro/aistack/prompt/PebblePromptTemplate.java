package com.gentoro.aistack.prompt;

import com.gentoro.aistack.apis.inference.Message;
import com.gentoro.aistack.exception.PromptException;
import io.pebbletemplates.pebble.PebbleEngine;
import io.pebbletemplates.pebble.template.PebbleTemplate;
import java.io.StringWriter;
import java.io.Writer;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Pebble-backed {@link PromptTemplate}. Sections are compiled once; unknown variables fail the
 * render. Output is plain text, so nothing is escaped.
 */
public class PebblePromptTemplate implements PromptTemplate {
  private static final PebbleEngine ENGINE =
      new PebbleEngine.Builder().strictVariables(true).autoEscaping(false).build();

  private final String id;
  private final List<PromptSection> sections;
  private final List<CompiledSection> compiled;

  private record CompiledSection(PromptSection section, PebbleTemplate template) {}

  public PebblePromptTemplate(String id, List<PromptSection> sections) {
    this.id = Objects.requireNonNull(id, "id");
    this.sections = List.copyOf(Objects.requireNonNull(sections, "sections"));
    List<CompiledSection> out = new ArrayList<>(this.sections.size());
    for (PromptSection s : this.sections) {
      try {
        out.add(new CompiledSection(s, ENGINE.getLiteralTemplate(s.content())));
      } catch (RuntimeException e) {
        throw new PromptException(
            "Failed to compile section '" + s.id() + "' of prompt '" + id + "'", e);
      }
    }
    this.compiled = List.copyOf(out);
  }

  @Override
  public String id() {
    return id;
  }

  @Override
  public List<PromptSection> sections() {
    return sections;
  }

  @Override
  public List<Message> renderMessages(Map<String, Object> vars) {
    Map<String, Object> ctx = vars == null ? Map.of() : vars;
    List<Message> out = new ArrayList<>(compiled.size());
    for (CompiledSection cs : compiled) {
      try {
        Writer writer = new StringWriter();
        cs.template().evaluate(writer, ctx);
        out.add(new Message(cs.section().role(), writer.toString()));
      } catch (Exception e) {
        throw new PromptException(
            "Failed to render section '" + cs.section().id() + "' of prompt '" + id + "'", e);
      }
    }
    return out;
  }

  @Override
  public String renderText(Map<String, Object> vars) {
    return String.join("\n\n", renderMessages(vars).stream().map(Message::content).toList());
  }
}
