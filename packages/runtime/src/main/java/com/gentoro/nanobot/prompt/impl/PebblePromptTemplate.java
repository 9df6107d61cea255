package com.gentoro.nanobot.prompt.impl;

import com.gentoro.nanobot.exception.PromptException;
import com.gentoro.nanobot.model.LlmClient;
import com.gentoro.nanobot.prompt.PromptTemplate;
import io.pebbletemplates.pebble.PebbleEngine;
import io.pebbletemplates.pebble.template.PebbleTemplate;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Pebble-based implementation of an immutable PromptTemplate definition. Rendering state is
 * isolated in PromptSession instances. Variables are strict: a section referencing an unbound
 * variable fails to render.
 */
public class PebblePromptTemplate implements PromptTemplate {
  private static final PebbleEngine ENGINE =
      new PebbleEngine.Builder().strictVariables(true).autoEscaping(false).build();

  private final String id;
  private final List<PromptSection> sections;
  private final Map<String, PebbleTemplate> compiled = new LinkedHashMap<>();

  public PebblePromptTemplate(String id, List<PromptSection> sections) {
    this.id = Objects.requireNonNull(id, "id");
    this.sections = List.copyOf(Objects.requireNonNull(sections, "sections"));
    for (PromptSection s : this.sections) {
      compiled.put(s.id(), ENGINE.getLiteralTemplate(s.content()));
    }
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
  public PromptSession newSession() {
    return new Session();
  }

  private class Session implements PromptSession {
    private final Map<String, Map<String, Object>> enabled = new HashMap<>();

    Session() {
      resetToDefaults();
    }

    @Override
    public PromptSession enable(String sectionId, Map<String, Object> vars) {
      if (!compiled.containsKey(sectionId)) {
        throw new PromptException(
            "Unknown section '%s' in template '%s'".formatted(sectionId, id));
      }
      enabled.put(sectionId, vars != null ? new HashMap<>(vars) : new HashMap<>());
      return this;
    }

    @Override
    public PromptSession disable(String... sectionIds) {
      for (String sectionId : sectionIds) {
        enabled.remove(sectionId);
      }
      return this;
    }

    @Override
    public PromptSession resetToDefaults() {
      enabled.clear();
      for (PromptSection s : sections) {
        if (s.enabledByDefault()) {
          enabled.put(s.id(), new HashMap<>());
        }
      }
      return this;
    }

    @Override
    public List<LlmClient.Message> renderMessages() {
      List<LlmClient.Message> out = new ArrayList<>();
      for (PromptSection s : sections) {
        Map<String, Object> vars = enabled.get(s.id());
        if (vars == null) continue;
        try {
          StringWriter writer = new StringWriter();
          compiled.get(s.id()).evaluate(writer, vars);
          out.add(new LlmClient.Message(s.role(), writer.toString().trim()));
        } catch (Exception e) {
          throw new PromptException(
              "Failed to render prompt section '" + s.id() + "' in template '" + id + "'", e);
        }
      }
      return out;
    }

    @Override
    public String renderText() {
      return String.join(
          "\n\n", renderMessages().stream().map(LlmClient.Message::content).toList());
    }
  }
}
