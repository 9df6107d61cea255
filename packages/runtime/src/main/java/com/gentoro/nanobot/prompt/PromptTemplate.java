package com.gentoro.nanobot.prompt;

import com.gentoro.nanobot.model.LlmClient;
import java.util.List;
import java.util.Map;

/**
 * Immutable definition of a prompt template composed of named sections. Use {@link PromptSession}
 * to select sections and render.
 */
public interface PromptTemplate {
  /** Identifier of this template (e.g., "agent"). */
  String id();

  List<PromptSection> sections();

  /** Create a new mutable session to enable/disable sections and render. */
  PromptSession newSession();

  /** A single prompt section definition. */
  record PromptSection(LlmClient.Role role, String id, boolean enabledByDefault, String content) {}

  /** Per-render mutable context. Variables are bound per section. */
  interface PromptSession {
    PromptSession enable(String sectionId, Map<String, Object> vars);

    PromptSession disable(String... sectionIds);

    /** Reset the enabled state to the template defaults. */
    PromptSession resetToDefaults();

    List<LlmClient.Message> renderMessages();

    /** Render all enabled sections joined by a blank line. */
    String renderText();
  }
}
