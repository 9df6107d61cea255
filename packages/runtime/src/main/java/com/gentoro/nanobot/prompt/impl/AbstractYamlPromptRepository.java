package com.gentoro.nanobot.prompt.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.nanobot.exception.ExceptionUtil;
import com.gentoro.nanobot.exception.NotFoundException;
import com.gentoro.nanobot.exception.PromptException;
import com.gentoro.nanobot.exception.ValidationException;
import com.gentoro.nanobot.model.LlmClient;
import com.gentoro.nanobot.prompt.PromptRepository;
import com.gentoro.nanobot.prompt.PromptTemplate;
import com.gentoro.nanobot.utility.JacksonUtility;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Parses YAML prompt documents of the form:
 *
 * <pre>
 * sections:
 *   - id: identity
 *     role: system
 *     enabled: true
 *     content: |
 *       You are ...
 * </pre>
 *
 * Subclasses only locate the raw document.
 */
public abstract class AbstractYamlPromptRepository implements PromptRepository {

  @Override
  public PromptTemplate get(String name) {
    String id = name.startsWith("/") ? name.substring(1) : name;
    try {
      String yaml = read(id);
      if (yaml == null) {
        throw new NotFoundException("Prompt not found: " + name);
      }
      return new PebblePromptTemplate(id, parseSections(id, yaml));
    } catch (Exception e) {
      throw ExceptionUtil.rethrowIfUnchecked(
          e, ex -> new PromptException("Failed to read prompt file: " + name, ex));
    }
  }

  /** Raw YAML of template {@code id}, or {@code null} when it does not exist. */
  protected abstract String read(String id) throws IOException;

  static List<PromptTemplate.PromptSection> parseSections(String id, String yaml)
      throws IOException {
    JsonNode arr = JacksonUtility.getYamlMapper().readTree(yaml).get("sections");
    if (arr == null || !arr.isArray()) {
      throw new ValidationException("Prompt YAML must contain a 'sections' array: " + id);
    }

    List<PromptTemplate.PromptSection> sections = new ArrayList<>();
    for (JsonNode n : arr) {
      String sectionId = n.path("id").asText("");
      if (sectionId.isBlank()) {
        throw new ValidationException("Missing section id in prompt: " + id);
      }
      LlmClient.Role role =
          switch (n.path("role").asText("system").toLowerCase()) {
            case "system" -> LlmClient.Role.SYSTEM;
            case "user" -> LlmClient.Role.USER;
            case "assistant" -> LlmClient.Role.ASSISTANT;
            default -> throw new ValidationException(
                "Unknown role '%s' in section '%s' of prompt: %s"
                    .formatted(n.path("role").asText(), sectionId, id));
          };
      String content = n.path("content").asText("");
      if (content.isBlank()) {
        throw new ValidationException(
            "Empty content for section '" + sectionId + "' in prompt: " + id);
      }
      sections.add(
          new PromptTemplate.PromptSection(
              role, sectionId, n.path("enabled").asBoolean(false), content));
    }
    return sections;
  }
}
