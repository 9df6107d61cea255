package com.gentoro.nanobot.session;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Objects;

/**
 * One role-tagged entry of a conversation history.
 *
 * @param timestamp ISO-8601 instant the turn was recorded
 */
public record Turn(Role role, String content, String timestamp) {

  public enum Role {
    USER,
    ASSISTANT
  }

  @JsonCreator
  public Turn(
      @JsonProperty("role") Role role,
      @JsonProperty("content") String content,
      @JsonProperty("timestamp") String timestamp) {
    this.role = Objects.requireNonNull(role, "role");
    this.content = content == null ? "" : content;
    this.timestamp = timestamp;
  }
}
