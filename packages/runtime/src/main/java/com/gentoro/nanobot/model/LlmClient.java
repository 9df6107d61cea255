package com.gentoro.nanobot.model;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Primary abstraction for talking to a reasoning engine (a chat-completion service).
 *
 * <p>Implementations encapsulate provider-specific SDKs and expose a single turn: given the
 * conversation so far and the tools on offer, return either final text or tool call requests.
 * Implementations must not throw; transport or provider failures are reported as a response whose
 * {@link LlmResponse#isError()} is true. Concrete providers are selected via {@link
 * LlmClientFactory} and the {@link java.util.ServiceLoader} managed SPI {@link LlmClientProvider}.
 */
public interface LlmClient {

  /**
   * Run one inference turn.
   *
   * @param messages conversation so far, in order
   * @param tools tool definitions the engine may call (may be empty)
   * @param model model identifier; {@code null} selects {@link #defaultModel()}
   */
  LlmResponse chat(List<Message> messages, List<ToolDefinition> tools, String model);

  /** Model used when the caller does not name one. */
  String defaultModel();

  enum Role {
    SYSTEM,
    USER,
    ASSISTANT,
    TOOL
  }

  /** A tool invocation requested by the engine. */
  record ToolCall(String id, String name, Map<String, Object> arguments) {
    public ToolCall {
      Objects.requireNonNull(name, "name");
      arguments = arguments == null ? Map.of() : arguments;
    }
  }

  /**
   * One entry of the conversation sent to the engine. Assistant messages may carry the tool calls
   * they requested; tool messages carry the id and name of the call they answer.
   */
  record Message(
      Role role, String content, List<ToolCall> toolCalls, String toolCallId, String toolName) {

    public Message {
      Objects.requireNonNull(role, "role");
      toolCalls = toolCalls == null ? List.of() : List.copyOf(toolCalls);
    }

    public Message(Role role, String content) {
      this(role, content, List.of(), null, null);
    }

    public static Message system(String content) {
      return new Message(Role.SYSTEM, content);
    }

    public static Message user(String content) {
      return new Message(Role.USER, content);
    }

    public static Message assistant(String content) {
      return new Message(Role.ASSISTANT, content);
    }

    public static Message assistant(String content, List<ToolCall> toolCalls) {
      return new Message(Role.ASSISTANT, content, toolCalls, null, null);
    }

    public static Message toolResult(String toolCallId, String toolName, String result) {
      return new Message(Role.TOOL, result, List.of(), toolCallId, toolName);
    }
  }
}
