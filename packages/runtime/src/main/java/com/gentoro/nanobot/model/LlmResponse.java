package com.gentoro.nanobot.model;

import java.util.List;

/**
 * Result of a single {@link LlmClient#chat} turn.
 *
 * @param content text produced by the engine, may be null when it only requested tool calls
 * @param toolCalls tool invocations requested by the engine, in the order returned
 * @param finishReason provider termination reason; {@link #FINISH_ERROR} marks a failed call
 * @param usage token accounting for the call
 */
public record LlmResponse(
    String content, List<LlmClient.ToolCall> toolCalls, String finishReason, Usage usage) {

  public static final String FINISH_STOP = "stop";
  public static final String FINISH_ERROR = "error";

  public LlmResponse {
    toolCalls = toolCalls == null ? List.of() : List.copyOf(toolCalls);
    finishReason = finishReason == null ? FINISH_STOP : finishReason;
    usage = usage == null ? Usage.EMPTY : usage;
  }

  public static LlmResponse text(String content) {
    return new LlmResponse(content, List.of(), FINISH_STOP, Usage.EMPTY);
  }

  public static LlmResponse error(String description) {
    return new LlmResponse(description, List.of(), FINISH_ERROR, Usage.EMPTY);
  }

  public boolean hasToolCalls() {
    return !toolCalls.isEmpty();
  }

  public boolean isError() {
    return FINISH_ERROR.equals(finishReason);
  }

  public record Usage(long promptTokens, long completionTokens, long totalTokens) {
    public static final Usage EMPTY = new Usage(0, 0, 0);
  }
}
