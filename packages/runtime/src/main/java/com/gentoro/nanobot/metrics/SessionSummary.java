package com.gentoro.nanobot.metrics;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

/** Aggregate record written once per finished cycle, foreground or subagent. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SessionSummary(
    String sessionId,
    String startedAt,
    String endedAt,
    long durationMs,
    boolean success,
    int totalIterations,
    int totalToolCalls,
    int totalLlmCalls,
    long totalPromptTokens,
    long totalCompletionTokens,
    long totalTokens,
    List<String> toolsUsed,
    String failureReason,
    String channel,
    String model) {

  public SessionSummary {
    toolsUsed = toolsUsed == null ? List.of() : List.copyOf(toolsUsed);
  }
}
