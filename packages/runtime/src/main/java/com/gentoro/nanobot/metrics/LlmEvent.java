package com.gentoro.nanobot.metrics;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/** One reasoning engine call. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record LlmEvent(
    String ts,
    String sessionId,
    String model,
    long promptTokens,
    long completionTokens,
    long totalTokens,
    boolean hasToolCalls,
    int numToolCalls,
    long latencyMs,
    int iteration,
    String finishReason) {}
