package com.gentoro.nanobot.metrics;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * One capability invocation.
 *
 * @param inputSize length of the JSON-encoded arguments
 * @param outputSize length of the textual result
 * @param iteration reasoning iteration (1-based) the call belongs to
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ToolEvent(
    String ts,
    String sessionId,
    String toolName,
    boolean toolSuccess,
    long latencyMs,
    int inputSize,
    int outputSize,
    String error,
    int iteration) {}
