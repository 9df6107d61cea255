package com.gentoro.nanobot.agent;

import com.gentoro.nanobot.exception.ConfigException;
import org.apache.commons.configuration2.Configuration;

/**
 * Per-instance agent configuration.
 *
 * @param model engine model; {@code null} defers to the client's default
 * @param subagentModel engine model for subagents; {@code null} uses {@code model}
 * @param maxIterations upper bound on reasoning calls per cycle
 * @param memoryWindow number of most recent turns offered to the engine
 * @param workspace working directory advertised to the engine
 */
public record AgentSettings(
    String model, String subagentModel, int maxIterations, int memoryWindow, String workspace) {
  public static final int DEFAULT_MAX_ITERATIONS = 20;
  public static final int DEFAULT_MEMORY_WINDOW = 50;

  public AgentSettings {
    if (maxIterations < 1) {
      throw new ConfigException("agent.max-iterations must be at least 1, got " + maxIterations);
    }
    if (memoryWindow < 0) {
      throw new ConfigException("agent.memory-window must not be negative, got " + memoryWindow);
    }
    subagentModel = (subagentModel == null || subagentModel.isBlank()) ? null : subagentModel;
    workspace = workspace == null ? System.getProperty("user.dir") : workspace;
  }

  public AgentSettings(String model, int maxIterations, int memoryWindow, String workspace) {
    this(model, null, maxIterations, memoryWindow, workspace);
  }

  public static AgentSettings defaults() {
    return new AgentSettings(null, DEFAULT_MAX_ITERATIONS, DEFAULT_MEMORY_WINDOW, null);
  }

  public static AgentSettings fromConfiguration(Configuration configuration) {
    return new AgentSettings(
        configuration.getString("agent.model", null),
        configuration.getString("agent.subagent-model", null),
        configuration.getInt("agent.max-iterations", DEFAULT_MAX_ITERATIONS),
        configuration.getInt("agent.memory-window", DEFAULT_MEMORY_WINDOW),
        configuration.getString("agent.workspace", null));
  }

  /** Model subagents run with. */
  public String effectiveSubagentModel() {
    return subagentModel != null ? subagentModel : model;
  }
}
