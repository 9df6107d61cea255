package com.gentoro.nanobot.tools;

import com.gentoro.nanobot.agent.SubagentManager;
import com.gentoro.nanobot.model.ToolDefinition;
import com.gentoro.nanobot.model.ToolProperty;
import java.util.Map;
import java.util.Objects;

/** Starts a background subagent for a self-contained task and returns its acknowledgement. */
public class SpawnTool implements Tool {
  public static final String NAME = "spawn";

  private static final ToolDefinition DEFINITION =
      ToolDefinition.builder()
          .name(NAME)
          .description(
              "Spawn a subagent to handle a task in the background. The subagent reports back"
                  + " in this conversation when it completes.")
          .parameter(ToolProperty.string("task", "The task for the subagent to complete", true))
          .parameter(
              ToolProperty.string("label", "Optional short label for the task (for display)", false))
          .build();

  private final SubagentManager manager;

  public SpawnTool(SubagentManager manager) {
    this.manager = Objects.requireNonNull(manager, "manager");
  }

  @Override
  public ToolDefinition definition() {
    return DEFINITION;
  }

  @Override
  public String execute(Map<String, Object> arguments, ToolContext context) {
    if (!context.hasDestination()) {
      return "Error: No origin conversation to report back to";
    }
    Object task = arguments.get("task");
    if (task == null || task.toString().isBlank()) {
      return "Error: 'task' is required";
    }
    Object label = arguments.get("label");
    return manager.spawn(
        task.toString(),
        label == null ? null : label.toString(),
        context.channel(),
        context.chatId());
  }
}
