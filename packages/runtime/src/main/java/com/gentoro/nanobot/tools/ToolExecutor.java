package com.gentoro.nanobot.tools;

import java.util.Map;

/** Executable half of a capability. May throw; {@link ToolRegistry} contains the failure. */
@FunctionalInterface
public interface ToolExecutor {
  String execute(Map<String, Object> arguments, ToolContext context) throws Exception;
}
