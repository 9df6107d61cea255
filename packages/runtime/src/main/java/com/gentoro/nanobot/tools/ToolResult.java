package com.gentoro.nanobot.tools;

/**
 * Text returned by a tool invocation together with whether the invocation succeeded. Failed
 * invocations carry a readable error description as their content.
 */
public record ToolResult(String content, boolean success) {

  public ToolResult {
    content = content == null ? "" : content;
  }

  public static ToolResult ok(String content) {
    return new ToolResult(content, true);
  }

  public static ToolResult error(String content) {
    return new ToolResult(content, false);
  }
}
