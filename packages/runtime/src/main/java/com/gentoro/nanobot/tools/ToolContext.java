package com.gentoro.nanobot.tools;

/**
 * Addressing context of the cycle invoking a tool. Tools that talk back to the user or start
 * background work use it as their only destination.
 */
public record ToolContext(String channel, String chatId) {

  public static final ToolContext NONE = new ToolContext(null, null);

  public boolean hasDestination() {
    return channel != null && !channel.isBlank() && chatId != null && !chatId.isBlank();
  }
}
