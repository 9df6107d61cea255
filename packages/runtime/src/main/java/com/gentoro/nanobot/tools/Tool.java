package com.gentoro.nanobot.tools;

import com.gentoro.nanobot.model.ToolDefinition;

/**
 * A capability the reasoning engine may invoke: a descriptor shown to the engine plus an
 * execution operation returning text.
 */
public interface Tool extends ToolExecutor {

  ToolDefinition definition();

  default String name() {
    return definition().name();
  }
}
