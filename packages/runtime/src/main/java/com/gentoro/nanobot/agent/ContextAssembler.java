package com.gentoro.nanobot.agent;

import com.gentoro.nanobot.model.LlmClient;
import com.gentoro.nanobot.session.Turn;
import java.util.List;

/** Builds the initial message set handed to the reasoning engine. */
public interface ContextAssembler {

  /**
   * Messages for a conversation cycle: the system prompt, prior turns, then the current input.
   *
   * @param history prior turns of the session, oldest first
   * @param media references attached to the current message, may be empty
   */
  List<LlmClient.Message> buildMessages(
      List<Turn> history, String content, List<String> media, String channel, String chatId);

  /** Messages for a background subagent working on {@code task}. */
  List<LlmClient.Message> buildSubagentMessages(String task);
}
