package com.gentoro.nanobot.bus;

import java.util.Objects;

/**
 * A reply on its way from the agent to a channel adapter.
 *
 * @param replyTo optional platform message id this message answers, may be null
 */
public record OutboundMessage(String channel, String chatId, String content, String replyTo) {

  public OutboundMessage {
    Objects.requireNonNull(channel, "channel");
    Objects.requireNonNull(chatId, "chatId");
    content = content == null ? "" : content;
  }

  public OutboundMessage(String channel, String chatId, String content) {
    this(channel, chatId, content, null);
  }
}
