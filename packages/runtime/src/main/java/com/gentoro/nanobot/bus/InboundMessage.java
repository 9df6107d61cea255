package com.gentoro.nanobot.bus;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * A message received from a channel adapter (or synthesized by the subagent manager) on its way to
 * the agent loop.
 *
 * @param channel channel name, e.g. {@code telegram}, {@code cli} or {@link #SYSTEM_CHANNEL}
 * @param senderId platform identifier of the author
 * @param chatId conversation identifier within the channel
 * @param content message text
 * @param media references to attached media (paths or URLs), never null
 * @param receivedAt when the message entered the runtime
 */
public record InboundMessage(
    String channel,
    String senderId,
    String chatId,
    String content,
    List<String> media,
    Instant receivedAt) {

  /** Reserved channel carrying subagent results back into their origin conversation. */
  public static final String SYSTEM_CHANNEL = "system";

  public InboundMessage {
    Objects.requireNonNull(channel, "channel");
    Objects.requireNonNull(chatId, "chatId");
    senderId = senderId == null ? "" : senderId;
    content = content == null ? "" : content;
    media = media == null ? List.of() : List.copyOf(media);
    receivedAt = receivedAt == null ? Instant.now() : receivedAt;
  }

  public InboundMessage(String channel, String senderId, String chatId, String content) {
    this(channel, senderId, chatId, content, List.of(), Instant.now());
  }

  /** Addressing identity used for history and routing: {@code channel:chatId}. */
  public String sessionKey() {
    return sessionKey(channel, chatId);
  }

  public boolean isSystem() {
    return SYSTEM_CHANNEL.equals(channel);
  }

  public static String sessionKey(String channel, String chatId) {
    return channel + ":" + chatId;
  }
}
