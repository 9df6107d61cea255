package com.gentoro.nanobot.tools;

import com.gentoro.nanobot.bus.MessageBus;
import com.gentoro.nanobot.bus.OutboundMessage;
import com.gentoro.nanobot.model.ToolDefinition;
import com.gentoro.nanobot.model.ToolProperty;
import java.util.Map;
import java.util.Objects;

/**
 * Sends an interim message to the conversation being processed without waiting for the cycle to
 * finish. The destination is always the invoking cycle's own channel and chat.
 */
public class MessageTool implements Tool {
  public static final String NAME = "message";

  private static final ToolDefinition DEFINITION =
      ToolDefinition.builder()
          .name(NAME)
          .description(
              "Send a message to the user in the current conversation. Use it for progress"
                  + " updates or when more than one message is needed.")
          .parameter(ToolProperty.string("content", "The message content to send", true))
          .build();

  private final MessageBus bus;

  public MessageTool(MessageBus bus) {
    this.bus = Objects.requireNonNull(bus, "bus");
  }

  @Override
  public ToolDefinition definition() {
    return DEFINITION;
  }

  @Override
  public String execute(Map<String, Object> arguments, ToolContext context) {
    if (!context.hasDestination()) {
      return "Error: No target channel/chat specified";
    }
    Object content = arguments.get("content");
    if (content == null || content.toString().isBlank()) {
      return "Error: 'content' is required";
    }
    bus.publishOutbound(
        new OutboundMessage(context.channel(), context.chatId(), content.toString()));
    return "Message sent to %s:%s".formatted(context.channel(), context.chatId());
  }
}
