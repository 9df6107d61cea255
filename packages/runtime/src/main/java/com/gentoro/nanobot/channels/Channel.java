package com.gentoro.nanobot.channels;

import com.gentoro.nanobot.bus.MessageBus;
import com.gentoro.nanobot.bus.OutboundMessage;

/**
 * A transport adapter. It turns platform events into inbound bus messages after {@link
 * #start(MessageBus)} and delivers outbound messages addressed to its {@link #name()}.
 */
public interface Channel {

  /** Channel name used as {@link OutboundMessage#channel()} routing key, e.g. "telegram". */
  String name();

  void start(MessageBus bus) throws Exception;

  void stop() throws Exception;

  void send(OutboundMessage message) throws Exception;
}
