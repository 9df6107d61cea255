package com.gentoro.nanobot.bus;

/** Delivery hook a channel registers with {@link MessageBus#subscribeOutbound}. */
@FunctionalInterface
public interface OutboundCallback {
  void deliver(OutboundMessage message) throws Exception;
}
