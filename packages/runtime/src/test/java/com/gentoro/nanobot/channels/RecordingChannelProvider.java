package com.gentoro.nanobot.channels;

import com.gentoro.nanobot.bus.MessageBus;
import com.gentoro.nanobot.bus.OutboundMessage;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import org.apache.commons.configuration2.Configuration;

/** Test provider registered through META-INF/services. */
public class RecordingChannelProvider implements ChannelProvider {

  @Override
  public String providerId() {
    return "recording";
  }

  @Override
  public Channel create(Configuration subConfiguration) {
    return new RecordingChannel(subConfiguration.getString("name", "recording"));
  }

  static class RecordingChannel implements Channel {
    final String name;
    final List<OutboundMessage> sent = new CopyOnWriteArrayList<>();
    volatile boolean started;

    RecordingChannel(String name) {
      this.name = name;
    }

    @Override
    public String name() {
      return name;
    }

    @Override
    public void start(MessageBus bus) {
      started = true;
    }

    @Override
    public void stop() {
      started = false;
    }

    @Override
    public void send(OutboundMessage message) {
      sent.add(message);
    }
  }
}
