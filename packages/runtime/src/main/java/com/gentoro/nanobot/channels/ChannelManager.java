package com.gentoro.nanobot.channels;

import com.gentoro.nanobot.bus.MessageBus;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.ServiceLoader;
import org.apache.commons.configuration2.Configuration;

/** Owns the enabled channels: wires their delivery into the bus and starts and stops them. */
public class ChannelManager {
  private static final org.slf4j.Logger log =
      com.gentoro.nanobot.logging.LoggingService.getLogger(ChannelManager.class);

  /** A discovered channel provider and whether configuration enables it. */
  public record ProviderStatus(String providerId, boolean enabled) {}

  private final List<Channel> channels;

  public ChannelManager(List<Channel> channels) {
    this.channels = List.copyOf(Objects.requireNonNull(channels, "channels"));
  }

  /** Instantiate every discovered provider whose {@code channels.<id>.enabled} is true. */
  public static ChannelManager fromConfiguration(Configuration configuration) {
    List<Channel> enabled = new ArrayList<>();
    for (ChannelProvider provider : ServiceLoader.load(ChannelProvider.class)) {
      String namespace = "channels." + provider.providerId();
      if (configuration.getBoolean(namespace + ".enabled", false)) {
        enabled.add(provider.create(configuration.subset(namespace)));
        log.info("Channel '{}' enabled", provider.providerId());
      } else {
        log.debug("Channel '{}' available but not enabled", provider.providerId());
      }
    }
    return new ChannelManager(enabled);
  }

  /** Every discovered provider, enabled or not, without creating any channel. */
  public static List<ProviderStatus> status(Configuration configuration) {
    List<ProviderStatus> result = new ArrayList<>();
    for (ChannelProvider provider : ServiceLoader.load(ChannelProvider.class)) {
      result.add(
          new ProviderStatus(
              provider.providerId(),
              configuration.getBoolean("channels." + provider.providerId() + ".enabled", false)));
    }
    return result;
  }

  public List<String> enabledChannels() {
    return channels.stream().map(Channel::name).toList();
  }

  /** Subscribe each channel's delivery to the bus, then start it. A failing channel is skipped. */
  public void startAll(MessageBus bus) {
    if (channels.isEmpty()) {
      log.warn("No channels enabled");
    }
    for (Channel channel : channels) {
      bus.subscribeOutbound(channel.name(), channel::send);
      try {
        channel.start(bus);
        log.info("Started channel '{}'", channel.name());
      } catch (Exception e) {
        log.error("Failed to start channel '{}'", channel.name(), e);
      }
    }
  }

  public void stopAll() {
    for (Channel channel : channels) {
      try {
        channel.stop();
        log.info("Stopped channel '{}'", channel.name());
      } catch (Exception e) {
        log.error("Error stopping channel '{}'", channel.name(), e);
      }
    }
  }
}
