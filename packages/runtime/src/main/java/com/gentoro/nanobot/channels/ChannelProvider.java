package com.gentoro.nanobot.channels;

import org.apache.commons.configuration2.Configuration;

/**
 * SPI for channel adapters, discovered via {@link java.util.ServiceLoader}. Register with {@code
 * META-INF/services/com.gentoro.nanobot.channels.ChannelProvider}.
 */
public interface ChannelProvider {

  /** Stable identifier, also the configuration namespace {@code channels.<id>}. */
  String providerId();

  /** Create the channel from its {@code channels.<id>.*} subset. */
  Channel create(Configuration subConfiguration);
}
