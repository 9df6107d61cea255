package com.gentoro.nanobot.model;

import org.apache.commons.configuration2.Configuration;

/**
 * Service Provider Interface (SPI) for pluggable reasoning engine providers.
 *
 * <p>Implementations are discovered via {@link java.util.ServiceLoader} and identify themselves
 * with a stable {@code providerId} (e.g. "openai"). To register a provider, add its fully
 * qualified class name to {@code META-INF/services/com.gentoro.nanobot.model.LlmClientProvider}.
 */
public interface LlmClientProvider {

  /** A stable, lowercase identifier for this provider (e.g. "openai"). */
  String providerId();

  /**
   * Creates a configured {@link LlmClient} instance.
   *
   * @param subConfiguration provider-specific configuration subset (e.g. {@code llm.default.*}).
   * @throws IllegalArgumentException when the configuration is invalid.
   */
  LlmClient create(Configuration subConfiguration);
}
