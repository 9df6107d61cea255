package com.gentoro.nanobot.model;

import java.util.Objects;
import java.util.ServiceLoader;
import org.apache.commons.configuration2.Configuration;

/**
 * Factory utility to create {@link LlmClient} instances from configuration, resolving the provider
 * through {@link ServiceLoader}.
 */
public final class LlmClientFactory {
  private LlmClientFactory() {}

  /**
   * Creates a client using an indirection key under the {@code llm.*} namespace.
   *
   * <p>Example configuration:
   *
   * <pre>
   *   llm.active-profile = default
   *   llm.default.provider = openai
   *   llm.default.apiKey = sk-...
   * </pre>
   */
  public static LlmClient createProvider(Configuration configuration) {
    String namespace = configuration.getString("llm.active-profile", "default").trim();
    if (namespace.isEmpty() || !configuration.getKeys("llm.%s".formatted(namespace)).hasNext()) {
      throw new IllegalArgumentException("Missing llm.%s configuration".formatted(namespace));
    }
    return create(configuration.subset("llm.%s".formatted(namespace)));
  }

  /**
   * Creates a client from a provider-specific subset configuration. Expected keys include at least
   * {@code provider} and any provider-specific settings (e.g. {@code apiKey}, {@code model}).
   */
  public static LlmClient create(Configuration subConfig) {
    String provider =
        Objects.requireNonNull(subConfig.getString("provider"), "llm.<ns>.provider")
            .trim()
            .toLowerCase();

    for (LlmClientProvider p : ServiceLoader.load(LlmClientProvider.class)) {
      if (provider.equals(p.providerId())) {
        return p.create(subConfig);
      }
    }

    throw new IllegalArgumentException("Unknown llm provider: %s".formatted(provider));
  }
}
