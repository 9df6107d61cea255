package com.gentoro.nanobot.model;

import com.openai.client.OpenAIClient;
import com.openai.client.okhttp.OpenAIOkHttpClient;
import java.time.Duration;
import org.apache.commons.configuration2.Configuration;

/**
 * SPI provider for OpenAI and OpenAI-compatible gateways. Recognized keys: {@code apiKey}
 * (required), {@code baseUrl}, {@code timeout-seconds} (default 120), {@code model}.
 */
public final class OpenAiLlmClientProvider implements LlmClientProvider {

  @Override
  public String providerId() {
    return "openai";
  }

  @Override
  public LlmClient create(Configuration subConfiguration) {
    String apiKey = subConfiguration.getString("apiKey");
    if (apiKey == null || apiKey.isBlank()) {
      throw new IllegalArgumentException("Missing llm.<profile>.apiKey in configuration");
    }
    OpenAIOkHttpClient.Builder builder =
        OpenAIOkHttpClient.builder()
            .apiKey(apiKey)
            .timeout(Duration.ofSeconds(subConfiguration.getLong("timeout-seconds", 120L)));
    String baseUrl = subConfiguration.getString("baseUrl");
    if (baseUrl != null && !baseUrl.isBlank()) {
      builder.baseUrl(baseUrl.trim());
    }
    OpenAIClient client = builder.build();
    return new OpenAiLlmClient(client, subConfiguration);
  }
}
