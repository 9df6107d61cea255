package com.gentoro.nanobot.model;

import static org.junit.jupiter.api.Assertions.*;

import org.apache.commons.configuration2.BaseConfiguration;
import org.junit.jupiter.api.Test;

class LlmClientFactoryTest {

  @Test
  void createsOpenAiClientForActiveProfile() {
    BaseConfiguration cfg = new BaseConfiguration();
    cfg.addProperty("llm.active-profile", "work");
    cfg.addProperty("llm.work.provider", "OpenAI");
    cfg.addProperty("llm.work.apiKey", "sk-test");
    cfg.addProperty("llm.work.baseUrl", "http://localhost:9999/v1");
    cfg.addProperty("llm.work.model", "gpt-test");

    LlmClient client = LlmClientFactory.createProvider(cfg);

    assertInstanceOf(OpenAiLlmClient.class, client);
    assertEquals("gpt-test", client.defaultModel());
  }

  @Test
  void missingProfileIsRejected() {
    BaseConfiguration cfg = new BaseConfiguration();
    cfg.addProperty("llm.active-profile", "absent");
    cfg.addProperty("llm.default.provider", "openai");
    assertThrows(IllegalArgumentException.class, () -> LlmClientFactory.createProvider(cfg));
  }

  @Test
  void unknownProviderIsRejected() {
    BaseConfiguration cfg = new BaseConfiguration();
    cfg.addProperty("llm.default.provider", "carrier-pigeon");
    assertThrows(IllegalArgumentException.class, () -> LlmClientFactory.createProvider(cfg));
  }

  @Test
  void openAiRequiresApiKey() {
    BaseConfiguration cfg = new BaseConfiguration();
    cfg.addProperty("llm.default.provider", "openai");
    IllegalArgumentException e =
        assertThrows(IllegalArgumentException.class, () -> LlmClientFactory.createProvider(cfg));
    assertTrue(e.getMessage().contains("apiKey"));
  }
}
