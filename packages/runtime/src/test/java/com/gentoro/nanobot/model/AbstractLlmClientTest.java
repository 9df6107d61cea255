package com.gentoro.nanobot.model;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Map;
import org.apache.commons.configuration2.BaseConfiguration;
import org.junit.jupiter.api.Test;

class AbstractLlmClientTest {

  static class ScriptedClient extends AbstractLlmClient {
    RuntimeException failure;
    String lastModel;

    ScriptedClient(BaseConfiguration configuration) {
      super(configuration);
    }

    @Override
    protected String fallbackModel() {
      return "fallback";
    }

    @Override
    protected LlmResponse runInference(
        List<LlmClient.Message> messages, List<ToolDefinition> tools, String model) {
      lastModel = model;
      if (failure != null) throw failure;
      return LlmResponse.text("ok");
    }
  }

  @Test
  void providerFailureBecomesErrorResponse() {
    ScriptedClient client = new ScriptedClient(new BaseConfiguration());
    client.failure = new IllegalStateException("connection refused");

    LlmResponse response = client.chat(List.of(LlmClient.Message.user("hi")), List.of(), null);

    assertTrue(response.isError());
    assertEquals(LlmResponse.FINISH_ERROR, response.finishReason());
    assertEquals("Error calling LLM: connection refused", response.content());
    assertFalse(response.hasToolCalls());
  }

  @Test
  void modelResolution() {
    BaseConfiguration cfg = new BaseConfiguration();
    ScriptedClient client = new ScriptedClient(cfg);
    client.chat(List.of(), null, null);
    assertEquals("fallback", client.lastModel);

    cfg.addProperty("model", "configured");
    client.chat(List.of(), null, " ");
    assertEquals("configured", client.lastModel);

    client.chat(List.of(), null, "explicit");
    assertEquals("explicit", client.lastModel);
  }

  @Test
  void undecodableToolArgumentsArePassedRaw() {
    assertEquals(Map.of("path", "/tmp"), OpenAiLlmClient.parseArguments("{\"path\":\"/tmp\"}"));
    assertEquals(Map.of("raw", "not json"), OpenAiLlmClient.parseArguments("not json"));
    assertEquals(Map.of(), OpenAiLlmClient.parseArguments(""));
  }
}
