package com.gentoro.nanobot.agent;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

import com.gentoro.nanobot.bus.InboundMessage;
import com.gentoro.nanobot.bus.MessageBus;
import com.gentoro.nanobot.bus.OutboundMessage;
import com.gentoro.nanobot.metrics.MetricsCollector;
import com.gentoro.nanobot.model.LlmClient;
import com.gentoro.nanobot.model.LlmResponse;
import com.gentoro.nanobot.model.ToolDefinition;
import com.gentoro.nanobot.prompt.impl.ClasspathPromptRepository;
import com.gentoro.nanobot.session.InMemorySessionStore;
import com.gentoro.nanobot.tools.ToolRegistry;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class SubagentManagerTest {

  MessageBus bus;
  LlmClient llm;
  ToolRegistry tools;
  AgentLoop loop;

  @BeforeEach
  void setUp() {
    bus = new MessageBus();
    llm = mock(LlmClient.class);
    tools = new ToolRegistry();
    tools.register(
        ToolDefinition.builder().name("read_file").description("read").build(), (a, c) -> "");
    loop =
        new AgentLoop(
            bus,
            llm,
            new InMemorySessionStore(),
            new PromptContextAssembler(
                new ClasspathPromptRepository("prompts"), AgentSettings.defaults()),
            tools,
            AgentSettings.defaults(),
            MetricsCollector.disabled());
  }

  @AfterEach
  void tearDown() {
    loop.shutdown();
  }

  @Test
  @DisplayName("a subagent spawned from telegram/42 reports back to telegram/42")
  void resultRoutesToOrigin() throws Exception {
    when(llm.chat(any(), any(), any())).thenReturn(LlmResponse.text("the answer is 7"));

    String ack = loop.subagents().spawn("t", null, "telegram", "42");
    assertTrue(ack.startsWith("Subagent [t] started (id: "));

    InboundMessage announced = bus.consumeInbound(5, TimeUnit.SECONDS);
    assertNotNull(announced);
    assertEquals(InboundMessage.SYSTEM_CHANNEL, announced.channel());
    assertEquals("telegram:42", announced.chatId());
    assertTrue(announced.content().contains("completed successfully"));
    assertTrue(announced.content().contains("the answer is 7"));

    OutboundMessage reply = loop.handle(announced);
    assertEquals("telegram", reply.channel());
    assertEquals("42", reply.chatId());
  }

  @Test
  void subagentDoesNotSeeMessageOrSpawn() throws Exception {
    List<String> offered = new CopyOnWriteArrayList<>();
    when(llm.chat(any(), any(), any()))
        .thenAnswer(
            inv -> {
              List<ToolDefinition> defs = inv.getArgument(1);
              defs.forEach(d -> offered.add(d.name()));
              return LlmResponse.text("ok");
            });

    loop.subagents().spawn("summarize logs", "logs", "cli", "direct");
    assertNotNull(bus.consumeInbound(5, TimeUnit.SECONDS));

    assertEquals(List.of("read_file"), offered);
  }

  @Test
  void subagentRunsOnItsOwnModel() throws Exception {
    List<String> models = new CopyOnWriteArrayList<>();
    when(llm.chat(any(), any(), any()))
        .thenAnswer(
            inv -> {
              models.add(inv.getArgument(2));
              return LlmResponse.text("ok");
            });
    AgentSettings settings = new AgentSettings("main-model", "small-model", 5, 10, null);
    SubagentManager manager =
        new SubagentManager(
            llm,
            tools,
            new PromptContextAssembler(new ClasspathPromptRepository("prompts"), settings),
            bus,
            settings,
            MetricsCollector.disabled());

    manager.spawn("check the feed", null, "cli", "direct");
    assertNotNull(bus.consumeInbound(5, TimeUnit.SECONDS));

    assertEquals(List.of("small-model"), models);
    manager.shutdown();
  }

  @Test
  void failureIsStillAnnounced() throws Exception {
    ContextAssembler failing = mock(ContextAssembler.class);
    when(failing.buildSubagentMessages(any())).thenThrow(new IllegalStateException("no prompt"));
    SubagentManager manager =
        new SubagentManager(
            llm, tools, failing, bus, AgentSettings.defaults(), MetricsCollector.disabled());

    manager.spawn("do it", "job", "slack", "C1");

    InboundMessage announced = bus.consumeInbound(5, TimeUnit.SECONDS);
    assertNotNull(announced);
    assertEquals("slack:C1", announced.chatId());
    assertTrue(announced.content().startsWith("[Subagent 'job' failed]"));
    assertTrue(announced.content().contains("no prompt"));
    manager.shutdown();
  }

  @Test
  void errorIsAnnouncedAsFailure() throws Exception {
    ContextAssembler failing = mock(ContextAssembler.class);
    when(failing.buildSubagentMessages(any())).thenThrow(new AssertionError("bad template"));
    SubagentManager manager =
        new SubagentManager(
            llm, tools, failing, bus, AgentSettings.defaults(), MetricsCollector.disabled());

    manager.spawn("do it", "job", "telegram", "42");

    InboundMessage announced = bus.consumeInbound(5, TimeUnit.SECONDS);
    assertNotNull(announced);
    assertEquals("telegram:42", announced.chatId());
    assertTrue(announced.content().startsWith("[Subagent 'job' failed]"));
    assertTrue(announced.content().contains("bad template"));
    manager.shutdown();
  }

  @Test
  void spawnToolAcknowledgesImmediately() throws Exception {
    when(llm.chat(any(), any(), any())).thenReturn(LlmResponse.text("background result"));

    String ack =
        loop.tools()
            .execute(
                "spawn",
                java.util.Map.of("task", "research the weather in a very long sentence here"),
                new com.gentoro.nanobot.tools.ToolContext("discord", "9"))
            .content();

    assertTrue(ack.contains("research the weather in a very..."));
    assertEquals("discord:9", bus.consumeInbound(5, TimeUnit.SECONDS).chatId());
  }
}
