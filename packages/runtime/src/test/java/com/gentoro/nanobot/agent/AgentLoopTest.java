package com.gentoro.nanobot.agent;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

import com.gentoro.nanobot.bus.InboundMessage;
import com.gentoro.nanobot.bus.MessageBus;
import com.gentoro.nanobot.bus.OutboundMessage;
import com.gentoro.nanobot.metrics.MetricsCollector;
import com.gentoro.nanobot.metrics.SessionSummary;
import com.gentoro.nanobot.model.LlmClient;
import com.gentoro.nanobot.model.LlmResponse;
import com.gentoro.nanobot.model.ToolDefinition;
import com.gentoro.nanobot.model.ToolProperty;
import com.gentoro.nanobot.prompt.impl.ClasspathPromptRepository;
import com.gentoro.nanobot.session.FileSessionStore;
import com.gentoro.nanobot.session.InMemorySessionStore;
import com.gentoro.nanobot.session.Session;
import com.gentoro.nanobot.session.Turn;
import com.gentoro.nanobot.tools.ToolRegistry;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class AgentLoopTest {

  MessageBus bus;
  LlmClient llm;
  InMemorySessionStore sessions;
  AgentLoop loop;

  @BeforeEach
  void setUp() {
    bus = new MessageBus();
    llm = mock(LlmClient.class);
    sessions = new InMemorySessionStore();
    loop = newLoop(contextAssembler(), MetricsCollector.disabled());
  }

  @AfterEach
  void tearDown() {
    loop.shutdown();
  }

  private AgentLoop newLoop(ContextAssembler assembler, MetricsCollector metrics) {
    return new AgentLoop(
        bus, llm, sessions, assembler, new ToolRegistry(), AgentSettings.defaults(), metrics);
  }

  private static ContextAssembler contextAssembler() {
    return new PromptContextAssembler(
        new ClasspathPromptRepository("prompts"), AgentSettings.defaults());
  }

  @Test
  @DisplayName("cli/direct '2+2' answered with '4' through the bus, two turns recorded")
  void directScenarioThroughTheBus() throws Exception {
    when(llm.chat(any(), any(), any())).thenReturn(LlmResponse.text("4"));

    Thread consumer = new Thread(loop::run, "agent-loop-test");
    consumer.start();
    bus.publishInbound(new InboundMessage("cli", "user", "direct", "2+2"));

    OutboundMessage reply = bus.consumeOutbound(5, TimeUnit.SECONDS);
    assertNotNull(reply);
    assertEquals("cli", reply.channel());
    assertEquals("direct", reply.chatId());
    assertEquals("4", reply.content());

    loop.stop();
    consumer.join(5000);
    assertFalse(consumer.isAlive());
    assertEquals(CycleState.IDLE, loop.state());

    List<Turn> turns = sessions.getOrCreate("cli:direct").turns();
    assertEquals(2, turns.size());
    assertEquals(new Turn(Turn.Role.USER, "2+2", turns.get(0).timestamp()), turns.get(0));
    assertEquals(Turn.Role.ASSISTANT, turns.get(1).role());
    assertEquals("4", turns.get(1).content());
  }

  @Test
  void finalizingAppendsExactlyOneExchangeAfterPriorHistory() {
    Session session = sessions.getOrCreate("telegram:42");
    session.appendExchange("earlier question", "earlier answer");
    when(llm.chat(any(), any(), any())).thenReturn(LlmResponse.text("second answer"));

    String reply = loop.processDirect("second question", "telegram:42");

    assertEquals("second answer", reply);
    List<Turn> turns = sessions.getOrCreate("telegram:42").turns();
    assertEquals(4, turns.size());
    assertEquals("earlier answer", turns.get(1).content());
    assertEquals(Turn.Role.USER, turns.get(2).role());
    assertEquals("second question", turns.get(2).content());
    assertEquals(Turn.Role.ASSISTANT, turns.get(3).role());
    assertEquals("second answer", turns.get(3).content());
  }

  @Test
  void historyIsOfferedToTheEngine() {
    sessions.getOrCreate("cli:direct").appendExchange("my name is Ada", "hello Ada");
    when(llm.chat(any(), any(), any()))
        .thenAnswer(
            inv -> {
              List<LlmClient.Message> messages = inv.getArgument(0);
              boolean remembers =
                  messages.stream().anyMatch(m -> "my name is Ada".equals(m.content()));
              return LlmResponse.text(remembers ? "Ada" : "unknown");
            });

    assertEquals("Ada", loop.processDirect("what is my name?"));
  }

  @Test
  @DisplayName("system-channel messages are answered in the origin conversation")
  void systemMessageRoutesToOrigin() {
    when(llm.chat(any(), any(), any())).thenReturn(LlmResponse.text("Your report is ready."));

    OutboundMessage reply =
        loop.processMessage(
            new InboundMessage(
                InboundMessage.SYSTEM_CHANNEL, "subagent", "telegram:42", "[Subagent done]"));

    assertEquals("telegram", reply.channel());
    assertEquals("42", reply.chatId());
    List<Turn> turns = sessions.getOrCreate("telegram:42").turns();
    assertEquals("[System: subagent] [Subagent done]", turns.get(0).content());
    assertEquals(0, sessions.getOrCreate("system:telegram:42").size());
  }

  @Test
  void systemMessageWithoutColonFallsBackToCli() {
    assertEquals(
        new AgentLoop.Destination("cli", "abc"),
        AgentLoop.destinationOf(
            new InboundMessage(InboundMessage.SYSTEM_CHANNEL, "subagent", "abc", "x")));
    assertEquals(
        new AgentLoop.Destination("slack", "C1:thread"), AgentLoop.parseSessionKey("slack:C1:thread"));
  }

  @Test
  @DisplayName("a failure escaping the cycle becomes an apologetic reply to the sender")
  void cycleFailureProducesApology() {
    ContextAssembler failing = mock(ContextAssembler.class);
    when(failing.buildMessages(any(), any(), any(), any(), any()))
        .thenThrow(new IllegalStateException("assembly failed"));
    AgentLoop failingLoop = newLoop(failing, MetricsCollector.disabled());

    OutboundMessage reply = failingLoop.handle(new InboundMessage("slack", "u1", "C9", "hello"));

    assertEquals("slack", reply.channel());
    assertEquals("C9", reply.chatId());
    assertEquals("Sorry, I encountered an error: assembly failed", reply.content());
    assertEquals(0, sessions.getOrCreate("slack:C9").size());
    verifyNoInteractions(llm);
    failingLoop.shutdown();
  }

  @Test
  void missingFinalContentIsAnErrorPath() {
    when(llm.chat(any(), any(), any())).thenReturn(new LlmResponse(null, List.of(), "stop", null));

    OutboundMessage reply = loop.handle(new InboundMessage("cli", "user", "direct", "hi"));

    assertTrue(reply.content().startsWith("Sorry, I encountered an error"));
    assertEquals(0, sessions.getOrCreate("cli:direct").size());
  }

  @Test
  void engineErrorBecomesTheAnswer() {
    when(llm.chat(any(), any(), any())).thenReturn(LlmResponse.error("Error calling LLM: timeout"));

    assertEquals("Error calling LLM: timeout", loop.processDirect("hi"));
    verify(llm, times(1)).chat(any(), any(), any());
    assertEquals(2, sessions.getOrCreate("cli:direct").size());
  }

  @Test
  void loopKeepsConsumingAfterAFailedMessage() throws Exception {
    when(llm.chat(any(), any(), any()))
        .thenReturn(new LlmResponse(null, List.of(), "stop", null))
        .thenReturn(LlmResponse.text("fine"));

    Thread consumer = new Thread(loop::run);
    consumer.start();
    bus.publishInbound(new InboundMessage("cli", "user", "direct", "first"));
    bus.publishInbound(new InboundMessage("cli", "user", "direct", "second"));

    OutboundMessage first = bus.consumeOutbound(5, TimeUnit.SECONDS);
    OutboundMessage second = bus.consumeOutbound(5, TimeUnit.SECONDS);
    loop.stop();
    consumer.join(5000);

    assertTrue(first.content().startsWith("Sorry"));
    assertEquals("fine", second.content());
  }

  @Test
  @DisplayName("a tool throwing StackOverflowError is answered and the loop keeps consuming")
  void errorThrownByToolDoesNotStopTheLoop() throws Exception {
    loop.tools()
        .register(
            ToolDefinition.builder()
                .name("recurse")
                .description("walks a structure")
                .parameter(ToolProperty.string("path", "start", false))
                .build(),
            (args, ctx) -> {
              throw new StackOverflowError();
            });
    when(llm.chat(any(), any(), any()))
        .thenReturn(
            new LlmResponse(
                null,
                List.of(new LlmClient.ToolCall("r1", "recurse", Map.of())),
                "tool_calls",
                null))
        .thenAnswer(
            inv -> {
              List<LlmClient.Message> messages = inv.getArgument(0);
              LlmClient.Message last = messages.get(messages.size() - 1);
              return LlmResponse.text(
                  last.role() == LlmClient.Role.TOOL && last.content().startsWith("Error")
                      ? "recovered"
                      : "unexpected");
            })
        .thenReturn(LlmResponse.text("next"));

    Thread consumer = new Thread(loop::run);
    consumer.start();
    bus.publishInbound(new InboundMessage("telegram", "u", "1", "walk it"));
    bus.publishInbound(new InboundMessage("telegram", "u", "1", "and then?"));

    OutboundMessage first = bus.consumeOutbound(5, TimeUnit.SECONDS);
    OutboundMessage second = bus.consumeOutbound(5, TimeUnit.SECONDS);
    loop.stop();
    consumer.join(5000);

    assertEquals("recovered", first.content());
    assertEquals("next", second.content());
  }

  @Test
  void errorEscapingTheCycleBecomesApology() {
    ContextAssembler failing = mock(ContextAssembler.class);
    when(failing.buildMessages(any(), any(), any(), any(), any()))
        .thenThrow(new AssertionError("history out of order"));
    AgentLoop failingLoop = newLoop(failing, MetricsCollector.disabled());

    OutboundMessage reply = failingLoop.handle(new InboundMessage("slack", "u1", "C9", "hello"));

    assertEquals("Sorry, I encountered an error: history out of order", reply.content());
    assertEquals(CycleState.IDLE, failingLoop.state());
    failingLoop.shutdown();
  }

  @Test
  void failedSessionSaveIsNotRemembered(@TempDir Path dir) throws Exception {
    FileSessionStore store = new FileSessionStore(dir);
    Path blocker = dir.resolve("telegram%3A1.json.tmp");
    Files.createDirectories(blocker);
    Files.writeString(blocker.resolve("occupied"), "x");
    AgentLoop filed =
        new AgentLoop(
            bus,
            llm,
            store,
            contextAssembler(),
            new ToolRegistry(),
            AgentSettings.defaults(),
            MetricsCollector.disabled());
    when(llm.chat(any(), any(), any())).thenReturn(LlmResponse.text("saved?"));

    OutboundMessage reply = filed.handle(new InboundMessage("telegram", "u", "1", "remember me"));

    assertTrue(reply.content().startsWith("Sorry, I encountered an error"));
    assertEquals(0, store.getOrCreate("telegram:1").size());
    filed.shutdown();
  }

  @Test
  @DisplayName("the message tool publishes interim output to the current conversation")
  void messageToolSendsInterimOutput() throws Exception {
    when(llm.chat(any(), any(), any()))
        .thenReturn(
            new LlmResponse(
                null,
                List.of(new LlmClient.ToolCall("m1", "message", Map.of("content", "on it"))),
                "tool_calls",
                null))
        .thenReturn(LlmResponse.text("done"));

    OutboundMessage reply =
        loop.processMessage(new InboundMessage("telegram", "u", "7", "do the thing"));

    OutboundMessage interim = bus.consumeOutbound(1, TimeUnit.SECONDS);
    assertEquals(new OutboundMessage("telegram", "7", "on it"), interim);
    assertEquals("done", reply.content());
  }

  @Test
  void registersMessageAndSpawnTools() {
    assertTrue(loop.tools().has("message"));
    assertTrue(loop.tools().has("spawn"));
  }

  @Test
  void recordsSessionSummaries(@TempDir Path dir) {
    MetricsCollector metrics = new MetricsCollector(dir, true);
    AgentLoop measured = newLoop(contextAssembler(), metrics);
    when(llm.chat(any(), any(), any())).thenReturn(LlmResponse.text("ok"));
    when(llm.defaultModel()).thenReturn("gpt-test");

    measured.processDirect("hi", "discord:5");

    List<SessionSummary> summaries = metrics.readSessions(0);
    assertEquals(1, summaries.size());
    assertEquals("discord:5", summaries.get(0).sessionId());
    assertEquals("discord", summaries.get(0).channel());
    assertEquals("gpt-test", summaries.get(0).model());
    assertTrue(summaries.get(0).success());
    measured.shutdown();
  }
}
