package com.gentoro.nanobot.agent;

import com.gentoro.nanobot.bus.InboundMessage;
import com.gentoro.nanobot.bus.MessageBus;
import com.gentoro.nanobot.bus.OutboundMessage;
import com.gentoro.nanobot.exception.ExceptionUtil;
import com.gentoro.nanobot.exception.StateException;
import com.gentoro.nanobot.logging.LoggingService;
import com.gentoro.nanobot.metrics.MetricsCollector;
import com.gentoro.nanobot.metrics.SessionSummary;
import com.gentoro.nanobot.model.LlmClient;
import com.gentoro.nanobot.session.Session;
import com.gentoro.nanobot.session.SessionStore;
import com.gentoro.nanobot.tools.MessageTool;
import com.gentoro.nanobot.tools.SpawnTool;
import com.gentoro.nanobot.tools.ToolContext;
import com.gentoro.nanobot.tools.ToolRegistry;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.MDC;

/**
 * The orchestrator. Drains the bus's inbound queue one message at a time and drives each through
 * assembly, the bounded Reasoning/Acting cycle and finalization.
 *
 * <p>Messages on {@link InboundMessage#SYSTEM_CHANNEL} carry their origin conversation encoded in
 * the chat id; they are processed and answered in that origin's session. Any failure escaping a
 * cycle is logged and answered with an apology to the sender, and the loop moves on.
 */
public class AgentLoop {
  private static final org.slf4j.Logger log =
      com.gentoro.nanobot.logging.LoggingService.getLogger(AgentLoop.class);

  public static final String DIRECT_CHANNEL = "cli";
  public static final String DIRECT_CHAT_ID = "direct";
  private static final long POLL_TIMEOUT_MS = 1000;

  /** Where a cycle's reply goes. */
  public record Destination(String channel, String chatId) {
    public String sessionKey() {
      return InboundMessage.sessionKey(channel, chatId);
    }
  }

  private final MessageBus bus;
  private final SessionStore sessions;
  private final ContextAssembler contextAssembler;
  private final ToolRegistry tools;
  private final AgentSettings settings;
  private final MetricsCollector metrics;
  private final ReasoningLoop reasoningLoop;
  private final SubagentManager subagents;
  private final AtomicBoolean running = new AtomicBoolean(false);
  private volatile CycleState state = CycleState.IDLE;

  public AgentLoop(
      MessageBus bus,
      LlmClient llmClient,
      SessionStore sessions,
      ContextAssembler contextAssembler,
      ToolRegistry tools,
      AgentSettings settings,
      MetricsCollector metrics) {
    this.bus = Objects.requireNonNull(bus, "bus");
    this.sessions = Objects.requireNonNull(sessions, "sessions");
    this.contextAssembler = Objects.requireNonNull(contextAssembler, "contextAssembler");
    this.tools = Objects.requireNonNull(tools, "tools");
    this.settings = Objects.requireNonNull(settings, "settings");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.subagents =
        new SubagentManager(llmClient, tools, contextAssembler, bus, settings, metrics);
    tools.register(new MessageTool(bus));
    tools.register(new SpawnTool(subagents));
    this.reasoningLoop =
        new ReasoningLoop(
            llmClient, tools, settings.model(), settings.maxIterations(), metrics);
  }

  /** Consume inbound messages until {@link #stop()} is called or the thread is interrupted. */
  public void run() {
    running.set(true);
    log.info("Agent loop started");
    while (running.get()) {
      InboundMessage message;
      try {
        message = bus.consumeInbound(POLL_TIMEOUT_MS, TimeUnit.MILLISECONDS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        break;
      }
      if (message != null) {
        bus.publishOutbound(handle(message));
      }
    }
    log.info("Agent loop stopped");
  }

  public void stop() {
    running.set(false);
  }

  public CycleState state() {
    return state;
  }

  public ToolRegistry tools() {
    return tools;
  }

  public SubagentManager subagents() {
    return subagents;
  }

  /**
   * Process one message, converting any failure into an apologetic reply. Errors thrown by tools
   * or the engine are answered the same way; only VM-fatal errors escape.
   */
  OutboundMessage handle(InboundMessage message) {
    try {
      return processMessage(message);
    } catch (Throwable e) {
      ExceptionUtil.rethrowIfFatal(e);
      log.error("Error processing message for {}", message.sessionKey(), e);
      Destination destination = destinationOf(message);
      return new OutboundMessage(
          destination.channel(),
          destination.chatId(),
          "Sorry, I encountered an error: " + ExceptionUtil.describe(e));
    }
  }

  /**
   * Run one cycle for {@code message} and build the reply. The session is appended and saved
   * before returning.
   *
   * @throws RuntimeException when the cycle cannot produce an answer
   */
  public OutboundMessage processMessage(InboundMessage message) {
    Destination destination = destinationOf(message);
    String userContent =
        message.isSystem()
            ? "[System: %s] %s".formatted(message.senderId(), message.content())
            : message.content();

    try (MDC.MDCCloseable ignored = LoggingService.sessionContext(destination.sessionKey())) {
      log.info(
          "Processing message from {}:{}{}",
          message.channel(),
          message.senderId(),
          message.isSystem() ? " for " + destination.sessionKey() : "");
      String reply = runCycle(destination, userContent, message.media());
      return new OutboundMessage(destination.channel(), destination.chatId(), reply);
    } finally {
      state = CycleState.IDLE;
    }
  }

  /** Synchronous entry point using the {@code cli:direct} conversation. */
  public String processDirect(String content) {
    return processDirect(content, InboundMessage.sessionKey(DIRECT_CHANNEL, DIRECT_CHAT_ID));
  }

  /** Synchronous entry point for the conversation {@code sessionKey} ({@code channel:chatId}). */
  public String processDirect(String content, String sessionKey) {
    Destination destination = parseSessionKey(sessionKey);
    InboundMessage message =
        new InboundMessage(destination.channel(), "user", destination.chatId(), content);
    return processMessage(message).content();
  }

  /** Stop the consumer loop and the subagents. */
  public void shutdown() {
    stop();
    subagents.shutdown();
  }

  private String runCycle(Destination destination, String userContent, List<String> media) {
    Instant startedAt = Instant.now();
    String sessionKey = destination.sessionKey();
    try {
      transition(CycleState.ASSEMBLING);
      Session session = sessions.getOrCreate(sessionKey);
      List<LlmClient.Message> initial =
          contextAssembler.buildMessages(
              session.turns(), userContent, media, destination.channel(), destination.chatId());

      ReasoningLoop.Outcome outcome =
          reasoningLoop.run(
              initial,
              new ToolContext(destination.channel(), destination.chatId()),
              sessionKey,
              this::transition);

      transition(CycleState.FINALIZING);
      if (outcome.content() == null) {
        throw new StateException("The reasoning engine produced no final answer");
      }
      session.appendExchange(userContent, outcome.content());
      sessions.save(session);
      metrics.recordSession(
          outcome.toSummary(
              sessionKey, startedAt, Instant.now(), destination.channel(), reasoningLoop.model()));
      log.info(
          "Cycle finished after {} iteration(s), {} tool call(s)",
          outcome.iterations(),
          outcome.toolCalls());
      return outcome.content();
    } catch (RuntimeException | Error e) {
      metrics.recordSession(failedSummary(sessionKey, startedAt, destination.channel(), e));
      throw e;
    }
  }

  private void transition(CycleState next) {
    log.trace("Cycle state {} -> {}", state, next);
    state = next;
  }

  private SessionSummary failedSummary(
      String sessionKey, Instant startedAt, String channel, Throwable e) {
    Instant endedAt = Instant.now();
    return new SessionSummary(
        sessionKey,
        startedAt.toString(),
        endedAt.toString(),
        Duration.between(startedAt, endedAt).toMillis(),
        false,
        0,
        0,
        0,
        0,
        0,
        0,
        List.of(),
        ExceptionUtil.describe(e),
        channel,
        reasoningLoop.model());
  }

  /** Reply destination: the sender, or for system messages the origin encoded in the chat id. */
  static Destination destinationOf(InboundMessage message) {
    if (message.isSystem()) {
      return parseSessionKey(message.chatId());
    }
    return new Destination(message.channel(), message.chatId());
  }

  /** Split {@code channel:chatId} at the first colon; a key without one is a cli chat id. */
  static Destination parseSessionKey(String sessionKey) {
    int idx = sessionKey.indexOf(':');
    if (idx < 0) {
      return new Destination(DIRECT_CHANNEL, sessionKey);
    }
    return new Destination(sessionKey.substring(0, idx), sessionKey.substring(idx + 1));
  }
}
