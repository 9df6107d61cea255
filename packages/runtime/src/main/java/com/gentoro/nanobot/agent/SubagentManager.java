package com.gentoro.nanobot.agent;

import com.gentoro.nanobot.bus.InboundMessage;
import com.gentoro.nanobot.bus.MessageBus;
import com.gentoro.nanobot.exception.ExceptionUtil;
import com.gentoro.nanobot.logging.LoggingService;
import com.gentoro.nanobot.metrics.MetricsCollector;
import com.gentoro.nanobot.model.LlmClient;
import com.gentoro.nanobot.tools.MessageTool;
import com.gentoro.nanobot.tools.SpawnTool;
import com.gentoro.nanobot.tools.ToolContext;
import com.gentoro.nanobot.tools.ToolRegistry;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.MDC;

/**
 * Runs background subagents and reports their results back into the originating conversation.
 *
 * <p>A subagent is a fresh reasoning cycle over its task, using the parent's tools minus {@code
 * message} and {@code spawn}, on {@code agent.subagent-model} when one is configured. When it
 * ends, successfully or not, its result is published to the bus as an inbound message on {@link
 * InboundMessage#SYSTEM_CHANNEL} whose chat id is {@code origin_channel:origin_chat_id}. The agent
 * loop routes that message back to the origin.
 */
public class SubagentManager {
  private static final org.slf4j.Logger log =
      com.gentoro.nanobot.logging.LoggingService.getLogger(SubagentManager.class);

  static final String SENDER_ID = "subagent";
  private static final String SUMMARIZE_HINT =
      "Summarize this naturally for the user. Keep it brief (1-2 sentences). Do not mention"
          + " technical details like \"subagent\" or task IDs.";

  private final LlmClient llmClient;
  private final ToolRegistry parentTools;
  private final ContextAssembler contextAssembler;
  private final MessageBus bus;
  private final AgentSettings settings;
  private final MetricsCollector metrics;
  private final ExecutorService executor;
  private final Map<String, CompletableFuture<Void>> running = new ConcurrentHashMap<>();

  public SubagentManager(
      LlmClient llmClient,
      ToolRegistry parentTools,
      ContextAssembler contextAssembler,
      MessageBus bus,
      AgentSettings settings,
      MetricsCollector metrics) {
    this.llmClient = Objects.requireNonNull(llmClient, "llmClient");
    this.parentTools = Objects.requireNonNull(parentTools, "parentTools");
    this.contextAssembler = Objects.requireNonNull(contextAssembler, "contextAssembler");
    this.bus = Objects.requireNonNull(bus, "bus");
    this.settings = Objects.requireNonNull(settings, "settings");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    AtomicInteger threadCounter = new AtomicInteger();
    this.executor =
        Executors.newCachedThreadPool(
            r -> {
              Thread t = new Thread(r, "subagent-" + threadCounter.incrementAndGet());
              t.setDaemon(true);
              return t;
            });
  }

  /**
   * Start a subagent and return immediately.
   *
   * @param label short display name; derived from the task when blank
   * @return acknowledgement text for the invoking cycle
   */
  public String spawn(String task, String label, String originChannel, String originChatId) {
    String taskId = UUID.randomUUID().toString().substring(0, 8);
    String displayLabel =
        (label != null && !label.isBlank())
            ? label
            : (task.length() > 30 ? task.substring(0, 30) + "..." : task);

    CompletableFuture<Void> future =
        CompletableFuture.runAsync(
            () -> runSubagent(taskId, task, displayLabel, originChannel, originChatId), executor);
    running.put(taskId, future);
    future.whenComplete((ignored, error) -> running.remove(taskId));

    log.info("Spawned subagent [{}]: {}", taskId, displayLabel);
    return "Subagent [%s] started (id: %s). I'll notify you when it completes."
        .formatted(displayLabel, taskId);
  }

  /** Interrupt running subagents and stop accepting new ones. */
  public void shutdown() {
    executor.shutdownNow();
    try {
      if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
        log.warn("{} subagent(s) still running after shutdown", running.size());
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }

  private void runSubagent(
      String taskId, String task, String label, String originChannel, String originChatId) {
    String sessionId = "subagent:" + taskId;
    try (MDC.MDCCloseable ignored = LoggingService.sessionContext(sessionId)) {
      log.info("Subagent [{}] starting task: {}", taskId, label);
      Instant startedAt = Instant.now();
      String content;
      boolean ok;
      try {
        ToolRegistry tools = parentTools.copyWithout(MessageTool.NAME, SpawnTool.NAME);
        ReasoningLoop loop =
            new ReasoningLoop(
                llmClient,
                tools,
                settings.effectiveSubagentModel(),
                settings.maxIterations(),
                metrics);
        ReasoningLoop.Outcome outcome =
            loop.run(
                contextAssembler.buildSubagentMessages(task),
                new ToolContext(originChannel, originChatId),
                sessionId,
                state -> {});
        metrics.recordSession(
            outcome.toSummary(sessionId, startedAt, Instant.now(), originChannel, loop.model()));
        ok = !outcome.engineError();
        content =
            (outcome.content() == null || outcome.content().isEmpty())
                ? "Task completed but no final response was generated."
                : outcome.content();
        log.info("Subagent [{}] finished ({})", taskId, ok ? "ok" : "error");
      } catch (Throwable e) {
        ExceptionUtil.rethrowIfFatal(e);
        log.error("Subagent [{}] failed", taskId, e);
        ok = false;
        content = ExceptionUtil.describe(e);
      }
      announce(label, task, content, ok, originChannel, originChatId);
    }
  }

  private void announce(
      String label,
      String task,
      String result,
      boolean ok,
      String originChannel,
      String originChatId) {
    String content =
        ok
            ? "[Subagent '%s' completed successfully]\n\nTask: %s\n\nResult:\n%s\n\n%s"
                .formatted(label, task, result, SUMMARIZE_HINT)
            : "[Subagent '%s' failed]\n\nTask: %s\n\nError: %s\n\n%s"
                .formatted(label, task, result, SUMMARIZE_HINT);
    bus.publishInbound(
        new InboundMessage(
            InboundMessage.SYSTEM_CHANNEL,
            SENDER_ID,
            InboundMessage.sessionKey(originChannel, originChatId),
            content));
    log.debug("Subagent result announced to {}:{}", originChannel, originChatId);
  }
}
