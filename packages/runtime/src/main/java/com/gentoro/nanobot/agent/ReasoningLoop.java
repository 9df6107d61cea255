package com.gentoro.nanobot.agent;

import com.gentoro.nanobot.metrics.LlmEvent;
import com.gentoro.nanobot.metrics.MetricsCollector;
import com.gentoro.nanobot.metrics.SessionSummary;
import com.gentoro.nanobot.metrics.ToolEvent;
import com.gentoro.nanobot.model.LlmClient;
import com.gentoro.nanobot.model.LlmResponse;
import com.gentoro.nanobot.tools.ToolContext;
import com.gentoro.nanobot.tools.ToolRegistry;
import com.gentoro.nanobot.tools.ToolResult;
import com.gentoro.nanobot.utility.JacksonUtility;
import com.gentoro.nanobot.utility.StringUtility;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Consumer;

/**
 * The bounded Reasoning/Acting cycle shared by foreground and subagent processing.
 *
 * <p>Each iteration makes one engine call. Requested tool calls are executed in the order returned
 * and their results appended to the message set before the next call. The cycle ends when the
 * engine answers without tool calls, returns an error-marked response, or the iteration budget is
 * spent. In the last case the most recent content, possibly empty, is the answer.
 */
public class ReasoningLoop {
  private static final org.slf4j.Logger log =
      com.gentoro.nanobot.logging.LoggingService.getLogger(ReasoningLoop.class);

  private final LlmClient llmClient;
  private final ToolRegistry tools;
  private final String model;
  private final int maxIterations;
  private final MetricsCollector metrics;

  public ReasoningLoop(
      LlmClient llmClient,
      ToolRegistry tools,
      String model,
      int maxIterations,
      MetricsCollector metrics) {
    this.llmClient = Objects.requireNonNull(llmClient, "llmClient");
    this.tools = Objects.requireNonNull(tools, "tools");
    this.model = model;
    this.maxIterations = maxIterations;
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  public String model() {
    return model != null ? model : llmClient.defaultModel();
  }

  /**
   * Run the cycle.
   *
   * @param initialMessages assembled context; not modified
   * @param context destination handed to tools
   * @param sessionId key recorded with every metrics event
   * @param states receives each phase transition
   */
  public Outcome run(
      List<LlmClient.Message> initialMessages,
      ToolContext context,
      String sessionId,
      Consumer<CycleState> states) {
    List<LlmClient.Message> messages = new ArrayList<>(initialMessages);
    Outcome.Builder outcome = new Outcome.Builder();
    String lastContent = null;

    for (int iteration = 1; iteration <= maxIterations; iteration++) {
      states.accept(CycleState.REASONING);
      long start = System.currentTimeMillis();
      LlmResponse response = llmClient.chat(messages, tools.definitions(), model);
      long latency = System.currentTimeMillis() - start;
      outcome.llmCall(iteration, response.usage());
      metrics.recordLlmEvent(
          new LlmEvent(
              Instant.now().toString(),
              sessionId,
              model(),
              response.usage().promptTokens(),
              response.usage().completionTokens(),
              response.usage().totalTokens(),
              response.hasToolCalls(),
              response.toolCalls().size(),
              latency,
              iteration,
              response.finishReason()));

      if (response.content() != null) {
        lastContent = response.content();
      }
      if (response.isError()) {
        log.warn("Engine call failed at iteration {}: {}", iteration, response.content());
        return outcome.engineError(response.content());
      }
      if (!response.hasToolCalls()) {
        return outcome.finished(response.content());
      }

      states.accept(CycleState.ACTING);
      messages.add(LlmClient.Message.assistant(response.content(), response.toolCalls()));
      for (LlmClient.ToolCall call : response.toolCalls()) {
        messages.add(
            LlmClient.Message.toolResult(
                call.id(), call.name(), invoke(call, context, sessionId, iteration, outcome)));
      }
    }

    log.warn(
        "Iteration budget of {} spent with tool calls still pending, returning last content",
        maxIterations);
    return outcome.truncated(lastContent == null ? "" : lastContent);
  }

  private String invoke(
      LlmClient.ToolCall call,
      ToolContext context,
      String sessionId,
      int iteration,
      Outcome.Builder outcome) {
    String arguments = JacksonUtility.toJsonLine(call.arguments());
    log.info("Tool call: {}({})", call.name(), StringUtility.preview(arguments, 200));
    long start = System.currentTimeMillis();
    ToolResult result = tools.execute(call.name(), call.arguments(), context);
    long latency = System.currentTimeMillis() - start;
    boolean success = result.success();
    outcome.toolCall(call.name());
    metrics.recordToolEvent(
        new ToolEvent(
            Instant.now().toString(),
            sessionId,
            call.name(),
            success,
            latency,
            arguments.length(),
            result.content().length(),
            success ? null : StringUtility.preview(result.content(), 500),
            iteration));
    return result.content();
  }

  /**
   * How a cycle ended.
   *
   * @param content final answer; {@code null} when the engine produced none
   * @param truncated the iteration budget ran out with tool calls still requested
   * @param engineError the engine returned an error-marked response
   */
  public record Outcome(
      String content,
      boolean truncated,
      boolean engineError,
      int iterations,
      int toolCalls,
      int llmCalls,
      long promptTokens,
      long completionTokens,
      long totalTokens,
      List<String> toolsUsed) {

    public boolean success() {
      return !truncated && !engineError && content != null && !content.isEmpty();
    }

    public String failureReason() {
      if (engineError) return "engine_error";
      if (truncated) return "max_iterations";
      if (content == null || content.isEmpty()) return "empty_response";
      return null;
    }

    /** Metrics record for this outcome. */
    public SessionSummary toSummary(
        String sessionId, Instant startedAt, Instant endedAt, String channel, String model) {
      return new SessionSummary(
          sessionId,
          startedAt.toString(),
          endedAt.toString(),
          Duration.between(startedAt, endedAt).toMillis(),
          success(),
          iterations,
          toolCalls,
          llmCalls,
          promptTokens,
          completionTokens,
          totalTokens,
          toolsUsed,
          failureReason(),
          channel,
          model);
    }

    static final class Builder {
      private int iterations;
      private int toolCalls;
      private int llmCalls;
      private long promptTokens;
      private long completionTokens;
      private long totalTokens;
      private final Set<String> toolsUsed = new LinkedHashSet<>();

      void llmCall(int iteration, LlmResponse.Usage usage) {
        iterations = iteration;
        llmCalls++;
        promptTokens += usage.promptTokens();
        completionTokens += usage.completionTokens();
        totalTokens += usage.totalTokens();
      }

      void toolCall(String name) {
        toolCalls++;
        toolsUsed.add(name);
      }

      Outcome finished(String content) {
        return build(content, false, false);
      }

      Outcome engineError(String content) {
        return build(content, false, true);
      }

      Outcome truncated(String content) {
        return build(content, true, false);
      }

      private Outcome build(String content, boolean truncated, boolean engineError) {
        return new Outcome(
            content,
            truncated,
            engineError,
            iterations,
            toolCalls,
            llmCalls,
            promptTokens,
            completionTokens,
            totalTokens,
            List.copyOf(toolsUsed));
      }
    }
  }
}
