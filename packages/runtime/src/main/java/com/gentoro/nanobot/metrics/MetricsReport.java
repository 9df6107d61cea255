package com.gentoro.nanobot.metrics;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.function.ToLongFunction;
import java.util.stream.Collectors;

/** Aggregations over what a {@link MetricsCollector} recorded. Rates are percentages. */
public class MetricsReport {
  private static final int ERROR_PREVIEW = 120;

  private final MetricsCollector collector;
  private final Clock clock;

  public MetricsReport(MetricsCollector collector) {
    this(collector, Clock.systemUTC());
  }

  public MetricsReport(MetricsCollector collector, Clock clock) {
    this.collector = Objects.requireNonNull(collector, "collector");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  public record Summary(
      double periodHours,
      int totalSessions,
      double successRate,
      double avgIterationsPerSession,
      long totalPromptTokens,
      long totalCompletionTokens,
      long totalTokens,
      long avgTokensPerSession,
      long tokensPerSuccess,
      int totalToolCalls,
      double toolSuccessRate,
      int llmCalls) {}

  public record ToolRow(
      String tool,
      int calls,
      double successRate,
      long avgLatencyMs,
      long avgInputSize,
      long avgOutputSize,
      Map<String, Long> topErrors) {}

  public record SessionRow(
      String sessionId,
      String startedAt,
      boolean success,
      int iterations,
      int toolCalls,
      long totalTokens,
      long durationMs,
      String model,
      List<String> toolsUsed,
      String failureReason) {}

  public record ModelRow(
      String model,
      int sessions,
      double successRate,
      long totalTokens,
      long tokensPerSession,
      long tokensPerSuccess) {}

  public Summary summary(double hours) {
    List<SessionSummary> sessions = since(collector.readSessions(0), SessionSummary::startedAt, hours);
    List<LlmEvent> llmEvents = since(collector.readLlmEvents(0), LlmEvent::ts, hours);
    List<ToolEvent> toolEvents = since(collector.readToolEvents(0), ToolEvent::ts, hours);

    int total = sessions.size();
    long successes = sessions.stream().filter(SessionSummary::success).count();
    long totalTokens = sum(sessions, SessionSummary::totalTokens);
    long toolSuccesses = toolEvents.stream().filter(ToolEvent::toolSuccess).count();

    return new Summary(
        hours,
        total,
        percent(successes, total),
        total == 0 ? 0.0 : round1((double) sum(sessions, SessionSummary::totalIterations) / total),
        sum(sessions, SessionSummary::totalPromptTokens),
        sum(sessions, SessionSummary::totalCompletionTokens),
        totalTokens,
        total == 0 ? 0 : totalTokens / total,
        successes == 0 ? 0 : totalTokens / successes,
        toolEvents.size(),
        percent(toolSuccesses, toolEvents.size()),
        llmEvents.size());
  }

  /** Per-tool breakdown, most called first. */
  public List<ToolRow> tools(double hours) {
    Map<String, List<ToolEvent>> byTool =
        since(collector.readToolEvents(0), ToolEvent::ts, hours).stream()
            .collect(
                Collectors.groupingBy(
                    e -> e.toolName() == null ? "?" : e.toolName(),
                    LinkedHashMap::new,
                    Collectors.toList()));

    List<ToolRow> rows = new ArrayList<>();
    byTool.forEach(
        (name, events) -> {
          int calls = events.size();
          long ok = events.stream().filter(ToolEvent::toolSuccess).count();
          rows.add(
              new ToolRow(
                  name,
                  calls,
                  percent(ok, calls),
                  sum(events, ToolEvent::latencyMs) / calls,
                  sum(events, ToolEvent::inputSize) / calls,
                  sum(events, ToolEvent::outputSize) / calls,
                  topErrors(events)));
        });
    rows.sort(Comparator.comparingInt(ToolRow::calls).reversed());
    return rows;
  }

  /** The {@code lastN} most recent sessions, newest first. */
  public List<SessionRow> sessions(int lastN) {
    List<SessionRow> rows = new ArrayList<>();
    for (SessionSummary s : collector.readSessions(lastN)) {
      rows.add(
          new SessionRow(
              s.sessionId(),
              s.startedAt(),
              s.success(),
              s.totalIterations(),
              s.totalToolCalls(),
              s.totalTokens(),
              s.durationMs(),
              s.model(),
              s.toolsUsed(),
              s.failureReason()));
    }
    Collections.reverse(rows);
    return rows;
  }

  /** Token efficiency and success rate per model, ordered by model name. */
  public List<ModelRow> models(double hours) {
    Map<String, List<SessionSummary>> byModel =
        since(collector.readSessions(0), SessionSummary::startedAt, hours).stream()
            .collect(
                Collectors.groupingBy(
                    s -> s.model() == null ? "?" : s.model(), TreeMap::new, Collectors.toList()));

    List<ModelRow> rows = new ArrayList<>();
    byModel.forEach(
        (model, sessions) -> {
          int total = sessions.size();
          long ok = sessions.stream().filter(SessionSummary::success).count();
          long tokens = sum(sessions, SessionSummary::totalTokens);
          rows.add(
              new ModelRow(
                  model,
                  total,
                  percent(ok, total),
                  tokens,
                  tokens / Math.max(total, 1),
                  tokens / Math.max(ok, 1)));
        });
    return rows;
  }

  private static Map<String, Long> topErrors(List<ToolEvent> events) {
    Map<String, Long> counts =
        events.stream()
            .map(ToolEvent::error)
            .filter(e -> e != null && !e.isEmpty())
            .map(e -> e.length() > ERROR_PREVIEW ? e.substring(0, ERROR_PREVIEW) : e)
            .collect(Collectors.groupingBy(Function.identity(), LinkedHashMap::new, Collectors.counting()));
    return counts.entrySet().stream()
        .sorted(Map.Entry.<String, Long>comparingByValue().reversed())
        .limit(3)
        .collect(
            Collectors.toMap(
                Map.Entry::getKey, Map.Entry::getValue, (a, b) -> a, LinkedHashMap::new));
  }

  private <T> List<T> since(List<T> events, Function<T, String> timestamp, double hours) {
    Instant cutoff = clock.instant().minus(Duration.ofSeconds((long) (hours * 3600)));
    return events.stream()
        .filter(
            e -> {
              Instant at = parse(timestamp.apply(e));
              return at != null && !at.isBefore(cutoff);
            })
        .collect(Collectors.toList());
  }

  private static Instant parse(String value) {
    if (value == null || value.isBlank()) return null;
    try {
      return Instant.parse(value);
    } catch (DateTimeParseException e) {
      return null;
    }
  }

  private static <T> long sum(List<T> items, ToLongFunction<T> f) {
    return items.stream().mapToLong(f).sum();
  }

  private static double percent(long part, long whole) {
    return whole == 0 ? 0.0 : round1(part * 100.0 / whole);
  }

  private static double round1(double value) {
    return Math.round(value * 10.0) / 10.0;
  }
}
