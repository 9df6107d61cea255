package com.gentoro.nanobot.metrics;

import com.gentoro.nanobot.exception.IoException;
import com.gentoro.nanobot.utility.JacksonUtility;
import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;
import org.apache.commons.configuration2.Configuration;

/**
 * Append-only JSONL metrics writer and reader.
 *
 * <ul>
 *   <li>{@code tool_events.jsonl}: one line per tool invocation
 *   <li>{@code llm_events.jsonl}: one line per engine call
 *   <li>{@code sessions.jsonl}: one line per finished cycle
 * </ul>
 *
 * Writes never fail the caller; problems are logged and the event is lost.
 */
public class MetricsCollector {
  private static final org.slf4j.Logger log =
      com.gentoro.nanobot.logging.LoggingService.getLogger(MetricsCollector.class);

  public static final String TOOL_EVENTS = "tool_events.jsonl";
  public static final String LLM_EVENTS = "llm_events.jsonl";
  public static final String SESSIONS = "sessions.jsonl";

  private final Path directory;
  private final boolean enabled;

  public MetricsCollector(Path directory, boolean enabled) {
    this.directory = Objects.requireNonNull(directory, "directory");
    this.enabled = enabled;
  }

  /** A collector that records nothing. */
  public static MetricsCollector disabled() {
    return new MetricsCollector(Path.of("."), false);
  }

  /** Built from the {@code metrics.*} keys; the directory defaults to {@code ~/.nanobot/metrics}. */
  public static MetricsCollector fromConfiguration(Configuration configuration) {
    String dir =
        configuration.getString(
            "metrics.dir", Path.of(System.getProperty("user.home"), ".nanobot", "metrics").toString());
    return new MetricsCollector(Path.of(dir), configuration.getBoolean("metrics.enabled", true));
  }

  public boolean isEnabled() {
    return enabled;
  }

  public Path directory() {
    return directory;
  }

  public void recordToolEvent(ToolEvent event) {
    append(TOOL_EVENTS, event);
  }

  public void recordLlmEvent(LlmEvent event) {
    append(LLM_EVENTS, event);
  }

  public void recordSession(SessionSummary summary) {
    append(SESSIONS, summary);
  }

  /** Recorded tool events, oldest first; {@code limit > 0} keeps only the most recent ones. */
  public List<ToolEvent> readToolEvents(int limit) {
    return read(TOOL_EVENTS, ToolEvent.class, limit);
  }

  public List<LlmEvent> readLlmEvents(int limit) {
    return read(LLM_EVENTS, LlmEvent.class, limit);
  }

  public List<SessionSummary> readSessions(int limit) {
    return read(SESSIONS, SessionSummary.class, limit);
  }

  /**
   * Delete the metrics directory and everything recorded in it.
   *
   * @return {@code false} when there was nothing to delete
   * @throws IoException when the directory cannot be removed
   */
  public synchronized boolean reset() {
    if (!Files.exists(directory)) {
      return false;
    }
    try (Stream<Path> paths = Files.walk(directory)) {
      for (Path path : paths.sorted(Comparator.reverseOrder()).toList()) {
        Files.delete(path);
      }
    } catch (IOException e) {
      throw new IoException("Failed to clear metrics directory " + directory, e);
    }
    log.info("Metrics data cleared from {}", directory);
    return true;
  }

  private synchronized void append(String file, Object event) {
    if (!enabled) return;
    try {
      Files.createDirectories(directory);
      Files.writeString(
          directory.resolve(file),
          JacksonUtility.toJsonLine(event) + "\n",
          StandardCharsets.UTF_8,
          StandardOpenOption.CREATE,
          StandardOpenOption.APPEND);
    } catch (IOException | RuntimeException e) {
      log.warn("Metrics write failed ({}): {}", file, e.getMessage());
    }
  }

  private <T> List<T> read(String file, Class<T> type, int limit) {
    Path path = directory.resolve(file);
    List<T> rows = new ArrayList<>();
    if (!Files.isRegularFile(path)) return rows;
    try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      String line;
      while ((line = reader.readLine()) != null) {
        if (line.isBlank()) continue;
        try {
          rows.add(JacksonUtility.getCompactJsonMapper().readValue(line, type));
        } catch (IOException e) {
          log.warn("Skipping malformed metrics line in {}: {}", file, e.getMessage());
        }
      }
    } catch (IOException e) {
      log.warn("Metrics read failed ({}): {}", file, e.getMessage());
    }
    if (limit > 0 && rows.size() > limit) {
      return new ArrayList<>(rows.subList(rows.size() - limit, rows.size()));
    }
    return rows;
  }
}
