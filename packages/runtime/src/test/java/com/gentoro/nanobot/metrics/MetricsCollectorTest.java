package com.gentoro.nanobot.metrics;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class MetricsCollectorTest {

  @TempDir Path dir;

  private static ToolEvent tool(String name, boolean ok) {
    return new ToolEvent(
        "2026-01-01T00:00:00Z", "cli:direct", name, ok, 5, 10, 20, ok ? null : "Error: x", 1);
  }

  @Test
  void writesSnakeCaseJsonLines() throws Exception {
    MetricsCollector collector = new MetricsCollector(dir, true);
    collector.recordToolEvent(tool("read_file", true));

    List<String> lines = Files.readAllLines(dir.resolve(MetricsCollector.TOOL_EVENTS));
    assertEquals(1, lines.size());
    assertTrue(lines.get(0).contains("\"tool_name\":\"read_file\""));
    assertTrue(lines.get(0).contains("\"session_id\":\"cli:direct\""));
  }

  @Test
  void readsBackWithLimitKeepingNewest() {
    MetricsCollector collector = new MetricsCollector(dir, true);
    collector.recordToolEvent(tool("a", true));
    collector.recordToolEvent(tool("b", false));
    collector.recordToolEvent(tool("c", true));

    assertEquals(3, collector.readToolEvents(0).size());
    assertEquals(
        List.of("b", "c"), collector.readToolEvents(2).stream().map(ToolEvent::toolName).toList());
    assertEquals("Error: x", collector.readToolEvents(0).get(1).error());
  }

  @Test
  void disabledCollectorWritesNothing() {
    MetricsCollector collector = new MetricsCollector(dir, false);
    collector.recordLlmEvent(
        new LlmEvent("2026-01-01T00:00:00Z", "s", "m", 1, 1, 2, false, 0, 3, 1, "stop"));
    assertFalse(Files.exists(dir.resolve(MetricsCollector.LLM_EVENTS)));
    assertTrue(collector.readLlmEvents(0).isEmpty());
  }

  @Test
  void malformedLinesAreSkipped() throws Exception {
    MetricsCollector collector = new MetricsCollector(dir, true);
    collector.recordToolEvent(tool("a", true));
    Files.writeString(
        dir.resolve(MetricsCollector.TOOL_EVENTS), "garbage\n", StandardOpenOption.APPEND);
    collector.recordToolEvent(tool("b", true));

    assertEquals(
        List.of("a", "b"), collector.readToolEvents(0).stream().map(ToolEvent::toolName).toList());
  }

  @Test
  void missingDirectoryReadsAsEmpty() {
    MetricsCollector collector = new MetricsCollector(dir.resolve("absent"), true);
    assertTrue(collector.readSessions(0).isEmpty());
  }

  @Test
  void resetDeletesEverythingRecorded() {
    Path metricsDir = dir.resolve("metrics");
    MetricsCollector collector = new MetricsCollector(metricsDir, true);
    collector.recordToolEvent(tool("a", true));

    assertTrue(collector.reset());
    assertFalse(Files.exists(metricsDir));
    assertTrue(collector.readToolEvents(0).isEmpty());
    assertFalse(collector.reset());

    collector.recordToolEvent(tool("b", true));
    assertEquals(1, collector.readToolEvents(0).size());
  }
}
