package com.gentoro.nanobot.agent;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.nanobot.model.LlmClient;
import com.gentoro.nanobot.prompt.impl.ClasspathPromptRepository;
import com.gentoro.nanobot.session.Turn;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class PromptContextAssemblerTest {

  static final Clock CLOCK = Clock.fixed(Instant.parse("2026-05-04T09:30:00Z"), ZoneOffset.UTC);

  private static PromptContextAssembler assembler(int memoryWindow) {
    return new PromptContextAssembler(
        new ClasspathPromptRepository("prompts"),
        new AgentSettings(null, 20, memoryWindow, "/work"),
        CLOCK);
  }

  @Test
  void systemPromptCarriesTimeWorkspaceAndConversation() {
    List<LlmClient.Message> messages =
        assembler(50).buildMessages(List.of(), "hello", List.of(), "telegram", "42");

    assertEquals(2, messages.size());
    LlmClient.Message system = messages.get(0);
    assertEquals(LlmClient.Role.SYSTEM, system.role());
    assertTrue(system.content().contains("2026-05-04 09:30"));
    assertTrue(system.content().contains("Workspace: /work"));
    assertTrue(system.content().contains("channel telegram, chat 42"));
    assertEquals(LlmClient.Message.user("hello"), messages.get(1));
  }

  @Test
  void historyIsBoundedByMemoryWindow() {
    List<Turn> history = new ArrayList<>();
    for (int i = 0; i < 6; i++) {
      history.add(new Turn(i % 2 == 0 ? Turn.Role.USER : Turn.Role.ASSISTANT, "t" + i, null));
    }

    List<LlmClient.Message> messages =
        assembler(4).buildMessages(history, "now", List.of(), "cli", "direct");

    assertEquals(6, messages.size());
    assertEquals(LlmClient.Message.user("t2"), messages.get(1));
    assertEquals(LlmClient.Message.assistant("t5"), messages.get(4));
    assertEquals("now", messages.get(5).content());
  }

  @Test
  void mediaReferencesFollowTheText() {
    List<LlmClient.Message> messages =
        assembler(50)
            .buildMessages(List.of(), "look", List.of("/tmp/a.png", "/tmp/b.jpg"), "cli", "direct");

    assertEquals("look\n\n[Attached media]\n- /tmp/a.png\n- /tmp/b.jpg", messages.get(1).content());
  }

  @Test
  void subagentPromptContainsTask() {
    List<LlmClient.Message> messages = assembler(50).buildSubagentMessages("count the files");

    assertEquals(2, messages.size());
    assertTrue(messages.get(0).content().contains("Your task: count the files"));
    assertEquals(LlmClient.Message.user("count the files"), messages.get(1));
  }
}
