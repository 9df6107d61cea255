package com.gentoro.nanobot.agent;

import com.gentoro.nanobot.model.LlmClient;
import com.gentoro.nanobot.prompt.PromptRepository;
import com.gentoro.nanobot.prompt.PromptTemplate;
import com.gentoro.nanobot.session.Turn;
import java.time.Clock;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * {@link ContextAssembler} rendering system prompts from the {@code agent} and {@code subagent}
 * templates of a {@link PromptRepository}.
 */
public class PromptContextAssembler implements ContextAssembler {
  private static final DateTimeFormatter NOW_FORMAT =
      DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm (EEEE)");

  private final PromptTemplate agentTemplate;
  private final PromptTemplate subagentTemplate;
  private final AgentSettings settings;
  private final Clock clock;

  public PromptContextAssembler(PromptRepository repository, AgentSettings settings) {
    this(repository, settings, Clock.systemDefaultZone());
  }

  public PromptContextAssembler(PromptRepository repository, AgentSettings settings, Clock clock) {
    this.agentTemplate = repository.get("agent");
    this.subagentTemplate = repository.get("subagent");
    this.settings = Objects.requireNonNull(settings, "settings");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  public List<LlmClient.Message> buildMessages(
      List<Turn> history, String content, List<String> media, String channel, String chatId) {
    PromptTemplate.PromptSession session =
        agentTemplate.newSession().enable("identity", commonVariables());
    if (channel != null && chatId != null) {
      session.enable("conversation", Map.of("channel", channel, "chat_id", chatId));
    }

    List<LlmClient.Message> messages = new ArrayList<>();
    messages.add(LlmClient.Message.system(session.renderText()));

    int window = settings.memoryWindow();
    int from = Math.max(0, history.size() - window);
    for (Turn turn : history.subList(from, history.size())) {
      messages.add(
          turn.role() == Turn.Role.USER
              ? LlmClient.Message.user(turn.content())
              : LlmClient.Message.assistant(turn.content()));
    }

    messages.add(LlmClient.Message.user(withMedia(content, media)));
    return messages;
  }

  @Override
  public List<LlmClient.Message> buildSubagentMessages(String task) {
    Map<String, Object> vars = commonVariables();
    vars.put("task", task);
    String system = subagentTemplate.newSession().enable("identity", vars).renderText();
    return List.of(LlmClient.Message.system(system), LlmClient.Message.user(task));
  }

  private Map<String, Object> commonVariables() {
    Map<String, Object> vars = new HashMap<>();
    vars.put("now", ZonedDateTime.now(clock).format(NOW_FORMAT));
    vars.put("timezone", clock.getZone().getId());
    vars.put("workspace", settings.workspace());
    return vars;
  }

  private static String withMedia(String content, List<String> media) {
    if (media == null || media.isEmpty()) return content;
    StringBuilder sb = new StringBuilder(content).append("\n\n[Attached media]");
    media.forEach(ref -> sb.append("\n- ").append(ref));
    return sb.toString();
  }
}
