package com.gentoro.nanobot.model;

import com.gentoro.nanobot.exception.ExceptionUtil;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import org.apache.commons.configuration2.Configuration;

/**
 * Base {@link LlmClient} with the plumbing every provider shares: model resolution, timing and
 * logging, and conversion of provider failures into error-marked responses.
 *
 * <p>Subclasses implement {@link #runInference(List, List, String)} against a concrete SDK and
 * are free to throw; nothing escapes {@link #chat(List, List, String)}.
 *
 * <p>Recognized keys of the provider sub-configuration:
 *
 * <ul>
 *   <li>{@code model} (string, default provided by the subclass)
 * </ul>
 */
public abstract class AbstractLlmClient implements LlmClient {
  private static final org.slf4j.Logger log =
      com.gentoro.nanobot.logging.LoggingService.getLogger(AbstractLlmClient.class);
  protected final Configuration configuration;

  public AbstractLlmClient(Configuration configuration) {
    this.configuration = Objects.requireNonNull(configuration, "configuration");
  }

  @Override
  public String defaultModel() {
    return configuration.getString("model", fallbackModel());
  }

  /** Model used when neither the caller nor the configuration names one. */
  protected abstract String fallbackModel();

  @Override
  public LlmResponse chat(List<Message> messages, List<ToolDefinition> tools, String model) {
    String effectiveModel = (model == null || model.isBlank()) ? defaultModel() : model;
    List<ToolDefinition> offered =
        Objects.requireNonNullElse(tools, Collections.<ToolDefinition>emptyList());
    log.trace(
        "chat() called with: messages = [{}], tools = [{}], model = [{}]",
        messages.size(),
        offered.stream().map(ToolDefinition::name).collect(Collectors.joining(", ")),
        effectiveModel);
    long start = System.currentTimeMillis();
    try {
      LlmResponse response = runInference(messages, offered, effectiveModel);
      if (response == null) {
        return LlmResponse.error("Error calling LLM: provider returned no response");
      }
      log.debug(
          "[Inference] model {} answered in {} ms (finish: {}, tool calls: {}, tokens: {})",
          effectiveModel,
          System.currentTimeMillis() - start,
          response.finishReason(),
          response.toolCalls().size(),
          response.usage().totalTokens());
      return response;
    } catch (Exception e) {
      log.error("Inference with model {} failed", effectiveModel, e);
      return LlmResponse.error("Error calling LLM: " + ExceptionUtil.describe(e));
    } finally {
      log.trace("chat() took {} ms", System.currentTimeMillis() - start);
    }
  }

  protected abstract LlmResponse runInference(
      List<Message> messages, List<ToolDefinition> tools, String model);
}
