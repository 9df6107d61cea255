package com.gentoro.nanobot.model;

import com.gentoro.nanobot.exception.LlmException;
import com.gentoro.nanobot.utility.JacksonUtility;
import com.openai.client.OpenAIClient;
import com.openai.core.JsonValue;
import com.openai.models.FunctionDefinition;
import com.openai.models.FunctionParameters;
import com.openai.models.chat.completions.ChatCompletion;
import com.openai.models.chat.completions.ChatCompletionAssistantMessageParam;
import com.openai.models.chat.completions.ChatCompletionCreateParams;
import com.openai.models.chat.completions.ChatCompletionFunctionTool;
import com.openai.models.chat.completions.ChatCompletionMessageFunctionToolCall;
import com.openai.models.chat.completions.ChatCompletionMessageToolCall;
import com.openai.models.chat.completions.ChatCompletionTool;
import com.openai.models.chat.completions.ChatCompletionToolMessageParam;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.commons.configuration2.Configuration;

/** OpenAI implementation of {@link LlmClient} using openai-java SDK (Chat Completions API). */
public class OpenAiLlmClient extends AbstractLlmClient {
  private static final org.slf4j.Logger log =
      com.gentoro.nanobot.logging.LoggingService.getLogger(OpenAiLlmClient.class);
  private final OpenAIClient openAIClient;

  public OpenAiLlmClient(OpenAIClient openAIClient, Configuration configuration) {
    super(configuration);
    this.openAIClient = openAIClient;
  }

  @Override
  protected String fallbackModel() {
    return "gpt-4.1";
  }

  @Override
  protected LlmResponse runInference(
      List<Message> messages, List<ToolDefinition> tools, String model) {
    ChatCompletionCreateParams.Builder builder = ChatCompletionCreateParams.builder().model(model);

    for (Message message : messages) {
      switch (message.role()) {
        case SYSTEM -> builder.addSystemMessage(nullToEmpty(message.content()));
        case USER -> builder.addUserMessage(nullToEmpty(message.content()));
        case ASSISTANT -> builder.addMessage(toAssistantParam(message));
        case TOOL ->
            builder.addMessage(
                ChatCompletionToolMessageParam.builder()
                    .toolCallId(nullToEmpty(message.toolCallId()))
                    .content(nullToEmpty(message.content()))
                    .build());
      }
    }

    if (!tools.isEmpty()) {
      builder.tools(tools.stream().map(this::convertTool).toList());
    }

    ChatCompletion chatCompletion = openAIClient.chat().completions().create(builder.build());
    if (chatCompletion.choices().isEmpty()) {
      throw new LlmException("OpenAI returned a completion without choices");
    }
    ChatCompletion.Choice choice = chatCompletion.choices().get(0);

    List<LlmClient.ToolCall> toolCalls =
        choice.message().toolCalls().orElse(List.of()).stream()
            .flatMap(call -> call.function().stream())
            .map(
                call ->
                    new LlmClient.ToolCall(
                        call.id(),
                        call.function().name(),
                        parseArguments(call.function().arguments())))
            .toList();

    LlmResponse.Usage usage =
        chatCompletion
            .usage()
            .map(u -> new LlmResponse.Usage(u.promptTokens(), u.completionTokens(), u.totalTokens()))
            .orElse(LlmResponse.Usage.EMPTY);

    return new LlmResponse(
        choice.message().content().orElse(null),
        toolCalls,
        choice.finishReason().toString(),
        usage);
  }

  private ChatCompletionAssistantMessageParam toAssistantParam(Message message) {
    ChatCompletionAssistantMessageParam.Builder builder =
        ChatCompletionAssistantMessageParam.builder();
    if (message.content() != null) {
      builder.content(message.content());
    }
    if (!message.toolCalls().isEmpty()) {
      builder.toolCalls(
          message.toolCalls().stream()
              .map(
                  call ->
                      ChatCompletionMessageToolCall.ofFunction(
                          ChatCompletionMessageFunctionToolCall.builder()
                              .id(nullToEmpty(call.id()))
                              .function(
                                  ChatCompletionMessageFunctionToolCall.Function.builder()
                                      .name(call.name())
                                      .arguments(JacksonUtility.toJsonLine(call.arguments()))
                                      .build())
                              .build()))
              .toList());
    }
    return builder.build();
  }

  /** Decode tool arguments; text that is not a JSON object is handed over as {@code raw}. */
  static Map<String, Object> parseArguments(String arguments) {
    try {
      return JacksonUtility.toMap(arguments);
    } catch (RuntimeException e) {
      log.warn("Tool call arguments are not a JSON object, passing them as raw text");
      Map<String, Object> raw = new LinkedHashMap<>();
      raw.put("raw", arguments);
      return raw;
    }
  }

  private ChatCompletionTool convertTool(ToolDefinition def) {
    FunctionParameters.Builder paramsBuilder = FunctionParameters.builder();
    def.schema()
        .toJsonSchema()
        .forEach(
            (key, value) -> {
              if (!"description".equals(key)) {
                paramsBuilder.putAdditionalProperty(key, JsonValue.from(value));
              }
            });

    FunctionDefinition function =
        FunctionDefinition.builder()
            .name(def.name())
            .description(def.description())
            .parameters(paramsBuilder.build())
            .build();
    return ChatCompletionTool.ofFunction(
        ChatCompletionFunctionTool.builder().function(function).build());
  }

  private static String nullToEmpty(String value) {
    return value == null ? "" : value;
  }
}
