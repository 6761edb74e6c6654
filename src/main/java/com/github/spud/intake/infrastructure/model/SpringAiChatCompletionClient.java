package com.github.spud.intake.infrastructure.model;

import com.github.spud.intake.application.config.IntakeProperties;
import com.github.spud.intake.domain.dispatch.ChatCompletionClient;
import com.github.spud.intake.domain.dispatch.ModelReply;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.ai.model.tool.ToolCallingChatOptions;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.stereotype.Component;

/**
 * ChatModel 调用封装 关闭框架内部工具执行，由调用方执行模型返回的工具调用
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SpringAiChatCompletionClient implements ChatCompletionClient {

  private final ChatModel chatModel;

  private final IntakeProperties properties;

  @Override
  public ModelReply complete(List<Message> history, Collection<ToolCallback> tools) {
    ToolCallingChatOptions options = ToolCallingChatOptions.builder()
      .toolCallbacks(new ArrayList<>(tools))
      .internalToolExecutionEnabled(false)
      .temperature(properties.getDispatch().getTemperature())
      .build();

    log.debug("Calling chat model with {} messages and {} tools", history.size(), tools.size());
    ChatResponse response = chatModel.call(new Prompt(new ArrayList<>(history), options));
    if (response == null || response.getResult() == null) {
      throw new IllegalStateException("Chat model returned no result");
    }

    AssistantMessage output = response.getResult().getOutput();
    ModelReply reply = ModelReply.builder()
      .content(output.getText())
      .toolCalls(output.hasToolCalls() ? List.copyOf(output.getToolCalls()) : List.of())
      .build();
    log.debug("Chat model replied: content length={}, tool_calls={}",
      reply.getContent() != null ? reply.getContent().length() : 0, reply.getToolCalls().size());
    return reply;
  }
}
