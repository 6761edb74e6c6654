package com.github.spud.intake.interfaces.rest;

import java.util.ArrayList;
import java.util.List;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.ToolResponseMessage;
import org.springframework.stereotype.Component;

/**
 * Spring AI 消息 -> 历史视图，一条工具消息含多个结果时按结果逐条展开
 */
@Component
public class MessageViewMapper {

  public List<MessageView> toViews(List<Message> messages) {
    List<MessageView> views = new ArrayList<>(messages.size());
    for (Message message : messages) {
      if (message instanceof ToolResponseMessage toolMsg) {
        for (ToolResponseMessage.ToolResponse response : toolMsg.getResponses()) {
          views.add(MessageView.builder()
            .role(message.getMessageType().getValue())
            .content(response.responseData())
            .toolCallId(response.id())
            .name(response.name())
            .build());
        }
      } else {
        views.add(toView(message));
      }
    }
    return views;
  }

  public MessageView toView(Message message) {
    MessageView.MessageViewBuilder builder = MessageView.builder()
      .role(message.getMessageType().getValue())
      .content(message.getText());

    if (message instanceof AssistantMessage assistantMsg && assistantMsg.hasToolCalls()) {
      List<MessageView.ToolCallView> toolCalls = new ArrayList<>();
      for (AssistantMessage.ToolCall tc : assistantMsg.getToolCalls()) {
        toolCalls.add(MessageView.ToolCallView.builder()
          .id(tc.id())
          .name(tc.name())
          .arguments(tc.arguments())
          .build());
      }
      builder.toolCalls(toolCalls);
    }
    return builder.build();
  }
}
