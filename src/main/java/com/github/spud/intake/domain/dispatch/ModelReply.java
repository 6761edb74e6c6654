package com.github.spud.intake.domain.dispatch;

import java.util.List;
import lombok.Builder;
import lombok.Value;
import org.springframework.ai.chat.messages.AssistantMessage.ToolCall;

/**
 * Model output for one round: text, tool call requests, or both
 */
@Value
@Builder
public class ModelReply {

  String content;

  @Builder.Default
  List<ToolCall> toolCalls = List.of();

  public boolean hasToolCalls() {
    return toolCalls != null && !toolCalls.isEmpty();
  }
}
