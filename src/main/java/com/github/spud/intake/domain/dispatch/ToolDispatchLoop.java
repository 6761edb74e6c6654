package com.github.spud.intake.domain.dispatch;

import com.github.spud.intake.application.config.IntakeProperties;
import com.github.spud.intake.domain.conversation.ThreadServices;
import com.github.spud.intake.domain.tools.ToolDispatcher;
import com.github.spud.intake.domain.tools.ToolDispatcher.ToolExecutionResult;
import com.github.spud.intake.domain.tools.ToolRegistry;
import java.time.Clock;
import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.AssistantMessage.ToolCall;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.ToolResponseMessage;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Runs one turn: model, tools, model again, until the model answers without tool calls.
 * <p>
 * Each round appends the assistant message carrying the tool calls, then one tool response per
 * call, in the order the model issued them and tagged with the call id. Tool failures become tool
 * results; only the round limit, the turn deadline and model failures end the turn early.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ToolDispatchLoop {

  private final ChatCompletionClient chatCompletionClient;

  private final ToolRegistry toolRegistry;

  private final ToolDispatcher toolDispatcher;

  private final IntakeProperties properties;

  private final Clock clock;

  /**
   * @param messages working history, appended to in place
   * @param deadline instant after which no further model or tool call starts
   * @return the terminal answer, also appended to {@code messages}
   */
  public String run(List<Message> messages, ThreadServices services, Instant deadline) {
    int maxRounds = properties.getDispatch().getMaxRounds();
    List<ToolCallback> tools = toolRegistry.getNoOpCallbacks();

    for (int round = 1; round <= maxRounds; round++) {
      checkDeadline(deadline, services);
      log.debug("Thread {} round {}/{} with {} messages", services.getThreadId(), round,
        maxRounds, messages.size());
      ModelReply reply = chatCompletionClient.complete(messages, tools);
      String content = reply.getContent() != null ? reply.getContent() : "";

      if (!reply.hasToolCalls()) {
        messages.add(new AssistantMessage(content));
        log.info("Thread {} answered after {} round(s)", services.getThreadId(), round);
        return content;
      }

      List<ToolCall> toolCalls = reply.getToolCalls();
      log.info("Thread {} round {}: model requested {}", services.getThreadId(), round,
        toolCalls.stream().map(ToolCall::name).collect(Collectors.joining(", ")));
      messages.add(new AssistantMessage(content, Map.of(), toolCalls));

      for (ToolCall toolCall : toolCalls) {
        checkDeadline(deadline, services);
        ToolExecutionResult result = toolDispatcher.execute(toolCall.name(),
          toolCall.arguments(), services);
        messages.add(new ToolResponseMessage(Collections.singletonList(
          new ToolResponseMessage.ToolResponse(toolCall.id(), toolCall.name(),
            result.getResult()))));
        log.debug("Tool {} (id: {}) -> {}", toolCall.name(), toolCall.id(),
          StringUtils.truncate(result.getResult(), 200));
      }
    }

    log.warn("Thread {} exceeded {} tool rounds", services.getThreadId(), maxRounds);
    throw new ToolLoopExceededException(maxRounds);
  }

  private void checkDeadline(Instant deadline, ThreadServices services) {
    if (deadline != null && !clock.instant().isBefore(deadline)) {
      log.warn("Thread {} turn deadline {} passed", services.getThreadId(), deadline);
      throw new TurnTimeoutException("Turn deadline passed for thread " + services.getThreadId());
    }
  }
}
