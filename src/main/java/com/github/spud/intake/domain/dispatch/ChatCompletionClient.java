package com.github.spud.intake.domain.dispatch;

import java.util.Collection;
import java.util.List;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.tool.ToolCallback;

/**
 * One model invocation. Tool calls are returned to the caller, never executed by the client.
 */
public interface ChatCompletionClient {

  ModelReply complete(List<Message> history, Collection<ToolCallback> tools);
}
