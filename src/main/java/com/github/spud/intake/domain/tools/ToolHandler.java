package com.github.spud.intake.domain.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.spud.intake.domain.conversation.ThreadServices;

/**
 * Runs one tool for one thread. The returned text goes back to the model as the tool result.
 */
@FunctionalInterface
public interface ToolHandler {

  String handle(JsonNode arguments, ThreadServices services);
}
