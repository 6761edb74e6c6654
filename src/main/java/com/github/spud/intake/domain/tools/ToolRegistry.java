package com.github.spud.intake.domain.tools;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentSkipListMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.ai.tool.definition.DefaultToolDefinition;
import org.springframework.ai.tool.definition.ToolDefinition;
import org.springframework.stereotype.Component;

/**
 * Closed tool catalog. Filled once at startup, read-only afterwards and shared by every thread.
 */
@Slf4j
@Component
public class ToolRegistry {

  /**
   * Tool -> definition, in enum order
   */
  private final Map<IntakeTool, ToolDefinition> definitionMap = new ConcurrentSkipListMap<>();

  /**
   * Tool -> handler
   */
  private final Map<IntakeTool, ToolHandler> handlerMap = new ConcurrentSkipListMap<>();

  public void register(IntakeTool tool, String description, String inputSchema,
    ToolHandler handler) {
    log.info("Registering tool: {}", tool.toolName());
    ToolDefinition definition = DefaultToolDefinition.builder()
      .name(tool.toolName())
      .description(description)
      .inputSchema(inputSchema)
      .build();
    definitionMap.put(tool, definition);
    handlerMap.put(tool, handler);
  }

  public Optional<ToolHandler> getHandler(IntakeTool tool) {
    return Optional.ofNullable(handlerMap.get(tool));
  }

  public Optional<ToolDefinition> getDefinition(IntakeTool tool) {
    return Optional.ofNullable(definitionMap.get(tool));
  }

  /**
   * Callbacks that only expose the schema to the model; {@link ToolDispatcher} runs the tools.
   */
  public List<ToolCallback> getNoOpCallbacks() {
    return definitionMap.values().stream()
      .<ToolCallback>map(NoOpToolCallback::new)
      .toList();
  }

  public int size() {
    return handlerMap.size();
  }

  private static class NoOpToolCallback implements ToolCallback {

    private final ToolDefinition definition;

    NoOpToolCallback(ToolDefinition definition) {
      this.definition = definition;
    }

    @Override
    public ToolDefinition getToolDefinition() {
      return definition;
    }

    @Override
    public String call(String toolInput) {
      // never invoked, tool execution is disabled on the model side
      return "[PENDING_EXECUTION]";
    }
  }
}
