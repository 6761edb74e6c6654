package com.github.spud.intake.domain.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.spud.intake.domain.conversation.ThreadServices;
import com.github.spud.intake.util.JsonUtils;
import java.time.Instant;
import lombok.Builder;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Runs one tool call for a thread. Failures come back to the model as result text.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ToolDispatcher {

  private final ToolRegistry toolRegistry;

  /**
   * Never throws
   */
  public ToolExecutionResult execute(String toolName, String arguments, ThreadServices services) {
    long startTime = System.currentTimeMillis();

    try {
      IntakeTool tool = IntakeTool.fromName(toolName)
        .orElseThrow(() -> new UnknownToolException(toolName));
      ToolHandler handler = toolRegistry.getHandler(tool)
        .orElseThrow(() -> new UnknownToolException(toolName));

      log.info("Executing tool: {}", toolName);
      log.debug("Tool {} args: {}", toolName, arguments);
      JsonNode args = JsonUtils.readArguments(arguments);
      String result = handler.handle(args, services);

      long duration = System.currentTimeMillis() - startTime;
      log.debug("Tool {} completed in {}ms", toolName, duration);
      return ToolExecutionResult.builder()
        .toolName(toolName)
        .arguments(arguments)
        .result(result != null ? result : "")
        .success(true)
        .durationMs(duration)
        .timestamp(Instant.now())
        .build();

    } catch (UnknownToolException e) {
      log.error("Tool not found: {}", toolName);
      return failure(toolName, arguments, e.getMessage(), e.getMessage(), startTime);

    } catch (Exception e) {
      log.error("Tool execution failed: {} - {}", toolName, e.getMessage(), e);
      return failure(toolName, arguments, "Error executing " + toolName + ": " + e.getMessage(),
        e.getMessage(), startTime);
    }
  }

  private static ToolExecutionResult failure(String toolName, String arguments, String text,
    String error, long startTime) {
    return ToolExecutionResult.builder()
      .toolName(toolName)
      .arguments(arguments)
      .result(text)
      .success(false)
      .error(error)
      .durationMs(System.currentTimeMillis() - startTime)
      .timestamp(Instant.now())
      .build();
  }

  @Data
  @Builder
  public static class ToolExecutionResult {

    private String toolName;
    private String arguments;
    /**
     * Text handed back to the model, for failures too
     */
    private String result;
    private boolean success;
    private String error;
    private long durationMs;
    private Instant timestamp;
  }
}
