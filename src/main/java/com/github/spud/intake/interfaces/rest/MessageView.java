package com.github.spud.intake.interfaces.rest;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;
import lombok.Builder;
import lombok.Data;

/**
 * 历史接口返回的单条消息
 */
@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class MessageView {

  private String role;

  private String content;

  // assistant 消息：本轮请求的工具调用
  private List<ToolCallView> toolCalls;

  // tool 消息：对应的工具调用 id
  private String toolCallId;

  private String name;

  @Data
  @Builder
  public static class ToolCallView {

    private String id;
    private String name;
    private String arguments;
  }
}
