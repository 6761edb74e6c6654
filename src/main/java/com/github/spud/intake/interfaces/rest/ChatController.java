package com.github.spud.intake.interfaces.rest;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.github.spud.intake.domain.conversation.ConversationSessionService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Chat API 对话入口、历史查询与线程删除
 */
@Slf4j
@RestController
@RequiredArgsConstructor
public class ChatController {

  private final ConversationSessionService sessionService;

  private final MessageViewMapper messageViewMapper;

  private final Clock clock;

  /**
   * 处理一轮对话（阻塞调用放到 boundedElastic）
   */
  @PostMapping("/chat")
  public Mono<ResponseEntity<ChatResponse>> chat(@Valid @RequestBody ChatRequest request) {
    return Mono.fromCallable(() -> {
      log.info("Received chat turn for thread {}: {}", request.getThreadId(),
        StringUtils.truncate(request.getQuery(), 100));
      String answer = sessionService.handleTurn(request.getThreadId(), request.getQuery());
      return ResponseEntity.ok(
        new ChatResponse(answer, request.getThreadId(), OffsetDateTime.now(clock)));
    }).subscribeOn(Schedulers.boundedElastic());
  }

  @GetMapping("/thread/{threadId}/history")
  public ResponseEntity<HistoryResponse> history(@PathVariable String threadId) {
    List<MessageView> messages = messageViewMapper.toViews(sessionService.getHistory(threadId));
    return ResponseEntity.ok(new HistoryResponse(threadId, messages.size(), messages));
  }

  @DeleteMapping("/thread/{threadId}")
  public ResponseEntity<Map<String, String>> delete(@PathVariable String threadId) {
    sessionService.deleteThread(threadId);
    log.info("Thread {} deleted", threadId);
    return ResponseEntity.ok(Map.of("message", "Thread " + threadId + " deleted successfully"));
  }

  @GetMapping("/health")
  public ResponseEntity<Map<String, Object>> health() {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("status", "healthy");
    body.put("active_threads", sessionService.activeThreadCount());
    body.put("timestamp", OffsetDateTime.now(clock).toString());
    return ResponseEntity.ok(body);
  }

  @GetMapping("/")
  public ResponseEntity<Map<String, Object>> info() {
    Map<String, String> endpoints = new LinkedHashMap<>();
    endpoints.put("POST /chat", "Send a message and get a response");
    endpoints.put("GET /thread/{thread_id}/history", "Get conversation history");
    endpoints.put("DELETE /thread/{thread_id}", "Delete a conversation thread");
    endpoints.put("GET /health", "Health check");

    Map<String, Object> body = new LinkedHashMap<>();
    body.put("name", "Insurance Chatbot API");
    body.put("version", "1.0.0");
    body.put("description", "Chatbot API with conversation memory for insurance quotes");
    body.put("endpoints", endpoints);
    return ResponseEntity.ok(body);
  }

  // ===== Request/Response DTOs =====

  @Data
  @NoArgsConstructor
  @AllArgsConstructor
  public static class ChatRequest {

    @NotNull
    private String query;

    @NotBlank
    @JsonProperty("thread_id")
    private String threadId;
  }

  @Data
  @AllArgsConstructor
  public static class ChatResponse {

    private String response;

    @JsonProperty("thread_id")
    private String threadId;

    private OffsetDateTime timestamp;
  }

  @Data
  @AllArgsConstructor
  public static class HistoryResponse {

    @JsonProperty("thread_id")
    private String threadId;

    @JsonProperty("message_count")
    private int messageCount;

    private List<MessageView> messages;
  }
}
