package com.github.spud.intake.interfaces.rest;

import com.github.spud.intake.domain.dispatch.ChatCompletionClient;
import com.github.spud.intake.domain.dispatch.ModelReply;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.ai.chat.messages.AssistantMessage.ToolCall;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.MessageType;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.AutoConfigureWebTestClient;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.context.annotation.Primary;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.reactive.server.WebTestClient;

/**
 * Chat API 集成测试，模型由脚本代替
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@AutoConfigureWebTestClient
@ActiveProfiles("test")
@Import(ChatControllerTest.ScriptedModelConfig.class)
class ChatControllerTest {

  @Autowired
  private WebTestClient webTestClient;

  @TestConfiguration
  static class ScriptedModelConfig {

    /**
     * "loop" never stops calling tools, "what time" takes one tool round, anything else gets a
     * greeting
     */
    @Bean
    @Primary
    ChatCompletionClient scriptedChatCompletionClient() {
      return (history, tools) -> {
        Message last = history.get(history.size() - 1);
        String userText = lastUserText(history);
        boolean afterTool = last.getMessageType() == MessageType.TOOL;
        if (userText.contains("loop") || userText.contains("what time") && !afterTool) {
          return ModelReply.builder()
            .content("")
            .toolCalls(List.of(new ToolCall("call-1", "function", "get_current_time", "{}")))
            .build();
        }
        if (afterTool) {
          return ModelReply.builder().content("Here you go.").build();
        }
        return ModelReply.builder().content("Hello! How can I help with your insurance?").build();
      };
    }

    private static String lastUserText(List<Message> history) {
      for (int i = history.size() - 1; i >= 0; i--) {
        if (history.get(i).getMessageType() == MessageType.USER) {
          return history.get(i).getText();
        }
      }
      return "";
    }
  }

  private void chat(String threadId, String query) {
    webTestClient.post()
      .uri("/chat")
      .contentType(MediaType.APPLICATION_JSON)
      .bodyValue("{\"query\": \"" + query + "\", \"thread_id\": \"" + threadId + "\"}")
      .exchange()
      .expectStatus().isOk();
  }

  @Test
  void chatReturnsAnswerAndThreadId() {
    webTestClient.post()
      .uri("/chat")
      .contentType(MediaType.APPLICATION_JSON)
      .bodyValue("""
        {"query": "hi there", "thread_id": "web-1"}
        """)
      .exchange()
      .expectStatus().isOk()
      .expectBody()
      .jsonPath("$.response").isEqualTo("Hello! How can I help with your insurance?")
      .jsonPath("$.thread_id").isEqualTo("web-1")
      .jsonPath("$.timestamp").isNotEmpty();
  }

  @Test
  void historyShowsToolRound() {
    chat("web-2", "what time is it?");

    webTestClient.get()
      .uri("/thread/web-2/history")
      .exchange()
      .expectStatus().isOk()
      .expectBody()
      .jsonPath("$.thread_id").isEqualTo("web-2")
      .jsonPath("$.message_count").isEqualTo(5)
      .jsonPath("$.messages[0].role").isEqualTo("system")
      .jsonPath("$.messages[1].role").isEqualTo("user")
      .jsonPath("$.messages[1].content").isEqualTo("what time is it?")
      .jsonPath("$.messages[2].tool_calls[0].name").isEqualTo("get_current_time")
      .jsonPath("$.messages[3].role").isEqualTo("tool")
      .jsonPath("$.messages[3].tool_call_id").isEqualTo("call-1")
      .jsonPath("$.messages[4].role").isEqualTo("assistant");
  }

  @Test
  void unknownThreadHistoryIsNotFound() {
    webTestClient.get()
      .uri("/thread/nobody/history")
      .exchange()
      .expectStatus().isNotFound()
      .expectBody()
      .jsonPath("$.code").isEqualTo("THREAD_NOT_FOUND")
      .jsonPath("$.message").isEqualTo("Thread nobody not found");
  }

  @Test
  void deleteIsIdempotent() {
    chat("web-3", "hello");

    for (int i = 0; i < 2; i++) {
      webTestClient.delete()
        .uri("/thread/web-3")
        .exchange()
        .expectStatus().isOk()
        .expectBody()
        .jsonPath("$.message").isEqualTo("Thread web-3 deleted successfully");
    }
    webTestClient.get()
      .uri("/thread/web-3/history")
      .exchange()
      .expectStatus().isNotFound();
  }

  @Test
  void missingThreadIdIsRejected() {
    webTestClient.post()
      .uri("/chat")
      .contentType(MediaType.APPLICATION_JSON)
      .bodyValue("{\"query\": \"hello\"}")
      .exchange()
      .expectStatus().isBadRequest()
      .expectBody()
      .jsonPath("$.code").isEqualTo("VALIDATION_ERROR")
      .jsonPath("$.details.fieldErrors.threadId").exists();
  }

  @Test
  void runawayToolLoopIsServiceUnavailable() {
    webTestClient.post()
      .uri("/chat")
      .contentType(MediaType.APPLICATION_JSON)
      .bodyValue("{\"query\": \"loop forever\", \"thread_id\": \"web-4\"}")
      .exchange()
      .expectStatus().isEqualTo(503)
      .expectBody()
      .jsonPath("$.code").isEqualTo("TOOL_LOOP_EXCEEDED")
      .jsonPath("$.message").isEqualTo(GlobalExceptionHandler.RETRY_MESSAGE);

    webTestClient.get()
      .uri("/thread/web-4/history")
      .exchange()
      .expectStatus().isOk()
      .expectBody()
      .jsonPath("$.message_count").isEqualTo(3);
  }

  @Test
  void healthAndInfo() {
    webTestClient.get()
      .uri("/health")
      .exchange()
      .expectStatus().isOk()
      .expectBody()
      .jsonPath("$.status").isEqualTo("healthy")
      .jsonPath("$.active_threads").isNumber();

    webTestClient.get()
      .uri("/")
      .exchange()
      .expectStatus().isOk()
      .expectBody()
      .jsonPath("$.name").isEqualTo("Insurance Chatbot API")
      .jsonPath("$.endpoints['POST /chat']").isEqualTo("Send a message and get a response");
  }
}
