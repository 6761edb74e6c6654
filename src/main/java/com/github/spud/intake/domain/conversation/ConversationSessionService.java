package com.github.spud.intake.domain.conversation;

import com.github.spud.intake.application.config.IntakeProperties;
import com.github.spud.intake.domain.dispatch.ToolDispatchLoop;
import com.github.spud.intake.domain.dispatch.TurnTimeoutException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.stereotype.Service;
import org.springframework.util.Assert;

/**
 * Conversation entry point. A turn runs under its thread's lock against a working copy of the
 * history; the messages it produced are committed only when the turn completes, so history never
 * holds an unresolved tool call.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ConversationSessionService {

  static final String RETRY_MESSAGE = "I'm sorry, I wasn't able to finish processing that request."
    + " Please try again in a moment.";

  private final ConversationStore store;

  private final ToolDispatchLoop dispatchLoop;

  private final IntakeProperties properties;

  private final Clock clock;

  public String handleTurn(String threadId, String userText) {
    Assert.hasText(threadId, "threadId must not be empty");
    Instant deadline = clock.instant().plus(properties.getDispatch().getTurnTimeout());
    ConversationThread thread = acquire(threadId, deadline);
    try {
      List<Message> working = new ArrayList<>(thread.messages());
      int beforeSize = working.size();
      UserMessage userMessage = new UserMessage(userText != null ? userText : "");
      working.add(userMessage);

      String answer;
      try {
        answer = dispatchLoop.run(working, thread.getServices(), deadline);
      } catch (RuntimeException e) {
        // keep the user's words, close the turn with a plain assistant reply
        thread.commit(List.of(userMessage, new AssistantMessage(RETRY_MESSAGE)));
        log.error("Turn on thread {} failed: {}", threadId, e.getMessage(), e);
        throw e;
      }

      thread.commit(working.subList(beforeSize, working.size()));
      thread.touch(clock.instant());
      log.info("Turn on thread {} completed, {} message(s) in history", threadId,
        thread.messageCount());
      return answer;
    } finally {
      thread.getLock().unlock();
    }
  }

  /**
   * @throws ThreadNotFoundException when no thread has the id
   */
  public List<Message> getHistory(String threadId) {
    return store.find(threadId)
      .map(ConversationThread::messages)
      .orElseThrow(() -> new ThreadNotFoundException(threadId));
  }

  /**
   * Idempotent: deleting an unknown thread is a no-op
   */
  public void deleteThread(String threadId) {
    if (!store.remove(threadId)) {
      log.debug("Delete of unknown thread {} ignored", threadId);
    }
  }

  public int activeThreadCount() {
    return store.size();
  }

  private ConversationThread acquire(String threadId, Instant deadline) {
    while (true) {
      ConversationThread thread = store.getOrCreate(threadId);
      long waitMillis = Duration.between(clock.instant(), deadline).toMillis();
      boolean locked;
      try {
        locked = waitMillis > 0 && thread.getLock().tryLock(waitMillis, TimeUnit.MILLISECONDS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new TurnTimeoutException("Interrupted while waiting for thread " + threadId);
      }
      if (!locked) {
        log.warn("Thread {} stayed busy past the turn deadline", threadId);
        throw new TurnTimeoutException("Timed out waiting for thread " + threadId);
      }
      if (!thread.isDetached()) {
        return thread;
      }
      // deleted or evicted while we waited
      thread.getLock().unlock();
    }
  }
}
