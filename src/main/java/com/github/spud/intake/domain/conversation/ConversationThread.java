package com.github.spud.intake.domain.conversation;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;
import lombok.Getter;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;

/**
 * One conversation: the system instruction followed by every committed message, plus the
 * thread's services. Turns hold {@link #getLock()} while they run; history reads do not.
 */
public class ConversationThread {

  @Getter
  private final String threadId;

  @Getter
  private final ThreadServices services;

  @Getter
  private final Instant createdAt;

  @Getter
  private final ReentrantLock lock = new ReentrantLock();

  private final List<Message> messages = new CopyOnWriteArrayList<>();

  private volatile Instant lastAccess;

  private volatile boolean detached;

  public ConversationThread(String threadId, String systemPrompt, ThreadServices services,
    Instant now) {
    this.threadId = threadId;
    this.services = services;
    this.createdAt = now;
    this.lastAccess = now;
    this.messages.add(new SystemMessage(systemPrompt));
  }

  /**
   * Immutable copy of the committed history
   */
  public List<Message> messages() {
    return List.copyOf(messages);
  }

  public int messageCount() {
    return messages.size();
  }

  /**
   * Append the messages of one finished turn in a single step
   */
  void commit(Collection<? extends Message> turnMessages) {
    messages.addAll(turnMessages);
  }

  void touch(Instant now) {
    this.lastAccess = now;
  }

  public Instant getLastAccess() {
    return lastAccess;
  }

  /**
   * Removed from the store by delete or eviction. A turn that finds its thread detached starts
   * over on a fresh one.
   */
  public boolean isDetached() {
    return detached;
  }

  void detach() {
    this.detached = true;
  }
}
