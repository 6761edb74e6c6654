package com.github.spud.intake.domain.conversation;

import lombok.Getter;

@Getter
public class ThreadNotFoundException extends RuntimeException {

  private final String threadId;

  public ThreadNotFoundException(String threadId) {
    super("Thread " + threadId + " not found");
    this.threadId = threadId;
  }
}
