package com.github.spud.intake.domain.dispatch;

public class TurnTimeoutException extends RuntimeException {

  public TurnTimeoutException(String message) {
    super(message);
  }
}
