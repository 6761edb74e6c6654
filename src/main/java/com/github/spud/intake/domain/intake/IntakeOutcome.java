package com.github.spud.intake.domain.intake;

import java.util.Optional;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Result of an intake operation: the text shown to the model plus the error kind, if any
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class IntakeOutcome {

  private final String message;

  private final IntakeErrorKind errorKind;

  public static IntakeOutcome ok(String message) {
    return new IntakeOutcome(message, null);
  }

  public static IntakeOutcome failure(IntakeErrorKind kind, String message) {
    return new IntakeOutcome(message, kind);
  }

  public boolean isSuccess() {
    return errorKind == null;
  }

  public Optional<IntakeErrorKind> error() {
    return Optional.ofNullable(errorKind);
  }

  @Override
  public String toString() {
    return message;
  }
}
