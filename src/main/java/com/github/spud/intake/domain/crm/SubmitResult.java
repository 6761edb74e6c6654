package com.github.spud.intake.domain.crm;

import java.util.Optional;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Outcome of one lead submission: a lead id, or the reason it failed
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class SubmitResult {

  private final String leadId;

  private final SubmitError error;

  public static SubmitResult ok(String leadId) {
    return new SubmitResult(leadId, null);
  }

  public static SubmitResult failed(SubmitError error) {
    return new SubmitResult(null, error);
  }

  public boolean isOk() {
    return error == null;
  }

  public Optional<SubmitError> error() {
    return Optional.ofNullable(error);
  }

  /**
   * Short status line recorded in the submission envelope
   */
  public String statusLine() {
    return isOk() ? "lead_created:" + leadId : "failed:" + error.getReason();
  }

  @Getter
  @AllArgsConstructor
  public static class SubmitError {

    private final String reason;

    private final Throwable cause;
  }
}
