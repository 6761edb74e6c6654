package com.github.spud.intake.domain.intake;

/**
 * Recoverable intake conditions. They reach the model as guidance text, never as exceptions.
 */
public enum IntakeErrorKind {
  INVALID_ACTION_TYPE,
  INVALID_INSURANCE_TYPE,
  VALIDATION_ERROR,
  WRONG_INSURANCE_TYPE,
  NO_ACTION_SET,
  NOTHING_COLLECTED,
  ALREADY_SUBMITTED,
  CRM_SUBMISSION_FAILED;

  public boolean isWorkflowStateError() {
    return this == WRONG_INSURANCE_TYPE || this == NO_ACTION_SET || this == NOTHING_COLLECTED
      || this == ALREADY_SUBMITTED;
  }
}
