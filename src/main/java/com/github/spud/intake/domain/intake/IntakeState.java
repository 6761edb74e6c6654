package com.github.spud.intake.domain.intake;

/**
 * Intake workflow progress
 * <pre>
 * UNINITIALIZED --(SELECT_ACTION)--> COLLECTING --(COLLECT)--> COLLECTED --(SUBMIT)--> SUBMITTED
 * </pre>
 * SELECT_ACTION is accepted from every state and restarts collection for the new type.
 */
public enum IntakeState {
  UNINITIALIZED,
  COLLECTING,
  COLLECTED,
  SUBMITTED
}
