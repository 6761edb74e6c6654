package com.github.spud.intake.domain.intake;

public enum IntakeEvent {
  /**
   * Action and insurance type chosen
   */
  SELECT_ACTION,

  /**
   * A validated record was stored for the active type
   */
  COLLECT,

  /**
   * The collected record was persisted as a quote request
   */
  SUBMIT
}
