package com.github.spud.intake.domain.common;

/**
 * A call to the agency management system or the CRM failed at the network or HTTP level
 */
public class ExternalCallFailedException extends RuntimeException {

  public ExternalCallFailedException(String message) {
    super(message);
  }

  public ExternalCallFailedException(String message, Throwable cause) {
    super(message, cause);
  }
}
