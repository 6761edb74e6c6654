package com.github.spud.intake.domain.common;

/**
 * The legacy backend refused or could not complete a login exchange
 */
public class AuthenticationFailedException extends RuntimeException {

  public AuthenticationFailedException(String message) {
    super(message);
  }

  public AuthenticationFailedException(String message, Throwable cause) {
    super(message, cause);
  }
}
