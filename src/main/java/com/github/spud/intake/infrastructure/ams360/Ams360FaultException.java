package com.github.spud.intake.infrastructure.ams360;

import com.github.spud.intake.domain.common.ExternalCallFailedException;
import java.util.regex.Pattern;

/**
 * SOAP fault returned by the agency management system
 */
public class Ams360FaultException extends ExternalCallFailedException {

  private static final Pattern AUTH_REJECTED = Pattern.compile(
    "ticket|not authenticated|unauthori[sz]ed|session (has )?expired|invalid session",
    Pattern.CASE_INSENSITIVE);

  private final String faultString;

  public Ams360FaultException(String operation, String faultString) {
    super("AMS360 " + operation + " fault: " + faultString);
    this.faultString = faultString;
  }

  public String getFaultString() {
    return faultString;
  }

  /**
   * Whether the fault says the ticket was not accepted
   */
  public boolean isAuthenticationRejected() {
    return faultString != null && AUTH_REJECTED.matcher(faultString).find();
  }
}
