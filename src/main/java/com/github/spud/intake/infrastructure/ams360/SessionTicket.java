package com.github.spud.intake.infrastructure.ams360;

import java.time.Instant;
import lombok.Value;

/**
 * Login ticket with the absolute instant it stops being used
 */
@Value
public class SessionTicket {

  String ticket;

  Instant expiresAt;

  public boolean isExpiredAt(Instant now) {
    return !now.isBefore(expiresAt);
  }
}
