package com.github.spud.intake.domain.intake;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * The fixed set of lines the intake workflow can collect
 */
public enum InsuranceType {
  HOME("home", "Perfect!"),
  AUTO("auto", "Excellent!"),
  FLOOD("flood", "Perfect!"),
  LIFE("life", "Great!"),
  COMMERCIAL("commercial", "Excellent!");

  private final String wire;

  private final String confirmationLead;

  InsuranceType(String wire, String confirmationLead) {
    this.wire = wire;
    this.confirmationLead = confirmationLead;
  }

  @JsonValue
  public String wire() {
    return wire;
  }

  public String confirmationLead() {
    return confirmationLead;
  }

  public static Optional<InsuranceType> fromWire(String value) {
    if (value == null) {
      return Optional.empty();
    }
    String normalized = value.trim().toLowerCase(Locale.ROOT);
    return Arrays.stream(values()).filter(t -> t.wire.equals(normalized)).findFirst();
  }
}
