package com.github.spud.intake.domain.intake.record;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

public enum LifePolicyType {
  TERM("term"),
  WHOLE("whole"),
  UNIVERSAL("universal"),
  ANNUITY("annuity"),
  LONG_TERM_CARE("long_term_care");

  private final String wire;

  LifePolicyType(String wire) {
    this.wire = wire;
  }

  @JsonValue
  public String wire() {
    return wire;
  }

  public static Optional<LifePolicyType> fromWire(String value) {
    if (value == null) {
      return Optional.empty();
    }
    String normalized = value.trim().toLowerCase(Locale.ROOT).replace(' ', '_');
    return Arrays.stream(values()).filter(p -> p.wire.equals(normalized)).findFirst();
  }
}
