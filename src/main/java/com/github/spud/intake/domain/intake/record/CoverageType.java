package com.github.spud.intake.domain.intake.record;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

public enum CoverageType {
  LIABILITY("liability"),
  FULL("full");

  private final String wire;

  CoverageType(String wire) {
    this.wire = wire;
  }

  @JsonValue
  public String wire() {
    return wire;
  }

  public static Optional<CoverageType> fromWire(String value) {
    if (value == null) {
      return Optional.empty();
    }
    String normalized = value.trim().toLowerCase(Locale.ROOT);
    return Arrays.stream(values()).filter(c -> c.wire.equals(normalized)).findFirst();
  }
}
