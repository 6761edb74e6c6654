package com.github.spud.intake.domain.intake;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

public enum ActionType {
  ADD("add"),
  UPDATE("update");

  private final String wire;

  ActionType(String wire) {
    this.wire = wire;
  }

  @JsonValue
  public String wire() {
    return wire;
  }

  public static Optional<ActionType> fromWire(String value) {
    if (value == null) {
      return Optional.empty();
    }
    String normalized = value.trim().toLowerCase(Locale.ROOT);
    return Arrays.stream(values()).filter(a -> a.wire.equals(normalized)).findFirst();
  }
}
