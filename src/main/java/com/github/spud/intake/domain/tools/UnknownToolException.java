package com.github.spud.intake.domain.tools;

import lombok.Getter;

@Getter
public class UnknownToolException extends RuntimeException {

  private final String toolName;

  public UnknownToolException(String toolName) {
    super("Unknown function: " + toolName);
    this.toolName = toolName;
  }
}
