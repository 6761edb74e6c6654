package com.github.spud.intake.domain.dispatch;

import lombok.Getter;

/**
 * The model kept requesting tools past the round limit of one turn
 */
@Getter
public class ToolLoopExceededException extends RuntimeException {

  private final int maxRounds;

  public ToolLoopExceededException(int maxRounds) {
    super("Model still requested tools after " + maxRounds + " rounds");
    this.maxRounds = maxRounds;
  }
}
