package com.github.spud.intake.domain.intake;

/**
 * A tool argument could not be turned into a record field, e.g. an unparseable date
 */
public class InvalidFieldException extends IllegalArgumentException {

  public InvalidFieldException(String field, String problem) {
    super(field + ": " + problem);
  }
}
