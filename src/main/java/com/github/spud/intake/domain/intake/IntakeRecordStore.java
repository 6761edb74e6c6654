package com.github.spud.intake.domain.intake;

/**
 * Local, human readable storage for collected records and submissions. Writes overwrite a
 * previous file of the same name. Implementations report failure through the return value and
 * never throw.
 */
public interface IntakeRecordStore {

  boolean saveSnapshot(IntakeSnapshot snapshot);

  boolean saveSubmission(QuoteSubmission submission);
}
