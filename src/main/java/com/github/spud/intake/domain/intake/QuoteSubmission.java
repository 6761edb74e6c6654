package com.github.spud.intake.domain.intake;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.github.spud.intake.domain.intake.record.InsuredRecord;
import lombok.Builder;
import lombok.Data;

/**
 * Submission envelope persisted when a quote request is submitted
 */
@Data
@Builder(toBuilder = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class QuoteSubmission {

  public static final String STATUS_SUBMITTED = "submitted";

  /**
   * {@code yyyyMMdd_HHmmss}, also part of the file name
   */
  private String submissionTimestamp;

  private String sessionId;

  private String threadId;

  @Builder.Default
  private String status = STATUS_SUBMITTED;

  private String crmStatus;

  private QuoteRequest quoteRequest;

  @Data
  @Builder
  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public static class QuoteRequest {

    private InsuranceType insuranceType;

    private ActionType action;

    private InsuredRecord record;
  }
}
