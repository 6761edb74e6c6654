package com.github.spud.intake.domain.intake;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.github.spud.intake.domain.intake.record.InsuredRecord;
import lombok.Builder;
import lombok.Data;

/**
 * Everything collected so far in one session, written after each successful collect
 */
@Data
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class IntakeSnapshot {

  private String sessionId;

  private ActionType action;

  private InsuranceType insuranceType;

  private InsuredRecord record;

  @JsonIgnore
  public String primaryName() {
    return record.primaryName();
  }
}
