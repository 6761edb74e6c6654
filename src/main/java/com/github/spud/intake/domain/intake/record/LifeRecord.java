package com.github.spud.intake.domain.intake.record;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.github.spud.intake.domain.intake.InsuranceType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class LifeRecord implements InsuredRecord {

  @Valid
  @NotNull
  private Person insured;

  @Valid
  @NotNull
  private Address address;

  private boolean appointmentRequested;

  private LocalDateTime appointmentDate;

  @Valid
  @NotNull
  private ContactInfo contact;

  private LifePolicyType policyType;

  @Override
  public InsuranceType insuranceType() {
    return InsuranceType.LIFE;
  }

  @Override
  public String primaryName() {
    return insured != null ? insured.getFullName() : null;
  }

  @Override
  public ContactInfo contactInfo() {
    return contact;
  }
}
