package com.github.spud.intake.domain.intake.record;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.github.spud.intake.domain.intake.InsuranceType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class HomeRecord implements InsuredRecord {

  @Valid
  @NotNull
  private Person primaryInsured;

  @Valid
  private Person spouse;

  @Valid
  @NotNull
  private PropertyDetails property;

  private boolean hasPets;

  @Valid
  @NotNull
  @Builder.Default
  private PolicyInfo currentPolicy = new PolicyInfo();

  @Valid
  @NotNull
  private ContactInfo contact;

  @Override
  public InsuranceType insuranceType() {
    return InsuranceType.HOME;
  }

  @Override
  public String primaryName() {
    return primaryInsured != null ? primaryInsured.getFullName() : null;
  }

  @Override
  public ContactInfo contactInfo() {
    return contact;
  }

  @Data
  @Builder
  @NoArgsConstructor
  @AllArgsConstructor
  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public static class PropertyDetails {

    @Valid
    @NotNull
    private Address address;

    private boolean hasSolarPanels;

    private boolean hasPool;

    @PositiveOrZero
    private int roofAge;
  }
}
