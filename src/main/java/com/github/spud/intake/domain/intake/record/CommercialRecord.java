package com.github.spud.intake.domain.intake.record;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.github.spud.intake.domain.intake.InsuranceType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
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
public class CommercialRecord implements InsuredRecord {

  @Valid
  @NotNull
  private BusinessDetails business;

  @Valid
  @NotNull
  private CoverageDetails coverage;

  @Valid
  @NotNull
  @Builder.Default
  private PolicyInfo currentPolicy = new PolicyInfo();

  @Valid
  @NotNull
  private ContactInfo contact;

  @Override
  public InsuranceType insuranceType() {
    return InsuranceType.COMMERCIAL;
  }

  @Override
  public String primaryName() {
    return business != null ? business.getName() : null;
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
  public static class BusinessDetails {

    @NotBlank
    private String name;

    @NotBlank
    @Builder.Default
    private String type = "General";

    @Valid
    @NotNull
    private Address address;
  }

  @Data
  @Builder
  @NoArgsConstructor
  @AllArgsConstructor
  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public static class CoverageDetails {

    @PositiveOrZero
    private Double inventoryLimit;

    private boolean buildingCoverage;

    @PositiveOrZero
    private Double buildingCoverageLimit;

    @AssertTrue(message = "building coverage limit is required when building coverage is requested")
    @JsonIgnore
    public boolean isBuildingLimitPresent() {
      return !buildingCoverage || buildingCoverageLimit != null;
    }
  }
}
