package com.github.spud.intake.domain.intake.record;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.github.spud.intake.domain.intake.InsuranceType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Past;
import jakarta.validation.constraints.Size;
import java.time.LocalDate;
import java.util.List;
import java.util.Locale;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class AutoRecord implements InsuredRecord {

  @NotEmpty
  private List<@Valid @NotNull Driver> drivers;

  @NotEmpty
  private List<@Valid @NotNull Vehicle> vehicles;

  @Valid
  @NotNull
  @Builder.Default
  private PolicyInfo currentPolicy = new PolicyInfo();

  @Valid
  @NotNull
  private ContactInfo contact;

  @Override
  public InsuranceType insuranceType() {
    return InsuranceType.AUTO;
  }

  @Override
  public String primaryName() {
    return drivers == null || drivers.isEmpty() ? null : drivers.get(0).getFullName();
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
  public static class Driver {

    @NotBlank
    private String fullName;

    @NotNull
    @Past
    private LocalDate dateOfBirth;

    @NotBlank
    private String licenseNumber;

    @Builder.Default
    private String qualification = "Unknown";

    @Builder.Default
    private String profession = "Unknown";

    /**
     * Only asked for drivers under 21
     */
    @DecimalMin("0.0")
    @DecimalMax("4.0")
    private Double gpa;
  }

  @Data
  @Builder
  @NoArgsConstructor
  @AllArgsConstructor
  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public static class Vehicle {

    @NotBlank
    @Size(min = 17, max = 17, message = "VIN must be exactly 17 characters")
    private String vin;

    @NotBlank
    private String make;

    @NotBlank
    private String model;

    @NotNull
    @Builder.Default
    private CoverageType coverageType = CoverageType.FULL;

    public void setVin(String vin) {
      this.vin = normalizeVin(vin);
    }

    static String normalizeVin(String vin) {
      return vin == null ? null : vin.trim().toUpperCase(Locale.ROOT);
    }

    public static class VehicleBuilder {

      public VehicleBuilder vin(String vin) {
        this.vin = normalizeVin(vin);
        return this;
      }
    }
  }
}
