package com.github.spud.intake.domain.intake.record;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class Address {

  @NotBlank
  private String streetAddress;

  @NotBlank
  private String city;

  @NotBlank
  private String state;

  @NotBlank
  private String country;

  @NotBlank
  private String zipCode;

  /**
   * Single line form used in CRM notes, e.g. {@code 12 Main St, Springfield, IL 62701}
   */
  public String oneLine() {
    return streetAddress + ", " + city + ", " + state + " " + zipCode;
  }
}
