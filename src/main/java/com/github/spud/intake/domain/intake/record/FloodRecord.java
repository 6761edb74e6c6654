package com.github.spud.intake.domain.intake.record;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.github.spud.intake.domain.intake.InsuranceType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class FloodRecord implements InsuredRecord {

  @NotBlank
  private String fullName;

  @Valid
  @NotNull
  private Address homeAddress;

  @NotBlank
  private String phone;

  @NotBlank
  @Email
  private String email;

  @Override
  public InsuranceType insuranceType() {
    return InsuranceType.FLOOD;
  }

  @Override
  public String primaryName() {
    return fullName;
  }

  @Override
  public ContactInfo contactInfo() {
    return new ContactInfo(phone, email);
  }
}
