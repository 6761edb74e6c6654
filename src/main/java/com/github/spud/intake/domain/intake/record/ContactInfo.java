package com.github.spud.intake.domain.intake.record;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.Email;
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
public class ContactInfo {

  /**
   * Stand-in address for callers who did not give one
   */
  public static final String PLACEHOLDER_EMAIL = "noemail@pending.com";

  @NotBlank
  private String phone;

  @NotBlank
  @Email
  private String email;
}
