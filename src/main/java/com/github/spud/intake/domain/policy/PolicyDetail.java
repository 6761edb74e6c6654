package com.github.spud.intake.domain.policy;

import lombok.Builder;
import lombok.Value;

/**
 * Policy fields as the backend reports them. Dates keep their raw form.
 */
@Value
@Builder
public class PolicyDetail {

  String policyNumber;

  String policyId;

  String customerId;

  String typeOfBusiness;

  String status;

  String effectiveDate;

  String expirationDate;

  String fullTermPremium;
}
