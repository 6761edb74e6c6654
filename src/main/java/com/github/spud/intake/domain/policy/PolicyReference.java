package com.github.spud.intake.domain.policy;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class PolicyReference {

  String policyNumber;

  String customerId;

  String policyId;
}
