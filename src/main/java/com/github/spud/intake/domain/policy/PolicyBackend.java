package com.github.spud.intake.domain.policy;

import java.util.List;
import java.util.Optional;

/**
 * Read access to the agency management system. Every call runs under a valid login ticket.
 */
public interface PolicyBackend {

  Optional<PolicyReference> findPolicyByNumber(String policyNumber);

  Optional<PolicyDetail> getPolicy(String policyId);

  List<PolicyDetail> getCustomerPolicies(String customerId);

  Optional<CustomerDetail> getCustomerDetails(String customerId);
}
