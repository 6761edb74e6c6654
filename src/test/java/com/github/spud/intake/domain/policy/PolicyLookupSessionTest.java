package com.github.spud.intake.domain.policy;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class PolicyLookupSessionTest {

  private PolicyBackend backend;
  private PolicyLookupSession session;

  @BeforeEach
  void setUp() {
    backend = mock(PolicyBackend.class);
    session = new PolicyLookupSession(backend);
  }

  private static PolicyDetail policy(String number) {
    return PolicyDetail.builder()
      .policyNumber(number)
      .policyId("P-7")
      .customerId("C-9")
      .typeOfBusiness("Homeowners")
      .status("Active")
      .effectiveDate("2024-01-01T00:00:00")
      .expirationDate("2025-01-01T00:00:00")
      .fullTermPremium("1200.00")
      .build();
  }

  @Test
  void lookupDescribesPolicyAndRemembersCustomer() {
    when(backend.findPolicyByNumber("HO-123")).thenReturn(Optional.of(PolicyReference.builder()
      .policyNumber("HO-123").customerId("C-9").policyId("P-7").build()));
    when(backend.getPolicy("P-7")).thenReturn(Optional.of(policy("HO-123")));

    String text = session.lookupPolicyByNumber("HO-123");

    assertThat(text).isEqualTo("Found policy HO-123 in AMS360. Type: Homeowners, Status: Active,"
      + " Effective Date: 2024-01-01, Expiration Date: 2025-01-01, Full Term Premium: $1200.00."
      + " Customer ID: C-9. Policy details retrieved successfully.");
    assertThat(session.getCustomerId()).isEqualTo("C-9");
    assertThat(session.getPolicyId()).isEqualTo("P-7");
  }

  @Test
  void unknownPolicyNumber() {
    when(backend.findPolicyByNumber("X")).thenReturn(Optional.empty());

    assertThat(session.lookupPolicyByNumber("X"))
      .isEqualTo("No policy found in AMS360 with policy number X.");
    assertThat(session.getCustomerId()).isNull();
  }

  @Test
  void customerToolsFallBackToRememberedCustomer() {
    when(backend.findPolicyByNumber("HO-123")).thenReturn(Optional.of(PolicyReference.builder()
      .policyNumber("HO-123").customerId("C-9").policyId("P-7").build()));
    when(backend.getPolicy("P-7")).thenReturn(Optional.empty());
    when(backend.getCustomerPolicies("C-9")).thenReturn(List.of(policy("HO-123")));
    when(backend.getCustomerDetails("C-9")).thenReturn(Optional.of(CustomerDetail.builder()
      .customerId("C-9")
      .attributes(Map.of("FirstName", "Jane", "LastName", "Doe", "CellPhone", "555-0100"))
      .build()));

    session.lookupPolicyByNumber("HO-123");

    assertThat(session.customerPolicies(null)).isEqualTo("Retrieved 1 policy for customer C-9"
      + " from AMS360: HO-123 (Homeowners, Active, expires 2025-01-01).");
    assertThat(session.customerDetails("")).isEqualTo("Customer C-9 in AMS360: Jane Doe,"
      + " email N/A, phone 555-0100, city N/A, state N/A.");
  }

  @Test
  void customerToolsNeedAnId() {
    assertThat(session.customerPolicies(null))
      .isEqualTo("Please provide a customer ID or look up a policy number first.");
    verify(backend, never()).getCustomerPolicies(any());
  }
}
