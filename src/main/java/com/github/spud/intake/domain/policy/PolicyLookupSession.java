package com.github.spud.intake.domain.policy;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.StringUtils;

/**
 * Per-thread view of the policy backend. Remembers the customer and policy found by the last
 * policy number lookup so follow-up questions can omit the customer id.
 */
@Slf4j
@RequiredArgsConstructor
public class PolicyLookupSession {

  private static final String NA = "N/A";

  private final PolicyBackend backend;

  @Getter
  private String customerId;

  @Getter
  private String policyId;

  public String lookupPolicyByNumber(String policyNumber) {
    Optional<PolicyReference> reference = backend.findPolicyByNumber(policyNumber);
    if (reference.isEmpty()) {
      return "No policy found in AMS360 with policy number " + policyNumber + ".";
    }
    this.customerId = reference.get().getCustomerId();
    this.policyId = reference.get().getPolicyId();
    log.info("Remembered customerId={}, policyId={}", customerId, policyId);

    return backend.getPolicy(policyId)
      .map(PolicyLookupSession::describe)
      .orElse("Found policy information in AMS360 for policy number " + policyNumber
        + ". Policy data retrieved successfully.");
  }

  public String customerPolicies(String requestedCustomerId) {
    String id = resolveCustomer(requestedCustomerId);
    if (id == null) {
      return "Please provide a customer ID or look up a policy number first.";
    }
    List<PolicyDetail> policies = backend.getCustomerPolicies(id);
    if (policies.isEmpty()) {
      return "No policies found for customer " + id + " in AMS360.";
    }
    String listing = policies.stream()
      .map(p -> orNa(p.getPolicyNumber()) + " (" + orNa(p.getTypeOfBusiness()) + ", "
        + orNa(p.getStatus()) + ", expires " + datePart(p.getExpirationDate()) + ")")
      .collect(Collectors.joining("; "));
    return "Retrieved " + policies.size() + " polic" + (policies.size() == 1 ? "y" : "ies")
      + " for customer " + id + " from AMS360: " + listing + ".";
  }

  public String customerDetails(String requestedCustomerId) {
    String id = resolveCustomer(requestedCustomerId);
    if (id == null) {
      return "Please provide a customer ID or look up a policy number first.";
    }
    return backend.getCustomerDetails(id)
      .map(c -> "Customer " + id + " in AMS360: " + orNa(emptyToNull(c.displayName()))
        + ", email " + orNa(c.attribute("Email"))
        + ", phone " + orNa(firstNonBlank(c.attribute("HomePhone"), c.attribute("CellPhone"),
        c.attribute("BusinessPhone")))
        + ", city " + orNa(c.attribute("City")) + ", state " + orNa(c.attribute("State")) + ".")
      .orElse("No customer found in AMS360 with customer ID " + id + ".");
  }

  static String describe(PolicyDetail p) {
    return "Found policy " + orNa(p.getPolicyNumber()) + " in AMS360. Type: "
      + orNa(p.getTypeOfBusiness()) + ", Status: " + orNa(p.getStatus()) + ", Effective Date: "
      + datePart(p.getEffectiveDate()) + ", Expiration Date: " + datePart(p.getExpirationDate())
      + ", Full Term Premium: $" + orNa(p.getFullTermPremium()) + ". Customer ID: "
      + orNa(p.getCustomerId()) + ". Policy details retrieved successfully.";
  }

  private String resolveCustomer(String requested) {
    return StringUtils.hasText(requested) ? requested : customerId;
  }

  private static String datePart(String value) {
    if (!StringUtils.hasText(value)) {
      return NA;
    }
    int t = value.indexOf('T');
    return t > 0 ? value.substring(0, t) : value;
  }

  private static String orNa(String value) {
    return StringUtils.hasText(value) ? value : NA;
  }

  private static String emptyToNull(String value) {
    return StringUtils.hasText(value) ? value : null;
  }

  private static String firstNonBlank(String... values) {
    for (String v : values) {
      if (StringUtils.hasText(v)) {
        return v;
      }
    }
    return null;
  }
}
