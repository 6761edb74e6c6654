package com.github.spud.intake.domain.policy;

import java.util.Map;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class CustomerDetail {

  String customerId;

  /**
   * Scalar customer attributes by backend field name
   */
  Map<String, String> attributes;

  public String attribute(String name) {
    return attributes.get(name);
  }

  public String displayName() {
    String firm = attribute("FirmName");
    if (firm != null && !firm.isBlank()) {
      return firm;
    }
    String first = attribute("FirstName");
    String last = attribute("LastName");
    return ((first != null ? first : "") + " " + (last != null ? last : "")).trim();
  }
}
