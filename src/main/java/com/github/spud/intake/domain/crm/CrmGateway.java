package com.github.spud.intake.domain.crm;

import java.util.List;
import java.util.Map;

/**
 * Outbound port to the CRM. Failures surface as
 * {@link com.github.spud.intake.domain.common.ExternalCallFailedException}.
 */
public interface CrmGateway {

  /**
   * Create a lead from flat lead data and return its id
   */
  String createLead(Map<String, Object> leadData);

  List<Map<String, Object>> searchContactsByPhone(String phone);

  List<Map<String, Object>> searchContactsByEmail(String email);
}
