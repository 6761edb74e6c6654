package com.github.spud.intake.domain.tools;

import java.util.Arrays;
import java.util.Optional;

/**
 * The closed tool catalog offered to the model. Names are the wire names the model calls.
 */
public enum IntakeTool {
  SET_USER_ACTION("set_user_action"),
  COLLECT_HOME_INSURANCE_DATA("collect_home_insurance_data"),
  COLLECT_AUTO_INSURANCE_DATA("collect_auto_insurance_data"),
  COLLECT_FLOOD_INSURANCE_DATA("collect_flood_insurance_data"),
  COLLECT_LIFE_INSURANCE_DATA("collect_life_insurance_data"),
  COLLECT_COMMERCIAL_INSURANCE_DATA("collect_commercial_insurance_data"),
  SUBMIT_QUOTE_REQUEST("submit_quote_request"),
  GET_POLICY_BY_NUMBER("get_policy_by_number"),
  GET_AMS360_CUSTOMER_POLICIES("get_ams360_customer_policies"),
  GET_AMS360_CUSTOMER_DETAILS("get_ams360_customer_details"),
  CREATE_AGENCYZOOM_LEAD("create_agencyzoom_lead"),
  SEARCH_AGENCYZOOM_CONTACT_BY_PHONE("search_agencyzoom_contact_by_phone"),
  SEARCH_AGENCYZOOM_CONTACT_BY_EMAIL("search_agencyzoom_contact_by_email"),
  SUBMIT_COLLECTED_DATA_TO_AGENCYZOOM("submit_collected_data_to_agencyzoom"),
  GET_CURRENT_TIME("get_current_time");

  private final String toolName;

  IntakeTool(String toolName) {
    this.toolName = toolName;
  }

  public String toolName() {
    return toolName;
  }

  public static Optional<IntakeTool> fromName(String name) {
    if (name == null) {
      return Optional.empty();
    }
    return Arrays.stream(values()).filter(t -> t.toolName.equals(name)).findFirst();
  }
}
