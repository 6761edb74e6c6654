package com.github.spud.intake.domain.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.spud.intake.domain.common.ExternalCallFailedException;
import com.github.spud.intake.domain.conversation.ThreadServices;
import com.github.spud.intake.domain.crm.LeadSubmissionAdapter;
import jakarta.annotation.PostConstruct;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Configuration;

/**
 * Registers the AMS360 policy lookup and AgencyZoom lead tools
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class BackendToolsConfig {

  /**
   * Optional create_agencyzoom_lead arguments copied onto the lead when present
   */
  private static final List<String> OPTIONAL_LEAD_ARGUMENTS = List.of(
    "address", "date_of_birth", "current_provider", "vehicle_info", "property_info",
    "business_name", "appointment_requested");

  private final ToolRegistry toolRegistry;

  @PostConstruct
  public void registerBackendTools() {
    log.info("Registering backend tools...");

    registerPolicyTools();
    registerCrmTools();

    log.info("Backend tools registered, registry size: {}", toolRegistry.size());
  }

  private void registerPolicyTools() {
    toolRegistry.register(IntakeTool.GET_POLICY_BY_NUMBER,
      "Get policy information or lookup for existing policy by policy number from AMS360.",
      """
        {
          "type": "object",
          "properties": {
            "policy_number": {"type": "string", "description": "The policy number to search for"}
          },
          "required": ["policy_number"]
        }
        """,
      (args, services) -> services.getPolicies()
        .lookupPolicyByNumber(IntakeRecordMapper.reqText(args, "policy_number")));

    toolRegistry.register(IntakeTool.GET_AMS360_CUSTOMER_POLICIES,
      "Get all policies for a specific customer from AMS360. Defaults to the customer of the last"
        + " policy looked up.",
      """
        {
          "type": "object",
          "properties": {
            "customer_id": {"type": "string", "description": "AMS360 customer ID (optional after a policy lookup)"}
          }
        }
        """,
      (args, services) -> services.getPolicies()
        .customerPolicies(IntakeRecordMapper.optText(args, "customer_id")));

    toolRegistry.register(IntakeTool.GET_AMS360_CUSTOMER_DETAILS,
      "Get customer details from AMS360. Defaults to the customer of the last policy looked up.",
      """
        {
          "type": "object",
          "properties": {
            "customer_id": {"type": "string", "description": "AMS360 customer ID (optional after a policy lookup)"}
          }
        }
        """,
      (args, services) -> services.getPolicies()
        .customerDetails(IntakeRecordMapper.optText(args, "customer_id")));
  }

  private void registerCrmTools() {
    toolRegistry.register(IntakeTool.CREATE_AGENCYZOOM_LEAD,
      "Create a new lead in AgencyZoom with detailed information.",
      """
        {
          "type": "object",
          "properties": {
            "first_name": {"type": "string", "description": "First name"},
            "last_name": {"type": "string", "description": "Last name"},
            "email": {"type": "string", "description": "Email address"},
            "phone": {"type": "string", "description": "Phone number"},
            "insurance_type": {"type": "string", "description": "Type of insurance the lead is interested in"},
            "notes": {"type": "string", "description": "Additional notes (optional)"},
            "address": {"type": "string", "description": "Full address (optional)"},
            "date_of_birth": {"type": "string", "description": "Date of birth (optional)"},
            "current_provider": {"type": "string", "description": "Current insurance provider (optional)"},
            "vehicle_info": {"type": "string", "description": "Vehicle information for auto insurance (optional)"},
            "property_info": {"type": "string", "description": "Property information for home insurance (optional)"},
            "business_name": {"type": "string", "description": "Business name for commercial insurance (optional)"},
            "appointment_requested": {"type": "boolean", "description": "Whether an appointment was requested (optional)"}
          },
          "required": ["first_name", "last_name", "email", "phone", "insurance_type"]
        }
        """,
      this::createLead);

    toolRegistry.register(IntakeTool.SEARCH_AGENCYZOOM_CONTACT_BY_PHONE,
      "Search for a contact in AgencyZoom by phone number.",
      """
        {
          "type": "object",
          "properties": {
            "phone": {"type": "string", "description": "Phone number to search for"}
          },
          "required": ["phone"]
        }
        """,
      (args, services) -> {
        String phone = IntakeRecordMapper.reqText(args, "phone");
        int count = services.getCrm().searchContactsByPhone(phone).size();
        return count > 0
          ? "Found " + count + " contact(s) in AgencyZoom with phone number " + phone + "."
          : "No contact found in AgencyZoom with phone number " + phone + ".";
      });

    toolRegistry.register(IntakeTool.SEARCH_AGENCYZOOM_CONTACT_BY_EMAIL,
      "Search for a contact in AgencyZoom by email address.",
      """
        {
          "type": "object",
          "properties": {
            "email": {"type": "string", "description": "Email address to search for"}
          },
          "required": ["email"]
        }
        """,
      (args, services) -> {
        String email = IntakeRecordMapper.reqText(args, "email");
        int count = services.getCrm().searchContactsByEmail(email).size();
        return count > 0
          ? "Found " + count + " contact(s) in AgencyZoom with email " + email + "."
          : "No contact found in AgencyZoom with email " + email + ".";
      });

    toolRegistry.register(IntakeTool.SUBMIT_COLLECTED_DATA_TO_AGENCYZOOM,
      "Submit all collected insurance data to AgencyZoom as a comprehensive lead.",
      """
        {
          "type": "object",
          "properties": {}
        }
        """,
      (args, services) -> services.getIntake().submitCollectedDataToCrm().getMessage());
  }

  private String createLead(JsonNode args, ThreadServices services) {
    String firstName = IntakeRecordMapper.reqText(args, "first_name");
    String lastName = IntakeRecordMapper.optText(args, "last_name");
    Map<String, Object> lead = new LinkedHashMap<>();
    lead.put("first_name", firstName);
    lead.put("last_name", lastName != null ? lastName : "");
    lead.put("email", IntakeRecordMapper.optText(args, "email"));
    lead.put("phone", IntakeRecordMapper.optText(args, "phone"));
    lead.put("insurance_type", IntakeRecordMapper.optText(args, "insurance_type"));
    String notes = IntakeRecordMapper.optText(args, "notes");
    lead.put("notes", notes != null ? notes : "");
    lead.put("source", LeadSubmissionAdapter.LEAD_SOURCE);
    for (String name : OPTIONAL_LEAD_ARGUMENTS) {
      String value = IntakeRecordMapper.optText(args, name);
      if (value != null) {
        lead.put(name, value);
      }
    }

    try {
      services.getCrm().createLead(lead);
    } catch (ExternalCallFailedException e) {
      log.warn("Thread {} lead creation failed: {}", services.getThreadId(), e.getMessage());
      return "Failed to create lead in AgencyZoom. Please check the logs for details.";
    }
    return "Successfully created lead in AgencyZoom for " + firstName
      + (lastName != null ? " " + lastName : "") + ".";
  }
}
