package com.github.spud.intake.domain.crm;

import com.github.spud.intake.domain.intake.record.Address;
import com.github.spud.intake.domain.intake.record.AutoRecord;
import com.github.spud.intake.domain.intake.record.CommercialRecord;
import com.github.spud.intake.domain.intake.record.ContactInfo;
import com.github.spud.intake.domain.intake.record.FloodRecord;
import com.github.spud.intake.domain.intake.record.HomeRecord;
import com.github.spud.intake.domain.intake.record.InsuredRecord;
import com.github.spud.intake.domain.intake.record.LifeRecord;
import com.github.spud.intake.domain.intake.record.PolicyInfo;
import com.github.spud.intake.util.JsonUtils;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Maps a collected intake record onto the CRM's flat lead schema and submits it once. A failure
 * is returned, not thrown, and is never retried here.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LeadSubmissionAdapter {

  public static final String LEAD_SOURCE = "AI Chatbot";

  private final CrmGateway crmGateway;

  public SubmitResult submit(InsuredRecord record, String notes) {
    Map<String, Object> lead = toLead(record, notes);
    try {
      String leadId = crmGateway.createLead(lead);
      log.info("Lead created for {} intake: leadId={}", record.insuranceType().wire(), leadId);
      return SubmitResult.ok(leadId);
    } catch (Exception e) {
      log.warn("Lead submission for {} intake failed: {}", record.insuranceType().wire(),
        e.getMessage());
      return SubmitResult.failed(new SubmitResult.SubmitError(e.getMessage(), e));
    }
  }

  /**
   * Flat lead data. Keys the CRM does not know become custom fields downstream.
   */
  public Map<String, Object> toLead(InsuredRecord record, String notes) {
    Map<String, Object> lead = new LinkedHashMap<>();
    String[] name = splitName(record);
    ContactInfo contact = record.contactInfo();
    lead.put("first_name", name[0]);
    lead.put("last_name", name[1]);
    lead.put("email", contact != null && StringUtils.hasText(contact.getEmail())
      ? contact.getEmail() : ContactInfo.PLACEHOLDER_EMAIL);
    lead.put("phone", contact != null && contact.getPhone() != null ? contact.getPhone() : "");
    lead.put("insurance_type", record.insuranceType().wire());
    lead.put("source", LEAD_SOURCE);
    lead.put("notes", notes);

    if (record instanceof HomeRecord home) {
      Address address = home.getProperty().getAddress();
      putAddress(lead, address);
      lead.put("property_address", address.oneLine());
      putProvider(lead, home.getCurrentPolicy());
    } else if (record instanceof AutoRecord auto) {
      AutoRecord.Vehicle vehicle = auto.getVehicles().get(0);
      lead.put("vehicle_info", vehicle.getMake() + " " + vehicle.getModel());
      lead.put("vin", vehicle.getVin());
      putProvider(lead, auto.getCurrentPolicy());
    } else if (record instanceof FloodRecord flood) {
      putAddress(lead, flood.getHomeAddress());
      lead.put("home_address", flood.getHomeAddress().oneLine());
    } else if (record instanceof LifeRecord life) {
      putAddress(lead, life.getAddress());
      lead.put("address", life.getAddress().oneLine());
      lead.put("appointment_requested", life.isAppointmentRequested());
      if (life.getPolicyType() != null) {
        lead.put("policy_type", life.getPolicyType().wire());
      }
    } else if (record instanceof CommercialRecord commercial) {
      Address address = commercial.getBusiness().getAddress();
      putAddress(lead, address);
      lead.put("business_name", commercial.getBusiness().getName());
      lead.put("business_address", address.oneLine());
      putProvider(lead, commercial.getCurrentPolicy());
    }
    lead.put("insurance_details", JsonUtils.toJson(record));
    return lead;
  }

  /**
   * First space splits first from last name. Commercial leads carry the business name as first
   * name.
   */
  static String[] splitName(InsuredRecord record) {
    String fullName = record.primaryName();
    if (!StringUtils.hasText(fullName)) {
      return new String[]{"Unknown", ""};
    }
    if (record instanceof CommercialRecord) {
      return new String[]{fullName.trim(), ""};
    }
    String[] parts = fullName.trim().split(" ", 2);
    return new String[]{parts[0], parts.length > 1 ? parts[1].trim() : ""};
  }

  private static void putAddress(Map<String, Object> lead, Address address) {
    lead.put("streetAddress", address.getStreetAddress());
    lead.put("city", address.getCity());
    lead.put("state", address.getState());
    lead.put("country", address.getCountry());
    lead.put("zip", address.getZipCode());
  }

  private static void putProvider(Map<String, Object> lead, PolicyInfo policy) {
    if (policy != null && StringUtils.hasText(policy.getCurrentProvider())) {
      lead.put("current_provider", policy.getCurrentProvider());
    }
  }
}
