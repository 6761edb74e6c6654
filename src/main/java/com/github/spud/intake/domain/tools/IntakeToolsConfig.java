package com.github.spud.intake.domain.tools;

import com.github.spud.intake.domain.intake.IntakeOutcome;
import jakarta.annotation.PostConstruct;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Configuration;

/**
 * Registers the quote intake tools and {@code get_current_time}
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class IntakeToolsConfig {

  private static final String ADDRESS_PROPERTIES = """
        "street_address": {"type": "string", "description": "Street address"},
        "city": {"type": "string", "description": "City"},
        "state": {"type": "string", "description": "State"},
        "country": {"type": "string", "description": "Country"},
        "zip_code": {"type": "string", "description": "ZIP or postal code"}""";

  private static final String CURRENT_POLICY_PROPERTIES = """
        "current_provider": {"type": "string", "description": "Current insurance provider (optional)"},
        "renewal_date": {"type": "string", "description": "Current policy renewal date (YYYY-MM-DD format, optional)"},
        "renewal_premium": {"type": "number", "description": "Current renewal premium amount (optional)"}""";

  private final ToolRegistry toolRegistry;

  private final Clock clock;

  @PostConstruct
  public void registerIntakeTools() {
    log.info("Registering intake tools...");

    registerSetUserAction();
    registerCollectTools();
    registerSubmitQuoteRequest();
    registerTimeTool();

    log.info("Intake tools registered: {}", toolRegistry.size());
  }

  private void registerSetUserAction() {
    toolRegistry.register(IntakeTool.SET_USER_ACTION,
      "Set the user action type (add/update) and insurance type.",
      """
        {
          "type": "object",
          "properties": {
            "action_type": {
              "type": "string",
              "enum": ["add", "update"],
              "description": "Either 'add' for new insurance or 'update' for existing policy"
            },
            "insurance_type": {
              "type": "string",
              "enum": ["home", "auto", "flood", "life", "commercial"],
              "description": "Type of insurance"
            }
          },
          "required": ["action_type", "insurance_type"]
        }
        """,
      (args, services) -> services.getIntake()
        .setUserAction(IntakeRecordMapper.optText(args, "action_type"),
          IntakeRecordMapper.optText(args, "insurance_type"))
        .getMessage());
  }

  private void registerCollectTools() {
    toolRegistry.register(IntakeTool.COLLECT_HOME_INSURANCE_DATA,
      "Collect home insurance information from the user.",
      """
        {
          "type": "object",
          "properties": {
            "full_name": {"type": "string", "description": "Full name of primary insured"},
            "date_of_birth": {"type": "string", "description": "Date of birth (YYYY-MM-DD format)"},
            "phone": {"type": "string", "description": "Phone number"},
            "email": {"type": "string", "description": "Email address"},
        %s,
            "spouse_name": {"type": "string", "description": "Spouse name (optional)"},
            "spouse_dob": {"type": "string", "description": "Spouse date of birth (YYYY-MM-DD format, optional)"},
            "has_solar_panels": {"type": "boolean", "description": "Whether property has solar panels"},
            "has_pool": {"type": "boolean", "description": "Whether property has a pool"},
            "roof_age": {"type": "integer", "description": "Age of roof in years"},
            "has_pets": {"type": "boolean", "description": "Whether household has pets"},
        %s
          },
          "required": ["full_name", "date_of_birth", "phone", "email", "street_address", "city", "state", "country", "zip_code"]
        }
        """.formatted(ADDRESS_PROPERTIES, CURRENT_POLICY_PROPERTIES),
      (args, services) -> message(services.getIntake()
        .collectHomeData(() -> IntakeRecordMapper.home(args))));

    toolRegistry.register(IntakeTool.COLLECT_AUTO_INSURANCE_DATA,
      "Collect auto insurance information from the user.",
      """
        {
          "type": "object",
          "properties": {
            "driver_name": {"type": "string", "description": "Full name of driver"},
            "driver_dob": {"type": "string", "description": "Driver date of birth (YYYY-MM-DD format)"},
            "license_number": {"type": "string", "description": "Driver's license number"},
            "qualification": {"type": "string", "description": "Driver qualification"},
            "profession": {"type": "string", "description": "Driver profession"},
            "vin": {"type": "string", "description": "Vehicle VIN (17 characters)"},
            "vehicle_make": {"type": "string", "description": "Vehicle make"},
            "vehicle_model": {"type": "string", "description": "Vehicle model"},
            "phone": {"type": "string", "description": "Phone number"},
            "email": {"type": "string", "description": "Email address"},
            "gpa": {"type": "number", "description": "GPA if driver under 21 (optional)"},
            "coverage_type": {"type": "string", "enum": ["liability", "full"], "description": "Coverage type - 'liability' or 'full'"},
        %s
          },
          "required": ["driver_name", "driver_dob", "license_number", "vin", "vehicle_make", "vehicle_model", "phone", "email"]
        }
        """.formatted(CURRENT_POLICY_PROPERTIES),
      (args, services) -> message(services.getIntake()
        .collectAutoData(() -> IntakeRecordMapper.auto(args))));

    toolRegistry.register(IntakeTool.COLLECT_FLOOD_INSURANCE_DATA,
      "Collect flood insurance information from the user.",
      """
        {
          "type": "object",
          "properties": {
            "full_name": {"type": "string", "description": "Full name of insured"},
            "email": {"type": "string", "description": "Email address"},
            "phone": {"type": "string", "description": "Phone number"},
        %s
          },
          "required": ["full_name", "email", "phone", "street_address", "city", "state", "country", "zip_code"]
        }
        """.formatted(ADDRESS_PROPERTIES),
      (args, services) -> message(services.getIntake()
        .collectFloodData(() -> IntakeRecordMapper.flood(args))));

    toolRegistry.register(IntakeTool.COLLECT_LIFE_INSURANCE_DATA,
      "Collect life insurance information from the user.",
      """
        {
          "type": "object",
          "properties": {
            "full_name": {"type": "string", "description": "Full name of insured"},
            "date_of_birth": {"type": "string", "description": "Date of birth (YYYY-MM-DD format)"},
            "phone": {"type": "string", "description": "Phone number"},
            "email": {"type": "string", "description": "Email address (optional)"},
        %s,
            "appointment_requested": {"type": "boolean", "description": "Whether customer wants an appointment"},
            "appointment_date": {"type": "string", "description": "Requested appointment date and time (YYYY-MM-DD HH:MM format, optional)"},
            "policy_type": {"type": "string", "enum": ["term", "whole", "universal", "annuity", "long_term_care"], "description": "Type of policy (optional)"}
          },
          "required": ["full_name", "date_of_birth", "phone", "street_address", "city", "state", "country", "zip_code"]
        }
        """.formatted(ADDRESS_PROPERTIES),
      (args, services) -> message(services.getIntake()
        .collectLifeData(() -> IntakeRecordMapper.life(args))));

    toolRegistry.register(IntakeTool.COLLECT_COMMERCIAL_INSURANCE_DATA,
      "Collect commercial insurance information from the user.",
      """
        {
          "type": "object",
          "properties": {
            "business_name": {"type": "string", "description": "Name of the business"},
            "business_type": {"type": "string", "description": "Type of business"},
            "phone": {"type": "string", "description": "Phone number"},
            "email": {"type": "string", "description": "Email address (optional)"},
        %s,
            "inventory_limit": {"type": "number", "description": "Inventory coverage limit (optional)"},
            "building_coverage": {"type": "boolean", "description": "Whether building coverage is needed"},
            "building_coverage_limit": {"type": "number", "description": "Building coverage limit, required when building coverage is needed"},
        %s
          },
          "required": ["business_name", "phone", "street_address", "city", "state", "country", "zip_code"]
        }
        """.formatted(ADDRESS_PROPERTIES, CURRENT_POLICY_PROPERTIES),
      (args, services) -> message(services.getIntake()
        .collectCommercialData(() -> IntakeRecordMapper.commercial(args))));
  }

  private void registerSubmitQuoteRequest() {
    toolRegistry.register(IntakeTool.SUBMIT_QUOTE_REQUEST,
      "Submit the collected insurance quote request.",
      """
        {
          "type": "object",
          "properties": {}
        }
        """,
      (args, services) -> message(services.getIntake().submitQuoteRequest()));
  }

  private void registerTimeTool() {
    toolRegistry.register(IntakeTool.GET_CURRENT_TIME,
      "Get the current date and time",
      """
        {
          "type": "object",
          "properties": {}
        }
        """,
      (args, services) -> "The current date and time is "
        + LocalDateTime.now(clock).format(DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm"))
        + ".");
  }

  private static String message(IntakeOutcome outcome) {
    return outcome.getMessage();
  }
}
