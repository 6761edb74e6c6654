package com.github.spud.intake.domain.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.spud.intake.domain.intake.InvalidFieldException;
import com.github.spud.intake.domain.intake.record.Address;
import com.github.spud.intake.domain.intake.record.AutoRecord;
import com.github.spud.intake.domain.intake.record.CommercialRecord;
import com.github.spud.intake.domain.intake.record.ContactInfo;
import com.github.spud.intake.domain.intake.record.CoverageType;
import com.github.spud.intake.domain.intake.record.FloodRecord;
import com.github.spud.intake.domain.intake.record.HomeRecord;
import com.github.spud.intake.domain.intake.record.LifePolicyType;
import com.github.spud.intake.domain.intake.record.LifeRecord;
import com.github.spud.intake.domain.intake.record.Person;
import com.github.spud.intake.domain.intake.record.PolicyInfo;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;

/**
 * Builds typed intake records from collect tool arguments. Missing required arguments and
 * unparseable values raise {@link InvalidFieldException} naming the argument; value constraints
 * are left to bean validation.
 */
final class IntakeRecordMapper {

  static final DateTimeFormatter APPOINTMENT_FORMAT = DateTimeFormatter.ofPattern(
    "yyyy-MM-dd HH:mm");

  private IntakeRecordMapper() {
  }

  static HomeRecord home(JsonNode args) {
    Person spouse = null;
    String spouseName = optText(args, "spouse_name");
    LocalDate spouseDob = optDate(args, "spouse_dob");
    if (spouseName != null && spouseDob != null) {
      spouse = new Person(spouseName, spouseDob);
    }
    return HomeRecord.builder()
      .primaryInsured(new Person(reqText(args, "full_name"), reqDate(args, "date_of_birth")))
      .spouse(spouse)
      .property(HomeRecord.PropertyDetails.builder()
        .address(address(args))
        .hasSolarPanels(flag(args, "has_solar_panels"))
        .hasPool(flag(args, "has_pool"))
        .roofAge(optInt(args, "roof_age", 0))
        .build())
      .hasPets(flag(args, "has_pets"))
      .currentPolicy(currentPolicy(args))
      .contact(new ContactInfo(reqText(args, "phone"), reqText(args, "email")))
      .build();
  }

  static AutoRecord auto(JsonNode args) {
    AutoRecord.Driver.DriverBuilder driver = AutoRecord.Driver.builder()
      .fullName(reqText(args, "driver_name"))
      .dateOfBirth(reqDate(args, "driver_dob"))
      .licenseNumber(reqText(args, "license_number"))
      .gpa(optDouble(args, "gpa"));
    String qualification = optText(args, "qualification");
    if (qualification != null) {
      driver.qualification(qualification);
    }
    String profession = optText(args, "profession");
    if (profession != null) {
      driver.profession(profession);
    }

    AutoRecord.Vehicle vehicle = AutoRecord.Vehicle.builder()
      .vin(reqText(args, "vin"))
      .make(reqText(args, "vehicle_make"))
      .model(reqText(args, "vehicle_model"))
      .coverageType(coverageType(args))
      .build();

    return AutoRecord.builder()
      .drivers(List.of(driver.build()))
      .vehicles(List.of(vehicle))
      .currentPolicy(currentPolicy(args))
      .contact(new ContactInfo(reqText(args, "phone"), reqText(args, "email")))
      .build();
  }

  static FloodRecord flood(JsonNode args) {
    return FloodRecord.builder()
      .fullName(reqText(args, "full_name"))
      .homeAddress(address(args))
      .phone(reqText(args, "phone"))
      .email(reqText(args, "email"))
      .build();
  }

  static LifeRecord life(JsonNode args) {
    String policyType = optText(args, "policy_type");
    return LifeRecord.builder()
      .insured(new Person(reqText(args, "full_name"), reqDate(args, "date_of_birth")))
      .address(address(args))
      .appointmentRequested(flag(args, "appointment_requested"))
      .appointmentDate(optDateTime(args, "appointment_date"))
      .contact(new ContactInfo(reqText(args, "phone"), emailOrPlaceholder(args)))
      .policyType(policyType == null ? null : LifePolicyType.fromWire(policyType)
        .orElseThrow(() -> new InvalidFieldException("policy_type",
          "must be one of term, whole, universal, annuity, long_term_care")))
      .build();
  }

  static CommercialRecord commercial(JsonNode args) {
    CommercialRecord.BusinessDetails.BusinessDetailsBuilder business =
      CommercialRecord.BusinessDetails.builder()
        .name(reqText(args, "business_name"))
        .address(address(args));
    String businessType = optText(args, "business_type");
    if (businessType != null) {
      business.type(businessType);
    }
    return CommercialRecord.builder()
      .business(business.build())
      .coverage(CommercialRecord.CoverageDetails.builder()
        .inventoryLimit(optDouble(args, "inventory_limit"))
        .buildingCoverage(flag(args, "building_coverage"))
        .buildingCoverageLimit(optDouble(args, "building_coverage_limit"))
        .build())
      .currentPolicy(currentPolicy(args))
      .contact(new ContactInfo(reqText(args, "phone"), emailOrPlaceholder(args)))
      .build();
  }

  private static Address address(JsonNode args) {
    return Address.builder()
      .streetAddress(reqText(args, "street_address"))
      .city(reqText(args, "city"))
      .state(reqText(args, "state"))
      .country(reqText(args, "country"))
      .zipCode(reqText(args, "zip_code"))
      .build();
  }

  private static PolicyInfo currentPolicy(JsonNode args) {
    return PolicyInfo.builder()
      .currentProvider(optText(args, "current_provider"))
      .renewalDate(optDate(args, "renewal_date"))
      .renewalPremium(optDouble(args, "renewal_premium"))
      .build();
  }

  private static CoverageType coverageType(JsonNode args) {
    String value = optText(args, "coverage_type");
    if (value == null) {
      return CoverageType.FULL;
    }
    return CoverageType.fromWire(value)
      .orElseThrow(() -> new InvalidFieldException("coverage_type", "must be 'liability' or 'full'"));
  }

  private static String emailOrPlaceholder(JsonNode args) {
    String email = optText(args, "email");
    return email != null ? email : ContactInfo.PLACEHOLDER_EMAIL;
  }

  static String reqText(JsonNode args, String name) {
    String value = optText(args, name);
    if (value == null) {
      throw new InvalidFieldException(name, "is required");
    }
    return value;
  }

  static String optText(JsonNode args, String name) {
    JsonNode node = args.get(name);
    if (node == null || node.isNull()) {
      return null;
    }
    String value = node.asText().trim();
    return value.isEmpty() ? null : value;
  }

  private static LocalDate reqDate(JsonNode args, String name) {
    LocalDate value = optDate(args, name);
    if (value == null) {
      throw new InvalidFieldException(name, "is required");
    }
    return value;
  }

  private static LocalDate optDate(JsonNode args, String name) {
    String value = optText(args, name);
    if (value == null) {
      return null;
    }
    try {
      return LocalDate.parse(value);
    } catch (DateTimeParseException e) {
      throw new InvalidFieldException(name, "must be a date in YYYY-MM-DD format");
    }
  }

  private static LocalDateTime optDateTime(JsonNode args, String name) {
    String value = optText(args, name);
    if (value == null) {
      return null;
    }
    try {
      return LocalDateTime.parse(value.replace('T', ' '), APPOINTMENT_FORMAT);
    } catch (DateTimeParseException e) {
      throw new InvalidFieldException(name, "must be a date and time in YYYY-MM-DD HH:MM format");
    }
  }

  private static Double optDouble(JsonNode args, String name) {
    JsonNode node = args.get(name);
    if (node == null || node.isNull()) {
      return null;
    }
    if (node.isNumber()) {
      return node.asDouble();
    }
    String value = node.asText().trim().replace("$", "").replace(",", "");
    if (value.isEmpty()) {
      return null;
    }
    try {
      return Double.valueOf(value);
    } catch (NumberFormatException e) {
      throw new InvalidFieldException(name, "must be a number");
    }
  }

  private static int optInt(JsonNode args, String name, int defaultValue) {
    Double value = optDouble(args, name);
    if (value == null) {
      return defaultValue;
    }
    if (value != Math.rint(value)) {
      throw new InvalidFieldException(name, "must be a whole number");
    }
    return value.intValue();
  }

  private static boolean flag(JsonNode args, String name) {
    JsonNode node = args.get(name);
    if (node == null || node.isNull()) {
      return false;
    }
    if (node.isBoolean()) {
      return node.booleanValue();
    }
    String value = node.asText().trim().toLowerCase(Locale.ROOT);
    return value.equals("true") || value.equals("yes") || value.equals("y");
  }
}
