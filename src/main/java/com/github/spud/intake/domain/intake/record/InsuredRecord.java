package com.github.spud.intake.domain.intake.record;

import com.github.spud.intake.domain.intake.InsuranceType;

/**
 * One collected intake record. Each insurance type has exactly one implementation.
 */
public interface InsuredRecord {

  InsuranceType insuranceType();

  /**
   * Name the record is filed under: the insured person, or the business for commercial
   */
  String primaryName();

  /**
   * Contact details, when the record carries any
   */
  ContactInfo contactInfo();
}
