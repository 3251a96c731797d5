package io.b2mash.b2b.inquiryquote.acknowledgment;

import io.b2mash.b2b.inquiryquote.exception.CatalogConfigurationException;

/** Company details and response-time promise used when writing acknowledgments. */
public record AcknowledgmentSettings(String companyName, String contactEmail, int slaHours) {

  public AcknowledgmentSettings {
    if (slaHours <= 0) {
      throw new CatalogConfigurationException("sla_hours must be positive, was " + slaHours);
    }
  }
}
