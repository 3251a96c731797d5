package io.b2mash.b2b.inquiryquote.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.math.BigDecimal;

/** Shape of {@code defaults.json}. Every field is optional; absent fields keep the property value. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SettingsOverrides(
    @JsonProperty("tax_rate") BigDecimal taxRate,
    @JsonProperty("default_currency") String defaultCurrency,
    @JsonProperty("quote_validity_days") Integer quoteValidityDays,
    @JsonProperty("sla_hours") Integer slaHours,
    @JsonProperty("company_name") String companyName,
    @JsonProperty("contact_email") String contactEmail) {

  static SettingsOverrides empty() {
    return new SettingsOverrides(null, null, null, null, null, null);
  }
}
