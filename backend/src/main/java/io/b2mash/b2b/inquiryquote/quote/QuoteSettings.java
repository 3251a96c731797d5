package io.b2mash.b2b.inquiryquote.quote;

import io.b2mash.b2b.inquiryquote.exception.CatalogConfigurationException;
import java.math.BigDecimal;

/**
 * Read-only inputs to the quoting engine.
 *
 * @param taxRate tax fraction in [0, 1], applied to the discounted subtotal
 * @param defaultCurrency currency used when the email names none
 * @param quoteValidityDays calendar days added to the extraction instant for {@code valid_until}
 */
public record QuoteSettings(BigDecimal taxRate, String defaultCurrency, int quoteValidityDays) {

  public QuoteSettings {
    if (taxRate == null || taxRate.signum() < 0 || taxRate.compareTo(BigDecimal.ONE) > 0) {
      throw new CatalogConfigurationException("tax_rate must be within [0, 1], was " + taxRate);
    }
    if (defaultCurrency == null || defaultCurrency.isBlank()) {
      throw new CatalogConfigurationException("default_currency must not be blank");
    }
    if (quoteValidityDays < 0) {
      throw new CatalogConfigurationException(
          "quote_validity_days must not be negative, was " + quoteValidityDays);
    }
  }
}
