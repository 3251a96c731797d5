package io.b2mash.b2b.inquiryquote.config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import java.math.BigDecimal;
import java.nio.file.Path;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration for quoting, acknowledgments and the inbox pipeline. Values in {@code
 * <configDir>/defaults.json} take precedence over these when that file exists.
 *
 * @param taxRate tax fraction applied after discount (e.g., 0.095 for 9.5%)
 * @param defaultCurrency currency used when an email names none
 * @param quoteValidityDays calendar days a quote stays valid
 * @param slaHours promised response time quoted in acknowledgments
 * @param companyName company signing acknowledgments
 * @param contactEmail contact address quoted in acknowledgments
 * @param configDir directory holding price_list.json, discount_rules.json and defaults.json
 * @param dataDir root directory for events, outbox, quotes and timeline artifacts
 * @param workers number of emails processed concurrently by the inbox processor
 */
@Validated
@ConfigurationProperties(prefix = "inquiry.quote")
public record InquiryQuoteProperties(
    @NotNull @DecimalMin("0") @DecimalMax("1") BigDecimal taxRate,
    @NotBlank String defaultCurrency,
    @PositiveOrZero int quoteValidityDays,
    @Positive int slaHours,
    @NotBlank String companyName,
    @NotBlank String contactEmail,
    @NotBlank String configDir,
    @NotBlank String dataDir,
    @Positive int workers) {

  public Path configPath() {
    return Path.of(configDir);
  }

  public Path dataPath() {
    return Path.of(dataDir);
  }
}
