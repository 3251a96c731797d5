package io.b2mash.b2b.inquiryquote.config;

import io.b2mash.b2b.inquiryquote.acknowledgment.AcknowledgmentSettings;
import io.b2mash.b2b.inquiryquote.activity.ActivityTimeline;
import io.b2mash.b2b.inquiryquote.catalog.CatalogLoader;
import io.b2mash.b2b.inquiryquote.catalog.CatalogSnapshot;
import io.b2mash.b2b.inquiryquote.inbox.ArtifactStore;
import io.b2mash.b2b.inquiryquote.quote.QuoteSettings;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import tools.jackson.core.type.TypeReference;
import tools.jackson.databind.ObjectMapper;

/**
 * Builds the per-run configuration snapshot (catalog, quote settings, acknowledgment settings) and
 * the file-backed stores under the data directory. Everything here is loaded and validated once at
 * startup; a bad file stops the application before any email is read.
 */
@Configuration
@EnableConfigurationProperties(InquiryQuoteProperties.class)
public class InquiryQuoteConfig {

  private static final Logger log = LoggerFactory.getLogger(InquiryQuoteConfig.class);
  private static final String DEFAULTS_FILE = "defaults.json";

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  public ActivityTimeline activityTimeline(
      InquiryQuoteProperties properties, ObjectMapper objectMapper, Clock clock) {
    return new ActivityTimeline(
        properties.dataPath().resolve("timeline").resolve("activity.jsonl"), objectMapper, clock);
  }

  @Bean
  public ArtifactStore artifactStore(InquiryQuoteProperties properties, ObjectMapper objectMapper) {
    return new ArtifactStore(properties.dataPath(), objectMapper);
  }

  @Bean
  public CatalogSnapshot catalogSnapshot(
      CatalogLoader catalogLoader, InquiryQuoteProperties properties) {
    return catalogLoader.load(properties.configPath());
  }

  @Bean
  public SettingsOverrides settingsOverrides(
      ConfigFileReader configFileReader, InquiryQuoteProperties properties) {
    return configFileReader
        .readIfPresent(
            properties.configPath(), DEFAULTS_FILE, new TypeReference<SettingsOverrides>() {})
        .orElseGet(SettingsOverrides::empty);
  }

  @Bean
  public QuoteSettings quoteSettings(
      InquiryQuoteProperties properties, SettingsOverrides overrides) {
    var settings =
        new QuoteSettings(
            overrides.taxRate() != null ? overrides.taxRate() : properties.taxRate(),
            overrides.defaultCurrency() != null
                ? overrides.defaultCurrency()
                : properties.defaultCurrency(),
            overrides.quoteValidityDays() != null
                ? overrides.quoteValidityDays()
                : properties.quoteValidityDays());
    log.info(
        "Quote settings: taxRate={}, defaultCurrency={}, validityDays={}",
        settings.taxRate(),
        settings.defaultCurrency(),
        settings.quoteValidityDays());
    return settings;
  }

  @Bean
  public AcknowledgmentSettings acknowledgmentSettings(
      InquiryQuoteProperties properties, SettingsOverrides overrides) {
    return new AcknowledgmentSettings(
        overrides.companyName() != null ? overrides.companyName() : properties.companyName(),
        overrides.contactEmail() != null ? overrides.contactEmail() : properties.contactEmail(),
        overrides.slaHours() != null ? overrides.slaHours() : properties.slaHours());
  }
}
