package io.b2mash.b2b.inquiryquote.inquiry;

import io.b2mash.b2b.inquiryquote.acknowledgment.Acknowledgment;
import io.b2mash.b2b.inquiryquote.acknowledgment.AcknowledgmentGenerator;
import io.b2mash.b2b.inquiryquote.catalog.CatalogSnapshot;
import io.b2mash.b2b.inquiryquote.extraction.EmailExtractor;
import io.b2mash.b2b.inquiryquote.extraction.ParsedEvent;
import io.b2mash.b2b.inquiryquote.quote.Quote;
import io.b2mash.b2b.inquiryquote.quote.QuoteCalculationService;
import io.b2mash.b2b.inquiryquote.quote.QuoteSettings;
import io.b2mash.b2b.inquiryquote.quote.QuoteSummaries;
import io.b2mash.b2b.inquiryquote.quote.QuoteValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Runs one email through extraction, acknowledgment and quoting against the startup catalog
 * snapshot. Shared by the HTTP endpoint and the inbox processor.
 */
@Service
public class InquiryService {

  private static final Logger log = LoggerFactory.getLogger(InquiryService.class);

  private final EmailExtractor emailExtractor;
  private final AcknowledgmentGenerator acknowledgmentGenerator;
  private final QuoteCalculationService quoteCalculationService;
  private final QuoteValidator quoteValidator;
  private final CatalogSnapshot catalogSnapshot;
  private final QuoteSettings quoteSettings;

  public InquiryService(
      EmailExtractor emailExtractor,
      AcknowledgmentGenerator acknowledgmentGenerator,
      QuoteCalculationService quoteCalculationService,
      QuoteValidator quoteValidator,
      CatalogSnapshot catalogSnapshot,
      QuoteSettings quoteSettings) {
    this.emailExtractor = emailExtractor;
    this.acknowledgmentGenerator = acknowledgmentGenerator;
    this.quoteCalculationService = quoteCalculationService;
    this.quoteValidator = quoteValidator;
    this.catalogSnapshot = catalogSnapshot;
    this.quoteSettings = quoteSettings;
  }

  public ParsedEvent extract(String rawContent) {
    return emailExtractor.extract(rawContent);
  }

  public Acknowledgment acknowledge(ParsedEvent event) {
    return acknowledgmentGenerator.generate(event);
  }

  /** Prices the event. Validation problems are logged, never thrown. */
  public Quote quote(ParsedEvent event) {
    var quote =
        quoteCalculationService.quote(
            event, catalogSnapshot.products(), catalogSnapshot.discounts(), quoteSettings);
    var errors = quoteValidator.validate(quote);
    if (!errors.isEmpty()) {
      log.warn("Quote for email {} failed validation: {}", event.emailId(), errors);
    }
    log.debug("Quote for email {}: {}", event.emailId(), QuoteSummaries.summarize(quote));
    return quote;
  }

  public InquiryResult process(String rawContent) {
    var event = extract(rawContent);
    return new InquiryResult(event, quote(event), acknowledge(event));
  }
}
