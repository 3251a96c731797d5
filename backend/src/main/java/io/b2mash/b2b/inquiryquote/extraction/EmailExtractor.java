package io.b2mash.b2b.inquiryquote.extraction;

import io.b2mash.b2b.inquiryquote.catalog.CatalogSnapshot;
import io.b2mash.b2b.inquiryquote.exception.EmptyInputException;
import java.time.Clock;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Turns raw email text into a {@link ParsedEvent}. Each field is extracted independently from the
 * cleaned text; ambiguity lowers a confidence score or adds a gap but never raises. The only
 * failure is blank input.
 *
 * <p>Only the catalog's product names are used here, so that mentions can be normalized to exact
 * catalog keys. Prices are the quoting engine's concern.
 */
@Service
public class EmailExtractor {

  private static final Logger log = LoggerFactory.getLogger(EmailExtractor.class);

  private final Clock clock;
  private final EmailTextCleaner cleaner = new EmailTextCleaner();
  private final SenderExtractor senderExtractor = new SenderExtractor();
  private final UrgencyDetector urgencyDetector = new UrgencyDetector();
  private final CurrencyDetector currencyDetector = new CurrencyDetector();
  private final ConfidenceScorer confidenceScorer = new ConfidenceScorer();
  private final GapDetector gapDetector = new GapDetector();
  private final ProductMatcher productMatcher;

  public EmailExtractor(CatalogSnapshot catalogSnapshot, Clock clock) {
    this.clock = clock;
    this.productMatcher = new ProductMatcher(catalogSnapshot.products().productNames());
  }

  /**
   * Extracts sender, products, urgency, currency and gaps from an email.
   *
   * @param rawContent the email as received
   * @return the parsed event; {@code rawContent} is kept verbatim
   * @throws EmptyInputException if the content is null or blank
   */
  public ParsedEvent extract(String rawContent) {
    if (rawContent == null || rawContent.isBlank()) {
      throw new EmptyInputException("Email content is empty");
    }

    String emailId = EmailIds.fromContent(rawContent);
    List<String> lines = cleaner.cleanLines(rawContent);
    String text = String.join("\n", lines);

    List<ProductMatch> matches = productMatcher.findMatches(lines);
    List<ExtractedProduct> products =
        matches.stream()
            .map(
                match ->
                    new ExtractedProduct(
                        match.name(),
                        match.quantity(),
                        match.unit(),
                        confidenceScorer.score(match),
                        confidenceScorer.notes(match)))
            .toList();

    var event =
        new ParsedEvent(
            emailId,
            clock.instant(),
            senderExtractor.extract(text),
            products,
            urgencyDetector.detect(text),
            currencyDetector.detect(text),
            gapDetector.detectGaps(matches),
            rawContent);

    log.debug(
        "Extracted email {}: {} products, {} gaps, urgency={}, currency={}",
        emailId,
        products.size(),
        event.gaps().size(),
        event.urgency(),
        event.currency());
    return event;
  }
}
