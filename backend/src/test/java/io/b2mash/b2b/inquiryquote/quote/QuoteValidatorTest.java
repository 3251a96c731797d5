package io.b2mash.b2b.inquiryquote.quote;

import static org.assertj.core.api.Assertions.assertThat;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;

class QuoteValidatorTest {

  private static final Instant NOW = Instant.parse("2024-01-15T10:00:00Z");

  private final QuoteValidator validator = new QuoteValidator();

  @Test
  void validate_consistentCompleteQuote_hasNoErrors() {
    var item = QuoteLineItem.of("Widget Pro", BigDecimal.TEN, new BigDecimal("25.00"), "piece");
    var quote = complete(List.of(item), "250.00", "246.38");

    assertThat(validator.validate(quote)).isEmpty();
  }

  @Test
  void validate_subtotalMismatch_isReported() {
    var item = QuoteLineItem.of("Widget Pro", BigDecimal.TEN, new BigDecimal("25.00"), "piece");
    var quote = complete(List.of(item), "240.00", "236.88");

    assertThat(validator.validate(quote)).singleElement().asString().contains("does not match");
  }

  @Test
  void validate_completeWithoutItems_isReported() {
    var quote = complete(List.of(), "0.00", "0.00");

    assertThat(validator.validate(quote))
        .contains("Complete quote has no line items")
        .anyMatch(error -> error.startsWith("Complete quote total must be positive"));
  }

  @Test
  void validate_pendingWithoutReasons_isReported() {
    var zero = new BigDecimal("0.00");
    var quote =
        new Quote(
            "abc12345",
            NOW,
            QuoteStatus.PENDING,
            List.of(),
            zero,
            zero,
            zero,
            zero,
            "USD",
            List.of(),
            NOW,
            new BigDecimal("0.0"));

    assertThat(validator.validate(quote)).containsExactly("Pending quote has no pending reasons");
  }

  @Test
  void summarize_rendersOneLine() {
    var item = QuoteLineItem.of("Widget Pro", BigDecimal.TEN, new BigDecimal("25.00"), "piece");

    assertThat(QuoteSummaries.summarize(complete(List.of(item), "250.00", "246.38")))
        .isEqualTo("10 Widget Pro - USD 246.38");
  }

  private static Quote complete(List<QuoteLineItem> items, String subtotal, String total) {
    return new Quote(
        "abc12345",
        NOW,
        QuoteStatus.COMPLETE,
        items,
        new BigDecimal(subtotal),
        BigDecimal.ZERO,
        BigDecimal.ZERO,
        new BigDecimal(total),
        "USD",
        List.of(),
        NOW,
        new BigDecimal("0.0"));
  }
}
