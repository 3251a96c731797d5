package io.b2mash.b2b.inquiryquote.extraction;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.b2mash.b2b.inquiryquote.catalog.CatalogEntry;
import io.b2mash.b2b.inquiryquote.catalog.CatalogFixtures;
import io.b2mash.b2b.inquiryquote.catalog.CatalogSnapshot;
import io.b2mash.b2b.inquiryquote.catalog.DiscountSchedule;
import io.b2mash.b2b.inquiryquote.catalog.ProductCatalog;
import io.b2mash.b2b.inquiryquote.exception.EmptyInputException;
import io.b2mash.b2b.inquiryquote.quote.QuoteCalculationService;
import io.b2mash.b2b.inquiryquote.quote.QuoteSettings;
import io.b2mash.b2b.inquiryquote.quote.QuoteStatus;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import org.junit.jupiter.api.Test;

class EmailExtractorTest {

  private static final Instant NOW = Instant.parse("2024-01-15T10:00:00Z");

  private final EmailExtractor extractor =
      new EmailExtractor(CatalogFixtures.defaultSnapshot(), Clock.fixed(NOW, ZoneOffset.UTC));

  @Test
  void extract_completeRequest() {
    var email =
        """
        From: John Smith <john.smith@example.com>
        Subject: Quote request

        Hi,

        I need 10 Widget Pro units ASAP. Please quote in USD.

        Best regards,
        John
        """;

    var event = extractor.extract(email);

    assertThat(event.emailId()).hasSize(8).isEqualTo(EmailIds.fromContent(email));
    assertThat(event.timestamp()).isEqualTo(NOW);
    assertThat(event.sender().name()).isEqualTo("John Smith");
    assertThat(event.sender().email()).isEqualTo("john.smith@example.com");
    assertThat(event.sender().confidence()).isEqualTo(1.0);
    assertThat(event.urgency()).isEqualTo(Urgency.HIGH);
    assertThat(event.currency()).isEqualTo("USD");
    assertThat(event.gaps()).isEmpty();
    assertThat(event.rawContent()).isEqualTo(email);
    assertThat(event.products())
        .singleElement()
        .satisfies(
            product -> {
              assertThat(product.name()).isEqualTo("Widget Pro");
              assertThat(product.quantity()).isEqualByComparingTo("10");
              assertThat(product.unit()).isEqualTo("unit");
              assertThat(product.confidence()).isEqualTo(1.0);
              assertThat(product.notes()).isEqualTo("Complete information extracted");
            });
  }

  @Test
  void extract_missingQuantity_addsGap() {
    var event =
        extractor.extract(
            """
            From: jane@example.com

            Could you send pricing for Tool Kit?
            """);

    assertThat(event.gaps()).containsExactly("Missing quantity for Tool Kit");
    assertThat(event.products())
        .singleElement()
        .satisfies(
            product -> {
              assertThat(product.quantity()).isNull();
              assertThat(product.confidence()).isEqualTo(0.9);
              assertThat(product.notes()).isEqualTo("Quantity not specified; Unit not specified");
            });
    assertThat(event.sender().name()).isNull();
    assertThat(event.sender().email()).isEqualTo("jane@example.com");
    assertThat(event.sender().confidence()).isEqualTo(SenderInfo.PARTIAL_CONFIDENCE);
  }

  @Test
  void extract_severalProductsOnOneLine_keepTheirOwnQuantities() {
    var event = extractor.extract("We need 10 Widget Pro and 5 Gadget Basic for the new site.");

    assertThat(event.products())
        .extracting(ExtractedProduct::name)
        .containsExactly("Widget Pro", "Gadget Basic");
    assertThat(event.products().get(0).quantity()).isEqualByComparingTo("10");
    assertThat(event.products().get(1).quantity()).isEqualByComparingTo("5");
  }

  @Test
  void extract_quantityInFrontOfNextProduct_isNotShared() {
    var event = extractor.extract("Please quote Widget Pro and 5 Tool Kit.");

    assertThat(event.products().get(0).quantity()).isNull();
    assertThat(event.products().get(1).quantity()).isEqualByComparingTo("5");
    assertThat(event.gaps()).containsExactly("Missing quantity for Widget Pro");

    var quote =
        new QuoteCalculationService()
            .quote(
                event,
                CatalogFixtures.defaultCatalog(),
                CatalogFixtures.defaultTiers(),
                new QuoteSettings(new BigDecimal("0.095"), "USD", 7));
    assertThat(quote.status()).isEqualTo(QuoteStatus.PENDING);
    assertThat(quote.pendingReasons()).containsExactly("Missing quantity for Widget Pro");
  }

  @Test
  void extract_quantityLaterInSentence_belongsToItsOwnProduct() {
    var event = extractor.extract("I need Widget Pro, also 10 Gadget Basic");

    assertThat(event.products())
        .extracting(ExtractedProduct::name)
        .containsExactly("Widget Pro", "Gadget Basic");
    assertThat(event.products().get(0).quantity()).isNull();
    assertThat(event.products().get(1).quantity()).isEqualByComparingTo("10");
  }

  @Test
  void extract_quantityAfterName_isNotReusedForNextProduct() {
    var event = extractor.extract("Widget Pro 5, Gadget Basic please");

    assertThat(event.products().get(0).quantity()).isEqualByComparingTo("5");
    assertThat(event.products().get(1).quantity()).isNull();
    assertThat(event.gaps()).containsExactly("Missing quantity for Gadget Basic");
  }

  @Test
  void extract_multiplierGluedToQuantity() {
    assertThat(extractor.extract("Widget Pro x10").products().get(0).quantity())
        .isEqualByComparingTo("10");
    assertThat(extractor.extract("Widget Pro ×3").products().get(0).quantity())
        .isEqualByComparingTo("3");
  }

  @Test
  void extract_repeatedMentionWithoutQuantity_hasOneGap() {
    var event =
        extractor.extract(
            """
            Do you stock Widget Pro?
            What does Widget Pro cost?
            """);

    assertThat(event.products()).hasSize(1);
    assertThat(event.gaps()).containsExactly("Missing quantity for Widget Pro");
  }

  @Test
  void extract_quantityWithoutUnit_hasNoGap() {
    var event = extractor.extract("Please quote 3 Tool Kit");

    assertThat(event.products().get(0).unit()).isNull();
    assertThat(event.products().get(0).quantity()).isEqualByComparingTo("3");
    assertThat(event.gaps()).isEmpty();
  }

  @Test
  void extract_quantityAfterName_withUnit() {
    var event = extractor.extract("Widget Pro: 15 pieces please");

    assertThat(event.products().get(0).quantity()).isEqualByComparingTo("15");
    assertThat(event.products().get(0).unit()).isEqualTo("piece");
  }

  @Test
  void extract_thousandsSeparator() {
    var event = extractor.extract("Please quote 1,000 Bulk Pack.");

    assertThat(event.products().get(0).quantity()).isEqualByComparingTo("1000");
  }

  @Test
  void extract_ignoresQuotedReplyLines() {
    var event =
        extractor.extract(
            """
            Please quote 5 Gadget Basic.

            > On Monday you wrote:
            > I need 100 Premium Widget
            """);

    assertThat(event.products()).extracting(ExtractedProduct::name).containsExactly("Gadget Basic");
  }

  @Test
  void extract_ignoresSignatureBlock() {
    var event =
        extractor.extract(
            """
            Please quote 2 Tool Kit.

            --
            John Smith
            Order 3 Premium Widget from our catalogue
            """);

    assertThat(event.products()).extracting(ExtractedProduct::name).containsExactly("Tool Kit");
  }

  @Test
  void extract_repeatedMention_isDeduplicated() {
    var event =
        extractor.extract(
            """
            Subject: Widget Pro pricing

            We would like 5 Widget Pro. The Widget Pro must ship in blue.
            """);

    assertThat(event.products())
        .singleElement()
        .satisfies(
            product -> {
              assertThat(product.name()).isEqualTo("Widget Pro");
              assertThat(product.quantity()).isEqualByComparingTo("5");
            });
    assertThat(event.gaps()).isEmpty();
  }

  @Test
  void extract_longestCatalogNameWins() {
    var entries = new LinkedHashMap<String, CatalogEntry>();
    entries.put("Widget", new CatalogEntry(BigDecimal.ONE, null, null));
    entries.put("Widget Pro", new CatalogEntry(BigDecimal.TEN, null, null));
    var snapshot = new CatalogSnapshot(new ProductCatalog(entries), DiscountSchedule.none());
    var overlapping = new EmailExtractor(snapshot, Clock.fixed(NOW, ZoneOffset.UTC));

    var event = overlapping.extract("I need 10 Widget Pro");

    assertThat(event.products()).extracting(ExtractedProduct::name).containsExactly("Widget Pro");
  }

  @Test
  void extract_unknownItem_isReportedByName() {
    var event = extractor.extract("I would like 20 Super Gizmo for our office.");

    assertThat(event.products())
        .singleElement()
        .satisfies(
            product -> {
              assertThat(product.name()).isEqualTo("Super Gizmo");
              assertThat(product.quantity()).isEqualByComparingTo("20");
            });
  }

  @Test
  void extract_datesAreNotProducts() {
    var event = extractor.extract("Delivery by 15 March would be great, 3 Tool Kit please.");

    assertThat(event.products()).extracting(ExtractedProduct::name).containsExactly("Tool Kit");
    assertThat(event.products().get(0).quantity()).isEqualByComparingTo("3");
  }

  @Test
  void extract_currencySymbol() {
    assertThat(extractor.extract("Budget is €500 for 4 Widget Pro").currency()).isEqualTo("EUR");
    assertThat(extractor.extract("Budget is £500 for 4 Widget Pro").currency()).isEqualTo("GBP");
    assertThat(extractor.extract("4 Widget Pro please").currency()).isNull();
  }

  @Test
  void extract_urgencyLevels() {
    assertThat(extractor.extract("We need this urgently: 2 Tool Kit").urgency())
        .isEqualTo(Urgency.HIGH);
    assertThat(extractor.extract("Please reply soon about 2 Tool Kit").urgency())
        .isEqualTo(Urgency.MEDIUM);
    assertThat(extractor.extract("No rush on 2 Tool Kit").urgency()).isEqualTo(Urgency.LOW);
    assertThat(extractor.extract("This is not urgent, 2 Tool Kit").urgency())
        .isEqualTo(Urgency.LOW);
    assertThat(extractor.extract("This is low priority, 2 Tool Kit").urgency())
        .isEqualTo(Urgency.LOW);
    assertThat(extractor.extract("High priority order: 2 Tool Kit").urgency())
        .isEqualTo(Urgency.MEDIUM);
    assertThat(extractor.extract("2 Tool Kit please").urgency()).isNull();
  }

  @Test
  void extract_noSender() {
    var event = extractor.extract("Please quote 2 Tool Kit.");

    assertThat(event.sender()).isEqualTo(SenderInfo.unknown());
  }

  @Test
  void extract_noProducts_hasNoGaps() {
    var event = extractor.extract("Hello, what do you sell?");

    assertThat(event.products()).isEmpty();
    assertThat(event.gaps()).isEmpty();
  }

  @Test
  void extract_isDeterministic() {
    var email = "From: a@example.com\n\n10 Widget Pro";

    var first = extractor.extract(email);
    var second = extractor.extract(email);

    assertThat(first).isEqualTo(second);
    assertThat(extractor.extract(email + " ").emailId()).isNotEqualTo(first.emailId());
  }

  @Test
  void extract_blankContent_isRejected() {
    assertThatThrownBy(() -> extractor.extract("   \n  "))
        .isInstanceOf(EmptyInputException.class);
    assertThatThrownBy(() -> extractor.extract(null)).isInstanceOf(EmptyInputException.class);
  }
}
