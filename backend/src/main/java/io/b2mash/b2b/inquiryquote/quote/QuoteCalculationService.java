package io.b2mash.b2b.inquiryquote.quote;

import io.b2mash.b2b.inquiryquote.catalog.CatalogEntry;
import io.b2mash.b2b.inquiryquote.catalog.DiscountSchedule;
import io.b2mash.b2b.inquiryquote.catalog.DiscountTier;
import io.b2mash.b2b.inquiryquote.catalog.ProductCatalog;
import io.b2mash.b2b.inquiryquote.extraction.ExtractedProduct;
import io.b2mash.b2b.inquiryquote.extraction.GapDetector;
import io.b2mash.b2b.inquiryquote.extraction.ParsedEvent;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import org.springframework.stereotype.Service;

/**
 * Stateless service that prices a parsed email. Every amount is rounded to scale 2 with HALF_UP,
 * and the subtotal is the sum of already-rounded line totals.
 */
@Service
public class QuoteCalculationService {

  static final String NO_PRODUCTS = "No products identified";
  private static final String UNKNOWN_PRODUCT = "Unknown product: ";

  private static final BigDecimal ZERO_AMOUNT = BigDecimal.ZERO.setScale(2);
  private static final BigDecimal ZERO_RATE = BigDecimal.ZERO.setScale(1);

  /**
   * Builds a complete quote when every product is in the catalog and has a quantity, otherwise a
   * pending quote listing why. Never throws for a well-formed event.
   *
   * @param event the parsed email
   * @param catalog price list
   * @param discounts discount tiers, matched on the subtotal
   * @param settings tax rate, default currency and validity period
   * @return the quote; {@code validUntil} is set for both outcomes
   */
  public Quote quote(
      ParsedEvent event,
      ProductCatalog catalog,
      DiscountSchedule discounts,
      QuoteSettings settings) {
    var reasons = new LinkedHashSet<String>(event.gaps());
    var lineItems = new ArrayList<QuoteLineItem>();

    for (ExtractedProduct product : event.products()) {
      Optional<CatalogEntry> entry = catalog.find(product.name());
      if (entry.isEmpty()) {
        reasons.add(UNKNOWN_PRODUCT + product.name());
      }
      if (product.quantity() == null) {
        reasons.add(GapDetector.missingQuantity(product.name()));
      }
      if (entry.isPresent() && product.quantity() != null) {
        String catalogName = catalog.resolveName(product.name()).orElse(product.name());
        lineItems.add(
            QuoteLineItem.of(
                catalogName, product.quantity(), entry.get().price(), entry.get().unit()));
      }
    }

    if (lineItems.isEmpty() && reasons.isEmpty()) {
      reasons.add(NO_PRODUCTS);
    }

    String currency = event.currency() != null ? event.currency() : settings.defaultCurrency();
    var validUntil = event.timestamp().plus(settings.quoteValidityDays(), ChronoUnit.DAYS);

    if (!reasons.isEmpty()) {
      return new Quote(
          event.emailId(),
          event.timestamp(),
          QuoteStatus.PENDING,
          List.of(),
          ZERO_AMOUNT,
          ZERO_AMOUNT,
          ZERO_AMOUNT,
          ZERO_AMOUNT,
          currency,
          List.copyOf(reasons),
          validUntil,
          ZERO_RATE);
    }

    BigDecimal subtotal =
        lineItems.stream()
            .map(QuoteLineItem::total)
            .reduce(BigDecimal.ZERO, BigDecimal::add)
            .setScale(2, RoundingMode.HALF_UP);

    Optional<DiscountTier> tier = discounts.select(subtotal);
    BigDecimal discount =
        tier.map(t -> roundMoney(subtotal.multiply(t.discount()))).orElse(ZERO_AMOUNT);
    BigDecimal discountRate = tier.map(DiscountTier::discountPercent).orElse(ZERO_RATE);

    BigDecimal taxable = subtotal.subtract(discount);
    BigDecimal tax = roundMoney(taxable.multiply(settings.taxRate()));
    BigDecimal total = roundMoney(taxable.add(tax));

    return new Quote(
        event.emailId(),
        event.timestamp(),
        QuoteStatus.COMPLETE,
        lineItems,
        subtotal,
        discount,
        tax,
        total,
        currency,
        List.of(),
        validUntil,
        discountRate);
  }

  static BigDecimal roundMoney(BigDecimal amount) {
    return amount.setScale(2, RoundingMode.HALF_UP);
  }
}
