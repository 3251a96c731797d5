package io.b2mash.b2b.inquiryquote.catalog;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Subtotal band with its discount fraction. The band is half-open: {@code minAmount} is included,
 * {@code maxAmount} is excluded. A null {@code maxAmount} means the band has no upper bound.
 *
 * @param minAmount inclusive lower bound
 * @param maxAmount exclusive upper bound, or null for unbounded
 * @param discount discount fraction in [0, 1] (e.g., 0.10 for 10%)
 */
public record DiscountTier(
    @JsonProperty("min_amount") BigDecimal minAmount,
    @JsonProperty("max_amount") BigDecimal maxAmount,
    BigDecimal discount) {

  private static final BigDecimal ONE_HUNDRED = new BigDecimal("100");

  public boolean contains(BigDecimal amount) {
    return minAmount.compareTo(amount) <= 0
        && (maxAmount == null || amount.compareTo(maxAmount) < 0);
  }

  @JsonIgnore
  public boolean isUnbounded() {
    return maxAmount == null;
  }

  /** Discount expressed as a percentage with one decimal place (0.10 becomes 10.0). */
  public BigDecimal discountPercent() {
    return discount.multiply(ONE_HUNDRED).setScale(1, RoundingMode.HALF_UP);
  }
}
