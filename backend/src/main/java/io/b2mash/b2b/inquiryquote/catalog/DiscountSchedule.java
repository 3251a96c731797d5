package io.b2mash.b2b.inquiryquote.catalog;

import io.b2mash.b2b.inquiryquote.exception.CatalogConfigurationException;
import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

/**
 * Ordered, validated list of discount tiers. Tiers must start at a non-negative amount, be listed
 * in ascending order and touch each other exactly (each tier's minimum equals the previous tier's
 * maximum), so that any subtotal falls into at most one tier. Only the last tier may be unbounded.
 */
public final class DiscountSchedule {

  private final List<DiscountTier> tiers;

  public DiscountSchedule(List<DiscountTier> tiers) {
    this.tiers = List.copyOf(tiers);
    validate(this.tiers);
  }

  public static DiscountSchedule none() {
    return new DiscountSchedule(List.of());
  }

  /**
   * Selects the first tier whose half-open range contains the subtotal. A subtotal equal to a
   * tier's maximum belongs to the next tier.
   */
  public Optional<DiscountTier> select(BigDecimal subtotal) {
    for (DiscountTier tier : tiers) {
      if (tier.contains(subtotal)) {
        return Optional.of(tier);
      }
    }
    return Optional.empty();
  }

  public List<DiscountTier> tiers() {
    return tiers;
  }

  private static void validate(List<DiscountTier> tiers) {
    DiscountTier previous = null;
    for (int i = 0; i < tiers.size(); i++) {
      DiscountTier tier = tiers.get(i);
      if (tier == null || tier.minAmount() == null || tier.discount() == null) {
        throw new CatalogConfigurationException(
            "Discount tier " + i + " must define min_amount and discount");
      }
      if (tier.minAmount().signum() < 0) {
        throw new CatalogConfigurationException(
            "Discount tier " + i + " has a negative min_amount " + tier.minAmount());
      }
      if (tier.maxAmount() != null && tier.maxAmount().compareTo(tier.minAmount()) <= 0) {
        throw new CatalogConfigurationException(
            "Discount tier "
                + i
                + " is inverted: max_amount "
                + tier.maxAmount()
                + " is not above min_amount "
                + tier.minAmount());
      }
      if (tier.discount().signum() < 0 || tier.discount().compareTo(BigDecimal.ONE) > 0) {
        throw new CatalogConfigurationException(
            "Discount tier " + i + " has a discount outside [0, 1]: " + tier.discount());
      }
      if (previous != null) {
        if (previous.isUnbounded()) {
          throw new CatalogConfigurationException(
              "Discount tier " + (i - 1) + " is unbounded but is not the last tier");
        }
        int cmp = tier.minAmount().compareTo(previous.maxAmount());
        if (cmp < 0) {
          throw new CatalogConfigurationException(
              "Discount tier " + i + " overlaps the previous tier at " + tier.minAmount());
        }
        if (cmp > 0) {
          throw new CatalogConfigurationException(
              "Discount tiers leave a gap between "
                  + previous.maxAmount()
                  + " and "
                  + tier.minAmount());
        }
      }
      previous = tier;
    }
  }
}
