package io.b2mash.b2b.inquiryquote.catalog;

import io.b2mash.b2b.inquiryquote.config.ConfigFileReader;
import io.b2mash.b2b.inquiryquote.exception.CatalogConfigurationException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import tools.jackson.core.type.TypeReference;

/**
 * Loads the price list ({@code price_list.json}) and discount rules ({@code discount_rules.json})
 * into an immutable {@link CatalogSnapshot}. Validation happens while the snapshot is built, so a
 * malformed catalog fails here rather than in the middle of a batch.
 */
@Service
public class CatalogLoader {

  private static final Logger log = LoggerFactory.getLogger(CatalogLoader.class);

  static final String PRICE_LIST_FILE = "price_list.json";
  static final String DISCOUNT_RULES_FILE = "discount_rules.json";

  private final ConfigFileReader configFileReader;

  public CatalogLoader(ConfigFileReader configFileReader) {
    this.configFileReader = configFileReader;
  }

  public CatalogSnapshot load(Path configDir) {
    LinkedHashMap<String, CatalogEntry> priceList =
        configFileReader.readOrDefault(
            configDir, PRICE_LIST_FILE, new TypeReference<LinkedHashMap<String, CatalogEntry>>() {});
    DiscountRules rules =
        configFileReader.readOrDefault(
            configDir, DISCOUNT_RULES_FILE, new TypeReference<DiscountRules>() {});

    if (priceList == null || priceList.isEmpty()) {
      throw new CatalogConfigurationException("Price list is empty");
    }

    var products = new ProductCatalog(priceList);
    var discounts =
        rules == null || rules.tiers() == null
            ? DiscountSchedule.none()
            : new DiscountSchedule(rules.tiers());

    log.info(
        "Catalog loaded: {} products, {} discount tiers",
        products.size(),
        discounts.tiers().size());
    return new CatalogSnapshot(products, discounts);
  }

  /** Shape of {@code discount_rules.json}. */
  public record DiscountRules(List<DiscountTier> tiers) {}
}
