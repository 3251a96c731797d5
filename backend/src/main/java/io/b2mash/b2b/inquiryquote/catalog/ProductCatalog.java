package io.b2mash.b2b.inquiryquote.catalog;

import io.b2mash.b2b.inquiryquote.exception.CatalogConfigurationException;
import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable price list keyed by product name. Lookups accept the exact key or any spelling that
 * differs only in case and whitespace, and always resolve to the exact catalog key.
 */
public final class ProductCatalog {

  private final Map<String, CatalogEntry> entries;
  private final Map<String, String> keysByNormalizedName;

  public ProductCatalog(Map<String, CatalogEntry> entries) {
    var copy = new LinkedHashMap<String, CatalogEntry>();
    var keys = new LinkedHashMap<String, String>();
    entries.forEach(
        (name, entry) -> {
          if (name == null || name.isBlank()) {
            throw new CatalogConfigurationException("Price list contains a blank product name");
          }
          if (entry == null || entry.price() == null) {
            throw new CatalogConfigurationException("No price configured for product " + name);
          }
          if (entry.price().compareTo(BigDecimal.ZERO) <= 0) {
            throw new CatalogConfigurationException(
                "Price for product " + name + " must be positive, was " + entry.price());
          }
          String previous = keys.putIfAbsent(normalize(name), name);
          if (previous != null) {
            throw new CatalogConfigurationException(
                "Products '" + previous + "' and '" + name + "' differ only in case or spacing");
          }
          copy.put(name, entry);
        });
    this.entries = Collections.unmodifiableMap(copy);
    this.keysByNormalizedName = Collections.unmodifiableMap(keys);
  }

  /** Resolves a free-text product name to its exact catalog key. */
  public Optional<String> resolveName(String name) {
    if (name == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(keysByNormalizedName.get(normalize(name)));
  }

  public Optional<CatalogEntry> find(String name) {
    return resolveName(name).map(entries::get);
  }

  /** Product names in price list order. */
  public Set<String> productNames() {
    return entries.keySet();
  }

  public Map<String, CatalogEntry> entries() {
    return entries;
  }

  public int size() {
    return entries.size();
  }

  static String normalize(String name) {
    return name.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
  }
}
