package io.b2mash.b2b.inquiryquote.extraction;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.Test;

class ProductMatcherTest {

  private final ProductMatcher matcher =
      new ProductMatcher(List.of("Widget Pro", "Gadget Basic", "Tool Kit"));

  @Test
  void findMatches_quantityWithMultiplier() {
    var matches = matcher.findMatches(List.of("Gadget Basic x 12"));

    assertThat(matches)
        .singleElement()
        .satisfies(
            match -> {
              assertThat(match.inCatalog()).isTrue();
              assertThat(match.quantity()).isEqualByComparingTo("12");
            });
  }

  @Test
  void findMatches_unitBeforeName() {
    var matches = matcher.findMatches(List.of("Please send 3 kits of Tool Kit"));

    assertThat(matches.get(0).quantity()).isEqualByComparingTo("3");
    assertThat(matches.get(0).unit()).isEqualTo("kit");
  }

  @Test
  void findMatches_laterLineFillsMissingQuantity() {
    var matches = matcher.findMatches(List.of("About the widget pro:", "we need 7 of them"));

    assertThat(matches).hasSize(1);
    assertThat(matches.get(0).quantity()).isNull();

    var filled = matcher.findMatches(List.of("About Widget Pro", "7 Widget Pro please"));

    assertThat(filled).singleElement().extracting(ProductMatch::quantity).asString().isEqualTo("7");
  }

  @Test
  void findMatches_ignoresPricesAndOrderNumbers() {
    var matches = matcher.findMatches(List.of("Order #4521 for Tool Kit at $45.00 each"));

    assertThat(matches.get(0).quantity()).isNull();
  }

  @Test
  void findMatches_nameMatchIsCaseInsensitiveButReportsCatalogKey() {
    var matches = matcher.findMatches(List.of("4 WIDGET   pro"));

    assertThat(matches.get(0).name()).isEqualTo("Widget Pro");
  }

  @Test
  void canonicalUnit_normalizesPlurals() {
    assertThat(ProductMatcher.canonicalUnit("pcs")).isEqualTo("piece");
    assertThat(ProductMatcher.canonicalUnit("Boxes")).isEqualTo("box");
    assertThat(ProductMatcher.canonicalUnit("packs")).isEqualTo("pack");
    assertThat(ProductMatcher.canonicalUnit("set")).isEqualTo("set");
  }
}
