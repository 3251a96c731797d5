package io.b2mash.b2b.inquiryquote.extraction;

import static org.assertj.core.api.Assertions.assertThat;

import java.math.BigDecimal;
import java.util.List;
import org.junit.jupiter.api.Test;

class GapDetectorTest {

  private final GapDetector detector = new GapDetector();

  @Test
  void detectGaps_missingQuantity_isAGap() {
    var gaps =
        detector.detectGaps(
            List.of(
                new ProductMatch("Widget Pro", true, null, null),
                new ProductMatch("Tool Kit", true, new BigDecimal("2"), "kit")));

    assertThat(gaps).containsExactly("Missing quantity for Widget Pro");
  }

  @Test
  void detectGaps_quantityWithoutUnit_isNotAGap() {
    var gaps =
        detector.detectGaps(List.of(new ProductMatch("Tool Kit", true, BigDecimal.TEN, null)));

    assertThat(gaps).isEmpty();
  }

  @Test
  void detectGaps_sameProductTwice_reportsOnce() {
    var gaps =
        detector.detectGaps(
            List.of(
                new ProductMatch("Widget Pro", true, null, null),
                new ProductMatch("Widget Pro", true, null, "piece")));

    assertThat(gaps).containsExactly("Missing quantity for Widget Pro");
  }

  @Test
  void detectGaps_noProducts_isEmpty() {
    assertThat(detector.detectGaps(List.of())).isEmpty();
  }
}
