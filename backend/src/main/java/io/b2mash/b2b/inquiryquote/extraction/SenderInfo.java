package io.b2mash.b2b.inquiryquote.extraction;

/**
 * Sender identity taken from the {@code From:} header.
 *
 * @param name display name, or null when none was found
 * @param email address, or null when none was found
 * @param confidence 1.0 when both were found, {@link #PARTIAL_CONFIDENCE} when one was, 0.0 when
 *     neither was
 */
public record SenderInfo(String name, String email, double confidence) {

  public static final double PARTIAL_CONFIDENCE = 0.6;

  public static SenderInfo unknown() {
    return new SenderInfo(null, null, 0.0);
  }
}
