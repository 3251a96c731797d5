package io.b2mash.b2b.inquiryquote.quote;

/** One-line renderings of a quote for logs and the command-line report. */
public final class QuoteSummaries {

  private QuoteSummaries() {}

  public static String summarize(Quote quote) {
    if (!quote.isComplete()) {
      return "Quote pending: " + String.join(", ", quote.pendingReasons());
    }
    if (quote.lineItems().size() == 1) {
      QuoteLineItem item = quote.lineItems().get(0);
      return String.format(
          "%s %s - %s %s",
          item.quantity().stripTrailingZeros().toPlainString(),
          item.product(),
          quote.currency(),
          quote.total().toPlainString());
    }
    return String.format(
        "%d items - %s %s",
        quote.lineItems().size(), quote.currency(), quote.total().toPlainString());
  }
}
