package io.b2mash.b2b.inquiryquote.inbox;

/**
 * Counts for one inbox run. {@code total} is the number of {@code *.txt} files found; every file
 * is counted exactly once as processed, failed or skipped.
 */
public record InboxResult(int processed, int failed, int skipped, int total) {

  public static InboxResult empty() {
    return new InboxResult(0, 0, 0, 0);
  }

  public boolean hasFailures() {
    return failed > 0;
  }
}
