package io.b2mash.b2b.inquiryquote.inbox;

import io.b2mash.b2b.inquiryquote.activity.ActivityAction;
import io.b2mash.b2b.inquiryquote.activity.ActivityTimeline;
import io.b2mash.b2b.inquiryquote.config.InquiryQuoteProperties;
import io.b2mash.b2b.inquiryquote.exception.ResourceNotFoundException;
import io.b2mash.b2b.inquiryquote.extraction.EmailIds;
import io.b2mash.b2b.inquiryquote.inquiry.InquiryService;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Processes every {@code *.txt} email in an inbox directory. A failing email is logged and
 * recorded on the timeline; the remaining emails still run. Emails whose event artifact already
 * exists are skipped, so re-running an inbox is safe.
 */
@Service
public class InboxProcessor {

  private static final Logger log = LoggerFactory.getLogger(InboxProcessor.class);
  static final String SYSTEM_ID = "system";

  private enum Outcome {
    PROCESSED,
    SKIPPED,
    FAILED
  }

  private final InquiryService inquiryService;
  private final ArtifactStore artifactStore;
  private final ActivityTimeline activityTimeline;
  private final int workers;

  public InboxProcessor(
      InquiryService inquiryService,
      ArtifactStore artifactStore,
      ActivityTimeline activityTimeline,
      InquiryQuoteProperties properties) {
    this.inquiryService = inquiryService;
    this.artifactStore = artifactStore;
    this.activityTimeline = activityTimeline;
    this.workers = properties.workers();
  }

  /**
   * Runs the pipeline over an inbox directory.
   *
   * @param inbox directory holding {@code *.txt} emails
   * @return per-run counts
   * @throws ResourceNotFoundException if the directory does not exist
   */
  public InboxResult processInbox(Path inbox) {
    if (!Files.isDirectory(inbox)) {
      throw new ResourceNotFoundException("Inbox directory", inbox);
    }

    List<Path> emails = listEmails(inbox);
    if (emails.isEmpty()) {
      activityTimeline.log(ActivityAction.INFO, SYSTEM_ID, "No .txt files found in " + inbox);
      log.info("No .txt files found in {}", inbox);
      return InboxResult.empty();
    }

    activityTimeline.log(
        ActivityAction.START,
        SYSTEM_ID,
        "Processing " + emails.size() + " emails from " + inbox);
    log.info("Processing {} emails from {} with {} worker(s)", emails.size(), inbox, workers);

    Set<String> claimed = ConcurrentHashMap.newKeySet();
    List<Outcome> outcomes =
        workers > 1 ? runParallel(emails, claimed) : runSequential(emails, claimed);

    int processed = 0;
    int failed = 0;
    int skipped = 0;
    for (Outcome outcome : outcomes) {
      switch (outcome) {
        case PROCESSED -> processed++;
        case FAILED -> failed++;
        case SKIPPED -> skipped++;
      }
    }
    var result = new InboxResult(processed, failed, skipped, emails.size());

    activityTimeline.log(
        ActivityAction.COMPLETE,
        SYSTEM_ID,
        "Processed " + processed + ", failed " + failed + ", skipped " + skipped,
        Map.of(
            "processed", processed, "failed", failed, "skipped", skipped, "total", emails.size()));
    log.info(
        "Inbox processing completed: {} processed, {} failed, {} skipped, {} total",
        processed,
        failed,
        skipped,
        emails.size());
    return result;
  }

  private List<Path> listEmails(Path inbox) {
    try (Stream<Path> files = Files.list(inbox)) {
      return files
          .filter(Files::isRegularFile)
          .filter(file -> file.getFileName().toString().endsWith(".txt"))
          .sorted()
          .toList();
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to list inbox " + inbox, e);
    }
  }

  private List<Outcome> runSequential(List<Path> emails, Set<String> claimed) {
    var outcomes = new ArrayList<Outcome>();
    for (Path email : emails) {
      outcomes.add(processEmail(email, claimed));
    }
    return outcomes;
  }

  private List<Outcome> runParallel(List<Path> emails, Set<String> claimed) {
    ExecutorService executor = Executors.newFixedThreadPool(Math.min(workers, emails.size()));
    try {
      var futures = new ArrayList<Future<Outcome>>();
      for (Path email : emails) {
        futures.add(executor.submit(() -> processEmail(email, claimed)));
      }
      var outcomes = new ArrayList<Outcome>();
      for (Future<Outcome> future : futures) {
        outcomes.add(await(future));
      }
      return outcomes;
    } finally {
      executor.shutdown();
    }
  }

  private Outcome await(Future<Outcome> future) {
    try {
      return future.get();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException("Interrupted while processing inbox", e);
    } catch (ExecutionException e) {
      // processEmail handles its own failures, so this is unexpected
      log.error("Email task failed unexpectedly", e.getCause());
      return Outcome.FAILED;
    }
  }

  private Outcome processEmail(Path email, Set<String> claimed) {
    String fileName = email.getFileName().toString();
    String emailId = "unknown";
    try {
      String content = Files.readString(email, StandardCharsets.UTF_8);
      emailId = EmailIds.fromContent(content);

      if (artifactStore.hasEvent(emailId) || !claimed.add(emailId)) {
        activityTimeline.log(ActivityAction.SKIP, emailId, "Already processed: " + fileName);
        log.debug("Skipping already processed email {} ({})", fileName, emailId);
        return Outcome.SKIPPED;
      }

      activityTimeline.log(ActivityAction.START, emailId, "Processing: " + fileName);
      var event = inquiryService.extract(content);
      artifactStore.writeEvent(event);
      activityTimeline.log(
          ActivityAction.PARSE,
          emailId,
          "Extracted " + event.products().size() + " products",
          Map.of("gaps", event.gaps().size()));

      var acknowledgment = inquiryService.acknowledge(event);
      artifactStore.writeAcknowledgment(acknowledgment);
      activityTimeline.log(
          ActivityAction.ACK,
          emailId,
          "Generated acknowledgment with " + acknowledgment.questions().size() + " questions");

      var quote = inquiryService.quote(event);
      artifactStore.writeQuote(quote);
      activityTimeline.log(
          ActivityAction.QUOTE,
          emailId,
          "Generated "
              + quote.status().value()
              + " quote: "
              + quote.currency()
              + " "
              + quote.total(),
          Map.of("status", quote.status().value(), "total", quote.total().toPlainString()));

      log.info("Processed {} ({}): {} quote", fileName, emailId, quote.status().value());
      return Outcome.PROCESSED;
    } catch (Exception e) {
      log.error("Failed to process {} ({})", fileName, emailId, e);
      activityTimeline.log(
          ActivityAction.ERROR, emailId, "Failed to process " + fileName + ": " + e.getMessage());
      return Outcome.FAILED;
    }
  }
}
