package io.b2mash.b2b.inquiryquote.inbox;

import io.b2mash.b2b.inquiryquote.acknowledgment.Acknowledgment;
import io.b2mash.b2b.inquiryquote.extraction.ParsedEvent;
import io.b2mash.b2b.inquiryquote.quote.Quote;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import tools.jackson.databind.ObjectMapper;

/**
 * Writes pipeline artifacts as pretty-printed JSON under the data directory: {@code
 * events/{id}.json}, {@code outbox/{id}_ack.json} and {@code quotes/{id}.json}. The presence of
 * the event file marks an email as processed.
 */
public class ArtifactStore {

  private final Path eventsDir;
  private final Path outboxDir;
  private final Path quotesDir;
  private final ObjectMapper objectMapper;

  public ArtifactStore(Path dataDir, ObjectMapper objectMapper) {
    this.eventsDir = dataDir.resolve("events");
    this.outboxDir = dataDir.resolve("outbox");
    this.quotesDir = dataDir.resolve("quotes");
    this.objectMapper = objectMapper;
  }

  public boolean hasEvent(String emailId) {
    return Files.exists(eventPath(emailId));
  }

  public Path eventPath(String emailId) {
    return eventsDir.resolve(emailId + ".json");
  }

  public Path acknowledgmentPath(String emailId) {
    return outboxDir.resolve(emailId + "_ack.json");
  }

  public Path quotePath(String emailId) {
    return quotesDir.resolve(emailId + ".json");
  }

  public Path writeEvent(ParsedEvent event) {
    return write(eventPath(event.emailId()), event);
  }

  public Path writeAcknowledgment(Acknowledgment acknowledgment) {
    return write(acknowledgmentPath(acknowledgment.emailId()), acknowledgment);
  }

  public Path writeQuote(Quote quote) {
    return write(quotePath(quote.emailId()), quote);
  }

  private Path write(Path target, Object artifact) {
    String json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(artifact);
    try {
      Files.createDirectories(target.toAbsolutePath().getParent());
      Files.writeString(target, json, StandardCharsets.UTF_8);
      return target;
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to write artifact " + target, e);
    }
  }
}
