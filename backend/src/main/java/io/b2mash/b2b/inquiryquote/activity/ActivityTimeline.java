package io.b2mash.b2b.inquiryquote.activity;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.ObjectMapper;

/**
 * Append-only JSON Lines log of pipeline activity. Appends are serialized on this instance;
 * readers tolerate unreadable lines by skipping them.
 */
public class ActivityTimeline {

  private static final Logger log = LoggerFactory.getLogger(ActivityTimeline.class);

  private final Path logFile;
  private final ObjectMapper objectMapper;
  private final Clock clock;

  public ActivityTimeline(Path logFile, ObjectMapper objectMapper, Clock clock) {
    this.logFile = logFile;
    this.objectMapper = objectMapper;
    this.clock = clock;
  }

  public Path logFile() {
    return logFile;
  }

  public ActivityEntry log(ActivityAction action, String emailId, String message) {
    return log(action, emailId, message, null);
  }

  /**
   * Appends one entry.
   *
   * @param details optional structured data, omitted from the line when null or empty
   * @throws UncheckedIOException if the log file cannot be written
   */
  public ActivityEntry log(
      ActivityAction action, String emailId, String message, Map<String, Object> details) {
    var entry =
        new ActivityEntry(
            clock.instant(),
            action,
            emailId,
            message,
            details == null || details.isEmpty() ? null : Map.copyOf(details));
    String line = objectMapper.writeValueAsString(entry) + System.lineSeparator();
    synchronized (this) {
      try {
        Files.createDirectories(logFile.toAbsolutePath().getParent());
        Files.writeString(
            logFile,
            line,
            StandardCharsets.UTF_8,
            StandardOpenOption.CREATE,
            StandardOpenOption.APPEND);
      } catch (IOException e) {
        throw new UncheckedIOException("Failed to append to activity log " + logFile, e);
      }
    }
    return entry;
  }

  /** Last {@code limit} readable entries, oldest first. */
  public List<ActivityEntry> recent(int limit) {
    if (limit <= 0) {
      return List.of();
    }
    List<ActivityEntry> all = readAll(entry -> true);
    return List.copyOf(all.subList(Math.max(0, all.size() - limit), all.size()));
  }

  public List<ActivityEntry> byEmail(String emailId) {
    return readAll(entry -> emailId.equals(entry.emailId()));
  }

  public List<ActivityEntry> byAction(ActivityAction action) {
    return readAll(entry -> entry.action() == action);
  }

  public ActivitySummary summary() {
    var actions = new EnumMap<ActivityAction, Integer>(ActivityAction.class);
    var emailIds = new LinkedHashSet<String>();
    int total = 0;
    int errors = 0;
    for (String line : readLines()) {
      Optional<ActivityEntry> parsed = parse(line);
      if (parsed.isEmpty()) {
        errors++;
        continue;
      }
      ActivityEntry entry = parsed.get();
      total++;
      actions.merge(entry.action(), 1, Integer::sum);
      if (entry.emailId() != null) {
        emailIds.add(entry.emailId());
      }
      if (entry.action() == ActivityAction.ERROR) {
        errors++;
      }
    }
    return new ActivitySummary(
        total, actionCounts(actions), List.copyOf(emailIds), emailIds.size(), errors);
  }

  private static Map<String, Integer> actionCounts(Map<ActivityAction, Integer> counts) {
    var byValue = new LinkedHashMap<String, Integer>();
    counts.forEach((action, count) -> byValue.put(action.value(), count));
    return Collections.unmodifiableMap(byValue);
  }

  private List<ActivityEntry> readAll(Predicate<ActivityEntry> filter) {
    var entries = new ArrayList<ActivityEntry>();
    for (String line : readLines()) {
      parse(line).filter(filter).ifPresent(entries::add);
    }
    return entries;
  }

  private List<String> readLines() {
    if (!Files.exists(logFile)) {
      return List.of();
    }
    synchronized (this) {
      try {
        return Files.readAllLines(logFile, StandardCharsets.UTF_8).stream()
            .filter(line -> !line.isBlank())
            .toList();
      } catch (IOException e) {
        throw new UncheckedIOException("Failed to read activity log " + logFile, e);
      }
    }
  }

  private Optional<ActivityEntry> parse(String line) {
    try {
      return Optional.of(objectMapper.readValue(line, ActivityEntry.class));
    } catch (JacksonException | IllegalArgumentException e) {
      log.warn("Skipping unreadable activity log line: {}", e.getMessage());
      return Optional.empty();
    }
  }
}
