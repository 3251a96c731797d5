package io.b2mash.b2b.inquiryquote.activity;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import tools.jackson.databind.ObjectMapper;

class ActivityTimelineTest {

  private static final Instant NOW = Instant.parse("2024-01-15T10:00:00Z");

  @TempDir Path dataDir;

  private ActivityTimeline timeline;

  @BeforeEach
  void setUp() {
    timeline =
        new ActivityTimeline(
            dataDir.resolve("timeline").resolve("activity.jsonl"),
            new ObjectMapper(),
            Clock.fixed(NOW, ZoneOffset.UTC));
  }

  @Test
  void log_appendsOneJsonLinePerEntry() throws Exception {
    timeline.log(ActivityAction.START, "abc12345", "Processing: a.txt");
    timeline.log(ActivityAction.QUOTE, "abc12345", "Generated quote", Map.of("status", "complete"));

    var lines = Files.readAllLines(timeline.logFile(), StandardCharsets.UTF_8);
    assertThat(lines).hasSize(2);
    assertThat(lines.get(0))
        .contains("\"action\":\"start\"")
        .contains("\"email_id\":\"abc12345\"")
        .doesNotContain("details");
    assertThat(lines.get(1)).contains("\"details\":{\"status\":\"complete\"}");
  }

  @Test
  void recent_returnsLastEntriesOldestFirst() {
    timeline.log(ActivityAction.START, "a", "one");
    timeline.log(ActivityAction.PARSE, "a", "two");
    timeline.log(ActivityAction.ACK, "a", "three");

    assertThat(timeline.recent(2))
        .extracting(ActivityEntry::message)
        .containsExactly("two", "three");
    assertThat(timeline.recent(10)).hasSize(3);
    assertThat(timeline.recent(0)).isEmpty();
  }

  @Test
  void recent_withoutLogFile_isEmpty() {
    assertThat(timeline.recent(10)).isEmpty();
    assertThat(timeline.summary().totalEntries()).isZero();
  }

  @Test
  void byEmailAndByAction_filterEntries() {
    timeline.log(ActivityAction.START, "a", "start a");
    timeline.log(ActivityAction.START, "b", "start b");
    timeline.log(ActivityAction.ERROR, "b", "failed b");

    assertThat(timeline.byEmail("b"))
        .extracting(ActivityEntry::message)
        .containsExactly("start b", "failed b");
    assertThat(timeline.byAction(ActivityAction.START)).hasSize(2);
    assertThat(timeline.byEmail("c")).isEmpty();
  }

  @Test
  void summary_countsActionsEmailsAndErrors() throws Exception {
    timeline.log(ActivityAction.START, "a", "start a");
    timeline.log(ActivityAction.START, "b", "start b");
    timeline.log(ActivityAction.ERROR, "b", "failed b");
    Files.writeString(
        timeline.logFile(), "not json\n", StandardCharsets.UTF_8, StandardOpenOption.APPEND);

    var summary = timeline.summary();

    assertThat(summary.totalEntries()).isEqualTo(3);
    assertThat(summary.actions()).containsEntry("start", 2).containsEntry("error", 1);
    assertThat(summary.emailIds()).containsExactly("a", "b");
    assertThat(summary.uniqueEmails()).isEqualTo(2);
    // one error entry plus one unreadable line
    assertThat(summary.errors()).isEqualTo(2);
  }

  @Test
  void readers_skipUnreadableLines() throws Exception {
    timeline.log(ActivityAction.INFO, "system", "hello");
    Files.writeString(
        timeline.logFile(),
        "{\"action\":\"bogus\"}\n",
        StandardCharsets.UTF_8,
        StandardOpenOption.APPEND);

    assertThat(timeline.recent(10)).extracting(ActivityEntry::message).containsExactly("hello");
  }
}
