package io.b2mash.b2b.inquiryquote.activity;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Map;

/**
 * Aggregate view of the timeline.
 *
 * @param totalEntries readable entries
 * @param actions entry count per action value, in declaration order of {@link ActivityAction}
 * @param emailIds distinct email ids, in first-seen order
 * @param uniqueEmails size of {@code emailIds}
 * @param errors {@code error} entries plus unreadable lines
 */
public record ActivitySummary(
    @JsonProperty("total_entries") int totalEntries,
    Map<String, Integer> actions,
    @JsonProperty("email_ids") List<String> emailIds,
    @JsonProperty("unique_emails") int uniqueEmails,
    int errors) {}
