package io.b2mash.b2b.inquiryquote.activity;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.Map;

/** One line of the activity timeline. */
public record ActivityEntry(
    Instant timestamp,
    ActivityAction action,
    @JsonProperty("email_id") String emailId,
    String message,
    @JsonInclude(JsonInclude.Include.NON_NULL) Map<String, Object> details) {}
