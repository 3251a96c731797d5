package io.b2mash.b2b.inquiryquote.acknowledgment;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.b2mash.b2b.inquiryquote.extraction.Urgency;
import java.time.Instant;
import java.util.List;

/**
 * Reply drafted for an inbound email. {@code to} is null when no sender address was found; the
 * message is then written to the outbox for manual routing.
 */
public record Acknowledgment(
    @JsonProperty("email_id") String emailId,
    Instant timestamp,
    String to,
    String subject,
    String greeting,
    String body,
    List<String> questions,
    String closing,
    @JsonProperty("sla_hours") int slaHours,
    @JsonProperty("urgency_level") Urgency urgencyLevel) {

  public Acknowledgment {
    questions = questions == null ? List.of() : List.copyOf(questions);
  }
}
