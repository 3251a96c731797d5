package io.b2mash.b2b.inquiryquote.activity;

import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for the processing activity timeline. */
@RestController
@RequestMapping("/api/activity")
public class ActivityController {

  private static final int MAX_LIMIT = 500;

  private final ActivityTimeline activityTimeline;

  public ActivityController(ActivityTimeline activityTimeline) {
    this.activityTimeline = activityTimeline;
  }

  /**
   * Returns the most recent timeline entries.
   *
   * @param limit number of entries (default 10, max 500)
   * @return entries ordered oldest first
   */
  @GetMapping
  public ResponseEntity<List<ActivityEntry>> getRecentActivity(
      @RequestParam(defaultValue = "10") int limit) {
    if (limit < 0) {
      throw new IllegalArgumentException("limit must not be negative");
    }
    return ResponseEntity.ok(activityTimeline.recent(Math.min(limit, MAX_LIMIT)));
  }

  @GetMapping("/emails/{emailId}")
  public ResponseEntity<List<ActivityEntry>> getEmailActivity(@PathVariable String emailId) {
    return ResponseEntity.ok(activityTimeline.byEmail(emailId));
  }

  @GetMapping("/actions/{action}")
  public ResponseEntity<List<ActivityEntry>> getActionActivity(@PathVariable String action) {
    return ResponseEntity.ok(activityTimeline.byAction(ActivityAction.fromValue(action)));
  }

  @GetMapping("/summary")
  public ResponseEntity<ActivitySummary> getSummary() {
    return ResponseEntity.ok(activityTimeline.summary());
  }
}
