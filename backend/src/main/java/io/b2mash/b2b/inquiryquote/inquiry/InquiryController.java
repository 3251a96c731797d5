package io.b2mash.b2b.inquiryquote.inquiry;

import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** Accepts a single inquiry email over HTTP and returns the extraction, quote and reply draft. */
@RestController
@RequestMapping("/api/inquiries")
public class InquiryController {

  private final InquiryService inquiryService;

  public InquiryController(InquiryService inquiryService) {
    this.inquiryService = inquiryService;
  }

  @PostMapping(consumes = MediaType.TEXT_PLAIN_VALUE)
  public ResponseEntity<InquiryResult> processInquiry(
      @RequestBody(required = false) String emailContent) {
    return ResponseEntity.ok(inquiryService.process(emailContent));
  }
}
