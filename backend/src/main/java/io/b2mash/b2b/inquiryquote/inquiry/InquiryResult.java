package io.b2mash.b2b.inquiryquote.inquiry;

import io.b2mash.b2b.inquiryquote.acknowledgment.Acknowledgment;
import io.b2mash.b2b.inquiryquote.extraction.ParsedEvent;
import io.b2mash.b2b.inquiryquote.quote.Quote;

/** Everything produced for one inbound email. */
public record InquiryResult(ParsedEvent event, Quote quote, Acknowledgment acknowledgment) {}
