package io.b2mash.b2b.inquiryquote.acknowledgment;

import io.b2mash.b2b.inquiryquote.extraction.ExtractedProduct;
import io.b2mash.b2b.inquiryquote.extraction.ParsedEvent;
import io.b2mash.b2b.inquiryquote.extraction.SenderInfo;
import io.b2mash.b2b.inquiryquote.extraction.Urgency;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.springframework.stereotype.Service;

/**
 * Drafts the acknowledgment reply for a parsed email. The text adapts to urgency, to what was
 * extracted and to what is still missing; at most {@value #MAX_QUESTIONS} follow-up questions are
 * asked.
 */
@Service
public class AcknowledgmentGenerator {

  static final int MAX_QUESTIONS = 2;
  private static final double CONFIDENT_SENDER = 0.7;

  private final AcknowledgmentSettings settings;
  private final Clock clock;

  public AcknowledgmentGenerator(AcknowledgmentSettings settings, Clock clock) {
    this.settings = settings;
    this.clock = clock;
  }

  public Acknowledgment generate(ParsedEvent event) {
    return new Acknowledgment(
        event.emailId(),
        clock.instant(),
        event.sender().email(),
        subject(event.products(), event.urgency()),
        greeting(event.sender()),
        body(event),
        questions(event),
        closing(),
        settings.slaHours(),
        event.urgency());
  }

  String subject(List<ExtractedProduct> products, Urgency urgency) {
    if (products.isEmpty()) {
      return "Re: Your Inquiry - Additional Information Needed";
    }
    String subject;
    if (products.size() == 1) {
      subject = "Re: " + products.get(0).name() + " Quote Request";
    } else if (products.size() == 2) {
      subject =
          "Re: " + products.get(0).name() + " and " + products.get(1).name() + " Quote Request";
    } else {
      subject = "Re: Quote Request for " + products.size() + " Items";
    }
    if (urgency == Urgency.HIGH) {
      subject += " - URGENT";
    } else if (urgency == Urgency.MEDIUM) {
      subject += " - Priority";
    }
    return subject;
  }

  String greeting(SenderInfo sender) {
    if (sender.name() == null || sender.name().isBlank()) {
      return "Dear Valued Customer,";
    }
    return "Dear " + sender.name() + ",";
  }

  String body(ParsedEvent event) {
    var parts = new ArrayList<String>();
    parts.add(thanks(event.urgency()));
    if (!event.products().isEmpty()) {
      parts.add(productReference(event.products()));
    }
    if (event.gaps().isEmpty()) {
      parts.add("We have all the necessary information to prepare your quote.");
    } else if (event.gaps().size() == 1) {
      parts.add(
          "To provide you with an accurate quote, we need some additional information: "
              + event.gaps().get(0).toLowerCase(Locale.ROOT));
    } else {
      parts.add(
          "To provide you with an accurate quote, we need some additional information about"
              + " your requirements.");
    }
    parts.add(nextSteps(event.urgency()));
    return String.join("\n\n", parts);
  }

  private String thanks(Urgency urgency) {
    if (urgency == Urgency.HIGH) {
      return "Thank you for your urgent inquiry. We understand the time-sensitive nature of your"
          + " request and will prioritize your quote accordingly.";
    }
    if (urgency == Urgency.MEDIUM) {
      return "Thank you for your inquiry. We appreciate your interest in our products and will"
          + " process your request promptly.";
    }
    return "Thank you for your inquiry. We appreciate your interest in "
        + settings.companyName()
        + " products.";
  }

  private String productReference(List<ExtractedProduct> products) {
    if (products.size() == 1) {
      ExtractedProduct product = products.get(0);
      if (product.quantity() != null) {
        return "We have received your request for "
            + product.quantity().stripTrailingZeros().toPlainString()
            + " "
            + product.name()
            + ".";
      }
      return "We have received your inquiry about " + product.name() + ".";
    }
    var names = products.stream().map(ExtractedProduct::name).toList();
    return "We have received your inquiry about the following products: "
        + String.join(", ", names)
        + ".";
  }

  private String nextSteps(Urgency urgency) {
    int hours = urgency == Urgency.HIGH ? settings.slaHours() / 2 : settings.slaHours();
    return "We will provide your quote within "
        + hours
        + " hours. If you have any questions, please don't hesitate to contact us at "
        + settings.contactEmail()
        + ".";
  }

  List<String> questions(ParsedEvent event) {
    var questions = new ArrayList<String>();
    for (ExtractedProduct product : event.products()) {
      if (product.quantity() == null) {
        questions.add("What quantity of " + product.name() + " do you need?");
      }
    }
    if (event.sender().confidence() < CONFIDENT_SENDER) {
      questions.add("Could you please confirm your contact information for our records?");
    }
    if (questions.isEmpty()) {
      if (event.products().isEmpty()) {
        questions.add("What products are you interested in purchasing?");
      }
      questions.add("Do you have any specific delivery requirements or timeline preferences?");
    }
    return List.copyOf(questions.subList(0, Math.min(MAX_QUESTIONS, questions.size())));
  }

  private String closing() {
    return "Best regards,\n\n"
        + settings.companyName()
        + " Sales Team\n"
        + settings.contactEmail();
  }
}
