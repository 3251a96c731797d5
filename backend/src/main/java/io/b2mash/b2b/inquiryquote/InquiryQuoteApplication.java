package io.b2mash.b2b.inquiryquote;

import io.b2mash.b2b.inquiryquote.inbox.InboxCommandRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class InquiryQuoteApplication {

  public static void main(String[] args) {
    var app = new SpringApplication(InquiryQuoteApplication.class);
    if (args.length > 0 && InboxCommandRunner.COMMAND.equals(args[0])) {
      app.setWebApplicationType(WebApplicationType.NONE);
      System.exit(SpringApplication.exit(app.run(args)));
    }
    app.run(args);
  }
}
