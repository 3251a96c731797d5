package io.b2mash.b2b.inquiryquote.inbox;

import io.b2mash.b2b.inquiryquote.exception.ResourceNotFoundException;
import java.nio.file.Path;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

/**
 * Handles {@code process <inbox> [--config=<dir>]} on the command line. Any other invocation
 * leaves the application running as a web service. The exit code is 1 when any email failed or the
 * inbox is missing, 2 on a usage error.
 */
@Component
public class InboxCommandRunner implements ApplicationRunner, ExitCodeGenerator {

  private static final Logger log = LoggerFactory.getLogger(InboxCommandRunner.class);

  public static final String COMMAND = "process";
  static final int FAILURE_EXIT_CODE = 1;
  static final int USAGE_EXIT_CODE = 2;

  private final InboxProcessor inboxProcessor;
  private volatile int exitCode;

  public InboxCommandRunner(InboxProcessor inboxProcessor) {
    this.inboxProcessor = inboxProcessor;
  }

  @Override
  public void run(ApplicationArguments args) {
    List<String> commandArgs = args.getNonOptionArgs();
    if (commandArgs.isEmpty() || !COMMAND.equals(commandArgs.get(0))) {
      return;
    }
    if (commandArgs.size() != 2) {
      log.error("Usage: process <inbox> [--config=<dir>]");
      exitCode = USAGE_EXIT_CODE;
      return;
    }

    try {
      InboxResult result = inboxProcessor.processInbox(Path.of(commandArgs.get(1)));
      log.info(
          "Processed: {}, Failed: {}, Skipped: {}, Total: {}",
          result.processed(),
          result.failed(),
          result.skipped(),
          result.total());
      exitCode = result.hasFailures() ? FAILURE_EXIT_CODE : 0;
    } catch (ResourceNotFoundException e) {
      log.error("Inbox not found: {}", commandArgs.get(1));
      exitCode = FAILURE_EXIT_CODE;
    }
  }

  @Override
  public int getExitCode() {
    return exitCode;
  }
}
