package io.b2mash.b2b.inquiryquote.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** Raised when an inbound email has no readable content. No parsed event is produced for it. */
public class EmptyInputException extends ErrorResponseException {

  public EmptyInputException(String detail) {
    super(HttpStatus.BAD_REQUEST, createProblem(detail), null);
  }

  private static ProblemDetail createProblem(String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
    problem.setTitle("Empty email");
    problem.setDetail(detail);
    return problem;
  }
}
