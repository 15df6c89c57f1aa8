package io.b2mash.b2b.dealroom.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** Malformed entry input (missing notes, negative price, terms on a plain message). HTTP 400. */
public class ValidationException extends ErrorResponseException {

  public ValidationException(String detail) {
    super(HttpStatus.BAD_REQUEST, createProblem(detail), null);
  }

  private static ProblemDetail createProblem(String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
    problem.setTitle("Invalid negotiation entry");
    problem.setDetail(detail);
    problem.setProperty("code", "VALIDATION_ERROR");
    return problem;
  }
}
