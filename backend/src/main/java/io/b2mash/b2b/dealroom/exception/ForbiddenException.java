package io.b2mash.b2b.dealroom.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** The actor is not a participant, or may not perform the action at the current turn. */
public class ForbiddenException extends ErrorResponseException {

  public ForbiddenException(String title, String detail) {
    super(HttpStatus.FORBIDDEN, createProblem(title, detail), null);
  }

  private static ProblemDetail createProblem(String title, String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.FORBIDDEN);
    problem.setTitle(title);
    problem.setDetail(detail);
    problem.setProperty("code", "FORBIDDEN");
    return problem;
  }
}
