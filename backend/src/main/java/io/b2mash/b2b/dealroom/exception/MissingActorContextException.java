package io.b2mash.b2b.dealroom.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

public class MissingActorContextException extends ErrorResponseException {

  public MissingActorContextException(String detail) {
    super(HttpStatus.UNAUTHORIZED, createProblem(detail), null);
  }

  private static ProblemDetail createProblem(String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.UNAUTHORIZED);
    problem.setTitle("Missing actor context");
    problem.setDetail(detail);
    return problem;
  }
}
