package io.b2mash.b2b.dealroom.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * Thrown when an action is not permitted from the negotiation's current status, including every
 * action on a closed negotiation. Results in HTTP 409 so that retries of a finalize on an already
 * closed negotiation get a stable answer.
 */
public class InvalidTransitionException extends ErrorResponseException {

  public InvalidTransitionException(String fromStatus, String action) {
    super(HttpStatus.CONFLICT, createProblem(fromStatus, action), null);
  }

  private static ProblemDetail createProblem(String fromStatus, String action) {
    var problem = ProblemDetail.forStatus(HttpStatus.CONFLICT);
    problem.setTitle("Invalid negotiation transition");
    problem.setDetail("Cannot " + action + " negotiation in status " + fromStatus);
    problem.setProperty("code", "INVALID_TRANSITION");
    problem.setProperty("negotiationStatus", fromStatus);
    return problem;
  }
}
