package io.b2mash.readiness.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** No active member could be resolved for the request. */
public class MissingCallerException extends ErrorResponseException {

  public MissingCallerException(String detail) {
    super(HttpStatus.UNAUTHORIZED, createProblem(detail), null);
  }

  private static ProblemDetail createProblem(String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.UNAUTHORIZED);
    problem.setTitle("Missing caller");
    problem.setDetail(detail);
    return problem;
  }
}
