package io.b2mash.readiness.exception;

import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

public class ResourceConflictException extends ErrorResponseException {

  public ResourceConflictException(String title, String detail) {
    super(HttpStatus.CONFLICT, createProblem(title, detail, Map.of()), null);
  }

  private ResourceConflictException(String title, String detail, Map<String, Object> properties) {
    super(HttpStatus.CONFLICT, createProblem(title, detail, properties), null);
  }

  /**
   * Conflict carrying the resource's current state as problem properties (e.g. {@code
   * currentStatus}) so the caller can reconcile without another round trip.
   */
  public static ResourceConflictException withCurrentState(
      String title, String detail, Map<String, Object> currentState) {
    return new ResourceConflictException(title, detail, currentState);
  }

  private static ProblemDetail createProblem(
      String title, String detail, Map<String, Object> properties) {
    var problem = ProblemDetail.forStatus(HttpStatus.CONFLICT);
    problem.setTitle(title);
    problem.setDetail(detail);
    properties.forEach(problem::setProperty);
    return problem;
  }
}
