package io.studentdeals.platform.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

public class ResourceNotFoundException extends ErrorResponseException {

  public ResourceNotFoundException(String resourceType, Object id) {
    super(HttpStatus.NOT_FOUND, createProblem(resourceType, id), null);
  }

  private static ProblemDetail createProblem(String resourceType, Object id) {
    var problem =
        ProblemDetail.forStatusAndDetail(
            HttpStatus.NOT_FOUND, "No " + resourceType.toLowerCase() + " found with id " + id);
    problem.setTitle(resourceType + " not found");
    return problem;
  }
}
