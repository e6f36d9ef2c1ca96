package za.gov.ooh.oohbooking.exception;

import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * Thrown by services when a request is well-formed but refers to something that does not hold (an
 * unknown campaign, an unknown enum value in a query filter). Rendered exactly like a bean
 * validation failure so clients see one error shape.
 */
public class InvalidRequestException extends ErrorResponseException {

  private final List<FieldViolation> violations;

  public InvalidRequestException(String field, String message) {
    this(List.of(new FieldViolation(field, message)));
  }

  public InvalidRequestException(List<FieldViolation> violations) {
    super(HttpStatus.BAD_REQUEST, createProblem(violations), null);
    this.violations = List.copyOf(violations);
  }

  public List<FieldViolation> getViolations() {
    return violations;
  }

  static ProblemDetail createProblem(List<FieldViolation> violations) {
    var problem = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
    problem.setTitle("Validation error");
    problem.setDetail("Request has " + violations.size() + " invalid field(s)");
    problem.setProperty("errors", violations);
    return problem;
  }
}
