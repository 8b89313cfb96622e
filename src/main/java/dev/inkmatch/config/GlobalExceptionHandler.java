package dev.inkmatch.config;

import dev.inkmatch.error.InvalidInputException;
import dev.inkmatch.error.RankingCancelledException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Global REST error handler that maps matching exceptions to RFC 9457 Problem Detail responses.
 *
 * <p>Malformed input maps to 400 Bad Request; a cancelled ranking call maps to 503 Service
 * Unavailable since no partial result is ever returned.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

  /**
   * Maps {@link InvalidInputException} to a 400 Bad Request Problem Detail naming the rejected
   * request or candidate.
   */
  @ExceptionHandler(InvalidInputException.class)
  ProblemDetail handleInvalidInput(InvalidInputException ex) {
    ProblemDetail problem =
        ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, ex.getMessage());
    problem.setTitle("Invalid input");
    problem.setProperty("subjectId", ex.getSubjectId());
    return problem;
  }

  /**
   * Maps {@link IllegalArgumentException} to a 400 Bad Request Problem Detail.
   *
   * @param ex the exception thrown by validation logic
   * @return a Problem Detail with HTTP 400 status and the exception message
   */
  @ExceptionHandler(IllegalArgumentException.class)
  ProblemDetail handleIllegalArgument(IllegalArgumentException ex) {
    return ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, ex.getMessage());
  }

  @ExceptionHandler(RankingCancelledException.class)
  ProblemDetail handleCancelled(RankingCancelledException ex) {
    log.warn("Ranking call cancelled: {}", ex.getMessage());
    return ProblemDetail.forStatusAndDetail(HttpStatus.SERVICE_UNAVAILABLE, ex.getMessage());
  }
}
