package dev.inkmatch.error;

/**
 * Root of the matching engine's unchecked exception hierarchy.
 *
 * <p>Only {@link InvalidInputException} on the request itself and {@link
 * RankingCancelledException} abort a whole ranking call. Failures local to one candidate are
 * recovered inside the pipeline and reported as counts on the result.
 */
public abstract class MatchingException extends RuntimeException {

  protected MatchingException(String message) {
    super(message);
  }

  protected MatchingException(String message, Throwable cause) {
    super(message, cause);
  }
}
