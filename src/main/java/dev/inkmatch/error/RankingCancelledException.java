package dev.inkmatch.error;

/** The caller cancelled a ranking call; in-flight work was abandoned and no result is returned. */
public class RankingCancelledException extends MatchingException {

  public RankingCancelledException(String message) {
    super(message);
  }

  public RankingCancelledException(String message, Throwable cause) {
    super(message, cause);
  }
}
