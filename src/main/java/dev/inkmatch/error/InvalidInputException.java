package dev.inkmatch.error;

/**
 * A request or candidate snapshot is malformed (non-finite coordinates, negative budget, palette
 * channel out of range). Raised before feature extraction; never silently defaulted.
 */
public class InvalidInputException extends MatchingException {

  private final String subjectId;

  public InvalidInputException(String subjectId, String message) {
    super(message);
    this.subjectId = subjectId;
  }

  /** Identifier of the request or candidate that failed validation. */
  public String getSubjectId() {
    return subjectId;
  }
}
