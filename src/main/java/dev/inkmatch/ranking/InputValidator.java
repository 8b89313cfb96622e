package dev.inkmatch.ranking;

import dev.inkmatch.candidate.Candidate;
import dev.inkmatch.error.InvalidInputException;
import dev.inkmatch.profile.ColorSummary;
import dev.inkmatch.profile.DesignProfile;
import dev.inkmatch.request.MatchRequest;

/** Fail-fast checks run before feature extraction. Malformed values are never defaulted. */
final class InputValidator {

  private InputValidator() {}

  static void validateRequest(MatchRequest request) {
    if (request.location() != null && !request.location().wellFormed()) {
      throw new InvalidInputException(
          request.id(), "Request location is not a finite lat/lon: " + request.location());
    }
    if (request.budget() != null && !request.budget().wellFormed()) {
      throw new InvalidInputException(
          request.id(),
          "Request budget must be finite, non-negative and min <= max: " + request.budget());
    }
    requireWellFormedPalette(request.id(), "Request design", request.design());
  }

  static void validateCandidate(Candidate candidate) {
    if (candidate.location() != null && !candidate.location().wellFormed()) {
      throw new InvalidInputException(
          candidate.id(), "Candidate location is not a finite lat/lon: " + candidate.location());
    }
    if (candidate.hasMalformedPricing()) {
      throw new InvalidInputException(
          candidate.id(), "Candidate pricing has negative or non-finite amounts");
    }
    if (!candidate.trackRecord().wellFormed()) {
      throw new InvalidInputException(
          candidate.id(), "Candidate track record is out of range: " + candidate.trackRecord());
    }
    for (DesignProfile work : candidate.portfolio()) {
      requireWellFormedPalette(candidate.id(), "Portfolio work", work);
    }
  }

  private static void requireWellFormedPalette(
      String subjectId, String what, DesignProfile design) {
    for (ColorSummary color : design.palette()) {
      if (!color.wellFormed()) {
        throw new InvalidInputException(
            subjectId, what + " palette has a channel outside [0, 255]: " + color);
      }
    }
  }
}
