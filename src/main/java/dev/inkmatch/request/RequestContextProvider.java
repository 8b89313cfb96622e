package dev.inkmatch.request;

import java.util.Optional;

/**
 * Request intake collaborator: resolves a feature-ready {@link MatchRequest} from the upload and
 * image-analysis service that created it.
 *
 * <p>Implementations build the request's reference design from raw image-analysis output with the
 * intake helpers below: labels become a style and complexity, and {@code rgb(r, g, b)} strings
 * become the palette.
 *
 * @see dev.inkmatch.profile.LabelStyleClassifier
 * @see dev.inkmatch.profile.ColorSummary#parse(String)
 */
public interface RequestContextProvider {

  /**
   * @param requestId identifier issued by the intake service
   * @return the request, or empty if no request with that id exists
   */
  Optional<MatchRequest> getRequestContext(String requestId);
}
