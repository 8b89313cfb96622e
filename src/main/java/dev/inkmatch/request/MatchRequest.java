package dev.inkmatch.request;

import dev.inkmatch.profile.DesignProfile;
import dev.inkmatch.profile.GeoPoint;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Immutable description of what a customer is looking for. Created once per matching call.
 *
 * @param id request identifier, used in logs and as the request subject of validation errors
 * @param design reference design extracted from the customer's uploaded image
 * @param location where the customer wants the work done (null when unknown)
 * @param budget price range the customer accepts (null when not given)
 * @param stylePreferences additional styles the customer would also accept (may be empty)
 */
public record MatchRequest(
    String id,
    DesignProfile design,
    @Nullable GeoPoint location,
    @Nullable BudgetRange budget,
    List<String> stylePreferences) {

  public MatchRequest {
    if (id == null || id.isBlank()) {
      throw new IllegalArgumentException("Request id must not be blank");
    }
    if (design == null) {
      throw new IllegalArgumentException("Request design must not be null");
    }
    stylePreferences = stylePreferences == null ? List.of() : List.copyOf(stylePreferences);
  }

  /** Convenience constructor for requests without style preferences. */
  public MatchRequest(
      String id, DesignProfile design, @Nullable GeoPoint location, @Nullable BudgetRange budget) {
    this(id, design, location, budget, List.of());
  }
}
