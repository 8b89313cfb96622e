package dev.inkmatch.candidate;

import dev.inkmatch.profile.DesignProfile;
import dev.inkmatch.profile.GeoPoint;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.jspecify.annotations.Nullable;

/**
 * Immutable snapshot of one artist, refreshed from the directory on every matching call.
 *
 * @param id stable artist identifier; also the final tie-break key when ranking
 * @param displayName name shown to customers
 * @param portfolio analysed portfolio works (may be empty for new artists)
 * @param location studio location (null when unknown)
 * @param pricing published pricing (null when unknown)
 * @param trackRecord experience, ratings and booking history
 */
public record Candidate(
    String id,
    String displayName,
    List<DesignProfile> portfolio,
    @Nullable GeoPoint location,
    @Nullable PriceSchedule pricing,
    TrackRecord trackRecord) {

  public Candidate {
    if (id == null || id.isBlank()) {
      throw new IllegalArgumentException("Candidate id must not be blank");
    }
    displayName = displayName == null ? id : displayName;
    portfolio = portfolio == null ? List.of() : List.copyOf(portfolio);
    trackRecord = trackRecord == null ? TrackRecord.none() : trackRecord;
  }

  /**
   * Share of portfolio works per style category, sorted by category name.
   *
   * @return style to fraction in (0, 1], summing to 1; empty for an empty portfolio
   */
  public Map<String, Double> styleDistribution() {
    if (portfolio.isEmpty()) {
      return Map.of();
    }
    Map<String, Double> distribution = new TreeMap<>();
    double share = 1.0 / portfolio.size();
    for (DesignProfile work : portfolio) {
      distribution.merge(work.styleCategory(), share, Double::sum);
    }
    return Collections.unmodifiableMap(distribution);
  }

  /** Whether the published pricing contains negative or non-finite amounts. */
  public boolean hasMalformedPricing() {
    return pricing != null && pricing.hasNegativeOrNonFinite();
  }
}
