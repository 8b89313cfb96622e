package dev.inkmatch.candidate;

import org.jspecify.annotations.Nullable;

/**
 * Filter passed to the artist directory when building a candidate pool.
 *
 * @param activeOnly restrict to artists currently accepting work
 * @param styleCategory restrict to artists with at least one work in this style (null for all)
 * @param limit maximum pool size; the directory returns a bounded snapshot
 */
public record CandidateCriteria(boolean activeOnly, @Nullable String styleCategory, int limit) {

  /** Default bound on pool size. */
  public static final int DEFAULT_LIMIT = 200;

  public CandidateCriteria {
    if (limit < 1) {
      throw new IllegalArgumentException("limit must be at least 1");
    }
  }

  /** All active artists, bounded by {@link #DEFAULT_LIMIT}. */
  public static CandidateCriteria activeArtists() {
    return new CandidateCriteria(true, null, DEFAULT_LIMIT);
  }
}
