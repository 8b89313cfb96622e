package dev.inkmatch.profile;

import java.util.List;

/**
 * Comparable visual summary of one design: the customer's reference image or one work in an
 * artist's portfolio.
 *
 * @param styleCategory style label such as {@code japanese} or {@code minimalist}
 * @param complexity coarse complexity bucket
 * @param palette dominant colours, most dominant first (may be empty)
 */
public record DesignProfile(
    String styleCategory, Complexity complexity, List<ColorSummary> palette) {

  /** Style used when image analysis could not classify the design. */
  public static final String GENERAL_STYLE = "general";

  public DesignProfile {
    styleCategory =
        styleCategory == null || styleCategory.isBlank() ? GENERAL_STYLE : styleCategory;
    complexity = complexity == null ? Complexity.MEDIUM : complexity;
    palette = palette == null ? List.of() : List.copyOf(palette);
  }
}
