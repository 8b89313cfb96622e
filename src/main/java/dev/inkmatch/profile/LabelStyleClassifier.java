package dev.inkmatch.profile;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Derives a {@link DesignProfile} from image-analysis labels.
 *
 * <p>Style: each style has a keyword list; a style's strength is the sum of the scores of labels
 * whose description contains one of its keywords. The strongest style wins; with no keyword hit
 * the style is {@value DesignProfile#GENERAL_STYLE}. Ties go to the style listed first.
 *
 * <p>Complexity: labels named exactly {@code detailed}, {@code intricate}, {@code complex} or
 * {@code elaborate} are indicators. More than 2 indicators or more than 15 labels is {@link
 * Complexity#COMPLEX}; any indicator or more than 8 labels is {@link Complexity#MEDIUM}; otherwise
 * {@link Complexity#SIMPLE}.
 */
public final class LabelStyleClassifier {

  private static final Map<String, List<String>> STYLE_KEYWORDS = new LinkedHashMap<>();

  static {
    STYLE_KEYWORDS.put("traditional", List.of("traditional", "classic", "vintage", "old school"));
    STYLE_KEYWORDS.put("realistic", List.of("realistic", "portrait", "photographic", "detailed"));
    STYLE_KEYWORDS.put(
        "japanese", List.of("japanese", "oriental", "asian", "dragon", "cherry blossom"));
    STYLE_KEYWORDS.put("tribal", List.of("tribal", "geometric", "pattern", "symbolic"));
    STYLE_KEYWORDS.put("watercolor", List.of("watercolor", "artistic", "colorful", "abstract"));
    STYLE_KEYWORDS.put("minimalist", List.of("simple", "minimal", "clean", "line art"));
  }

  private static final Set<String> COMPLEXITY_INDICATORS =
      Set.of("detailed", "intricate", "complex", "elaborate");

  private LabelStyleClassifier() {}

  /** Result of style detection: the winning category and its accumulated label score. */
  public record StyleMatch(String category, double strength) {}

  /**
   * Builds a full design profile from labels and an already-extracted palette.
   *
   * @param labels detected labels, any order
   * @param palette dominant colours, most dominant first
   * @return design profile with classified style and complexity
   */
  public static DesignProfile classify(List<ImageLabel> labels, List<ColorSummary> palette) {
    return new DesignProfile(detectStyle(labels).category(), assessComplexity(labels), palette);
  }

  public static StyleMatch detectStyle(List<ImageLabel> labels) {
    StyleMatch best = new StyleMatch(DesignProfile.GENERAL_STYLE, 0.0);
    for (Map.Entry<String, List<String>> style : STYLE_KEYWORDS.entrySet()) {
      double strength = 0.0;
      for (ImageLabel label : labels) {
        String description = normalise(label.description());
        for (String keyword : style.getValue()) {
          if (description.contains(keyword)) {
            strength += label.score();
          }
        }
      }
      if (strength > best.strength()) {
        best = new StyleMatch(style.getKey(), strength);
      }
    }
    return best;
  }

  public static Complexity assessComplexity(List<ImageLabel> labels) {
    long indicators =
        labels.stream()
            .map(label -> normalise(label.description()))
            .filter(COMPLEXITY_INDICATORS::contains)
            .count();
    int labelCount = labels.size();

    if (indicators > 2 || labelCount > 15) {
      return Complexity.COMPLEX;
    }
    if (indicators > 0 || labelCount > 8) {
      return Complexity.MEDIUM;
    }
    return Complexity.SIMPLE;
  }

  private static String normalise(String description) {
    return description == null ? "" : description.toLowerCase(Locale.ROOT);
  }
}
