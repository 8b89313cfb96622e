package dev.inkmatch.feature;

import dev.inkmatch.candidate.Candidate;
import dev.inkmatch.candidate.TrackRecord;
import dev.inkmatch.profile.ColorSummary;
import dev.inkmatch.profile.DesignProfile;
import dev.inkmatch.request.MatchRequest;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Derives a {@link FeatureSet} from a request and a candidate snapshot.
 *
 * <p>Pure and total for validated inputs: each signal is computed independently and a missing
 * input yields a documented neutral value, recorded in {@link FeatureSet#defaultedSignals()}.
 *
 * <ul>
 *   <li>Design: mean over portfolio works of {@code 0.4 style + 0.3 palette + 0.3 complexity};
 *       {@value #NEW_ARTIST_DESIGN_SCORE} for an empty portfolio
 *   <li>Location: {@link DistanceBandProfile} band of the haversine distance; {@value
 *       #NEUTRAL_SCORE} when either location is unknown
 *   <li>Price: {@link PriceBands} band of {@code budget.max / representativePrice}; {@value
 *       #NEUTRAL_SCORE} when either is unknown
 *   <li>Experience: {@code 0.3 tenure + 0.4 rating + 0.2 reviewVolume + 0.1 completion}
 * </ul>
 */
public class FeatureExtractor {

  static final double NEUTRAL_SCORE = 0.5;
  static final double NEW_ARTIST_DESIGN_SCORE = 0.3;

  static final double STYLE_WEIGHT = 0.4;
  static final double PALETTE_WEIGHT = 0.3;
  static final double COMPLEXITY_WEIGHT = 0.3;
  static final double PREFERRED_STYLE_MATCH = 0.5;
  static final int PALETTE_COMPARISONS = 3;

  static final double TENURE_CAP_YEARS = 10.0;
  static final double MAX_RATING = 5.0;
  static final double REVIEW_COUNT_CAP = 20.0;

  /** Number of style categories the classifier can produce, including the general fallback. */
  static final int STYLE_CATEGORY_COUNT = 7;

  private final DistanceBandProfile distanceProfile;

  public FeatureExtractor(DistanceBandProfile distanceProfile) {
    this.distanceProfile = distanceProfile;
  }

  public FeatureExtractor() {
    this(DistanceBandProfile.CANONICAL);
  }

  /**
   * @param request validated customer request
   * @param candidate validated candidate snapshot
   * @return freshly computed signals for the pair
   */
  public FeatureSet extract(MatchRequest request, Candidate candidate) {
    Set<Signal> defaulted = EnumSet.noneOf(Signal.class);

    double design = designSimilarity(request, candidate.portfolio());
    if (candidate.portfolio().isEmpty()) {
      defaulted.add(Signal.DESIGN);
    }

    Double distanceKm = null;
    double location = NEUTRAL_SCORE;
    if (request.location() != null && candidate.location() != null) {
      distanceKm = Haversine.distanceKm(request.location(), candidate.location());
      location = distanceProfile.score(distanceKm);
    } else {
      defaulted.add(Signal.LOCATION);
    }

    Double priceRatio = null;
    double price = NEUTRAL_SCORE;
    OptionalDouble representativePrice =
        candidate.pricing() == null
            ? OptionalDouble.empty()
            : candidate.pricing().representativePrice();
    if (request.budget() != null && representativePrice.isPresent()) {
      priceRatio = request.budget().max() / representativePrice.getAsDouble();
      price = PriceBands.score(priceRatio);
    } else {
      defaulted.add(Signal.PRICE);
    }

    TrackRecordSignals trackRecord = trackRecordSignals(candidate.trackRecord());
    if (candidate.trackRecord().completionRate().isEmpty()) {
      defaulted.add(Signal.COMPLETION);
    }
    double experience =
        clampUnit(
            0.3 * trackRecord.tenure()
                + 0.4 * trackRecord.rating()
                + 0.2 * trackRecord.reviewVolume()
                + 0.1 * trackRecord.completion());

    return new FeatureSet(
        candidate.id(),
        design,
        location,
        price,
        experience,
        trackRecord,
        styleDiversity(candidate.styleDistribution()),
        candidate.portfolio().size(),
        distanceKm,
        priceRatio,
        defaulted);
  }

  double designSimilarity(MatchRequest request, List<DesignProfile> portfolio) {
    if (portfolio.isEmpty()) {
      return NEW_ARTIST_DESIGN_SCORE;
    }
    DesignProfile reference = request.design();
    Set<String> preferred =
        request.stylePreferences().stream()
            .map(style -> style.toLowerCase(Locale.ROOT))
            .collect(Collectors.toSet());

    double total = 0.0;
    for (DesignProfile work : portfolio) {
      double style;
      if (work.styleCategory().equalsIgnoreCase(reference.styleCategory())) {
        style = 1.0;
      } else if (preferred.contains(work.styleCategory().toLowerCase(Locale.ROOT))) {
        style = PREFERRED_STYLE_MATCH;
      } else {
        style = 0.0;
      }
      double complexity = work.complexity() == reference.complexity() ? 1.0 : 0.0;
      total +=
          STYLE_WEIGHT * style
              + PALETTE_WEIGHT * paletteSimilarity(reference.palette(), work.palette())
              + COMPLEXITY_WEIGHT * complexity;
    }
    return clampUnit(total / portfolio.size());
  }

  /**
   * Mean inverted RGB distance over the first few dominant colours of each palette, position by
   * position. Either palette empty yields the neutral score.
   */
  static double paletteSimilarity(List<ColorSummary> first, List<ColorSummary> second) {
    if (first.isEmpty() || second.isEmpty()) {
      return NEUTRAL_SCORE;
    }
    int comparisons = Math.min(PALETTE_COMPARISONS, Math.min(first.size(), second.size()));
    double similarity = 0.0;
    for (int i = 0; i < comparisons; i++) {
      double distance = first.get(i).distanceTo(second.get(i));
      similarity += Math.max(0.0, 1.0 - distance / ColorSummary.MAX_DISTANCE);
    }
    return clampUnit(similarity / comparisons);
  }

  static TrackRecordSignals trackRecordSignals(TrackRecord record) {
    return new TrackRecordSignals(
        clampUnit(record.experienceYears() / TENURE_CAP_YEARS),
        clampUnit(record.averageRating() / MAX_RATING),
        clampUnit(record.reviewCount() / REVIEW_COUNT_CAP),
        clampUnit(record.completionRate().orElse(NEUTRAL_SCORE)));
  }

  /** Shannon entropy of the distribution over ln({@value #STYLE_CATEGORY_COUNT}), capped at 1. */
  static double styleDiversity(Map<String, Double> distribution) {
    if (distribution.size() < 2) {
      return 0.0;
    }
    double entropy = 0.0;
    for (double share : distribution.values()) {
      if (share > 0.0) {
        entropy -= share * Math.log(share);
      }
    }
    return clampUnit(entropy / Math.log(STYLE_CATEGORY_COUNT));
  }

  static double clampUnit(double value) {
    return Math.max(0.0, Math.min(1.0, value));
  }
}
