package dev.inkmatch.feature;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import dev.inkmatch.candidate.Candidate;
import dev.inkmatch.candidate.PriceSchedule;
import dev.inkmatch.fixture.CandidateBuilder;
import dev.inkmatch.fixture.MatchRequestBuilder;
import dev.inkmatch.fixture.Places;
import dev.inkmatch.profile.ColorSummary;
import dev.inkmatch.profile.Complexity;
import dev.inkmatch.profile.DesignProfile;
import dev.inkmatch.profile.GeoPoint;
import dev.inkmatch.request.BudgetRange;
import dev.inkmatch.request.MatchRequest;
import java.util.List;
import org.junit.jupiter.api.Test;

class FeatureExtractorTest {

  private final FeatureExtractor extractor = new FeatureExtractor();

  private static DesignProfile work(String style, Complexity complexity, ColorSummary... palette) {
    return new DesignProfile(style, complexity, List.of(palette));
  }

  @Test
  void fully_known_inputs_record_no_defaults() {
    FeatureSet features =
        extractor.extract(new MatchRequestBuilder().build(), new CandidateBuilder().build());

    assertThat(features.defaultedSignals()).isEmpty();
    assertThat(features.distanceKm()).isEqualTo(0.0);
    assertThat(features.locationScore()).isEqualTo(1.0);
    assertThat(features.priceRatio()).isCloseTo(40_000.0 / 30_000.0, within(1e-12));
    assertThat(features.priceScore()).isEqualTo(0.9);
  }

  @Test
  void missing_location_yields_neutral_location_score() {
    MatchRequest request = new MatchRequestBuilder().location(null).build();

    FeatureSet features = extractor.extract(request, new CandidateBuilder().build());

    assertThat(features.locationScore()).isEqualTo(0.5);
    assertThat(features.distanceKm()).isNull();
    assertThat(features.isDefaulted(Signal.LOCATION)).isTrue();
  }

  @Test
  void candidate_without_location_yields_neutral_location_score() {
    FeatureSet features =
        extractor.extract(
            new MatchRequestBuilder().build(), new CandidateBuilder().location(null).build());

    assertThat(features.locationScore()).isEqualTo(0.5);
    assertThat(features.isDefaulted(Signal.LOCATION)).isTrue();
  }

  @Test
  void missing_budget_yields_neutral_price_score() {
    MatchRequest request = new MatchRequestBuilder().budget((BudgetRange) null).build();

    FeatureSet features = extractor.extract(request, new CandidateBuilder().build());

    assertThat(features.priceScore()).isEqualTo(0.5);
    assertThat(features.priceRatio()).isNull();
    assertThat(features.isDefaulted(Signal.PRICE)).isTrue();
  }

  @Test
  void unpublished_price_yields_neutral_price_score() {
    Candidate candidate =
        new CandidateBuilder().pricing(new PriceSchedule(null, null, null, 0.0)).build();

    FeatureSet features = extractor.extract(new MatchRequestBuilder().build(), candidate);

    assertThat(features.priceScore()).isEqualTo(0.5);
    assertThat(features.isDefaulted(Signal.PRICE)).isTrue();
  }

  @Test
  void price_falls_back_to_hourly_rate_times_session_hours() {
    Candidate candidate =
        new CandidateBuilder().pricing(new PriceSchedule(null, 10_000.0, 2.0, 5_000.0)).build();

    FeatureSet features = extractor.extract(new MatchRequestBuilder().build(), candidate);

    assertThat(features.priceRatio()).isEqualTo(2.0);
    assertThat(features.priceScore()).isEqualTo(1.0);
  }

  @Test
  void budget_range_is_judged_against_its_maximum() {
    MatchRequest request =
        new MatchRequestBuilder()
            .budget(new BudgetRange(10_000, 30_000))
            .build();

    FeatureSet features = extractor.extract(request, new CandidateBuilder().build());

    assertThat(features.priceRatio()).isEqualTo(1.0);
    assertThat(features.priceScore()).isEqualTo(0.8);
  }

  @Test
  void empty_portfolio_gets_new_artist_design_default() {
    FeatureSet features =
        extractor.extract(
            new MatchRequestBuilder().build(), new CandidateBuilder().emptyPortfolio().build());

    assertThat(features.designSimilarity()).isEqualTo(0.3);
    assertThat(features.isDefaulted(Signal.DESIGN)).isTrue();
    assertThat(features.portfolioSize()).isZero();
    assertThat(features.styleDiversity()).isZero();
  }

  @Test
  void identical_work_is_a_perfect_design_match() {
    ColorSummary red = new ColorSummary(255, 0, 0);
    MatchRequest request =
        new MatchRequestBuilder().design(work("japanese", Complexity.COMPLEX, red)).build();
    Candidate candidate =
        new CandidateBuilder().portfolio(work("japanese", Complexity.COMPLEX, red)).build();

    assertThat(extractor.extract(request, candidate).designSimilarity()).isEqualTo(1.0);
  }

  @Test
  void preferred_style_earns_half_the_style_term() {
    MatchRequest request = new MatchRequestBuilder().stylePreference("Realistic").build();
    Candidate candidate =
        new CandidateBuilder().portfolio(work("realistic", Complexity.MEDIUM)).build();

    // 0.4 * 0.5 + 0.3 * 0.5 (no palettes) + 0.3 * 1
    assertThat(extractor.extract(request, candidate).designSimilarity())
        .isCloseTo(0.65, within(1e-12));
  }

  @Test
  void design_similarity_is_averaged_over_the_portfolio() {
    Candidate candidate =
        new CandidateBuilder()
            .portfolio(work("japanese", Complexity.MEDIUM), work("tribal", Complexity.SIMPLE))
            .build();

    // (0.4 + 0.15 + 0.3) and (0 + 0.15 + 0) averaged
    assertThat(extractor.extract(new MatchRequestBuilder().build(), candidate).designSimilarity())
        .isCloseTo(0.5, within(1e-12));
  }

  @Test
  void opposite_colours_have_zero_palette_similarity() {
    double similarity =
        FeatureExtractor.paletteSimilarity(
            List.of(new ColorSummary(0, 0, 0)), List.of(new ColorSummary(255, 255, 255)));

    assertThat(similarity).isCloseTo(0.0, within(1e-12));
  }

  @Test
  void only_the_first_three_palette_entries_are_compared() {
    ColorSummary black = new ColorSummary(0, 0, 0);
    ColorSummary white = new ColorSummary(255, 255, 255);

    double similarity =
        FeatureExtractor.paletteSimilarity(
            List.of(black, black, black, black), List.of(black, black, black, white));

    assertThat(similarity).isEqualTo(1.0);
  }

  @Test
  void experience_combines_capped_tenure_rating_reviews_and_completion() {
    Candidate veteran =
        new CandidateBuilder().experienceYears(20).rating(5.0, 40).bookings(0, 0).build();

    FeatureSet features = extractor.extract(new MatchRequestBuilder().build(), veteran);

    // 0.3 * 1 + 0.4 * 1 + 0.2 * 1 + 0.1 * 0.5 (no bookings yet)
    assertThat(features.experienceScore()).isCloseTo(0.95, within(1e-12));
    assertThat(features.trackRecord().completion()).isEqualTo(0.5);
    assertThat(features.isDefaulted(Signal.EXPERIENCE)).isFalse();
    assertThat(features.isDefaulted(Signal.COMPLETION)).isTrue();
  }

  @Test
  void even_two_style_portfolio_has_entropy_based_diversity() {
    Candidate candidate =
        new CandidateBuilder()
            .portfolio(work("japanese", Complexity.MEDIUM), work("tribal", Complexity.MEDIUM))
            .build();

    FeatureSet features = extractor.extract(new MatchRequestBuilder().build(), candidate);

    assertThat(features.styleDiversity()).isCloseTo(Math.log(2) / Math.log(7), within(1e-12));
  }

  @Test
  void distance_profile_is_configurable() {
    FeatureExtractor matchingProfile = new FeatureExtractor(DistanceBandProfile.MATCHING_FUNCTIONS);
    Candidate sevenKmNorth =
        new CandidateBuilder()
            .location(Places.northOf(new GeoPoint(35.0, 139.0), 7.0))
            .build();

    assertThat(extractor.extract(new MatchRequestBuilder().build(), sevenKmNorth).locationScore())
        .isEqualTo(0.8);
    assertThat(
            matchingProfile
                .extract(new MatchRequestBuilder().build(), sevenKmNorth)
                .locationScore())
        .isEqualTo(1.0);
  }
}
