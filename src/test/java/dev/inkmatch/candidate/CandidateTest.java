package dev.inkmatch.candidate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;

import dev.inkmatch.profile.Complexity;
import dev.inkmatch.profile.DesignProfile;
import java.util.List;
import org.junit.jupiter.api.Test;

class CandidateTest {

  private static DesignProfile work(String style) {
    return new DesignProfile(style, Complexity.MEDIUM, List.of());
  }

  @Test
  void style_distribution_is_sorted_shares() {
    Candidate candidate =
        new Candidate(
            "a",
            "A",
            List.of(work("tribal"), work("japanese"), work("japanese"), work("realistic")),
            null,
            null,
            null);

    assertThat(candidate.styleDistribution())
        .containsExactly(entry("japanese", 0.5), entry("realistic", 0.25), entry("tribal", 0.25));
  }

  @Test
  void missing_collections_and_track_record_default_to_empty() {
    Candidate candidate = new Candidate("a", null, null, null, null, null);

    assertThat(candidate.displayName()).isEqualTo("a");
    assertThat(candidate.portfolio()).isEmpty();
    assertThat(candidate.styleDistribution()).isEmpty();
    assertThat(candidate.trackRecord()).isEqualTo(TrackRecord.none());
  }

  @Test
  void blank_id_is_rejected() {
    assertThatThrownBy(() -> new Candidate(" ", "A", List.of(), null, null, null))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void completion_rate_is_empty_without_bookings() {
    assertThat(TrackRecord.none().completionRate()).isEmpty();
    assertThat(new TrackRecord(3, 4.5, 10, 9, 10).completionRate()).hasValue(0.9);
  }

  @Test
  void rating_above_five_or_more_completed_than_booked_is_not_well_formed() {
    assertThat(new TrackRecord(3, 5.5, 10, 9, 10).wellFormed()).isFalse();
    assertThat(new TrackRecord(3, 4.5, 10, 11, 10).wellFormed()).isFalse();
    assertThat(new TrackRecord(3, 4.5, 10, 9, 10).wellFormed()).isTrue();
  }
}
