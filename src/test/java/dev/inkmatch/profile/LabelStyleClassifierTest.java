package dev.inkmatch.profile;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class LabelStyleClassifierTest {

  @Test
  void strongest_keyword_score_wins() {
    List<ImageLabel> labels =
        List.of(
            new ImageLabel("Dragon", 0.9),
            new ImageLabel("Cherry blossom", 0.8),
            new ImageLabel("Geometric", 0.7));

    LabelStyleClassifier.StyleMatch match = LabelStyleClassifier.detectStyle(labels);

    assertThat(match.category()).isEqualTo("japanese");
    assertThat(match.strength()).isEqualTo(0.9 + 0.8);
  }

  @Test
  void unmatched_labels_fall_back_to_general() {
    LabelStyleClassifier.StyleMatch match =
        LabelStyleClassifier.detectStyle(List.of(new ImageLabel("cat", 0.99)));

    assertThat(match.category()).isEqualTo(DesignProfile.GENERAL_STYLE);
    assertThat(match.strength()).isZero();
  }

  @Test
  void few_plain_labels_are_simple() {
    assertThat(LabelStyleClassifier.assessComplexity(List.of(new ImageLabel("rose", 0.9))))
        .isEqualTo(Complexity.SIMPLE);
  }

  @Test
  void one_indicator_is_medium() {
    List<ImageLabel> labels = List.of(new ImageLabel("rose", 0.9), new ImageLabel("Detailed", 0.6));

    assertThat(LabelStyleClassifier.assessComplexity(labels)).isEqualTo(Complexity.MEDIUM);
  }

  @Test
  void three_indicators_are_complex() {
    List<ImageLabel> labels =
        List.of(
            new ImageLabel("detailed", 0.9),
            new ImageLabel("intricate", 0.8),
            new ImageLabel("elaborate", 0.7));

    assertThat(LabelStyleClassifier.assessComplexity(labels)).isEqualTo(Complexity.COMPLEX);
  }

  @Test
  void label_count_alone_raises_complexity() {
    List<ImageLabel> nine = new ArrayList<>();
    for (int i = 0; i < 9; i++) {
      nine.add(new ImageLabel("label" + i, 0.5));
    }
    List<ImageLabel> sixteen = new ArrayList<>(nine);
    for (int i = 9; i < 16; i++) {
      sixteen.add(new ImageLabel("label" + i, 0.5));
    }

    assertThat(LabelStyleClassifier.assessComplexity(nine)).isEqualTo(Complexity.MEDIUM);
    assertThat(LabelStyleClassifier.assessComplexity(sixteen)).isEqualTo(Complexity.COMPLEX);
  }

  @Test
  void classify_builds_a_design_profile() {
    ColorSummary ink = new ColorSummary(10, 10, 10);

    DesignProfile design =
        LabelStyleClassifier.classify(List.of(new ImageLabel("line art", 0.8)), List.of(ink));

    assertThat(design)
        .isEqualTo(new DesignProfile("minimalist", Complexity.SIMPLE, List.of(ink)));
  }
}
