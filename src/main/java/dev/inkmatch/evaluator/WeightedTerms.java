package dev.inkmatch.evaluator;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/** Accumulates {@code weight * value} terms and renders them for a rationale. */
final class WeightedTerms {

  private final List<String> rendered = new ArrayList<>();
  private double total;

  WeightedTerms add(String label, double weight, double value) {
    total += weight * value;
    rendered.add(String.format(Locale.ROOT, "%s %.2fx%.2f", label, weight, value));
    return this;
  }

  double total() {
    return Math.max(0.0, Math.min(1.0, total));
  }

  String describe() {
    return String.join(" + ", rendered) + String.format(Locale.ROOT, " = %.3f", total());
  }
}
