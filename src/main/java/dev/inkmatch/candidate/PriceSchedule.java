package dev.inkmatch.candidate;

import java.util.OptionalDouble;
import org.jspecify.annotations.Nullable;

/**
 * An artist's published pricing. Any field may be absent; zero is treated as absent.
 *
 * @param averagePrice typical price of a finished piece
 * @param hourlyRate price per hour of work
 * @param averageSessionHours typical session length, used with {@code hourlyRate}
 * @param basePrice minimum charge
 */
public record PriceSchedule(
    @Nullable Double averagePrice,
    @Nullable Double hourlyRate,
    @Nullable Double averageSessionHours,
    @Nullable Double basePrice) {

  public static PriceSchedule ofAveragePrice(double averagePrice) {
    return new PriceSchedule(averagePrice, null, null, null);
  }

  /**
   * The single price that stands for this schedule: the average price, else hourly rate times
   * session hours, else the base price.
   *
   * @return the representative price, or empty when no usable price is published
   */
  public OptionalDouble representativePrice() {
    if (positive(averagePrice)) {
      return OptionalDouble.of(averagePrice);
    }
    if (positive(hourlyRate) && positive(averageSessionHours)) {
      return OptionalDouble.of(hourlyRate * averageSessionHours);
    }
    if (positive(basePrice)) {
      return OptionalDouble.of(basePrice);
    }
    return OptionalDouble.empty();
  }

  boolean hasNegativeOrNonFinite() {
    return invalid(averagePrice)
        || invalid(hourlyRate)
        || invalid(averageSessionHours)
        || invalid(basePrice);
  }

  private static boolean positive(@Nullable Double value) {
    return value != null && Double.isFinite(value) && value > 0.0;
  }

  private static boolean invalid(@Nullable Double value) {
    return value != null && (!Double.isFinite(value) || value < 0.0);
  }
}
