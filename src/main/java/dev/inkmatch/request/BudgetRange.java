package dev.inkmatch.request;

/**
 * The price range a customer is willing to pay, in the marketplace currency (JPY).
 *
 * <p>Price fit is judged against {@link #max()}: the most the customer will spend.
 */
public record BudgetRange(double min, double max) {

  /** A single-value budget where the minimum and maximum coincide. */
  public static BudgetRange of(double amount) {
    return new BudgetRange(amount, amount);
  }

  public boolean wellFormed() {
    return Double.isFinite(min) && Double.isFinite(max) && min >= 0.0 && min <= max;
  }
}
