package dev.inkmatch.feature;

/**
 * The component signals of a {@link FeatureSet}. {@link #COMPLETION} is the booking-completion
 * part of {@link #EXPERIENCE}, tracked on its own because strategies weight it directly.
 */
public enum Signal {
  DESIGN,
  LOCATION,
  PRICE,
  EXPERIENCE,
  COMPLETION
}
