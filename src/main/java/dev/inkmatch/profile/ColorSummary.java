package dev.inkmatch.profile;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * One dominant colour of a design, as 8-bit RGB channels.
 *
 * @param red red channel, expected in [0, 255]
 * @param green green channel, expected in [0, 255]
 * @param blue blue channel, expected in [0, 255]
 */
public record ColorSummary(int red, int green, int blue) {

  /** Largest possible Euclidean distance between two RGB colours: sqrt(3 * 255^2). */
  public static final double MAX_DISTANCE = Math.sqrt(3.0 * 255 * 255);

  private static final Pattern RGB_PATTERN =
      Pattern.compile("rgb\\(\\s*(\\d{1,3})\\s*,\\s*(\\d{1,3})\\s*,\\s*(\\d{1,3})\\s*\\)");

  /**
   * Parses the {@code rgb(r, g, b)} notation produced by image analysis.
   *
   * @param value colour string, may be null
   * @return the parsed colour, or empty if the string is not in rgb() notation
   */
  public static Optional<ColorSummary> parse(String value) {
    if (value == null) {
      return Optional.empty();
    }
    Matcher matcher = RGB_PATTERN.matcher(value.trim());
    if (!matcher.matches()) {
      return Optional.empty();
    }
    return Optional.of(
        new ColorSummary(
            Integer.parseInt(matcher.group(1)),
            Integer.parseInt(matcher.group(2)),
            Integer.parseInt(matcher.group(3))));
  }

  public boolean wellFormed() {
    return inRange(red) && inRange(green) && inRange(blue);
  }

  /** Euclidean distance to {@code other} in RGB space. */
  public double distanceTo(ColorSummary other) {
    int dr = red - other.red;
    int dg = green - other.green;
    int db = blue - other.blue;
    return Math.sqrt((double) dr * dr + (double) dg * dg + (double) db * db);
  }

  private static boolean inRange(int channel) {
    return channel >= 0 && channel <= 255;
  }
}
