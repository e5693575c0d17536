package com.flamingo.ai.interviewinsights.util;

import java.math.BigDecimal;
import java.math.RoundingMode;

/** Rounding and clamping shared by the scoring components. */
public final class ScoreMath {

  private ScoreMath() {}

  /** Clamps a value to [min, max]; NaN becomes min. */
  public static double clamp(double value, double min, double max) {
    if (Double.isNaN(value)) {
      return min;
    }
    return Math.max(min, Math.min(max, value));
  }

  public static double clamp01(double value) {
    return clamp(value, 0.0, 1.0);
  }

  /**
   * Rounds half-up to the given number of decimals.
   *
   * @param value the value, must be finite
   * @param scale number of decimals
   * @return the rounded value
   */
  public static double round(double value, int scale) {
    if (Double.isNaN(value) || Double.isInfinite(value)) {
      return value;
    }
    return BigDecimal.valueOf(value).setScale(scale, RoundingMode.HALF_UP).doubleValue();
  }

  /**
   * Coverage scaled by a category weight relative to the largest weight, rounded half-up to two
   * decimals. With coverage in [0,100] and 0 < weight <= maxWeight the result stays in [0,100]
   * without clamping, so topics keep their order however common they are.
   *
   * @param coveragePercent share of (decay-weighted) documents referencing the topic, in percent
   * @param weight category multiplier of the topic
   * @param maxWeight largest multiplier of the taxonomy
   * @return the weighted frequency
   */
  public static double weightedFrequency(double coveragePercent, double weight, double maxWeight) {
    double scale = maxWeight > 0.0 ? Math.min(1.0, weight / maxWeight) : 1.0;
    return round(clamp(coveragePercent, 0.0, 100.0) * scale, 2);
  }

  /** Log damping of a raw repetition count: 1 + ln(count), 0 for no occurrences. */
  public static double dampen(int count) {
    return count <= 0 ? 0.0 : 1.0 + Math.log(count);
  }
}
