package com.flamingo.ai.interviewinsights.service.scoring;

import com.flamingo.ai.interviewinsights.config.InsightsConfig;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Exponential time decay w = e^(-λ·days) with λ derived from the configured half-life.
 *
 * <p>Weights are floored at the configured minimum, and dates after the reference date count as
 * age zero.
 */
@Component
@RequiredArgsConstructor
public class TimeDecayCalculator {

  private final InsightsConfig insightsConfig;

  /** Decay rate per day: ln 2 / half-life. */
  public double lambda() {
    return Math.log(2.0) / insightsConfig.getScoring().getDecay().getHalfLifeDays();
  }

  /**
   * Weight of an experience dated {@code date} as seen from {@code referenceDate}.
   *
   * @param date date of the experience, null is treated as maximally old
   * @param referenceDate date ages are measured from
   * @return weight in [minWeight, 1]
   */
  public double weight(LocalDate date, LocalDate referenceDate) {
    double minWeight = insightsConfig.getScoring().getDecay().getMinWeight();
    if (date == null) {
      return minWeight;
    }
    long days = Math.max(0L, ChronoUnit.DAYS.between(date, referenceDate));
    return Math.max(minWeight, Math.exp(-lambda() * days));
  }
}
