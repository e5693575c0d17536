package com.flamingo.ai.interviewinsights.service.scoring;

import com.flamingo.ai.interviewinsights.config.InsightsConfig;
import com.flamingo.ai.interviewinsights.exception.InsufficientDataException;
import com.flamingo.ai.interviewinsights.util.ScoreMath;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Confidence of a topic's statistics from the spread of its per-document contributions.
 *
 * <p>confidence = clamp(1 - t(0.975, n-1) * sqrt(s² / n), 0, 1), where s² is the sample variance.
 */
@Component
@RequiredArgsConstructor
public class ConfidenceEstimator {

  private final InsightsConfig insightsConfig;

  /**
   * Estimates confidence from contributions, expected to be normalized to [0,1].
   *
   * @param contributions per-document contributions, in a fixed order
   * @return confidence in [0,1]
   * @throws InsufficientDataException when fewer than the minimum sample size are given
   */
  public double estimate(List<Double> contributions) {
    int minSampleSize = insightsConfig.getScoring().getConfidence().getMinSampleSize();
    int n = contributions == null ? 0 : contributions.size();
    if (n < minSampleSize) {
      throw new InsufficientDataException(n, minSampleSize);
    }

    double mean = 0.0;
    for (double value : contributions) {
      mean += value;
    }
    mean /= n;

    double squaredDeviations = 0.0;
    for (double value : contributions) {
      squaredDeviations += (value - mean) * (value - mean);
    }
    double variance = squaredDeviations / (n - 1);
    double standardError = Math.sqrt(variance / n);

    return ScoreMath.clamp01(1.0 - StudentTDistribution.criticalValue95(n - 1) * standardError);
  }
}
