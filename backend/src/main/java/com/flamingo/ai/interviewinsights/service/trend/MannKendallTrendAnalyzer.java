package com.flamingo.ai.interviewinsights.service.trend;

import com.flamingo.ai.interviewinsights.config.InsightsConfig;
import com.flamingo.ai.interviewinsights.domain.enums.TrendDirection;
import com.flamingo.ai.interviewinsights.domain.model.TimeBucket;
import com.flamingo.ai.interviewinsights.domain.model.Topic;
import com.flamingo.ai.interviewinsights.domain.model.TrendResult;
import com.flamingo.ai.interviewinsights.util.ScoreMath;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Non-parametric trend detection with the Mann-Kendall test.
 *
 * <p>S is the sum of signs over all ordered pairs of bucket values. Its variance is corrected for
 * tied values, Z uses a continuity correction and the p-value is two-sided. Kendall's tau, |S|
 * divided by the number of pairs, is reported as strength; the Theil-Sen estimator as slope.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MannKendallTrendAnalyzer implements TrendAnalyzer {

  private final InsightsConfig insightsConfig;

  @Override
  public TrendResult analyzeTrend(Topic topic, List<TimeBucket> historicalSeries) {
    Objects.requireNonNull(topic, "topic must not be null");
    InsightsConfig.Trend config = insightsConfig.getTrend();

    List<Double> values = new ArrayList<>();
    if (historicalSeries != null) {
      for (TimeBucket bucket : historicalSeries) {
        if (bucket != null) {
          values.add(ScoreMath.round(bucket.value(), 9));
        }
      }
    }
    int n = values.size();
    if (n < config.getMinBuckets()) {
      log.debug("Trend test skipped for {}: {} buckets", topic.id(), n);
      return TrendResult.insufficientData(topic.id(), n);
    }

    long s = 0;
    for (int i = 0; i < n - 1; i++) {
      for (int j = i + 1; j < n; j++) {
        s += Long.signum(Double.compare(values.get(j), values.get(i)));
      }
    }

    double variance = variance(values);
    double z;
    if (variance <= 0.0 || s == 0) {
      z = 0.0;
    } else if (s > 0) {
      z = (s - 1) / Math.sqrt(variance);
    } else {
      z = (s + 1) / Math.sqrt(variance);
    }
    double pValue = NormalDistribution.twoSidedPValue(z);
    double strength = ScoreMath.clamp01(Math.abs(s) / (n * (n - 1) / 2.0));

    TrendDirection direction = TrendDirection.STABLE;
    if (s != 0 && strength >= config.getMinStrength()) {
      direction = s > 0 ? TrendDirection.RISING : TrendDirection.FALLING;
    }

    TrendResult result =
        new TrendResult(
            topic.id(),
            direction,
            ScoreMath.round(strength, 4),
            ScoreMath.round(pValue, 6),
            pValue < config.getSignificanceLevel(),
            ScoreMath.round(theilSenSlope(values), 6),
            n);
    log.debug(
        "Trend for {}: S={}, z={}, p={}, direction={}",
        topic.id(),
        s,
        String.format("%.3f", z),
        String.format("%.3f", pValue),
        direction);
    return result;
  }

  // n(n-1)(2n+5)/18 minus the tie correction per group of equal values
  static double variance(List<Double> values) {
    int n = values.size();
    Map<Double, Integer> ties = new HashMap<>();
    for (double value : values) {
      ties.merge(value, 1, Integer::sum);
    }
    double tieCorrection = 0.0;
    for (int t : ties.values()) {
      tieCorrection += (double) t * (t - 1) * (2 * t + 5);
    }
    return ((double) n * (n - 1) * (2 * n + 5) - tieCorrection) / 18.0;
  }

  static double theilSenSlope(List<Double> values) {
    List<Double> slopes = new ArrayList<>();
    for (int i = 0; i < values.size() - 1; i++) {
      for (int j = i + 1; j < values.size(); j++) {
        slopes.add((values.get(j) - values.get(i)) / (j - i));
      }
    }
    if (slopes.isEmpty()) {
      return 0.0;
    }
    Collections.sort(slopes);
    int middle = slopes.size() / 2;
    return slopes.size() % 2 == 1
        ? slopes.get(middle)
        : (slopes.get(middle - 1) + slopes.get(middle)) / 2.0;
  }
}
