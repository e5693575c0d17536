package com.flamingo.ai.interviewinsights.domain.model;

import com.flamingo.ai.interviewinsights.domain.enums.TrendDirection;

/**
 * Outcome of a monotonic trend test on one topic's historical series.
 *
 * @param topicId id of the analyzed topic
 * @param direction trend direction
 * @param strength absolute Kendall tau in [0,1]
 * @param pValue two-sided p-value of the Mann-Kendall test, 1.0 when the test was skipped
 * @param significant whether the p-value is below the significance level
 * @param slope Theil-Sen slope in value units per bucket
 * @param bucketCount number of buckets in the analyzed series
 */
public record TrendResult(
    String topicId,
    TrendDirection direction,
    double strength,
    double pValue,
    boolean significant,
    double slope,
    int bucketCount) {

  /** Result used when the series is too short to test. */
  public static TrendResult insufficientData(String topicId, int bucketCount) {
    return new TrendResult(topicId, TrendDirection.STABLE, 0.0, 1.0, false, 0.0, bucketCount);
  }
}
